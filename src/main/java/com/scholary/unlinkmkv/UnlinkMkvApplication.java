package com.scholary.unlinkmkv;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
public class UnlinkMkvApplication {

  public static void main(String[] args) {
    SpringApplication.run(UnlinkMkvApplication.class, args);
  }
}
