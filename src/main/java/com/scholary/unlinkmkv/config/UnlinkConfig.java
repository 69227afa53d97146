package com.scholary.unlinkmkv.config;

import com.scholary.unlinkmkv.toolchain.MkvToolnixProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for unlinking beans.
 *
 * <p>Enables UnlinkProperties and MkvToolnixProperties to be loaded from application.yml.
 */
@Configuration
@EnableConfigurationProperties({UnlinkProperties.class, MkvToolnixProperties.class})
public class UnlinkConfig {}
