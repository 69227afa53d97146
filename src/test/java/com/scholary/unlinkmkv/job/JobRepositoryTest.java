package com.scholary.unlinkmkv.job;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

class JobRepositoryTest {

  private final JobRepository jobRepository = new JobRepository(100, 60);

  @Test
  void findById_shouldReturnSavedJob() {
    UnlinkJob job = new UnlinkJob("job-1", List.of("/media/show"));

    jobRepository.save(job);

    assertThat(jobRepository.findById("job-1")).containsSame(job);
    assertThat(jobRepository.findById("job-2")).isEmpty();
  }

  @Test
  void delete_shouldForgetJob() {
    jobRepository.save(new UnlinkJob("job-1", List.of("/media/show")));

    jobRepository.delete("job-1");

    assertThat(jobRepository.findById("job-1")).isEmpty();
  }
}
