package com.scholary.unlinkmkv.job;

import com.scholary.unlinkmkv.api.JobStatusResponse.Status;
import com.scholary.unlinkmkv.logging.StructuredLogger;
import com.scholary.unlinkmkv.service.BatchReport;
import com.scholary.unlinkmkv.service.UnlinkBatchService;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Executes unlink jobs on the async executor.
 *
 * <p>The job status is updated as processing progresses. Per-file failures end up in the report; a
 * job is only FAILED when the batch itself could not run.
 */
@Service
public class UnlinkJobRunner {

  private static final Logger LOGGER = LoggerFactory.getLogger(UnlinkJobRunner.class);

  private final UnlinkBatchService batchService;
  private final JobRepository jobRepository;

  public UnlinkJobRunner(UnlinkBatchService batchService, JobRepository jobRepository) {
    this.batchService = batchService;
    this.jobRepository = jobRepository;
  }

  @Async("taskExecutor")
  public void runAsync(UnlinkJob job) {
    run(job);
  }

  /** Run a job on the calling thread. */
  public void run(UnlinkJob job) {
    StructuredLogger.setJobContext(job.getJobId());
    LOGGER.info("Starting unlink job {} for {} paths", job.getJobId(), job.getPaths().size());

    try {
      job.setStatus(Status.PROCESSING);
      jobRepository.save(job);

      List<Path> paths = job.getPaths().stream().map(Paths::get).toList();
      BatchReport report = batchService.run(job.getJobId(), paths);

      job.setReport(report);
      job.setStatus(Status.COMPLETED);
      jobRepository.save(job);

      LOGGER.info("Completed unlink job {}", job.getJobId());

    } catch (Exception e) {
      LOGGER.error("Unlink job failed: {}", job.getJobId(), e);
      job.setStatus(Status.FAILED);
      job.setError(e.getMessage());
      jobRepository.save(job);
    } finally {
      StructuredLogger.clearJobContext();
    }
  }
}
