package com.scholary.unlinkmkv.api;

import com.scholary.unlinkmkv.job.JobRepository;
import com.scholary.unlinkmkv.job.UnlinkJob;
import com.scholary.unlinkmkv.job.UnlinkJobRunner;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for unlinking.
 *
 * <p>Batches run asynchronously: the POST returns a job ID immediately and the job endpoint reports
 * progress and, once done, the per-file results.
 */
@RestController
@Tag(name = "Unlink", description = "Segmented MKV unlinking API")
public class UnlinkController {

  private static final Logger LOGGER = LoggerFactory.getLogger(UnlinkController.class);

  private final UnlinkJobRunner jobRunner;
  private final JobRepository jobRepository;

  public UnlinkController(UnlinkJobRunner jobRunner, JobRepository jobRepository) {
    this.jobRunner = jobRunner;
    this.jobRepository = jobRepository;
  }

  /** Start an asynchronous unlink batch. */
  @PostMapping("/api/unlink")
  @Operation(
      summary = "Start unlinking",
      description = "Start an asynchronous unlink batch and return a job ID for status polling")
  public ResponseEntity<AsyncJobResponse> unlink(@Valid @RequestBody UnlinkRequest request) {
    String jobId = UUID.randomUUID().toString();
    LOGGER.info("Unlink request: paths={}", request.paths());

    UnlinkJob job = new UnlinkJob(jobId, request.paths());
    jobRepository.save(job);

    try {
      jobRunner.runAsync(job);
    } catch (TaskRejectedException e) {
      LOGGER.warn("Rejected unlink job {}, executor is saturated", jobId);
      jobRepository.delete(jobId);
      return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build();
    }

    LOGGER.info("Created async unlink job: {}", jobId);
    return ResponseEntity.accepted().body(new AsyncJobResponse(jobId));
  }

  /** Get job status, including the batch report once the job has completed. */
  @GetMapping("/api/jobs/{id}")
  @Operation(summary = "Get job status", description = "Check the status of an unlink job")
  public ResponseEntity<JobStatusResponse> getJobStatus(@PathVariable String id) {
    return jobRepository
        .findById(id)
        .map(
            job ->
                ResponseEntity.ok(
                    new JobStatusResponse(
                        job.getJobId(),
                        job.getStatus(),
                        BatchReportResponse.from(job.getReport()),
                        job.getError())))
        .orElse(ResponseEntity.notFound().build());
  }
}
