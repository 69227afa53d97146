package com.scholary.unlinkmkv.job;

import com.scholary.unlinkmkv.api.JobStatusResponse.Status;
import com.scholary.unlinkmkv.service.BatchReport;
import java.time.Instant;
import java.util.List;

/**
 * Represents an async unlink batch.
 *
 * <p>Tracks the job's state and its report. Stored in memory using Caffeine cache.
 */
public class UnlinkJob {

  private final String jobId;
  private final List<String> paths;
  private final Instant createdAt;

  private volatile Status status;
  private volatile BatchReport report;
  private volatile String error;

  public UnlinkJob(String jobId, List<String> paths) {
    this.jobId = jobId;
    this.paths = List.copyOf(paths);
    this.createdAt = Instant.now();
    this.status = Status.PENDING;
  }

  public String getJobId() {
    return jobId;
  }

  public List<String> getPaths() {
    return paths;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Status getStatus() {
    return status;
  }

  public void setStatus(Status status) {
    this.status = status;
  }

  public BatchReport getReport() {
    return report;
  }

  public void setReport(BatchReport report) {
    this.report = report;
  }

  public String getError() {
    return error;
  }

  public void setError(String error) {
    this.error = error;
  }
}
