package com.scholary.unlinkmkv.api;

/**
 * Response for job status query.
 *
 * <p>Shows the current state of a batch job and includes the per-file report once it is done.
 */
public record JobStatusResponse(
    String jobId, Status status, BatchReportResponse report, String error) {

  public enum Status {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED
  }
}
