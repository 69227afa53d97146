package com.scholary.unlinkmkv.service;

import java.util.List;

/** Per-file results of one batch, in processing order. */
public record BatchReport(List<FileResult> results) {

  public BatchReport {
    results = List.copyOf(results);
  }

  public long succeeded() {
    return count(FileOutcome.SUCCEEDED);
  }

  public long skipped() {
    return count(FileOutcome.SKIPPED);
  }

  public long failed() {
    return count(FileOutcome.FAILED);
  }

  private long count(FileOutcome outcome) {
    return results.stream().filter(result -> result.outcome() == outcome).count();
  }
}
