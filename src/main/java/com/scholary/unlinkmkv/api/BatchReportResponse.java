package com.scholary.unlinkmkv.api;

import com.scholary.unlinkmkv.service.BatchReport;
import com.scholary.unlinkmkv.service.FileOutcome;
import com.scholary.unlinkmkv.service.FileResult;
import java.util.List;

/** Batch report as returned by the job status endpoint. */
public record BatchReportResponse(
    long succeeded, long skipped, long failed, List<FileResultResponse> files) {

  public record FileResultResponse(
      String file, FileOutcome outcome, String output, String message) {

    static FileResultResponse from(FileResult result) {
      return new FileResultResponse(
          result.file().toString(),
          result.outcome(),
          result.output() == null ? null : result.output().toString(),
          result.message());
    }
  }

  public static BatchReportResponse from(BatchReport report) {
    if (report == null) {
      return null;
    }
    return new BatchReportResponse(
        report.succeeded(),
        report.skipped(),
        report.failed(),
        report.results().stream().map(FileResultResponse::from).toList());
  }
}
