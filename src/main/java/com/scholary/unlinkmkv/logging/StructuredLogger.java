package com.scholary.unlinkmkv.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Each event puts its fields into the MDC for the duration of one log call, so log shippers can
 * index them without parsing the message.
 */
public class StructuredLogger {

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log file started event. */
  public void logFileStarted(String file) {
    try {
      MDC.put("event_type", "file_started");
      MDC.put("source", file);

      logger.info("Processing {}", file);
    } finally {
      clearEventFields();
    }
  }

  /** Log one chapter's rewritten position on the flattened timeline. */
  public void logChapterRewritten(
      int chapterIndex, String kind, String start, String end, String offset) {
    try {
      MDC.put("event_type", "chapter_rewritten");
      MDC.put("chapter_index", String.valueOf(chapterIndex));
      MDC.put("kind", kind);
      MDC.put("start", start);
      MDC.put("end", end);
      MDC.put("offset", offset);

      logger.info(
          "Chapter {} ({}): start={}, end={}, offset={}", chapterIndex, kind, start, end, offset);
    } finally {
      clearEventFields();
    }
  }

  /** Log split planning event. */
  public void logSplitPlanned(String file, int splitPoints, int externalParts) {
    try {
      MDC.put("event_type", "split_planned");
      MDC.put("source", file);
      MDC.put("splitPoints", String.valueOf(splitPoints));
      MDC.put("externalParts", String.valueOf(externalParts));

      logger.info(
          "Split planned: file={}, splitPoints={}, externalParts={}",
          file,
          splitPoints,
          externalParts);
    } finally {
      clearEventFields();
    }
  }

  /** Log a subtitle file that is passed through unmodified. */
  public void logSubtitlePassthrough(String file, String reason) {
    try {
      MDC.put("event_type", "subtitle_passthrough");
      MDC.put("source", file);
      MDC.put("reason", reason);

      logger.warn("Leaving {} unmodified: {}", file, reason);
    } finally {
      clearEventFields();
    }
  }

  /** Log file finished event. */
  public void logFileFinished(String file, String outcome, long elapsedMs) {
    try {
      MDC.put("event_type", "file_finished");
      MDC.put("source", file);
      MDC.put("outcome", outcome);
      MDC.put("elapsedMs", String.valueOf(elapsedMs));

      logger.info("Finished {}: outcome={}, elapsed={}ms", file, outcome, elapsedMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log file failure event. */
  public void logFileFailed(String file, String errorType, String message) {
    try {
      MDC.put("event_type", "file_failed");
      MDC.put("source", file);
      MDC.put("errorType", errorType);

      logger.error("Failed {}: error={}, message={}", file, errorType, message);
    } finally {
      clearEventFields();
    }
  }

  /** Log batch summary event. */
  public void logBatchFinished(String jobId, int succeeded, int skipped, int failed) {
    try {
      MDC.put("event_type", "batch_finished");
      MDC.put("succeeded", String.valueOf(succeeded));
      MDC.put("skipped", String.valueOf(skipped));
      MDC.put("failed", String.valueOf(failed));

      logger.info(
          "Batch finished: jobId={}, succeeded={}, skipped={}, failed={}",
          jobId,
          succeeded,
          skipped,
          failed);
    } finally {
      clearEventFields();
    }
  }

  /** Set job context in MDC. */
  public static void setJobContext(String jobId) {
    MDC.put("jobId", jobId);
  }

  /** Clear job context from MDC. */
  public static void clearJobContext() {
    MDC.remove("jobId");
  }

  /** Set the file currently being processed in MDC. */
  public static void setFileContext(String file) {
    MDC.put("file", file);
  }

  /** Clear file context from MDC. */
  public static void clearFileContext() {
    MDC.remove("file");
  }

  /** Clear event-specific fields from MDC. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("source");
    MDC.remove("chapter_index");
    MDC.remove("kind");
    MDC.remove("start");
    MDC.remove("end");
    MDC.remove("offset");
    MDC.remove("splitPoints");
    MDC.remove("externalParts");
    MDC.remove("reason");
    MDC.remove("outcome");
    MDC.remove("elapsedMs");
    MDC.remove("errorType");
    MDC.remove("succeeded");
    MDC.remove("skipped");
    MDC.remove("failed");
  }
}
