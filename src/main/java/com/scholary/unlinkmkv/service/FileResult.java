package com.scholary.unlinkmkv.service;

import java.nio.file.Path;

/**
 * Result of processing one file.
 *
 * @param file the input file
 * @param outcome what happened
 * @param output the written file, set only on success
 * @param message skip reason or error description, {@code null} on success
 */
public record FileResult(Path file, FileOutcome outcome, Path output, String message) {

  public static FileResult succeeded(Path file, Path output) {
    return new FileResult(file, FileOutcome.SUCCEEDED, output, null);
  }

  public static FileResult skipped(Path file, String reason) {
    return new FileResult(file, FileOutcome.SKIPPED, null, reason);
  }

  public static FileResult failed(Path file, String error) {
    return new FileResult(file, FileOutcome.FAILED, null, error);
  }
}
