package com.scholary.unlinkmkv;

/**
 * Base exception for failures that abort the processing of a single input file.
 *
 * <p>The batch driver catches these per file and records a failed result; the remaining files of
 * the batch are still processed.
 */
public class UnlinkException extends RuntimeException {

  public UnlinkException(String message) {
    super(message);
  }

  public UnlinkException(String message, Throwable cause) {
    super(message, cause);
  }
}
