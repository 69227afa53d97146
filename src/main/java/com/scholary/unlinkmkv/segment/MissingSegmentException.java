package com.scholary.unlinkmkv.segment;

import com.scholary.unlinkmkv.UnlinkException;

/**
 * Thrown when a chapter references a segment that no sibling file provides.
 *
 * <p>Only the file being processed is abandoned.
 */
public class MissingSegmentException extends UnlinkException {

  private final String segmentId;

  public MissingSegmentException(String segmentId) {
    super("Missing segment: " + segmentId);
    this.segmentId = segmentId;
  }

  public String getSegmentId() {
    return segmentId;
  }
}
