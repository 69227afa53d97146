package com.scholary.unlinkmkv.segment;

import com.scholary.unlinkmkv.UnlinkException;
import java.nio.file.Path;

/** Thrown when two files in the same directory report the same segment UID. */
public class DuplicateSegmentException extends UnlinkException {

  public DuplicateSegmentException(String segmentId, Path first, Path second) {
    super(
        String.format(
            "Segment %s is provided by both %s and %s", segmentId, first, second));
  }
}
