package com.scholary.unlinkmkv.segment;

import java.nio.file.Path;

/** Reads the segment UID and duration of a container file. */
@FunctionalInterface
public interface SegmentProber {

  SegmentProbe probeSegment(Path file);
}
