package com.scholary.unlinkmkv.timeline;

import com.scholary.unlinkmkv.chapter.ChapterDocument;
import com.scholary.unlinkmkv.timecode.Timecode;
import java.nio.file.Path;
import java.util.List;

/**
 * Result of the first reconstruction pass over one file.
 *
 * @param source the processed file
 * @param chapters flattened chapter structure (selected edition only, no segment references)
 * @param segments per-chapter sources, in chapter order
 * @param splitPoints processed-file timecodes to split at; sorted and distinct
 */
public record TimelinePlan(
    Path source, ChapterDocument chapters, List<TimelineSegment> segments, List<Timecode> splitPoints) {

  public boolean requiresSplit() {
    return !splitPoints.isEmpty();
  }

  public long externalCount() {
    return segments.stream().filter(TimelineSegment::isExternal).count();
  }
}
