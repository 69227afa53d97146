package com.scholary.unlinkmkv.timeline;

import com.scholary.unlinkmkv.timecode.Timecode;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Second reconstruction pass: turns a {@link TimelinePlan} into the ordered list of files to
 * append.
 *
 * <p>Internal chapters are mapped onto the slices produced by splitting at the plan's split points.
 * Slice {@code k} (1-based) covers {@code [S(k-1), S(k))} of the processed file, with {@code S(0)}
 * being zero, so a chapter range {@code [s, e)} spans slices {@code count(S <= s) + 1} through
 * {@code count(S < e) + 1}. Consecutive identical parts are merged.
 */
@Component
public class PartAssembler {

  private static final Logger LOGGER = LoggerFactory.getLogger(PartAssembler.class);

  /** External chapters starting before this point count as starting at the head of their file. */
  static final Timecode FILE_START_TOLERANCE = Timecode.ofSeconds(1);

  /**
   * Assign the final parts.
   *
   * @param plan first-pass result
   * @param ignoreSegmentStart when false, only external chapters that start within the first second
   *     of their file contribute that file
   * @return parts in playback order
   */
  public List<Part> assemble(TimelinePlan plan, boolean ignoreSegmentStart) {
    List<Part> parts = new ArrayList<>();
    List<Timecode> splits = plan.splitPoints();

    for (TimelineSegment segment : plan.segments()) {
      if (segment.isExternal()) {
        if (ignoreSegmentStart || segment.start().isBefore(FILE_START_TOLERANCE)) {
          append(parts, Part.external(segment.file()));
        } else {
          LOGGER.info(
              "Chapter {} starts at {} inside {}, not adding it as a part",
              segment.chapterIndex(),
              segment.start(),
              segment.file().getFileName());
        }
        continue;
      }

      if (splits.isEmpty()) {
        append(parts, Part.whole(plan.source()));
        continue;
      }

      int first = countAtOrBefore(splits, segment.start()) + 1;
      int last = countBefore(splits, segment.end()) + 1;
      for (int slice = first; slice <= Math.max(first, last); slice++) {
        append(parts, Part.slice(plan.source(), slice));
      }
    }

    LOGGER.info("Assembled {} parts for {}", parts.size(), plan.source().getFileName());
    for (Part part : parts) {
      LOGGER.debug("part {} {} slice={}", part.kind(), part.file(), part.sliceIndex());
    }
    return List.copyOf(parts);
  }

  private static void append(List<Part> parts, Part part) {
    if (!parts.isEmpty() && parts.get(parts.size() - 1).equals(part)) {
      return;
    }
    parts.add(part);
  }

  private static int countAtOrBefore(List<Timecode> splits, Timecode time) {
    int count = 0;
    for (Timecode split : splits) {
      if (!split.isAfter(time)) {
        count++;
      }
    }
    return count;
  }

  private static int countBefore(List<Timecode> splits, Timecode time) {
    int count = 0;
    for (Timecode split : splits) {
      if (split.isBefore(time)) {
        count++;
      }
    }
    return count;
  }
}
