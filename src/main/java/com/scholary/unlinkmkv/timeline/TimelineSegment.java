package com.scholary.unlinkmkv.timeline;

import com.scholary.unlinkmkv.timecode.Timecode;
import java.nio.file.Path;

/**
 * First-pass record of where one chapter's content comes from.
 *
 * @param kind internal (processed file) or external (another resolved file)
 * @param chapterIndex 1-based position of the chapter in its edition
 * @param start chapter start in its source file, before rewriting
 * @param end chapter end in its source file, before rewriting
 * @param segmentId normalized segment UID, null for internal chapters
 * @param file source file
 */
public record TimelineSegment(
    Kind kind, int chapterIndex, Timecode start, Timecode end, String segmentId, Path file) {

  public enum Kind {
    INTERNAL,
    EXTERNAL
  }

  public static TimelineSegment internal(
      int chapterIndex, Timecode start, Timecode end, Path original) {
    return new TimelineSegment(Kind.INTERNAL, chapterIndex, start, end, null, original);
  }

  public static TimelineSegment external(
      int chapterIndex, Timecode start, Timecode end, String segmentId, Path file) {
    return new TimelineSegment(Kind.EXTERNAL, chapterIndex, start, end, segmentId, file);
  }

  public boolean isExternal() {
    return kind == Kind.EXTERNAL;
  }
}
