package com.scholary.unlinkmkv.timeline;

import com.scholary.unlinkmkv.timecode.Timecode;

/**
 * State carried through the left-to-right walk over an edition's chapters.
 *
 * @param offset total duration of external content inserted so far
 * @param lastExternalId id of the external run in progress, null when the last chapter was internal
 * @param lastInternalEnd processed-file end time of the most recent internal chapter
 * @param timelineEnd end of the flattened timeline built so far
 * @param runStart flattened-timeline position where the current external run began
 * @param inInternalRun whether the previous chapter was internal
 * @param chapterIndex number of chapters consumed
 */
public record ReconstructionState(
    Timecode offset,
    String lastExternalId,
    Timecode lastInternalEnd,
    Timecode timelineEnd,
    Timecode runStart,
    boolean inInternalRun,
    int chapterIndex) {

  public static ReconstructionState initial() {
    return new ReconstructionState(
        Timecode.ZERO, null, Timecode.ZERO, Timecode.ZERO, Timecode.ZERO, false, 0);
  }

  ReconstructionState afterInternal(Timecode originalEnd, Timecode rewrittenEnd) {
    return new ReconstructionState(
        offset, null, originalEnd, rewrittenEnd, runStart, true, chapterIndex + 1);
  }

  ReconstructionState afterContinuation() {
    return new ReconstructionState(
        offset, lastExternalId, lastInternalEnd, timelineEnd, runStart, false, chapterIndex + 1);
  }

  ReconstructionState afterExternal(String segmentId, Timecode newRunStart, Timecode duration) {
    return new ReconstructionState(
        offset.plus(duration),
        segmentId,
        lastInternalEnd,
        newRunStart.plus(duration),
        newRunStart,
        false,
        chapterIndex + 1);
  }
}
