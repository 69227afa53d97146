package com.scholary.unlinkmkv.timeline;

import com.scholary.unlinkmkv.chapter.ChapterDocument;
import com.scholary.unlinkmkv.chapter.ChapterEntry;
import com.scholary.unlinkmkv.logging.StructuredLogger;
import com.scholary.unlinkmkv.segment.MissingSegmentException;
import com.scholary.unlinkmkv.segment.RegistryEntry;
import com.scholary.unlinkmkv.segment.SegmentRegistry;
import com.scholary.unlinkmkv.timecode.Timecode;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Flattens an ordered-chapter edition into a single timeline.
 *
 * <p>The walk is a fold over the edition's chapters: each {@link #step} takes the current {@link
 * ReconstructionState} and one chapter, rewrites the chapter's times in place and returns the next
 * state together with the chapter's source and an optional split point.
 *
 * <ul>
 *   <li>Internal chapters (disabled, or without a segment UID) are shifted by the duration of all
 *       external content inserted before them.
 *   <li>A chapter that starts a new external reference is resolved through the {@link
 *       SegmentRegistry}; the referenced file is inserted whole and the offset grows by its
 *       duration.
 *   <li>A chapter that repeats the previous external reference continues the same run and adds
 *       nothing to the timeline.
 * </ul>
 *
 * <p>Split points mark where the processed file has to be cut so its pieces can be interleaved
 * with external files: the file is cut where an internal run hands over to an external file, and
 * nowhere else. They are only kept when the timeline actually contains external content.
 */
@Component
public class TimelineBuilder {

  private static final Logger LOGGER = LoggerFactory.getLogger(TimelineBuilder.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  /**
   * Run the first reconstruction pass.
   *
   * <p>The document is modified in place: chapter times are rewritten, segment references removed,
   * every edition but {@code edition} dropped and the ordered flag cleared.
   *
   * @param document parsed chapters of {@code source}
   * @param edition 1-based edition to flatten
   * @param registry segments available next to {@code source}
   * @param source the file being processed
   * @return chapter sources and split points
   * @throws com.scholary.unlinkmkv.chapter.NoSuchEditionException if the edition does not exist
   * @throws MissingSegmentException if a referenced segment is not in the registry
   */
  public TimelinePlan build(
      ChapterDocument document, int edition, SegmentRegistry registry, Path source) {

    List<ChapterEntry> entries = document.entries(edition);
    LOGGER.info("Walking {} chapters of edition {}", entries.size(), edition);

    ReconstructionState state = ReconstructionState.initial();
    List<TimelineSegment> segments = new ArrayList<>();
    List<Timecode> splitPoints = new ArrayList<>();

    for (ChapterEntry entry : entries) {
      Step step = step(state, entry, registry, source);
      step.segment().ifPresent(segments::add);
      step.splitPoint().ifPresent(splitPoints::add);
      state = step.state();

      structuredLogger.logChapterRewritten(
          state.chapterIndex(),
          entry.isExternal() ? "external" : "internal",
          entry.getStartTime().toString(),
          entry.getEndTime().toString(),
          state.offset().toString());
    }
    finish(state).ifPresent(splitPoints::add);

    boolean hasExternal = segments.stream().anyMatch(TimelineSegment::isExternal);
    List<Timecode> normalizedSplits =
        normalizeSplitPoints(splitPoints, hasExternal, registry.durationOf(source));

    document.selectEdition(edition);
    document.clearOrderedFlag();
    document.stripSegmentReferences();

    structuredLogger.logSplitPlanned(
        source.getFileName().toString(),
        normalizedSplits.size(),
        (int) segments.stream().filter(TimelineSegment::isExternal).count());

    return new TimelinePlan(source, document, List.copyOf(segments), normalizedSplits);
  }

  /**
   * Consume one chapter.
   *
   * @param state state after the previous chapter
   * @param entry the chapter; its times are rewritten and its segment UID removed
   * @param registry segment lookup
   * @param source the file being processed
   * @return the next state, the chapter's source (absent for run continuations) and an optional
   *     split point
   */
  public Step step(
      ReconstructionState state, ChapterEntry entry, SegmentRegistry registry, Path source) {

    int chapterIndex = state.chapterIndex() + 1;
    Timecode start = entry.getOriginalStart();
    Timecode end = entry.getOriginalEnd();

    if (!entry.isExternal()) {
      // No split at gaps: the slice that starts at the previous internal end also holds the
      // skipped range.
      Timecode rewrittenEnd = end.plus(state.offset());
      entry.setStartTime(start.plus(state.offset()));
      entry.setEndTime(rewrittenEnd);
      entry.removeSegmentUid();

      return new Step(
          state.afterInternal(end, rewrittenEnd),
          Optional.of(TimelineSegment.internal(chapterIndex, start, end, source)),
          Optional.empty());
    }

    String segmentId = entry.getSegmentUid().orElseThrow().normalized();

    if (segmentId.equals(state.lastExternalId())) {
      LOGGER.debug("Chapter {} continues segment {}", chapterIndex, segmentId);
      entry.setStartTime(state.runStart().plus(start));
      entry.setEndTime(state.runStart().plus(end));
      entry.removeSegmentUid();
      return new Step(state.afterContinuation(), Optional.empty(), Optional.empty());
    }

    RegistryEntry resolved =
        registry
            .resolve(segmentId, source)
            .orElseThrow(() -> new MissingSegmentException(segmentId));
    LOGGER.info("Chapter {} uses segment {} from {}", chapterIndex, segmentId, resolved.file());

    Optional<Timecode> split =
        state.inInternalRun() && !state.lastInternalEnd().isZero()
            ? Optional.of(state.lastInternalEnd())
            : Optional.empty();

    Timecode runStart = state.timelineEnd();
    entry.setStartTime(runStart.plus(start));
    entry.setEndTime(runStart.plus(end));
    entry.removeSegmentUid();

    return new Step(
        state.afterExternal(segmentId, runStart, resolved.duration()),
        Optional.of(
            TimelineSegment.external(chapterIndex, start, end, segmentId, resolved.file())),
        split);
  }

  /** Close a trailing internal run. */
  public Optional<Timecode> finish(ReconstructionState state) {
    if (state.inInternalRun() && !state.lastInternalEnd().isZero()) {
      return Optional.of(state.lastInternalEnd());
    }
    return Optional.empty();
  }

  /**
   * Sort and deduplicate split points.
   *
   * <p>Without external content nothing needs splitting. Points at or past the end of the processed
   * file would only produce an empty trailing slice and are dropped.
   */
  static List<Timecode> normalizeSplitPoints(
      List<Timecode> splitPoints, boolean hasExternal, Optional<Timecode> sourceDuration) {
    if (!hasExternal) {
      return List.of();
    }
    TreeSet<Timecode> sorted = new TreeSet<>();
    for (Timecode point : splitPoints) {
      if (point.isZero()) {
        continue;
      }
      if (sourceDuration.isPresent() && !point.isBefore(sourceDuration.get())) {
        LOGGER.debug("Dropping split point {} at or beyond end of file", point);
        continue;
      }
      sorted.add(point);
    }
    return List.copyOf(sorted);
  }
}
