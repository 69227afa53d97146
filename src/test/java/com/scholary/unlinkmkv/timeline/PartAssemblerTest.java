package com.scholary.unlinkmkv.timeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.scholary.unlinkmkv.UnlinkException;
import com.scholary.unlinkmkv.timecode.Timecode;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class PartAssemblerTest {

  private static final Path EPISODE = Paths.get("/media/show/episode01.mkv");
  private static final Path OPENING = Paths.get("/media/show/opening.mkv");
  private static final Path ENDING = Paths.get("/media/show/ending.mkv");

  private PartAssembler assembler;

  @BeforeEach
  void setUp() {
    assembler = new PartAssembler();
  }

  @Test
  void assemble_shouldUseWholeFileWhenNothingWasSplit() {
    TimelinePlan plan =
        plan(
            List.of(
                TimelineSegment.internal(1, tc("00:00:00"), tc("00:10:00"), EPISODE),
                TimelineSegment.internal(2, tc("00:10:00"), tc("00:20:00"), EPISODE)),
            List.of());

    List<Part> parts = assembler.assemble(plan, false);

    assertThat(parts).containsExactly(Part.whole(EPISODE));
  }

  @Test
  void assemble_shouldInterleaveSlicesWithExternalFiles() {
    TimelinePlan plan =
        plan(
            List.of(
                TimelineSegment.internal(1, tc("00:00:00"), tc("00:10:00"), EPISODE),
                TimelineSegment.external(2, tc("00:00:00"), tc("00:01:30"), "aa", OPENING),
                TimelineSegment.internal(3, tc("00:10:00"), tc("00:20:00"), EPISODE),
                TimelineSegment.external(4, tc("00:00:00"), tc("00:01:00"), "bb", ENDING)),
            List.of(tc("00:10:00"), tc("00:20:00")));

    List<Part> parts = assembler.assemble(plan, false);

    assertThat(parts)
        .containsExactly(
            Part.slice(EPISODE, 1),
            Part.external(OPENING),
            Part.slice(EPISODE, 2),
            Part.external(ENDING));
  }

  @Test
  void assemble_shouldCoalesceChaptersInSameSlice() {
    TimelinePlan plan =
        plan(
            List.of(
                TimelineSegment.external(1, tc("00:00:00"), tc("00:01:00"), "aa", OPENING),
                TimelineSegment.internal(2, tc("00:00:00"), tc("00:00:30"), EPISODE),
                TimelineSegment.internal(3, tc("00:00:30"), tc("00:01:00"), EPISODE)),
            List.of(tc("00:01:00")));

    List<Part> parts = assembler.assemble(plan, false);

    assertThat(parts).containsExactly(Part.external(OPENING), Part.slice(EPISODE, 1));
  }

  @Test
  void assemble_shouldTakeGapWithFollowingSlice() {
    TimelinePlan plan =
        plan(
            List.of(
                TimelineSegment.internal(1, tc("00:00:00"), tc("00:05:00"), EPISODE),
                TimelineSegment.external(2, tc("00:00:00"), tc("00:01:30"), "aa", OPENING),
                TimelineSegment.internal(3, tc("00:07:00"), tc("00:10:00"), EPISODE)),
            List.of(tc("00:05:00")));

    List<Part> parts = assembler.assemble(plan, false);

    assertThat(parts)
        .containsExactly(Part.slice(EPISODE, 1), Part.external(OPENING), Part.slice(EPISODE, 2));
  }

  @Test
  void assemble_shouldSkipExternalChaptersNotAtFileStartByDefault() {
    TimelinePlan plan =
        plan(
            List.of(
                TimelineSegment.external(1, tc("00:00:30"), tc("00:01:30"), "aa", OPENING),
                TimelineSegment.internal(2, tc("00:00:00"), tc("00:10:00"), EPISODE)),
            List.of(tc("00:10:00")));

    assertThat(assembler.assemble(plan, false)).containsExactly(Part.slice(EPISODE, 1));
    assertThat(assembler.assemble(plan, true))
        .containsExactly(Part.external(OPENING), Part.slice(EPISODE, 1));
  }

  @Test
  void assemble_shouldTreatSubSecondStartAsFileStart() {
    TimelinePlan plan =
        plan(
            List.of(
                TimelineSegment.external(1, tc("00:00:00.041"), tc("00:01:00"), "aa", OPENING),
                TimelineSegment.internal(2, tc("00:00:00"), tc("00:00:30"), EPISODE),
                TimelineSegment.external(3, tc("00:00:01"), tc("00:01:00"), "bb", ENDING)),
            List.of(tc("00:00:30")));

    assertThat(assembler.assemble(plan, false))
        .containsExactly(Part.external(OPENING), Part.slice(EPISODE, 1));
  }

  @Test
  void resolve_shouldMapSlicesToSplitOutput() {
    List<Path> slices = List.of(Paths.get("split-001.mkv"), Paths.get("split-002.mkv"));

    assertThat(Part.slice(EPISODE, 2).resolve(slices)).isEqualTo(Paths.get("split-002.mkv"));
    assertThat(Part.external(OPENING).resolve(slices)).isEqualTo(OPENING);
    assertThatThrownBy(() -> Part.slice(EPISODE, 3).resolve(slices))
        .isInstanceOf(UnlinkException.class);
  }

  private static TimelinePlan plan(List<TimelineSegment> segments, List<Timecode> splits) {
    return new TimelinePlan(EPISODE, null, segments, splits);
  }

  private static Timecode tc(String text) {
    return Timecode.parse(text);
  }
}
