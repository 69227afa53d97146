package com.scholary.unlinkmkv.timeline;

import com.scholary.unlinkmkv.timecode.Timecode;
import java.util.Optional;

/** Outcome of feeding one chapter to {@link TimelineBuilder#step}. */
public record Step(
    ReconstructionState state, Optional<TimelineSegment> segment, Optional<Timecode> splitPoint) {}
