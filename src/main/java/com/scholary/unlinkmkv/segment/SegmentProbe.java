package com.scholary.unlinkmkv.segment;

import com.scholary.unlinkmkv.timecode.Timecode;

/**
 * Identity and length of one Matroska file, as reported by the prober.
 *
 * @param segmentId hex segment UID, or {@code null} if the file has none
 * @param duration playback length
 */
public record SegmentProbe(String segmentId, Timecode duration) {}
