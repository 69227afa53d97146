package com.scholary.unlinkmkv.service;

import com.scholary.unlinkmkv.timeline.Part;
import com.scholary.unlinkmkv.timeline.TimelinePlan;
import java.util.List;

/** Planned reconstruction of one file, without any media written. */
public record TimelinePreview(TimelinePlan plan, List<Part> parts) {}
