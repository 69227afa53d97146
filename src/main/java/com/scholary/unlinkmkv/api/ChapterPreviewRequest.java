package com.scholary.unlinkmkv.api;

import jakarta.validation.constraints.NotBlank;

/** Request to preview the flattened timeline of one file. */
public record ChapterPreviewRequest(@NotBlank String path) {}
