package com.scholary.unlinkmkv.api;

/** Response for an accepted unlink request. Poll {@code /api/jobs/{jobId}} for progress. */
public record AsyncJobResponse(String jobId) {}
