package com.scholary.unlinkmkv.service;

/** What happened to one input file. */
public enum FileOutcome {
  SUCCEEDED,
  /** The file has no linked chapters, or its output already exists. */
  SKIPPED,
  FAILED
}
