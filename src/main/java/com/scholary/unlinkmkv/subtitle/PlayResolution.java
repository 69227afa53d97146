package com.scholary.unlinkmkv.subtitle;

/** Optional {@code PlayResX}/{@code PlayResY} overrides applied while merging style catalogs. */
public record PlayResolution(Integer x, Integer y) {

  public static PlayResolution none() {
    return new PlayResolution(null, null);
  }
}
