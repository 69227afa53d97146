package com.scholary.unlinkmkv.segment;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-batch cache of segment registries, keyed by directory.
 *
 * <p>Probing a directory means running mkvmerge once per file, so a directory is scanned at most
 * once per batch no matter how many linked files it holds. A new cache is created for every batch
 * so files added between batches are picked up.
 */
public class SegmentRegistryCache {

  private static final Logger LOGGER = LoggerFactory.getLogger(SegmentRegistryCache.class);

  private final Cache<Path, SegmentRegistry> cache;
  private final SegmentProber prober;

  public SegmentRegistryCache(SegmentProber prober, int maxDirectories) {
    this.prober = prober;
    this.cache = Caffeine.newBuilder().maximumSize(maxDirectories).recordStats().build();
  }

  /**
   * Registry for the directory holding {@code file}, scanning it on first use.
   *
   * @throws IOException if the directory cannot be listed
   */
  public SegmentRegistry registryFor(Path file) throws IOException {
    Path directory = file.toAbsolutePath().normalize().getParent();
    try {
      return cache.get(directory, this::scan);
    } catch (UncheckedIOException e) {
      throw e.getCause();
    }
  }

  private SegmentRegistry scan(Path directory) {
    LOGGER.debug("Registry cache miss for {}", directory);
    try {
      return SegmentRegistry.scan(directory, prober);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  /** Cache statistics for the end-of-batch summary. */
  public String getStats() {
    var stats = cache.stats();
    return String.format(
        "SegmentRegistryCache[directories=%d, hitRate=%.2f%%]",
        cache.estimatedSize(), stats.hitRate() * 100);
  }
}
