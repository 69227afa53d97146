package com.scholary.unlinkmkv.job;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Duration;
import java.util.Optional;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

/**
 * In-memory repository for unlink jobs.
 *
 * <p>Uses Caffeine cache for automatic eviction of old jobs, so finished reports do not accumulate
 * forever.
 */
@Repository
public class JobRepository {

  private final Cache<String, UnlinkJob> cache;

  public JobRepository(
      @Value("${jobstore.max-size}") int maxSize,
      @Value("${jobstore.expire-after-minutes}") int expireAfterMinutes) {

    this.cache =
        Caffeine.newBuilder()
            .maximumSize(maxSize)
            .expireAfterWrite(Duration.ofMinutes(expireAfterMinutes))
            .build();
  }

  public void save(UnlinkJob job) {
    cache.put(job.getJobId(), job);
  }

  public Optional<UnlinkJob> findById(String jobId) {
    return Optional.ofNullable(cache.getIfPresent(jobId));
  }

  public void delete(String jobId) {
    cache.invalidate(jobId);
  }
}
