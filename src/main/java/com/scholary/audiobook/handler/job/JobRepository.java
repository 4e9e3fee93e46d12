package com.scholary.audiobook.handler.job;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Duration;
import java.util.Optional;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

/**
 * In-memory repository for ingestion jobs.
 *
 * <p>Uses Caffeine cache so finished jobs are evicted after a while instead of piling up. Job
 * history does not survive a restart; the books themselves live in the object store.
 */
@Repository
public class JobRepository {

  private final Cache<String, IngestionJob> cache;

  public JobRepository(
      @Value("${jobstore.max-size}") int maxSize,
      @Value("${jobstore.expire-after-minutes}") int expireAfterMinutes) {

    this.cache =
        Caffeine.newBuilder()
            .maximumSize(maxSize)
            .expireAfterWrite(Duration.ofMinutes(expireAfterMinutes))
            .build();
  }

  public void save(IngestionJob job) {
    cache.put(job.getJobId(), job);
  }

  public Optional<IngestionJob> findById(String jobId) {
    return Optional.ofNullable(cache.getIfPresent(jobId));
  }

  public void delete(String jobId) {
    cache.invalidate(jobId);
  }
}
