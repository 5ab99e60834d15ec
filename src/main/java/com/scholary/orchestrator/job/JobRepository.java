package com.scholary.orchestrator.job;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Duration;
import java.util.Optional;

/**
 * In-memory registry of jobs, shared by all pipelines.
 *
 * <p>Uses a Caffeine cache so memory stays bounded: jobs are evicted once the registry is full or
 * when nobody has looked at them for a while. Job history does not survive a restart; the result
 * store keeps what matters.
 */
public class JobRepository {

  private final Cache<String, Job<?, ?>> cache;

  public JobRepository(long maxSize, Duration expireAfterAccess) {
    this.cache =
        Caffeine.newBuilder().maximumSize(maxSize).expireAfterAccess(expireAfterAccess).build();
  }

  void save(Job<?, ?> job) {
    cache.put(job.id(), job);
  }

  Optional<Job<?, ?>> findById(String jobId) {
    return Optional.ofNullable(cache.getIfPresent(jobId));
  }

  /** Current view of a job, whichever pipeline owns it. */
  public Optional<JobSnapshot<?, ?>> findSnapshot(String jobId) {
    return findById(jobId).map(job -> job.snapshot());
  }

  public void delete(String jobId) {
    cache.invalidate(jobId);
  }
}
