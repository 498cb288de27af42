package com.scholary.podcast.job;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

/**
 * In-memory registry of pipeline jobs.
 *
 * <p>Jobs that are still running live in a plain map and are never evicted. Once a job reaches a
 * terminal state it moves to a Caffeine cache, bounded by size and by time since last access, so
 * outcomes nobody collects eventually go away.
 */
@Repository
public class JobRepository {

  private final Map<String, PipelineJob> active = new ConcurrentHashMap<>();
  private final Cache<String, PipelineJob> finished;

  public JobRepository(
      @Value("${jobstore.maxSize}") int maxSize,
      @Value("${jobstore.expireAfterMinutes}") int expireAfterMinutes) {

    this.finished =
        Caffeine.newBuilder()
            .maximumSize(maxSize)
            .expireAfterAccess(Duration.ofMinutes(expireAfterMinutes))
            .build();
  }

  public void save(PipelineJob job) {
    active.put(job.id(), job);
    job.onTerminal(this::archive);
  }

  public Optional<PipelineJob> findById(String jobId) {
    PipelineJob job = active.get(jobId);
    if (job != null) {
      return Optional.of(job);
    }
    return Optional.ofNullable(finished.getIfPresent(jobId));
  }

  public void delete(String jobId) {
    active.remove(jobId);
    finished.invalidate(jobId);
  }

  /** Number of jobs that have not reached a terminal state. */
  public int activeCount() {
    return active.size();
  }

  // Moves the entry atomically so a concurrent delete cannot resurrect it
  private void archive(PipelineJob job) {
    active.computeIfPresent(
        job.id(),
        (id, current) -> {
          if (current != job) {
            return current;
          }
          finished.put(id, job);
          return null;
        });
  }
}
