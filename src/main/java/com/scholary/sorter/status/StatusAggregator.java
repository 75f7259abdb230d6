package com.scholary.sorter.status;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.scholary.sorter.job.JobStatus;
import com.scholary.sorter.job.JobStore;
import com.scholary.sorter.job.JobTransitionEvent;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Derives status snapshots from the job store.
 *
 * <p>Counts are always recomputed from the store; the Caffeine cache in front only absorbs bursts
 * of readers and is dropped on every local transition.
 */
@Service
public class StatusAggregator {

  private static final Logger LOGGER = LoggerFactory.getLogger(StatusAggregator.class);

  private static final String SNAPSHOT_KEY = "snapshot";

  private final JobStore jobStore;
  private final int recentWindow;
  private final Cache<String, StatusSnapshot> cache;

  public StatusAggregator(JobStore jobStore, EventsProperties properties) {
    this.jobStore = jobStore;
    this.recentWindow = properties.recentWindow();
    this.cache =
        Caffeine.newBuilder()
            .maximumSize(1)
            .expireAfterWrite(Duration.ofMillis(properties.cacheTtlMillis()))
            .build();

    LOGGER.info(
        "Initialized status aggregator: recentWindow={}, cacheTtlMillis={}",
        recentWindow,
        properties.cacheTtlMillis());
  }

  public StatusSnapshot snapshot() {
    return cache.get(SNAPSHOT_KEY, key -> compute());
  }

  /** Drop the cached snapshot so the next read goes to the store. */
  public void invalidate() {
    cache.invalidateAll();
  }

  @EventListener
  public void onTransition(JobTransitionEvent event) {
    invalidate();
  }

  StatusSnapshot compute() {
    long revision = jobStore.currentRevision();
    Map<JobStatus, Long> byStatus = jobStore.countByStatus();

    Map<String, Long> counts = new LinkedHashMap<>();
    long total = 0;
    long processed = 0;
    for (JobStatus status : JobStatus.values()) {
      long count = byStatus.getOrDefault(status, 0L);
      counts.put(status.wireName(), count);
      total += count;
      if (status.isTerminal()) {
        processed += count;
      }
    }

    List<JobSummary> recent =
        jobStore.recent(recentWindow, null).stream().map(JobSummary::of).toList();
    return new StatusSnapshot(counts, processed, total, recent, revision);
  }
}
