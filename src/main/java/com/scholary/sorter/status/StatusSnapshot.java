package com.scholary.sorter.status;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Point-in-time view of the pipeline.
 *
 * @param counts jobs per status, keyed by status wire name; every status is present
 * @param processed jobs in a terminal status
 * @param total all jobs ever created; always the sum of {@code counts}
 * @param recent most recently updated jobs, newest first
 * @param revision store revision the snapshot was taken at
 */
public record StatusSnapshot(
    Map<String, Long> counts, long processed, long total, List<JobSummary> recent, long revision) {

  public StatusSnapshot {
    counts = Collections.unmodifiableMap(new LinkedHashMap<>(counts));
    recent = List.copyOf(recent);
  }
}
