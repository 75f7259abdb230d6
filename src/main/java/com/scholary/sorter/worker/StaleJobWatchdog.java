package com.scholary.sorter.worker;

import com.scholary.sorter.job.JobStatus;
import com.scholary.sorter.job.JobStore;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Returns jobs abandoned mid-stage to the status they were claimed from.
 *
 * <p>A worker that dies between claim and outcome leaves its job in {@code analyzing} or {@code
 * moving} forever. Past the configured age such jobs go back to {@code queued} or {@code
 * accepted} and are claimed again.
 */
@Component
public class StaleJobWatchdog {

  private static final Logger LOGGER = LoggerFactory.getLogger(StaleJobWatchdog.class);

  private final JobStore jobStore;
  private final WatchdogProperties properties;

  public StaleJobWatchdog(JobStore jobStore, WatchdogProperties properties) {
    this.jobStore = jobStore;
    this.properties = properties;
  }

  @Scheduled(
      fixedDelayString = "${watchdog.interval-seconds}",
      initialDelayString = "${watchdog.interval-seconds}",
      timeUnit = TimeUnit.SECONDS)
  public void scheduledSweep() {
    if (!properties.enabled()) {
      return;
    }
    try {
      sweep();
    } catch (DataAccessException e) {
      LOGGER.error("Stale-job sweep failed: {}", e.getMessage(), e);
    }
  }

  /** @return number of jobs reverted */
  public int sweep() {
    int reverted =
        jobStore.revertStale(
            JobStatus.ANALYZING,
            JobStatus.QUEUED,
            Duration.ofSeconds(properties.staleAnalyzingSeconds()));
    reverted +=
        jobStore.revertStale(
            JobStatus.MOVING, JobStatus.ACCEPTED, Duration.ofSeconds(properties.staleMovingSeconds()));
    return reverted;
  }
}
