package com.scholary.sorter.worker;

import com.scholary.sorter.paths.PathsConfirmedEvent;
import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ScheduledFuture;
import java.util.function.BooleanSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

/**
 * Starts the polling loops of the enabled stages once the application is up.
 *
 * <p>Every analyze or move loop drains all claimable work, then sleeps for its poll interval.
 * Loops never share state; they only meet in the job store.
 */
@Component
public class WorkerScheduler {

  private static final Logger LOGGER = LoggerFactory.getLogger(WorkerScheduler.class);

  private final TaskScheduler scheduler;
  private final WorkerProperties properties;
  private final ScanProducer scanProducer;
  private final AnalyzeWorker analyzeWorker;
  private final MoveWorker moveWorker;
  private final List<ScheduledFuture<?>> loops = new ArrayList<>();

  public WorkerScheduler(
      @Qualifier("workerScheduler") TaskScheduler scheduler,
      WorkerProperties properties,
      ScanProducer scanProducer,
      AnalyzeWorker analyzeWorker,
      MoveWorker moveWorker) {
    this.scheduler = scheduler;
    this.properties = properties;
    this.scanProducer = scanProducer;
    this.analyzeWorker = analyzeWorker;
    this.moveWorker = moveWorker;
  }

  @EventListener(ApplicationReadyEvent.class)
  public synchronized void start() {
    if (properties.scan().enabled()) {
      schedule("scan", 1, properties.scan(), scanProducer::scanOnce);
    }
    if (properties.analyze().enabled()) {
      schedule(
          "analyze",
          properties.analyze().instances(),
          properties.analyze(),
          () -> drain("analyze", analyzeWorker::runOnce));
    }
    if (properties.move().enabled()) {
      schedule(
          "move",
          properties.move().instances(),
          properties.move(),
          () -> drain("move", moveWorker::runOnce));
    }
    LOGGER.info(
        "Worker loops started: scan={}, analyze={}x{}, move={}x{}",
        properties.scan().enabled(),
        properties.analyze().enabled(),
        properties.analyze().instances(),
        properties.move().enabled(),
        properties.move().instances());
  }

  /** Rescan straight away when the source root changes. */
  @EventListener
  public void onPathsConfirmed(PathsConfirmedEvent event) {
    if (!properties.scan().enabled()) {
      return;
    }
    LOGGER.info("Source root confirmed as {}; scanning now", event.current().sourceDir());
    scheduler.schedule(() -> guarded("scan", scanProducer::scanOnce), Instant.now());
  }

  @PreDestroy
  public synchronized void stop() {
    loops.forEach(loop -> loop.cancel(false));
    loops.clear();
  }

  private void schedule(String stage, int instances, WorkerProperties.Stage config, Runnable body) {
    Duration delay = Duration.ofSeconds(config.pollSeconds());
    for (int i = 0; i < instances; i++) {
      loops.add(scheduler.scheduleWithFixedDelay(() -> guarded(stage, body), delay));
    }
  }

  /** Process claimable jobs until none is left. */
  static void drain(String stage, BooleanSupplier runOnce) {
    int processed = 0;
    while (!Thread.currentThread().isInterrupted() && runOnce.getAsBoolean()) {
      processed++;
    }
    if (processed > 0) {
      LOGGER.debug("{} loop processed {} job(s)", stage, processed);
    }
  }

  private static void guarded(String stage, Runnable body) {
    try {
      body.run();
    } catch (DataAccessException e) {
      LOGGER.error("{} loop hit a store failure, retrying next poll: {}", stage, e.getMessage(), e);
    } catch (RuntimeException e) {
      LOGGER.error("{} loop failed, retrying next poll", stage, e);
    }
  }
}
