package com.scholary.sorter.status;

import com.scholary.sorter.job.JobStore;
import com.scholary.sorter.job.JobTransitionEvent;
import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.event.EventListener;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * Pushes status snapshots to Server-Sent Events subscribers.
 *
 * <p>Two triggers feed it: transitions made in this process (coalesced into one broadcast per
 * burst) and a poll of the store revision, which catches writes from other processes. A broadcast
 * only goes out when the revision moved. Delivery is best effort; a subscriber whose send fails is
 * dropped and is expected to reconnect and read a fresh snapshot.
 */
@Component
public class EventBroadcaster {

  private static final Logger LOGGER = LoggerFactory.getLogger(EventBroadcaster.class);

  static final String STATUS_EVENT = "status";

  private final List<SseEmitter> emitters = new CopyOnWriteArrayList<>();
  private final AtomicBoolean flushPending = new AtomicBoolean(false);
  private final StatusAggregator aggregator;
  private final JobStore jobStore;
  private final TaskScheduler scheduler;
  private final EventsProperties properties;
  private long lastRevision = -1;

  public EventBroadcaster(
      StatusAggregator aggregator,
      JobStore jobStore,
      @Qualifier("workerScheduler") TaskScheduler scheduler,
      EventsProperties properties) {
    this.aggregator = aggregator;
    this.jobStore = jobStore;
    this.scheduler = scheduler;
    this.properties = properties;
  }

  /** Register a subscriber and send it the current snapshot. */
  public SseEmitter subscribe() {
    SseEmitter emitter = newEmitter();
    emitter.onCompletion(() -> emitters.remove(emitter));
    emitter.onTimeout(
        () -> {
          emitters.remove(emitter);
          emitter.complete();
        });
    emitter.onError(e -> emitters.remove(emitter));
    emitters.add(emitter);
    LOGGER.debug("Subscriber connected, total: {}", emitters.size());

    send(emitter, aggregator.snapshot());
    return emitter;
  }

  public int subscriberCount() {
    return emitters.size();
  }

  @EventListener
  public void onTransition(JobTransitionEvent event) {
    if (!properties.enabled() || emitters.isEmpty()) {
      return;
    }
    if (flushPending.compareAndSet(false, true)) {
      scheduler.schedule(this::flush, Instant.now().plusMillis(properties.coalesceMillis()));
    }
  }

  @Scheduled(fixedDelayString = "${events.poll-millis}")
  public void pollRevision() {
    if (!properties.enabled() || emitters.isEmpty()) {
      return;
    }
    try {
      broadcastIfChanged();
    } catch (DataAccessException e) {
      LOGGER.warn("Revision poll failed: {}", e.getMessage());
    }
  }

  @Scheduled(fixedDelayString = "${events.heartbeat-seconds}", timeUnit = TimeUnit.SECONDS)
  public void heartbeat() {
    for (SseEmitter emitter : emitters) {
      try {
        emitter.send(SseEmitter.event().comment("heartbeat"));
      } catch (IOException | IllegalStateException e) {
        drop(emitter, e);
      }
    }
  }

  void flush() {
    flushPending.set(false);
    try {
      broadcastIfChanged();
    } catch (DataAccessException e) {
      LOGGER.warn("Broadcast failed: {}", e.getMessage());
    }
  }

  /**
   * Broadcast a fresh snapshot if the store changed since the last broadcast.
   *
   * @return true if a broadcast went out
   */
  synchronized boolean broadcastIfChanged() {
    long revision = jobStore.currentRevision();
    if (revision == lastRevision) {
      return false;
    }
    lastRevision = revision;
    aggregator.invalidate();
    StatusSnapshot snapshot = aggregator.snapshot();
    for (SseEmitter emitter : emitters) {
      send(emitter, snapshot);
    }
    LOGGER.debug("Broadcast revision {} to {} subscriber(s)", revision, emitters.size());
    return true;
  }

  SseEmitter newEmitter() {
    return new SseEmitter(properties.emitterTimeoutMillis());
  }

  private void send(SseEmitter emitter, StatusSnapshot snapshot) {
    try {
      emitter.send(
          SseEmitter.event()
              .name(STATUS_EVENT)
              .id(String.valueOf(snapshot.revision()))
              .data(snapshot));
    } catch (IOException | IllegalStateException e) {
      drop(emitter, e);
    }
  }

  private void drop(SseEmitter emitter, Exception cause) {
    if (emitters.remove(emitter)) {
      // the container reports the broken connection itself; no completion call needed
      LOGGER.debug("Dropping subscriber after failed send: {}", cause.getMessage());
    }
  }
}
