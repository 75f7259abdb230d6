package com.scholary.sorter.api;

import com.scholary.sorter.status.EventBroadcaster;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/** Live status stream. */
@RestController
@Tag(name = "Events", description = "Server-Sent Events stream of status snapshots")
public class EventsController {

  private final EventBroadcaster broadcaster;

  public EventsController(EventBroadcaster broadcaster) {
    this.broadcaster = broadcaster;
  }

  @GetMapping(path = "/api/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
  @Operation(
      summary = "Subscribe to status updates",
      description =
          "Sends the current snapshot on connect, then one 'status' event per batch of "
              + "transitions. Reconnect and read /api/status after a disconnect.")
  public SseEmitter events() {
    return broadcaster.subscribe();
  }
}
