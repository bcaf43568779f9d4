package ca.gc.cra.conduit.testutil;

import ca.gc.cra.conduit.domain.event.EventGroup;
import ca.gc.cra.conduit.domain.event.LogEvent;
import ca.gc.cra.conduit.domain.queue.QueueKey;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** Event group fixtures. */
public final class Groups {
  public static final QueueKey KEY = QueueKey.of("ca-central-1", "agent", "app-logs");

  private Groups() {}

  /**
   * Builds a group of one event whose estimated size is exactly {@code bytes}.
   *
   * @param bytes target size; at least 10
   * @return group with source {@code "s"} and a single {@code "k"} field
   */
  public static EventGroup sized(int bytes) {
    // source (1) + timestamp (8) + key (1)
    String value = "x".repeat(bytes - 10);
    return new EventGroup("s", Map.of(), List.of(LogEvent.of(1_000L, "k", value)));
  }

  public static EventGroup withEvents(int count) {
    List<LogEvent> events = new ArrayList<>(count);
    for (int i = 0; i < count; i++) {
      events.add(LogEvent.of(1_000L + i, "msg", "line-" + i));
    }
    return new EventGroup("/var/log/app.log", Map.of("host", "node-1"), events);
  }
}
