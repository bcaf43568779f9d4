package ca.gc.cra.conduit.domain.event;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class EventGroupTest {

  @Test
  void byteSizeCountsUtf8BytesOfEveryField() {
    LogEvent event = LogEvent.of(1L, "msg", "café");
    assertEquals(8 + 3 + 5, event.byteSize());

    EventGroup group = new EventGroup("src", Map.of("host", "n1"), List.of(event, LogEvent.of(2L, "k", "v")));

    assertEquals(3 + 4 + 2 + 16 + 10, group.byteSize());
    assertEquals(2, group.eventCount());
  }

  @Test
  void eventsAreCopiedOnConstruction() {
    List<LogEvent> events = new ArrayList<>(List.of(LogEvent.of(1L, "k", "v")));
    EventGroup group = new EventGroup("src", Map.of(), events);
    events.add(LogEvent.of(2L, "k", "v"));

    assertEquals(1, group.eventCount());
    assertThrows(UnsupportedOperationException.class, () -> group.events().clear());
  }

  @Test
  void blankKeysAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> LogEvent.of(1L, " ", "v"));
    assertThrows(IllegalArgumentException.class, () -> new EventGroup("src", Map.of("", "x"), List.of()));
  }
}
