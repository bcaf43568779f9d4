package ca.gc.cra.conduit.infrastructure.serialize;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.conduit.application.port.SerializationException;
import ca.gc.cra.conduit.domain.event.Batch;
import ca.gc.cra.conduit.domain.event.Batch.CloseReason;
import ca.gc.cra.conduit.domain.event.EventGroup;
import ca.gc.cra.conduit.domain.event.LogEvent;
import ca.gc.cra.conduit.domain.sink.PayloadFormat;
import ca.gc.cra.conduit.testutil.Groups;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class JsonBatchSerializerTest {
  private static final EventGroup NGINX = new EventGroup("/var/log/nginx/access.log",
      Map.of("host", "node-1"),
      List.of(new LogEvent(1_700_000_000_000L, Map.of("status", "200", "path", "/health")),
          LogEvent.of(1_700_000_000_500L, "msg", "quote \" and é")));

  private static Batch batch(EventGroup... groups) {
    long bytes = 0;
    int events = 0;
    for (EventGroup group : groups) {
      bytes += group.byteSize();
      events += group.eventCount();
    }
    return new Batch(Groups.KEY, List.of(groups), bytes, events, 0, 0, CloseReason.SIZE);
  }

  @Test
  void jsonDocumentCarriesKeyAndGroups() throws Exception {
    JsonBatchSerializer serializer = new JsonBatchSerializer(PayloadFormat.JSON, 1 << 20);

    byte[] payload = serializer.serialize(batch(NGINX, Groups.withEvents(2)));

    String text = new String(payload, StandardCharsets.UTF_8);
    assertTrue(text.startsWith("{\"key\":\"ca-central-1/agent/app-logs\",\"groups\":["), text);
    assertTrue(text.contains("\"time\":1700000000000"), text);
    assertEquals(List.of(NGINX, Groups.withEvents(2)), serializer.deserialize(payload));
  }

  @Test
  void ndjsonWritesOneGroupPerLine() throws Exception {
    JsonBatchSerializer serializer = new JsonBatchSerializer(PayloadFormat.NDJSON, 1 << 20);

    byte[] payload = serializer.serialize(batch(NGINX, Groups.withEvents(1), Groups.withEvents(3)));

    String[] lines = new String(payload, StandardCharsets.UTF_8).split("\n");
    assertEquals(3, lines.length);
    assertTrue(lines[0].startsWith("{\"source\":\"/var/log/nginx/access.log\""), lines[0]);
    List<EventGroup> decoded = serializer.deserialize(payload);
    assertEquals(3, decoded.size());
    assertEquals(NGINX, decoded.get(0));
    assertEquals(3, decoded.get(2).eventCount());
  }

  @Test
  void payloadAboveLimitFails() {
    JsonBatchSerializer serializer = new JsonBatchSerializer(PayloadFormat.JSON, 64);

    SerializationException ex = assertThrows(SerializationException.class,
        () -> serializer.serialize(batch(Groups.sized(500))));
    assertTrue(ex.getMessage().contains("64 byte limit"), ex.getMessage());
  }

  @Test
  void malformedPayloadFails() {
    JsonBatchSerializer json = new JsonBatchSerializer(PayloadFormat.JSON, 1 << 20);
    JsonBatchSerializer ndjson = new JsonBatchSerializer(PayloadFormat.NDJSON, 1 << 20);

    assertThrows(SerializationException.class, () -> json.deserialize("[1,2]".getBytes(StandardCharsets.UTF_8)));
    assertThrows(SerializationException.class,
        () -> json.deserialize("{\"groups\":[{\"tags\":{}}]}".getBytes(StandardCharsets.UTF_8)));
    assertThrows(SerializationException.class,
        () -> ndjson.deserialize("{\"source\":\"s\",\"events\":[".getBytes(StandardCharsets.UTF_8)));
  }

  @Test
  void rejectsNonPositiveLimit() {
    assertThrows(IllegalArgumentException.class, () -> new JsonBatchSerializer(PayloadFormat.JSON, 0));
  }
}
