package ca.gc.cra.conduit.domain.event;

import ca.gc.cra.conduit.domain.util.Utf8;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Single telemetry event: a timestamp plus ordered key/value contents.
 * <p><strong>Role:</strong> Domain value carried inside an {@link EventGroup}.</p>
 * <p><strong>Thread-safety:</strong> Immutable; contents are copied on construction.</p>
 *
 * @param timestampMillis event time in epoch milliseconds
 * @param contents ordered field map; keys must be non-blank and values non-null
 * @since 0.1.0
 */
public record LogEvent(long timestampMillis, Map<String, String> contents) {
  private static final int TIMESTAMP_BYTES = 8;

  /**
   * Validates and copies the event contents preserving insertion order.
   *
   * @throws NullPointerException if {@code contents} or any value is {@code null}
   * @throws IllegalArgumentException if a key is blank
   */
  public LogEvent {
    Objects.requireNonNull(contents, "contents");
    Map<String, String> copy = new LinkedHashMap<>(contents.size() * 2);
    for (Map.Entry<String, String> entry : contents.entrySet()) {
      String key = entry.getKey();
      if (key == null || key.isBlank()) {
        throw new IllegalArgumentException("event content keys must not be blank");
      }
      copy.put(key, Objects.requireNonNull(entry.getValue(), "value for " + key));
    }
    contents = Collections.unmodifiableMap(copy);
  }

  /**
   * Convenience factory for single-field events.
   *
   * @param timestampMillis event time in epoch milliseconds
   * @param key field name
   * @param value field value
   * @return new event
   */
  public static LogEvent of(long timestampMillis, String key, String value) {
    return new LogEvent(timestampMillis, Map.of(key, value));
  }

  /**
   * Estimates the payload size of this event: eight bytes for the timestamp plus the UTF-8
   * length of every key and value.
   *
   * @return estimated size in bytes
   */
  public long byteSize() {
    long size = TIMESTAMP_BYTES;
    for (Map.Entry<String, String> entry : contents.entrySet()) {
      size += Utf8.encodedLength(entry.getKey());
      size += Utf8.encodedLength(entry.getValue());
    }
    return size;
  }
}
