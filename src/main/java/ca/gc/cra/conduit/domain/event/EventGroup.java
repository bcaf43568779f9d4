package ca.gc.cra.conduit.domain.event;

import ca.gc.cra.conduit.domain.queue.QueueElement;
import ca.gc.cra.conduit.domain.util.Utf8;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Ordered sequence of events sharing a source and tag set.
 * <p><strong>Why:</strong> The atomic unit handed to the pipeline by producers; ownership moves with each hand-off.</p>
 * <p><strong>Role:</strong> Domain value object stored in the process queue and accumulated into batches.</p>
 * <p><strong>Thread-safety:</strong> Immutable once constructed; events and tags are copied.</p>
 * <p><strong>Performance:</strong> The byte size is computed once at construction.</p>
 *
 * @since 0.1.0
 */
public final class EventGroup implements QueueElement {
  private final String source;
  private final Map<String, String> tags;
  private final List<LogEvent> events;
  private final long byteSize;

  /**
   * Creates an event group.
   *
   * @param source producer identifier (file path, listener address); must not be {@code null}
   * @param tags shared metadata; keys must be non-blank, values non-null
   * @param events ordered events; must not be {@code null}
   * @throws IllegalArgumentException if a tag key is blank
   */
  public EventGroup(String source, Map<String, String> tags, List<LogEvent> events) {
    this.source = Objects.requireNonNull(source, "source");
    Map<String, String> tagCopy = new LinkedHashMap<>();
    for (Map.Entry<String, String> entry : Objects.requireNonNull(tags, "tags").entrySet()) {
      if (entry.getKey() == null || entry.getKey().isBlank()) {
        throw new IllegalArgumentException("tag keys must not be blank");
      }
      tagCopy.put(entry.getKey(), Objects.requireNonNull(entry.getValue(), "tag value"));
    }
    this.tags = Collections.unmodifiableMap(tagCopy);
    this.events = List.copyOf(Objects.requireNonNull(events, "events"));
    this.byteSize = computeSize(this.source, this.tags, this.events);
  }

  public String source() {
    return source;
  }

  public Map<String, String> tags() {
    return tags;
  }

  public List<LogEvent> events() {
    return events;
  }

  @Override
  public long byteSize() {
    return byteSize;
  }

  @Override
  public int eventCount() {
    return events.size();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof EventGroup other)) {
      return false;
    }
    return source.equals(other.source) && tags.equals(other.tags) && events.equals(other.events);
  }

  @Override
  public int hashCode() {
    return Objects.hash(source, tags, events);
  }

  @Override
  public String toString() {
    return "EventGroup{source=" + source + ", events=" + events.size() + ", bytes=" + byteSize + "}";
  }

  private static long computeSize(String source, Map<String, String> tags, List<LogEvent> events) {
    long size = Utf8.encodedLength(source);
    for (Map.Entry<String, String> tag : tags.entrySet()) {
      size += Utf8.encodedLength(tag.getKey()) + Utf8.encodedLength(tag.getValue());
    }
    for (LogEvent event : events) {
      size += event.byteSize();
    }
    return size;
  }
}
