package ca.gc.cra.conduit.infrastructure.serialize;

import ca.gc.cra.conduit.application.port.BatchSerializer;
import ca.gc.cra.conduit.application.port.SerializationException;
import ca.gc.cra.conduit.domain.event.Batch;
import ca.gc.cra.conduit.domain.event.EventGroup;
import ca.gc.cra.conduit.domain.event.LogEvent;
import ca.gc.cra.conduit.domain.sink.PayloadFormat;
import com.fasterxml.jackson.core.JsonEncoding;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Jackson streaming encoder for batches.
 * <p><strong>Formats:</strong>
 * <ul>
 *   <li>{@link PayloadFormat#JSON}: one document {@code {"key": "...", "groups": [group, ...]}}.</li>
 *   <li>{@link PayloadFormat#NDJSON}: one group object per line.</li>
 * </ul>
 * A group is {@code {"source": "...", "tags": {...}, "events": [{"time": ms, "contents": {...}}]}}.</p>
 * <p><strong>Thread-safety:</strong> The {@link JsonFactory} is thread-safe; generators and parsers are per call.</p>
 *
 * @since 0.1.0
 */
public final class JsonBatchSerializer implements BatchSerializer {
  private static final String FIELD_KEY = "key";
  private static final String FIELD_GROUPS = "groups";
  private static final String FIELD_SOURCE = "source";
  private static final String FIELD_TAGS = "tags";
  private static final String FIELD_EVENTS = "events";
  private static final String FIELD_TIME = "time";
  private static final String FIELD_CONTENTS = "contents";

  private final JsonFactory factory = new JsonFactory();
  private final PayloadFormat format;
  private final long maxPayloadBytes;

  /**
   * Creates a serializer.
   *
   * @param format output format
   * @param maxPayloadBytes largest payload accepted; larger batches fail serialization
   */
  public JsonBatchSerializer(PayloadFormat format, long maxPayloadBytes) {
    this.format = Objects.requireNonNull(format, "format");
    if (maxPayloadBytes <= 0) {
      throw new IllegalArgumentException("maxPayloadBytes must be positive");
    }
    this.maxPayloadBytes = maxPayloadBytes;
  }

  @Override
  public PayloadFormat format() {
    return format;
  }

  @Override
  public byte[] serialize(Batch batch) throws SerializationException {
    Objects.requireNonNull(batch, "batch");
    ByteArrayOutputStream out = new ByteArrayOutputStream((int) Math.min(batch.byteSize() * 2 + 64, maxPayloadBytes));
    try {
      if (format == PayloadFormat.NDJSON) {
        for (EventGroup group : batch.groups()) {
          try (JsonGenerator generator = factory.createGenerator(out, JsonEncoding.UTF8)) {
            generator.configure(JsonGenerator.Feature.AUTO_CLOSE_TARGET, false);
            writeGroup(generator, group);
          }
          out.write('\n');
        }
      } else {
        try (JsonGenerator generator = factory.createGenerator(out, JsonEncoding.UTF8)) {
          generator.writeStartObject();
          generator.writeStringField(FIELD_KEY, batch.key().toString());
          generator.writeArrayFieldStart(FIELD_GROUPS);
          for (EventGroup group : batch.groups()) {
            writeGroup(generator, group);
          }
          generator.writeEndArray();
          generator.writeEndObject();
        }
      }
    } catch (IOException ex) {
      throw new SerializationException("Failed to encode batch for " + batch.key(), ex);
    }
    if (out.size() > maxPayloadBytes) {
      throw new SerializationException("Encoded batch for " + batch.key() + " is " + out.size()
          + " bytes, above the " + maxPayloadBytes + " byte limit");
    }
    return out.toByteArray();
  }

  @Override
  public List<EventGroup> deserialize(byte[] payload) throws SerializationException {
    Objects.requireNonNull(payload, "payload");
    List<EventGroup> groups = new ArrayList<>();
    try (JsonParser parser = factory.createParser(payload)) {
      if (format == PayloadFormat.NDJSON) {
        JsonToken token;
        while ((token = parser.nextToken()) != null) {
          expect(token, JsonToken.START_OBJECT);
          groups.add(readGroup(parser));
        }
        return groups;
      }
      expect(parser.nextToken(), JsonToken.START_OBJECT);
      JsonToken token;
      while ((token = parser.nextToken()) != JsonToken.END_OBJECT) {
        expect(token, JsonToken.FIELD_NAME);
        String field = parser.getCurrentName();
        JsonToken value = parser.nextToken();
        if (FIELD_GROUPS.equals(field)) {
          expect(value, JsonToken.START_ARRAY);
          while ((token = parser.nextToken()) != JsonToken.END_ARRAY) {
            expect(token, JsonToken.START_OBJECT);
            groups.add(readGroup(parser));
          }
        } else {
          parser.skipChildren();
        }
      }
      return groups;
    } catch (IOException | IllegalArgumentException | NullPointerException ex) {
      throw new SerializationException("Malformed " + format + " payload", ex);
    }
  }

  private static void writeGroup(JsonGenerator generator, EventGroup group) throws IOException {
    generator.writeStartObject();
    generator.writeStringField(FIELD_SOURCE, group.source());
    generator.writeObjectFieldStart(FIELD_TAGS);
    writeFields(generator, group.tags());
    generator.writeEndObject();
    generator.writeArrayFieldStart(FIELD_EVENTS);
    for (LogEvent event : group.events()) {
      generator.writeStartObject();
      generator.writeNumberField(FIELD_TIME, event.timestampMillis());
      generator.writeObjectFieldStart(FIELD_CONTENTS);
      writeFields(generator, event.contents());
      generator.writeEndObject();
      generator.writeEndObject();
    }
    generator.writeEndArray();
    generator.writeEndObject();
  }

  private static void writeFields(JsonGenerator generator, Map<String, String> fields) throws IOException {
    for (Map.Entry<String, String> field : fields.entrySet()) {
      generator.writeStringField(field.getKey(), field.getValue());
    }
  }

  /** Parser is positioned on the group's START_OBJECT. */
  private static EventGroup readGroup(JsonParser parser) throws IOException {
    String source = null;
    Map<String, String> tags = Map.of();
    List<LogEvent> events = new ArrayList<>();
    JsonToken token;
    while ((token = parser.nextToken()) != JsonToken.END_OBJECT) {
      expect(token, JsonToken.FIELD_NAME);
      String field = parser.getCurrentName();
      JsonToken value = parser.nextToken();
      switch (field) {
        case FIELD_SOURCE -> source = parser.getText();
        case FIELD_TAGS -> tags = readFields(parser, value);
        case FIELD_EVENTS -> {
          expect(value, JsonToken.START_ARRAY);
          while ((token = parser.nextToken()) != JsonToken.END_ARRAY) {
            expect(token, JsonToken.START_OBJECT);
            events.add(readEvent(parser));
          }
        }
        default -> parser.skipChildren();
      }
    }
    if (source == null) {
      throw new IOException("group without source");
    }
    return new EventGroup(source, tags, events);
  }

  private static LogEvent readEvent(JsonParser parser) throws IOException {
    long time = 0L;
    Map<String, String> contents = Map.of();
    JsonToken token;
    while ((token = parser.nextToken()) != JsonToken.END_OBJECT) {
      expect(token, JsonToken.FIELD_NAME);
      String field = parser.getCurrentName();
      JsonToken value = parser.nextToken();
      if (FIELD_TIME.equals(field)) {
        time = parser.getLongValue();
      } else if (FIELD_CONTENTS.equals(field)) {
        contents = readFields(parser, value);
      } else {
        parser.skipChildren();
      }
    }
    return new LogEvent(time, contents);
  }

  private static Map<String, String> readFields(JsonParser parser, JsonToken start) throws IOException {
    expect(start, JsonToken.START_OBJECT);
    Map<String, String> fields = new LinkedHashMap<>();
    JsonToken token;
    while ((token = parser.nextToken()) != JsonToken.END_OBJECT) {
      expect(token, JsonToken.FIELD_NAME);
      String name = parser.getCurrentName();
      expect(parser.nextToken(), JsonToken.VALUE_STRING);
      fields.put(name, parser.getText());
    }
    return fields;
  }

  private static void expect(JsonToken actual, JsonToken expected) throws IOException {
    if (actual != expected) {
      throw new IOException("expected " + expected + " but found " + actual);
    }
  }
}
