package ca.gc.cra.conduit.domain.sink;

import java.util.Locale;

/**
 * Wire encoding produced by the serializer stage.
 *
 * @since 0.1.0
 */
public enum PayloadFormat {
  /** One JSON document holding every group of the batch. */
  JSON,
  /** One JSON document per group, newline separated. */
  NDJSON;

  /**
   * Parses a configuration value.
   *
   * @param raw configured value; {@code null} or blank yields {@link #JSON}
   * @return matching format
   * @throws IllegalArgumentException if the value is not recognised
   */
  public static PayloadFormat fromString(String raw) {
    if (raw == null || raw.isBlank()) {
      return JSON;
    }
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "json" -> JSON;
      case "ndjson", "jsonl" -> NDJSON;
      default -> throw new IllegalArgumentException("Unsupported serializer format: " + raw);
    };
  }
}
