package ca.gc.cra.conduit.config;

import java.util.Locale;

/**
 * <strong>What:</strong> Destination adapters a pipeline can deliver to.
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum DestinationType {
  /** Logs an item summary and acknowledges; for smoke tests and dry runs. */
  LOG,
  /** Publishes payloads to an Apache Kafka topic. */
  KAFKA;

  /**
   * Parses a destination type, defaulting to {@link #LOG} when blank.
   *
   * @param value textual representation such as {@code "log"} or {@code "kafka"}
   * @return parsed type
   * @throws IllegalArgumentException if the string does not match a known type
   */
  public static DestinationType fromString(String value) {
    if (value == null || value.isBlank()) {
      return LOG;
    }
    try {
      return DestinationType.valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("Unknown destination.type: " + value, ex);
    }
  }
}
