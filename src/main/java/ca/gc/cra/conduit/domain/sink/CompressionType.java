package ca.gc.cra.conduit.domain.sink;

import java.util.Locale;

/**
 * Compression applied to a serialized payload.
 *
 * @since 0.1.0
 */
public enum CompressionType {
  /** Payload is sent as serialized. */
  NONE,
  /** RFC 1952 gzip framing. */
  GZIP,
  /** RFC 1950 zlib/deflate framing. */
  DEFLATE;

  /**
   * Parses a configuration value.
   *
   * @param raw configured value; {@code null} or blank yields {@link #NONE}
   * @return matching compression type
   * @throws IllegalArgumentException if the value is not recognised
   */
  public static CompressionType fromString(String raw) {
    if (raw == null || raw.isBlank()) {
      return NONE;
    }
    String normalized = raw.trim().toUpperCase(Locale.ROOT);
    try {
      return CompressionType.valueOf(normalized);
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("Unsupported compression: " + raw, ex);
    }
  }
}
