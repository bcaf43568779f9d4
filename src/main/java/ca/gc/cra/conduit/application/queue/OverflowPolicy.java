package ca.gc.cra.conduit.application.queue;

import java.util.Locale;

/**
 * Behaviour of {@link BoundedQueue#push} once capacity plus extra buffer is exhausted.
 *
 * @since 0.1.0
 */
public enum OverflowPolicy {
  /** Reject immediately and count the discard. */
  DISCARD,
  /** Wait up to the configured block timeout for space, then reject and count the discard. */
  BLOCK;

  /**
   * Parses a configuration value.
   *
   * @param raw configured value; {@code null} or blank yields {@link #DISCARD}
   * @return policy
   * @throws IllegalArgumentException if the value is not recognised
   */
  public static OverflowPolicy fromString(String raw) {
    if (raw == null || raw.isBlank()) {
      return DISCARD;
    }
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "discard", "drop" -> DISCARD;
      case "block" -> BLOCK;
      default -> throw new IllegalArgumentException("Unsupported overflow policy: " + raw);
    };
  }
}
