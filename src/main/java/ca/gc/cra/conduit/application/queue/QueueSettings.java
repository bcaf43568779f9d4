package ca.gc.cra.conduit.application.queue;

import ca.gc.cra.conduit.validation.Numbers;
import java.util.Objects;

/**
 * Sizing of one bounded queue lane.
 *
 * @param capacity regular capacity in elements
 * @param extraBuffer overflow allowance beyond {@code capacity}
 * @param highWatermark occupancy at which {@link BoundedQueue#validToPush()} turns false
 * @param overflowPolicy behaviour once {@code capacity + extraBuffer} is reached
 * @param blockTimeoutMillis maximum wait under {@link OverflowPolicy#BLOCK}
 * @since 0.1.0
 */
public record QueueSettings(
    int capacity,
    int extraBuffer,
    int highWatermark,
    OverflowPolicy overflowPolicy,
    long blockTimeoutMillis) {

  /**
   * Validates sizing.
   *
   * @throws IllegalArgumentException if a bound is out of range
   */
  public QueueSettings {
    Numbers.requireRange("capacity", capacity, 1, 1_000_000);
    Numbers.requireRange("extraBuffer", extraBuffer, 0, 1_000_000);
    Numbers.requireRange("highWatermark", highWatermark, 1, (long) capacity + extraBuffer);
    Objects.requireNonNull(overflowPolicy, "overflowPolicy");
    Numbers.requireRange("blockTimeoutMillis", blockTimeoutMillis, 0, 60_000);
  }

  /**
   * Creates discard-on-overflow settings.
   *
   * @param capacity regular capacity
   * @param extraBuffer overflow allowance
   * @param highWatermark backpressure threshold
   * @return settings
   */
  public static QueueSettings discarding(int capacity, int extraBuffer, int highWatermark) {
    return new QueueSettings(capacity, extraBuffer, highWatermark, OverflowPolicy.DISCARD, 0);
  }

  /**
   * Returns the hard bound on elements held by one lane.
   *
   * @return {@code capacity + extraBuffer}
   */
  public int limit() {
    return capacity + extraBuffer;
  }
}
