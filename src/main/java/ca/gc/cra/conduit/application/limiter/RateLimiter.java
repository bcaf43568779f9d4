package ca.gc.cra.conduit.application.limiter;

import ca.gc.cra.conduit.application.port.ClockPort;
import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.Refill;
import io.github.bucket4j.TimeMeter;
import java.time.Duration;
import java.util.Objects;

/**
 * <strong>What:</strong> Fixed-window token bucket backed by a Bucket4j {@link Bucket}.
 * <p>The bucket holds {@code permitsPerInterval} tokens and is refilled to that amount at every interval
 * boundary; unused tokens do not carry over.</p>
 * <p><strong>Thread-safety:</strong> The underlying bucket is thread-safe. Time is read from the supplied
 * {@link ClockPort} so tests can drive refills with a manual clock.</p>
 *
 * @since 0.1.0
 */
public final class RateLimiter {
  private final long permitsPerInterval;
  private final Bucket bucket;

  /**
   * Creates a limiter starting with a full bucket.
   *
   * @param permitsPerInterval tokens granted per window; must be positive
   * @param intervalMillis refill interval; must be positive
   * @param clock time source
   */
  public RateLimiter(long permitsPerInterval, long intervalMillis, ClockPort clock) {
    if (permitsPerInterval <= 0) {
      throw new IllegalArgumentException("permitsPerInterval must be positive");
    }
    if (intervalMillis <= 0) {
      throw new IllegalArgumentException("intervalMillis must be positive");
    }
    this.permitsPerInterval = permitsPerInterval;
    Bandwidth bandwidth = Bandwidth.classic(
        permitsPerInterval, Refill.intervally(permitsPerInterval, Duration.ofMillis(intervalMillis)));
    this.bucket = Bucket.builder()
        .addLimit(bandwidth)
        .withCustomTimePrecision(new ClockTimeMeter(Objects.requireNonNull(clock, "clock")))
        .build();
  }

  /**
   * Takes one token if available.
   *
   * @return {@code true} when a token was taken
   */
  public boolean tryAcquire() {
    return bucket.tryConsume(1);
  }

  public long available() {
    return bucket.getAvailableTokens();
  }

  public long permitsPerInterval() {
    return permitsPerInterval;
  }

  private static final class ClockTimeMeter implements TimeMeter {
    private final ClockPort clock;

    private ClockTimeMeter(ClockPort clock) {
      this.clock = clock;
    }

    @Override
    public long currentTimeNanos() {
      return clock.nowMillis() * 1_000_000L;
    }

    @Override
    public boolean isWallClockBased() {
      return false;
    }
  }
}
