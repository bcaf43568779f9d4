package ca.gc.cra.conduit.application.port;

/**
 * <strong>What:</strong> Port supplying wall-clock timestamps to batching, rate limiting, and delay metrics.
 * <p><strong>Why:</strong> Batch ages and limiter refills are time driven; tests inject a manual clock to make
 * them deterministic.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe; the sweep timer, producers, and
 * flusher workers read the clock concurrently.</p>
 *
 * @implNote Default implementation delegates to {@link System#currentTimeMillis()}.
 * @since 0.1.0
 * @see ca.gc.cra.conduit.infrastructure.time.SystemClockAdapter
 */
public interface ClockPort {
  /**
   * Returns the current epoch time in milliseconds.
   *
   * @return milliseconds since 1970-01-01T00:00:00Z
   */
  long nowMillis();

  /** Default {@link ClockPort} using {@link System#currentTimeMillis()}. */
  ClockPort SYSTEM = System::currentTimeMillis;
}
