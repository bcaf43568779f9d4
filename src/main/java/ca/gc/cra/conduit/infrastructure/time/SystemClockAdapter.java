package ca.gc.cra.conduit.infrastructure.time;

import ca.gc.cra.conduit.application.port.ClockPort;

/**
 * {@link ClockPort} implementation backed by {@link System#currentTimeMillis()}.
 *
 * @since 0.1.0
 */
public final class SystemClockAdapter implements ClockPort {
  public SystemClockAdapter() {}

  /**
   * Returns the current epoch milliseconds.
   *
   * @return current epoch milliseconds
   * @implNote Delegates to {@link System#currentTimeMillis()} without smoothing; batch ages may jump when the
   *     wall clock is adjusted.
   */
  @Override
  public long nowMillis() {
    return System.currentTimeMillis();
  }
}
