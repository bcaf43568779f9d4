package ca.gc.cra.conduit.application.pipeline;

import ca.gc.cra.conduit.validation.Numbers;

/**
 * Worker pool, retry, and registration limits of the flusher runner.
 *
 * @param concurrency number of concurrent send workers
 * @param maxRetries retries granted to network, server, and unauthorized failures before discard
 * @param backoffInitialMillis delay before the first retry
 * @param backoffMaxMillis upper bound of the retry delay
 * @param backoffMultiplier growth factor between consecutive retry delays
 * @param sendTimeoutMillis per-attempt timeout; an expired attempt counts as a network error
 * @param maxRegisterAttempts registration attempts before a destination is marked failed
 * @param otherErrorRetries retries granted to unclassified failures
 * @since 0.1.0
 */
public record FlusherSettings(
    int concurrency,
    int maxRetries,
    long backoffInitialMillis,
    long backoffMaxMillis,
    double backoffMultiplier,
    long sendTimeoutMillis,
    int maxRegisterAttempts,
    int otherErrorRetries) {

  /**
   * Validates limits.
   *
   * @throws IllegalArgumentException if a limit is out of range
   */
  public FlusherSettings {
    Numbers.requireRange("flusher.concurrency", concurrency, 1, 256);
    Numbers.requireRange("flusher.maxRetries", maxRetries, 0, 1_000);
    Numbers.requireRange("flusher.backoffInitialMillis", backoffInitialMillis, 0, 600_000);
    Numbers.requireRange("flusher.backoffMaxMillis", backoffMaxMillis, backoffInitialMillis, 3_600_000);
    if (!(backoffMultiplier >= 1.0d) || Double.isInfinite(backoffMultiplier)) {
      throw new IllegalArgumentException("flusher.backoffMultiplier must be a finite number >= 1.0");
    }
    Numbers.requireRange("flusher.sendTimeoutMillis", sendTimeoutMillis, 1, 600_000);
    Numbers.requireRange("flusher.maxRegisterAttempts", maxRegisterAttempts, 1, 100);
    Numbers.requireRange("flusher.otherErrorRetries", otherErrorRetries, 0, 100);
  }

  /**
   * Computes the delay before retry number {@code retry}: {@code initial * multiplier^(retry-1)}, capped at
   * {@code backoffMaxMillis}.
   *
   * @param retry 1-based retry number
   * @return delay in milliseconds
   */
  public long backoffMillis(int retry) {
    if (retry <= 1) {
      return Math.min(backoffInitialMillis, backoffMaxMillis);
    }
    double delay = backoffInitialMillis * Math.pow(backoffMultiplier, retry - 1);
    if (Double.isNaN(delay) || delay >= backoffMaxMillis) {
      return backoffMaxMillis;
    }
    return (long) delay;
  }
}
