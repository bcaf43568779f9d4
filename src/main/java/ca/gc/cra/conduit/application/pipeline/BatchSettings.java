package ca.gc.cra.conduit.application.pipeline;

import ca.gc.cra.conduit.validation.Numbers;

/**
 * Thresholds that close an open batch.
 *
 * @param maxBytes byte size at which a batch closes
 * @param maxEvents event count at which a batch closes
 * @param timeoutMillis age at which a batch closes
 * @param sweepIntervalMillis period of the age sweep
 * @since 0.1.0
 */
public record BatchSettings(long maxBytes, int maxEvents, long timeoutMillis, long sweepIntervalMillis) {

  /**
   * Validates thresholds.
   *
   * @throws IllegalArgumentException if a threshold is out of range
   */
  public BatchSettings {
    Numbers.requireRange("batch.maxBytes", maxBytes, 1, 64L * 1024 * 1024);
    Numbers.requireRange("batch.maxEvents", maxEvents, 1, 1_000_000);
    Numbers.requireRange("batch.timeoutMillis", timeoutMillis, 1, 3_600_000);
    Numbers.requireRange("batch.sweepIntervalMillis", sweepIntervalMillis, 1, timeoutMillis);
  }
}
