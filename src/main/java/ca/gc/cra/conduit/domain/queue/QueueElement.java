package ca.gc.cra.conduit.domain.queue;

/**
 * Element that can be held by a bounded keyed queue.
 * <p>Queues use these figures for occupancy gauges and discard accounting.</p>
 *
 * @since 0.1.0
 */
public interface QueueElement {
  /**
   * Returns the size this element contributes to queue byte gauges.
   *
   * @return size in bytes; never negative
   */
  long byteSize();

  /**
   * Returns the number of telemetry events this element represents.
   *
   * @return event count; never negative
   */
  int eventCount();
}
