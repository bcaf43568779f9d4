package ca.gc.cra.conduit.application.pipeline;

/**
 * Outcome of {@link Pipeline#stop()}: what was delivered and what had to be discarded.
 *
 * @param drained {@code true} if the sender queues emptied within the grace period
 * @param deliveredItems items acknowledged by destinations over the pipeline's lifetime
 * @param discardedGroups event groups still in the process queue when the grace period ended
 * @param discardedItems items still in sender queues when the grace period ended
 * @param discardedEvents events carried by the discarded groups and items
 * @param elapsedMillis time spent stopping
 * @since 0.1.0
 */
public record ShutdownReport(
    boolean drained,
    long deliveredItems,
    int discardedGroups,
    int discardedItems,
    long discardedEvents,
    long elapsedMillis) {

  /**
   * Returns whether anything had to be discarded.
   *
   * @return {@code true} when no group or item was discarded
   */
  public boolean lossless() {
    return discardedGroups == 0 && discardedItems == 0;
  }
}
