package ca.gc.cra.conduit.domain.event;

import ca.gc.cra.conduit.domain.queue.QueueKey;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Closed batch of event groups accumulated under one {@link QueueKey}.
 * <p><strong>Role:</strong> Hand-off value between the batcher and the router/serializer stages.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param key destination stream of every member group
 * @param groups member groups in arrival order; never empty
 * @param byteSize sum of member byte sizes
 * @param eventCount sum of member event counts
 * @param openedAtMillis arrival time of the first member
 * @param closedAtMillis time the batch was closed
 * @param reason trigger that closed the batch
 * @since 0.1.0
 */
public record Batch(
    QueueKey key,
    List<EventGroup> groups,
    long byteSize,
    int eventCount,
    long openedAtMillis,
    long closedAtMillis,
    CloseReason reason) {

  /**
   * Validates batch invariants.
   *
   * @throws IllegalArgumentException if the batch has no groups or closes before it opened
   */
  public Batch {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(reason, "reason");
    groups = List.copyOf(Objects.requireNonNull(groups, "groups"));
    if (groups.isEmpty()) {
      throw new IllegalArgumentException("batch must contain at least one group");
    }
    if (closedAtMillis < openedAtMillis) {
      throw new IllegalArgumentException("batch closed before it opened");
    }
  }

  /**
   * Returns how long the batch stayed open.
   *
   * @return age at close in milliseconds
   */
  public long ageMillis() {
    return closedAtMillis - openedAtMillis;
  }

  /** Trigger that closed a batch. */
  public enum CloseReason {
    /** Byte threshold reached. */
    SIZE,
    /** Event-count threshold reached. */
    EVENTS,
    /** Age threshold reached, by an arrival or by the sweep timer. */
    TIMEOUT,
    /** Closed early by shutdown or an explicit flush. */
    FORCED
  }
}
