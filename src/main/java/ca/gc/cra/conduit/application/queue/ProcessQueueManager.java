package ca.gc.cra.conduit.application.queue;

import ca.gc.cra.conduit.application.metrics.MetricNames;
import ca.gc.cra.conduit.application.metrics.MetricsRecord;
import ca.gc.cra.conduit.application.metrics.MetricsRegistry;
import ca.gc.cra.conduit.application.port.ClockPort;
import ca.gc.cra.conduit.domain.event.EventGroup;
import ca.gc.cra.conduit.domain.queue.QueueKey;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * <strong>What:</strong> Per-pipeline process queue: one {@link BoundedQueue} of event groups per {@link QueueKey}.
 * <p><strong>Why:</strong> Producers must never block on a congested destination for longer than the configured
 * overflow wait; this queue absorbs bursts up to {@code capacity + extraBuffer} per key and counts the rest as
 * discarded.</p>
 * <p><strong>Role:</strong> First stage of the output path, fed by {@code Pipeline.submit} and consumed by the
 * process runner.</p>
 * <p><strong>Thread-safety:</strong> Lanes are created on first use through a concurrent map; each lane guards its
 * own state.</p>
 * <p><strong>Observability:</strong> Each lane owns a {@code process_queue} metrics record labelled with the key.</p>
 *
 * @since 0.1.0
 */
public final class ProcessQueueManager {
  private final String pipelineName;
  private final QueueSettings settings;
  private final MetricsRegistry registry;
  private final ClockPort clock;
  private final ConcurrentMap<QueueKey, BoundedQueue<EventGroup>> lanes = new ConcurrentHashMap<>();
  private final List<BoundedQueue<EventGroup>> order = new CopyOnWriteArrayList<>();
  private final WorkSignal signal = new WorkSignal();
  private volatile boolean closed;

  /**
   * Creates an empty manager.
   *
   * @param pipelineName owning pipeline, used as metrics label
   * @param settings sizing applied to every lane
   * @param registry registry receiving lane records
   * @param clock time source for delay metrics
   */
  public ProcessQueueManager(
      String pipelineName, QueueSettings settings, MetricsRegistry registry, ClockPort clock) {
    this.pipelineName = Objects.requireNonNull(pipelineName, "pipelineName");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.registry = Objects.requireNonNull(registry, "registry");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Appends a group to the lane of {@code key}.
   *
   * @param key stream identity
   * @param group event group; ownership moves to the queue on success
   * @return {@code false} if the lane is full and the group was discarded
   */
  public boolean push(QueueKey key, EventGroup group) {
    return laneFor(key).push(group);
  }

  /**
   * Removes the head group of {@code key}'s lane.
   *
   * @param key stream identity
   * @return head group, or empty when the lane is empty or unknown
   */
  public Optional<EventGroup> pop(QueueKey key) {
    BoundedQueue<EventGroup> lane = lanes.get(key);
    return lane == null ? Optional.empty() : lane.poll();
  }

  /**
   * Returns whether producers should keep feeding {@code key}. Unknown keys are always valid.
   *
   * @param key stream identity
   * @return backpressure flag
   */
  public boolean validToPush(QueueKey key) {
    BoundedQueue<EventGroup> lane = lanes.get(key);
    return lane == null || lane.validToPush();
  }

  public Optional<BoundedQueue<EventGroup>> lane(QueueKey key) {
    return Optional.ofNullable(lanes.get(key));
  }

  /**
   * Returns lanes in creation order for round-robin consumers.
   *
   * @return snapshot of lanes
   */
  public List<BoundedQueue<EventGroup>> lanes() {
    return List.copyOf(order);
  }

  /**
   * Counts groups held across all lanes.
   *
   * @return total element count
   */
  public int size() {
    int total = 0;
    for (BoundedQueue<EventGroup> lane : order) {
      total += lane.size();
    }
    return total;
  }

  public boolean isEmpty() {
    return size() == 0;
  }

  /**
   * Parks the caller until a lane receives a group or the timeout elapses.
   *
   * @param timeoutMillis maximum wait
   * @return {@code true} if woken by new work
   * @throws InterruptedException if interrupted while waiting
   */
  public boolean awaitWork(long timeoutMillis) throws InterruptedException {
    return signal.await(timeoutMillis);
  }

  /** Wakes consumers parked in {@link #awaitWork(long)}. */
  public void wakeUp() {
    signal.signal();
  }

  /**
   * Closes every lane and discards the groups they hold. Groups pushed afterwards, including those of producers
   * parked on a full lane, are refused and counted on the lane's record.
   *
   * @return groups discarded by this call, lane by lane in FIFO order
   */
  public List<EventGroup> closeAll() {
    closed = true;
    List<EventGroup> discarded = new ArrayList<>();
    for (BoundedQueue<EventGroup> lane : order) {
      discarded.addAll(lane.close());
    }
    return discarded;
  }

  /** Removes the lane records from the registry. */
  public void unregisterMetrics() {
    for (BoundedQueue<EventGroup> lane : order) {
      registry.unregister(lane.metrics());
    }
  }

  /**
   * Drains every lane into a list without counting the groups as discarded, for hand-off to the batcher during
   * shutdown.
   *
   * @return groups per lane in FIFO order
   */
  public List<Drained> takeAll() {
    List<Drained> out = new ArrayList<>();
    for (BoundedQueue<EventGroup> lane : order) {
      Optional<EventGroup> next;
      while ((next = lane.poll()).isPresent()) {
        out.add(new Drained(lane.key(), next.get()));
      }
    }
    return out;
  }

  private BoundedQueue<EventGroup> laneFor(QueueKey key) {
    Objects.requireNonNull(key, "key");
    BoundedQueue<EventGroup> lane = lanes.get(key);
    if (lane == null) {
      lane = lanes.computeIfAbsent(key, k -> {
        MetricsRecord record =
            registry.register(QueueLabels.of(pipelineName, MetricNames.COMPONENT_PROCESS_QUEUE, k));
        BoundedQueue<EventGroup> created = new BoundedQueue<>(k, settings, record, clock, signal::signal);
        order.add(created);
        return created;
      });
    }
    // closeAll may have snapshotted the lanes before this one was added
    if (closed) {
      lane.close();
    }
    return lane;
  }

  /**
   * Group removed by {@link #takeAll()} together with its key.
   *
   * @param key stream identity
   * @param group removed group
   */
  public record Drained(QueueKey key, EventGroup group) {}
}
