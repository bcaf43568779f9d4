package ca.gc.cra.conduit.application.queue;

import ca.gc.cra.conduit.application.limiter.RateLimiterScope;
import ca.gc.cra.conduit.application.limiter.RateLimiters;
import ca.gc.cra.conduit.application.metrics.MetricNames;
import ca.gc.cra.conduit.application.metrics.MetricsRecord;
import ca.gc.cra.conduit.application.metrics.MetricsRegistry;
import ca.gc.cra.conduit.application.port.ClockPort;
import ca.gc.cra.conduit.domain.queue.QueueKey;
import ca.gc.cra.conduit.domain.sink.SenderItem;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * <strong>What:</strong> Per-destination sender queues: one {@link BoundedQueue} of {@link SenderItem}s per bound
 * {@link QueueKey}.
 * <p><strong>Why:</strong> Holds ready-to-send items while exposing the {@code valid to push} flag that throttles
 * the process runner before the queue is actually full.</p>
 * <p><strong>Role:</strong> Hand-off point between the dispatcher and the flusher runner.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Create and remove lanes as routes are bound and unbound.</li>
 *   <li>Hand out items round-robin across lanes, only after every rate-limiter scope admits them.</li>
 *   <li>Count limiter refusals per scope without removing the refused item.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Safe for concurrent fetches; the round-robin cursor is atomic and limiter
 * checks run under the candidate lane's lock so a refused item is never half-leased.</p>
 *
 * @since 0.1.0
 */
public final class SenderQueueManager {
  private final String pipelineName;
  private final QueueSettings settings;
  private final RateLimiters limiters;
  private final MetricsRegistry registry;
  private final ClockPort clock;
  private final ConcurrentMap<QueueKey, BoundedQueue<SenderItem>> lanes = new ConcurrentHashMap<>();
  private final List<BoundedQueue<SenderItem>> order = new CopyOnWriteArrayList<>();
  private final List<MetricsRecord> records = new CopyOnWriteArrayList<>();
  private final AtomicInteger cursor = new AtomicInteger();
  private final WorkSignal signal = new WorkSignal();

  /**
   * Creates an empty manager.
   *
   * @param pipelineName owning pipeline, used as metrics label
   * @param settings sizing applied to every lane
   * @param limiters limiter scopes consulted on fetch
   * @param registry registry receiving lane records
   * @param clock time source for delay metrics
   */
  public SenderQueueManager(
      String pipelineName,
      QueueSettings settings,
      RateLimiters limiters,
      MetricsRegistry registry,
      ClockPort clock) {
    this.pipelineName = Objects.requireNonNull(pipelineName, "pipelineName");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.limiters = Objects.requireNonNull(limiters, "limiters");
    this.registry = Objects.requireNonNull(registry, "registry");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Returns the lane of {@code key}, creating it on first call.
   *
   * @param key stream identity
   * @param destinationId destination label for the lane's metrics record
   * @return lane
   */
  public BoundedQueue<SenderItem> open(QueueKey key, String destinationId) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(destinationId, "destinationId");
    return lanes.computeIfAbsent(key, k -> {
      Map<String, String> labels = QueueLabels.of(pipelineName, MetricNames.COMPONENT_SENDER_QUEUE, k);
      labels.put(MetricNames.LABEL_FLUSHER_PLUGIN_ID, destinationId);
      MetricsRecord record = registry.register(labels);
      records.add(record);
      BoundedQueue<SenderItem> lane = new BoundedQueue<>(k, settings, record, clock, signal::signal);
      order.add(lane);
      return lane;
    });
  }

  /**
   * Removes the lane of {@code key} and discards its items. Items leased by workers at that moment are discarded
   * too; the workers' later settlement calls find nothing to settle. Limiter buckets no other lane shares are
   * evicted.
   *
   * @param key stream identity
   * @return items discarded, in FIFO order
   */
  public List<SenderItem> close(QueueKey key) {
    BoundedQueue<SenderItem> lane = lanes.remove(key);
    if (lane == null) {
      return List.of();
    }
    order.remove(lane);
    List<SenderItem> dropped = lane.close();
    limiters.retainOnly(lanes.keySet());
    return dropped;
  }

  public Optional<BoundedQueue<SenderItem>> lane(QueueKey key) {
    return Optional.ofNullable(lanes.get(key));
  }

  public List<BoundedQueue<SenderItem>> lanes() {
    return List.copyOf(order);
  }

  /**
   * Appends an item to the lane of its key.
   *
   * @param item item to enqueue
   * @return {@code false} if no lane exists or the lane is full; a full lane counts the discard
   */
  public boolean push(SenderItem item) {
    BoundedQueue<SenderItem> lane = lanes.get(item.key());
    return lane != null && lane.push(item);
  }

  /**
   * Returns the backpressure flag of {@code key}'s lane. Keys without a lane report {@code true} so groups
   * for unrouted keys keep flowing to the router, which discards and counts them.
   *
   * @param key stream identity
   * @return {@code true} while the lane is below its high watermark
   */
  public boolean validToPush(QueueKey key) {
    BoundedQueue<SenderItem> lane = lanes.get(key);
    return lane == null || lane.validToPush();
  }

  /**
   * Leases the next sendable item, visiting lanes round-robin.
   *
   * @return leased item with its lane, or empty when nothing is ready or every candidate was rate limited
   */
  public Optional<Lease> fetch() {
    List<BoundedQueue<SenderItem>> snapshot = List.copyOf(order);
    int count = snapshot.size();
    if (count == 0) {
      return Optional.empty();
    }
    int start = Math.floorMod(cursor.getAndIncrement(), count);
    for (int i = 0; i < count; i++) {
      BoundedQueue<SenderItem> lane = snapshot.get((start + i) % count);
      if (!lane.hasReady()) {
        continue;
      }
      MetricsRecord record = lane.metrics();
      record.counter(MetricNames.FETCH_TIMES_TOTAL).increment();
      Optional<SenderItem> item = lane.acquire(candidate -> admit(record, candidate));
      if (item.isPresent()) {
        return Optional.of(new Lease(lane, item.get()));
      }
    }
    return Optional.empty();
  }

  /**
   * Counts items held across all lanes, leased and parked ones included.
   *
   * @return total element count
   */
  public int size() {
    int total = 0;
    for (BoundedQueue<SenderItem> lane : order) {
      total += lane.size();
    }
    return total;
  }

  public boolean isEmpty() {
    return size() == 0;
  }

  /**
   * Parks the caller until an item becomes ready or the timeout elapses.
   *
   * @param timeoutMillis maximum wait
   * @return {@code true} if woken by new work
   * @throws InterruptedException if interrupted while waiting
   */
  public boolean awaitWork(long timeoutMillis) throws InterruptedException {
    return signal.await(timeoutMillis);
  }

  /** Wakes workers parked in {@link #awaitWork(long)}. */
  public void wakeUp() {
    signal.signal();
  }

  /**
   * Closes every lane, counting the removed items as discarded.
   *
   * @return items discarded
   */
  public List<SenderItem> discardAll() {
    List<SenderItem> discarded = new ArrayList<>();
    for (BoundedQueue<SenderItem> lane : order) {
      discarded.addAll(lane.close());
    }
    return discarded;
  }

  /** Removes the records of every lane ever opened, closed ones included, from the registry. */
  public void unregisterMetrics() {
    for (MetricsRecord record : records) {
      registry.unregister(record);
    }
  }

  private boolean admit(MetricsRecord record, SenderItem candidate) {
    Optional<RateLimiterScope> refused = limiters.tryAcquireAll(candidate.key());
    if (refused.isPresent()) {
      record.counter(refused.get().rejectionMetric()).increment();
      return false;
    }
    return true;
  }

  /**
   * Item leased by {@link #fetch()} together with the lane that still holds it.
   *
   * @param lane owning lane
   * @param item leased item
   */
  public record Lease(BoundedQueue<SenderItem> lane, SenderItem item) {}
}
