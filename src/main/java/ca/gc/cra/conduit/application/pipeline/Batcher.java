package ca.gc.cra.conduit.application.pipeline;

import ca.gc.cra.conduit.application.metrics.MetricNames;
import ca.gc.cra.conduit.application.metrics.MetricsRecord;
import ca.gc.cra.conduit.application.port.ClockPort;
import ca.gc.cra.conduit.application.port.MetricsPort;
import ca.gc.cra.conduit.domain.event.Batch;
import ca.gc.cra.conduit.domain.event.Batch.CloseReason;
import ca.gc.cra.conduit.domain.event.EventGroup;
import ca.gc.cra.conduit.domain.queue.QueueKey;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Accumulates event groups into size, count, and age bounded batches, one open batch per
 * {@link QueueKey}.
 * <p><strong>Why:</strong> Destinations favour fewer, larger requests; the age bound keeps end-to-end latency
 * bounded for low-volume streams.</p>
 * <p><strong>Role:</strong> Second stage of the output path, fed by the process runner and drained into the
 * {@link BatchDispatcher}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Close a batch before a new group would push it past {@code maxBytes} or {@code maxEvents}.</li>
 *   <li>Close a batch once it reaches a threshold, or once its age reaches {@code timeoutMillis}.</li>
 *   <li>Hand each closed batch to the handler exactly once, in per-key close order.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Each key's open batch is guarded by its own lock; closing, handing off, and
 * reopening happen under that lock, so concurrent {@link #add} and {@link #sweep} calls on one key observe at
 * most one open batch. No call holds two key locks.</p>
 * <p><strong>Observability:</strong> Updates the {@code batcher} record (buffered gauges,
 * {@code event_batches_total}) and observes {@code batcher.batch.ageMillis}.</p>
 *
 * @implNote A single group larger than {@code maxBytes} is emitted alone rather than split.
 * @since 0.1.0
 */
public final class Batcher {
  private static final Logger log = LoggerFactory.getLogger(Batcher.class);

  private final BatchSettings settings;
  private final MetricsRecord record;
  private final MetricsPort metrics;
  private final ClockPort clock;
  private final Consumer<Batch> handler;
  private final ConcurrentMap<QueueKey, OpenBatch> open = new ConcurrentHashMap<>();

  /**
   * Creates a batcher.
   *
   * @param settings close thresholds
   * @param record {@code batcher} metrics record
   * @param metrics histogram sink
   * @param clock time source for batch ages
   * @param handler receives every closed batch while the key's lock is held
   */
  public Batcher(
      BatchSettings settings,
      MetricsRecord record,
      MetricsPort metrics,
      ClockPort clock,
      Consumer<Batch> handler) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.record = Objects.requireNonNull(record, "record");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.handler = Objects.requireNonNull(handler, "handler");
  }

  /**
   * Appends a group to the open batch of {@code key}, closing batches as thresholds require.
   *
   * @param key stream identity
   * @param group group taken from the process queue
   */
  public void add(QueueKey key, EventGroup group) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(group, "group");
    record.counter(MetricNames.IN_ITEMS_TOTAL).increment();
    record.counter(MetricNames.IN_EVENTS_TOTAL).add(group.eventCount());
    record.counter(MetricNames.IN_SIZE_BYTES).add(group.byteSize());

    OpenBatch batch = open.computeIfAbsent(key, OpenBatch::new);
    batch.lock.lock();
    try {
      long now = clock.nowMillis();
      if (!batch.isEmpty()) {
        if (batch.bytes + group.byteSize() > settings.maxBytes()) {
          close(batch, now, CloseReason.SIZE);
        } else if (batch.events + group.eventCount() > settings.maxEvents()) {
          close(batch, now, CloseReason.EVENTS);
        } else if (now - batch.openedAtMillis >= settings.timeoutMillis()) {
          close(batch, now, CloseReason.TIMEOUT);
        }
      }
      batch.append(group, now);
      buffered(1, group.eventCount(), group.byteSize());
      if (batch.bytes >= settings.maxBytes()) {
        close(batch, now, CloseReason.SIZE);
      } else if (batch.events >= settings.maxEvents()) {
        close(batch, now, CloseReason.EVENTS);
      }
    } finally {
      batch.lock.unlock();
    }
  }

  /**
   * Closes every open batch whose age reached the timeout. Run periodically by the sweep timer.
   *
   * @return number of batches closed
   */
  public int sweep() {
    int closed = 0;
    for (OpenBatch batch : open.values()) {
      batch.lock.lock();
      try {
        long now = clock.nowMillis();
        if (!batch.isEmpty() && now - batch.openedAtMillis >= settings.timeoutMillis()) {
          close(batch, now, CloseReason.TIMEOUT);
          closed++;
        }
      } finally {
        batch.lock.unlock();
      }
    }
    return closed;
  }

  /**
   * Closes every non-empty batch regardless of thresholds, used on shutdown and explicit flushes.
   *
   * @return number of batches closed
   */
  public int flushAll() {
    int closed = 0;
    for (OpenBatch batch : open.values()) {
      batch.lock.lock();
      try {
        if (!batch.isEmpty()) {
          close(batch, clock.nowMillis(), CloseReason.FORCED);
          closed++;
        }
      } finally {
        batch.lock.unlock();
      }
    }
    return closed;
  }

  /**
   * Drops every open batch without handing it to the handler, counting its groups as discarded. Used when a
   * shutdown is interrupted and nothing downstream will run again.
   *
   * @return groups dropped
   */
  public List<EventGroup> discardAll() {
    List<EventGroup> dropped = new ArrayList<>();
    for (OpenBatch batch : open.values()) {
      batch.lock.lock();
      try {
        if (batch.isEmpty()) {
          continue;
        }
        buffered(-batch.groups.size(), -batch.events, -batch.bytes);
        record.counter(MetricNames.DISCARDED_ITEMS_TOTAL).add(batch.groups.size());
        record.counter(MetricNames.DISCARDED_EVENTS_TOTAL).add(batch.events);
        record.counter(MetricNames.DISCARDED_SIZE_BYTES).add(batch.bytes);
        dropped.addAll(batch.groups);
        batch.reset();
      } finally {
        batch.lock.unlock();
      }
    }
    if (!dropped.isEmpty()) {
      log.warn("Discarded {} buffered groups from open batches", dropped.size());
    }
    return dropped;
  }

  /**
   * Counts groups currently buffered across all keys.
   *
   * @return buffered group count
   */
  public int bufferedGroups() {
    int total = 0;
    for (OpenBatch batch : open.values()) {
      batch.lock.lock();
      try {
        total += batch.groups.size();
      } finally {
        batch.lock.unlock();
      }
    }
    return total;
  }

  /** Caller holds {@code batch.lock}. */
  private void close(OpenBatch batch, long now, CloseReason reason) {
    Batch closed = new Batch(
        batch.key,
        batch.groups,
        batch.bytes,
        batch.events,
        batch.openedAtMillis,
        Math.max(now, batch.openedAtMillis),
        reason);
    buffered(-closed.groups().size(), -closed.eventCount(), -closed.byteSize());
    batch.reset();

    record.counter(MetricNames.BATCHER_EVENT_BATCHES_TOTAL).increment();
    record.counter(MetricNames.OUT_ITEMS_TOTAL).add(closed.groups().size());
    record.counter(MetricNames.OUT_EVENTS_TOTAL).add(closed.eventCount());
    record.counter(MetricNames.OUT_SIZE_BYTES).add(closed.byteSize());
    record.counter(MetricNames.TOTAL_DELAY_MS).add(closed.ageMillis());
    metrics.observe(MetricNames.HISTOGRAM_BATCH_AGE, closed.ageMillis());
    if (log.isDebugEnabled()) {
      log.debug("Closed batch for {} ({} groups, {} bytes, reason {})",
          closed.key(), closed.groups().size(), closed.byteSize(), reason);
    }
    try {
      handler.accept(closed);
    } catch (RuntimeException ex) {
      record.counter(MetricNames.DISCARDED_ITEMS_TOTAL).add(closed.groups().size());
      record.counter(MetricNames.DISCARDED_EVENTS_TOTAL).add(closed.eventCount());
      record.counter(MetricNames.DISCARDED_SIZE_BYTES).add(closed.byteSize());
      log.warn("Batch handler failed for {}; discarded {} events", closed.key(), closed.eventCount(), ex);
    }
  }

  private void buffered(long groups, long events, long bytes) {
    record.gauge(MetricNames.BATCHER_BUFFERED_GROUPS).addAndGet(groups);
    record.gauge(MetricNames.BATCHER_BUFFERED_EVENTS).addAndGet(events);
    record.gauge(MetricNames.BATCHER_BUFFERED_SIZE_BYTES).addAndGet(bytes);
  }

  private static final class OpenBatch {
    private final QueueKey key;
    private final ReentrantLock lock = new ReentrantLock();
    private List<EventGroup> groups = new ArrayList<>();
    private long bytes;
    private int events;
    private long openedAtMillis;

    private OpenBatch(QueueKey key) {
      this.key = key;
    }

    private boolean isEmpty() {
      return groups.isEmpty();
    }

    private void append(EventGroup group, long now) {
      if (groups.isEmpty()) {
        openedAtMillis = now;
      }
      groups.add(group);
      bytes += group.byteSize();
      events += group.eventCount();
    }

    private void reset() {
      groups = new ArrayList<>();
      bytes = 0;
      events = 0;
      openedAtMillis = 0;
    }
  }
}
