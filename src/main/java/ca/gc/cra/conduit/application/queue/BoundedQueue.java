package ca.gc.cra.conduit.application.queue;

import ca.gc.cra.conduit.application.metrics.MetricNames;
import ca.gc.cra.conduit.application.metrics.MetricsRecord;
import ca.gc.cra.conduit.application.port.ClockPort;
import ca.gc.cra.conduit.domain.queue.QueueElement;
import ca.gc.cra.conduit.domain.queue.QueueKey;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;

/**
 * <strong>What:</strong> FIFO lane of one {@link QueueKey} with a hard element bound and a backpressure watermark.
 * <p><strong>Why:</strong> Keeps slow destinations from growing memory without limit; every element that does not
 * fit is counted as discarded instead of disappearing.</p>
 * <p><strong>Role:</strong> Shared building block of the process queue (event groups, consumed with
 * {@link #poll()}) and the sender queue (items, leased with {@link #acquire(Predicate)} and settled with
 * {@link #complete}, {@link #park}, {@link #release}, or {@link #drop}).</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Never hold more than {@code capacity + extraBuffer} elements, leased ones included.</li>
 *   <li>Answer {@link #validToPush()} from current occupancy only.</li>
 *   <li>Publish size, extra-buffer usage, in/out and discard counters to its {@link MetricsRecord}.</li>
 * </ul>
 * <p>A lane ends with {@link #close()}; afterwards every push, including one parked on a full
 * {@link OverflowPolicy#BLOCK} lane, is refused and counted as discarded.</p>
 * <p><strong>Thread-safety:</strong> All state is guarded by one {@link ReentrantLock} per lane; no method holds
 * another lane's lock, and the {@code onChange} callback runs after the lock is released.</p>
 * <p><strong>Performance:</strong> Push and poll are O(1); leasing scans past in-flight entries, which is bounded by
 * the flusher concurrency.</p>
 *
 * @param <E> element type
 * @since 0.1.0
 */
public final class BoundedQueue<E extends QueueElement> {
  private final QueueKey key;
  private final QueueSettings settings;
  private final MetricsRecord metrics;
  private final ClockPort clock;
  private final Runnable onChange;
  private final ReentrantLock lock = new ReentrantLock();
  private final Condition notFull = lock.newCondition();
  private final LinkedList<Entry<E>> entries = new LinkedList<>();
  private long bytes;
  private boolean closed;

  /**
   * Creates a lane.
   *
   * @param key stream identity
   * @param settings sizing and overflow policy
   * @param metrics record receiving this lane's counters
   * @param clock time source for delay metrics
   * @param onChange callback invoked after an element becomes available to consumers; may be {@code null}
   */
  public BoundedQueue(
      QueueKey key, QueueSettings settings, MetricsRecord metrics, ClockPort clock, Runnable onChange) {
    this.key = Objects.requireNonNull(key, "key");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.onChange = onChange == null ? () -> {} : onChange;
    lock.lock();
    try {
      refreshGauges();
    } finally {
      lock.unlock();
    }
  }

  public QueueKey key() {
    return key;
  }

  public QueueSettings settings() {
    return settings;
  }

  public MetricsRecord metrics() {
    return metrics;
  }

  /**
   * Appends an element when the lane has room.
   *
   * @param element element to append; ownership moves to the lane on success
   * @return {@code true} if appended; {@code false} if the lane is full or closed and the element was counted as
   *     discarded
   */
  public boolean push(E element) {
    Objects.requireNonNull(element, "element");
    boolean accepted;
    lock.lock();
    try {
      accepted = awaitRoom();
      if (accepted) {
        entries.addLast(new Entry<>(element, clock.nowMillis()));
        bytes += element.byteSize();
        metrics.counter(MetricNames.IN_ITEMS_TOTAL).increment();
        metrics.counter(MetricNames.IN_EVENTS_TOTAL).add(element.eventCount());
        metrics.counter(MetricNames.IN_SIZE_BYTES).add(element.byteSize());
      } else {
        countDiscard(element);
      }
      refreshGauges();
    } finally {
      lock.unlock();
    }
    if (accepted) {
      onChange.run();
    }
    return accepted;
  }

  /**
   * Removes and returns the head element when it is ready.
   *
   * @return head element, or empty when the lane is empty or its head is leased
   */
  public Optional<E> poll() {
    lock.lock();
    try {
      Entry<E> head = entries.peekFirst();
      if (head == null || head.state != State.READY) {
        return Optional.empty();
      }
      entries.removeFirst();
      recordOut(head);
      return Optional.of(head.element);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Leases the oldest ready element if {@code gate} admits it. The element stays in the lane, counted towards
   * occupancy, until it is completed or dropped.
   *
   * @param gate admission check run under the lane lock (rate limiters); must not call back into this lane
   * @return leased element, or empty when nothing is ready or the gate refused
   */
  public Optional<E> acquire(Predicate<? super E> gate) {
    Objects.requireNonNull(gate, "gate");
    lock.lock();
    try {
      for (Entry<E> entry : entries) {
        if (entry.state == State.READY) {
          if (!gate.test(entry.element)) {
            return Optional.empty();
          }
          entry.state = State.IN_FLIGHT;
          metrics.counter(MetricNames.FETCHED_ITEMS_TOTAL).increment();
          return Optional.of(entry.element);
        }
      }
      return Optional.empty();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Removes a leased element after successful delivery.
   *
   * @param element leased element
   * @return {@code true} if the element was still held by this lane
   */
  public boolean complete(E element) {
    lock.lock();
    try {
      Entry<E> entry = remove(element);
      if (entry == null) {
        return false;
      }
      recordOut(entry);
      return true;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Removes a leased element that will not be delivered and counts it as discarded.
   *
   * @param element leased element
   * @return {@code true} if the element was still held by this lane
   */
  public boolean drop(E element) {
    lock.lock();
    try {
      Entry<E> entry = remove(element);
      if (entry == null) {
        return false;
      }
      countDiscard(entry.element);
      refreshGauges();
      return true;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Marks a leased element as waiting for a retry timer. It keeps its place and its share of occupancy but is
   * not handed out until {@link #release(QueueElement)}.
   *
   * @param element leased element
   */
  public void park(E element) {
    lock.lock();
    try {
      Entry<E> entry = find(element);
      if (entry != null) {
        entry.state = State.WAITING;
      }
    } finally {
      lock.unlock();
    }
  }

  /**
   * Makes a leased or parked element available again.
   *
   * @param element element previously returned by {@link #acquire(Predicate)}
   */
  public void release(E element) {
    boolean released = false;
    lock.lock();
    try {
      Entry<E> entry = find(element);
      if (entry != null && entry.state != State.READY) {
        entry.state = State.READY;
        released = true;
      }
    } finally {
      lock.unlock();
    }
    if (released) {
      onChange.run();
    }
  }

  /**
   * Removes every element, leased ones included, and counts them as discarded. The lane stays open.
   *
   * @return removed elements in FIFO order
   */
  public List<E> drain() {
    lock.lock();
    try {
      return drainLocked();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Closes the lane and discards what it holds. Producers parked for room wake up and are refused. Closing twice
   * returns an empty list the second time.
   *
   * @return removed elements in FIFO order
   */
  public List<E> close() {
    lock.lock();
    try {
      closed = true;
      List<E> drained = drainLocked();
      notFull.signalAll();
      return drained;
    } finally {
      lock.unlock();
    }
  }

  public boolean isClosed() {
    lock.lock();
    try {
      return closed;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns whether upstream stages may produce more work for this lane. Pure query over occupancy.
   *
   * @return {@code true} while occupancy is below the high watermark
   */
  public boolean validToPush() {
    lock.lock();
    try {
      return entries.size() < settings.highWatermark();
    } finally {
      lock.unlock();
    }
  }

  public int size() {
    lock.lock();
    try {
      return entries.size();
    } finally {
      lock.unlock();
    }
  }

  public long sizeBytes() {
    lock.lock();
    try {
      return bytes;
    } finally {
      lock.unlock();
    }
  }

  public boolean isEmpty() {
    return size() == 0;
  }

  /**
   * Returns whether an element could be leased or polled right now.
   *
   * @return {@code true} if at least one element is ready
   */
  public boolean hasReady() {
    lock.lock();
    try {
      for (Entry<E> entry : entries) {
        if (entry.state == State.READY) {
          return true;
        }
      }
      return false;
    } finally {
      lock.unlock();
    }
  }

  /** Caller holds the lock. */
  private List<E> drainLocked() {
    List<E> drained = new ArrayList<>(entries.size());
    for (Entry<E> entry : entries) {
      drained.add(entry.element);
      countDiscard(entry.element);
    }
    entries.clear();
    bytes = 0;
    refreshGauges();
    return drained;
  }

  /** Caller holds the lock. */
  private boolean awaitRoom() {
    if (closed) {
      return false;
    }
    if (entries.size() < settings.limit()) {
      return true;
    }
    if (settings.overflowPolicy() != OverflowPolicy.BLOCK || settings.blockTimeoutMillis() <= 0) {
      return false;
    }
    long remaining = TimeUnit.MILLISECONDS.toNanos(settings.blockTimeoutMillis());
    try {
      while (entries.size() >= settings.limit()) {
        if (remaining <= 0L) {
          return false;
        }
        remaining = notFull.awaitNanos(remaining);
        if (closed) {
          return false;
        }
      }
      return true;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  private void recordOut(Entry<E> entry) {
    E element = entry.element;
    bytes -= element.byteSize();
    metrics.counter(MetricNames.OUT_ITEMS_TOTAL).increment();
    metrics.counter(MetricNames.OUT_EVENTS_TOTAL).add(element.eventCount());
    metrics.counter(MetricNames.OUT_SIZE_BYTES).add(element.byteSize());
    metrics.counter(MetricNames.TOTAL_DELAY_MS).add(Math.max(0L, clock.nowMillis() - entry.enqueuedAtMillis));
    refreshGauges();
  }

  private void countDiscard(E element) {
    metrics.counter(MetricNames.DISCARDED_ITEMS_TOTAL).increment();
    metrics.counter(MetricNames.DISCARDED_EVENTS_TOTAL).add(element.eventCount());
    metrics.counter(MetricNames.DISCARDED_SIZE_BYTES).add(element.byteSize());
  }

  private Entry<E> find(E element) {
    for (Entry<E> entry : entries) {
      if (entry.element == element) {
        return entry;
      }
    }
    return null;
  }

  private Entry<E> remove(E element) {
    Iterator<Entry<E>> it = entries.iterator();
    while (it.hasNext()) {
      Entry<E> entry = it.next();
      if (entry.element == element) {
        it.remove();
        return entry;
      }
    }
    return null;
  }

  /** Caller holds the lock. */
  private void refreshGauges() {
    if (bytes < 0) {
      bytes = 0;
    }
    int size = entries.size();
    int extra = Math.max(0, size - settings.capacity());
    long extraBytes = 0;
    if (extra > 0) {
      Iterator<Entry<E>> tail = entries.descendingIterator();
      for (int i = 0; i < extra && tail.hasNext(); i++) {
        extraBytes += tail.next().element.byteSize();
      }
    }
    metrics.gauge(MetricNames.QUEUE_SIZE).set(size);
    metrics.gauge(MetricNames.QUEUE_SIZE_BYTES).set(bytes);
    metrics.gauge(MetricNames.QUEUE_EXTRA_BUFFER_SIZE).set(extra);
    metrics.gauge(MetricNames.QUEUE_EXTRA_BUFFER_SIZE_BYTES).set(extraBytes);
    metrics.gauge(MetricNames.QUEUE_VALID_TO_PUSH).set(size < settings.highWatermark() ? 1 : 0);
    if (size < settings.limit()) {
      notFull.signalAll();
    }
  }

  @Override
  public String toString() {
    return "BoundedQueue{key=" + key + ", size=" + size() + ", limit=" + settings.limit() + "}";
  }

  private enum State {
    READY,
    IN_FLIGHT,
    WAITING
  }

  private static final class Entry<E> {
    private final E element;
    private final long enqueuedAtMillis;
    private State state = State.READY;

    private Entry(E element, long enqueuedAtMillis) {
      this.element = element;
      this.enqueuedAtMillis = enqueuedAtMillis;
    }
  }
}
