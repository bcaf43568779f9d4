package ca.gc.cra.conduit.application.queue;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.conduit.application.metrics.MetricNames;
import ca.gc.cra.conduit.application.metrics.MetricsRecord;
import ca.gc.cra.conduit.application.metrics.MetricsRegistry;
import ca.gc.cra.conduit.domain.event.EventGroup;
import ca.gc.cra.conduit.testutil.Groups;
import ca.gc.cra.conduit.testutil.ManualClock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class BoundedQueueTest {
  private final ManualClock clock = new ManualClock(0);
  private final MetricsRecord record = new MetricsRegistry().register(Map.of("component_name", "test"));

  private BoundedQueue<EventGroup> queue(int capacity, int extra, int watermark) {
    return new BoundedQueue<>(Groups.KEY, QueueSettings.discarding(capacity, extra, watermark), record, clock, null);
  }

  @Test
  void pollReturnsElementsInPushOrder() {
    BoundedQueue<EventGroup> queue = queue(10, 0, 10);
    List<EventGroup> pushed = new ArrayList<>();
    for (int i = 0; i < 5; i++) {
      EventGroup group = Groups.withEvents(i + 1);
      pushed.add(group);
      assertTrue(queue.push(group));
    }

    for (EventGroup expected : pushed) {
      assertSame(expected, queue.poll().orElseThrow());
    }
    assertTrue(queue.poll().isEmpty());
  }

  @Test
  void overflowBeyondExtraBufferIsDiscardedAndCounted() {
    BoundedQueue<EventGroup> queue = queue(2, 1, 2);
    EventGroup group = Groups.withEvents(3);

    assertTrue(queue.push(group));
    assertTrue(queue.push(group));
    assertTrue(queue.push(group));
    assertFalse(queue.push(group));
    assertFalse(queue.push(group));

    assertEquals(3, queue.size());
    assertEquals(3, record.value(MetricNames.IN_ITEMS_TOTAL));
    assertEquals(2, record.value(MetricNames.DISCARDED_ITEMS_TOTAL));
    assertEquals(6, record.value(MetricNames.DISCARDED_EVENTS_TOTAL));
    assertEquals(1, record.value(MetricNames.QUEUE_EXTRA_BUFFER_SIZE));
    assertEquals(group.byteSize(), record.value(MetricNames.QUEUE_EXTRA_BUFFER_SIZE_BYTES));
  }

  @Test
  void validToPushFollowsWatermarkAndHasNoSideEffects() {
    BoundedQueue<EventGroup> queue = queue(4, 0, 2);
    queue.push(Groups.withEvents(1));
    assertTrue(queue.validToPush());
    queue.push(Groups.withEvents(1));

    for (int i = 0; i < 3; i++) {
      assertFalse(queue.validToPush());
    }
    assertEquals(2, queue.size());
    assertEquals(0, record.value(MetricNames.QUEUE_VALID_TO_PUSH));

    queue.poll();
    assertTrue(queue.validToPush());
    assertEquals(1, record.value(MetricNames.QUEUE_VALID_TO_PUSH));
  }

  @Test
  void leasedElementsCountTowardsOccupancyUntilSettled() {
    BoundedQueue<EventGroup> queue = queue(2, 0, 2);
    EventGroup first = Groups.withEvents(1);
    EventGroup second = Groups.withEvents(2);
    queue.push(first);
    queue.push(second);

    EventGroup leased = queue.acquire(e -> true).orElseThrow();
    assertSame(first, leased);
    assertFalse(queue.push(Groups.withEvents(1)));
    assertSame(second, queue.acquire(e -> true).orElseThrow());
    assertTrue(queue.acquire(e -> true).isEmpty());

    assertTrue(queue.complete(first));
    assertFalse(queue.complete(first));
    assertEquals(1, queue.size());
    assertEquals(1, record.value(MetricNames.OUT_ITEMS_TOTAL));
  }

  @Test
  void parkedElementIsSkippedUntilReleased() {
    AtomicInteger signals = new AtomicInteger();
    BoundedQueue<EventGroup> queue = new BoundedQueue<>(
        Groups.KEY, QueueSettings.discarding(4, 0, 4), record, clock, signals::incrementAndGet);
    EventGroup group = Groups.withEvents(1);
    queue.push(group);
    assertEquals(1, signals.get());

    queue.acquire(e -> true).orElseThrow();
    queue.park(group);
    assertFalse(queue.hasReady());
    assertTrue(queue.acquire(e -> true).isEmpty());

    queue.release(group);
    assertEquals(2, signals.get());
    assertSame(group, queue.acquire(e -> true).orElseThrow());
  }

  @Test
  void refusingGateLeavesHeadInPlace() {
    BoundedQueue<EventGroup> queue = queue(4, 0, 4);
    EventGroup group = Groups.withEvents(1);
    queue.push(group);

    assertEquals(Optional.empty(), queue.acquire(e -> false));
    assertTrue(queue.hasReady());
    assertEquals(0, record.value(MetricNames.FETCHED_ITEMS_TOTAL));
  }

  @Test
  void drainRemovesEverythingAndCountsDiscards() {
    BoundedQueue<EventGroup> queue = queue(4, 0, 4);
    queue.push(Groups.withEvents(2));
    queue.push(Groups.withEvents(3));
    queue.acquire(e -> true);

    List<EventGroup> drained = queue.drain();

    assertEquals(2, drained.size());
    assertTrue(queue.isEmpty());
    assertEquals(0, queue.sizeBytes());
    assertEquals(2, record.value(MetricNames.DISCARDED_ITEMS_TOTAL));
    assertEquals(5, record.value(MetricNames.DISCARDED_EVENTS_TOTAL));
  }

  @Test
  void delayIsMeasuredFromEnqueueTime() {
    BoundedQueue<EventGroup> queue = queue(4, 0, 4);
    queue.push(Groups.withEvents(1));
    clock.advance(250);

    queue.poll();

    assertEquals(250, record.value(MetricNames.TOTAL_DELAY_MS));
  }

  @Test
  void blockingPolicyGivesUpAfterTimeout() {
    BoundedQueue<EventGroup> queue = new BoundedQueue<>(
        Groups.KEY, new QueueSettings(1, 0, 1, OverflowPolicy.BLOCK, 20), record, clock, null);
    assertTrue(queue.push(Groups.withEvents(1)));

    long start = System.nanoTime();
    assertFalse(queue.push(Groups.withEvents(1)));
    long waitedMillis = (System.nanoTime() - start) / 1_000_000;

    assertTrue(waitedMillis >= 15, "push should wait for the block timeout, waited " + waitedMillis);
    assertEquals(1, record.value(MetricNames.DISCARDED_ITEMS_TOTAL));
  }

  @Test
  void blockingPolicyAcceptsOnceRoomFrees() throws Exception {
    BoundedQueue<EventGroup> queue = new BoundedQueue<>(
        Groups.KEY, new QueueSettings(1, 0, 1, OverflowPolicy.BLOCK, 5_000), record, clock, null);
    queue.push(Groups.withEvents(1));

    Thread consumer = new Thread(() -> {
      try {
        Thread.sleep(50);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
      queue.poll();
    });
    consumer.start();

    assertTrue(queue.push(Groups.withEvents(1)));
    consumer.join();
    assertEquals(1, queue.size());
  }

  @Test
  void closeRefusesProducerParkedOnFullLane() throws Exception {
    BoundedQueue<EventGroup> queue = new BoundedQueue<>(
        Groups.KEY, new QueueSettings(1, 0, 1, OverflowPolicy.BLOCK, 10_000), record, clock, null);
    queue.push(Groups.withEvents(1));
    AtomicBoolean accepted = new AtomicBoolean(true);
    Thread producer = new Thread(() -> accepted.set(queue.push(Groups.withEvents(4))));
    producer.start();
    long deadline = System.currentTimeMillis() + 5_000;
    while (producer.getState() != Thread.State.TIMED_WAITING && System.currentTimeMillis() < deadline) {
      Thread.sleep(5);
    }

    List<EventGroup> drained = queue.close();
    producer.join(5_000);

    assertFalse(producer.isAlive());
    assertFalse(accepted.get());
    assertEquals(1, drained.size());
    assertEquals(0, queue.size());
    assertTrue(queue.isClosed());
    assertEquals(2, record.value(MetricNames.DISCARDED_ITEMS_TOTAL));
    assertEquals(5, record.value(MetricNames.DISCARDED_EVENTS_TOTAL));

    assertFalse(queue.push(Groups.withEvents(1)));
    assertTrue(queue.close().isEmpty());
  }
}
