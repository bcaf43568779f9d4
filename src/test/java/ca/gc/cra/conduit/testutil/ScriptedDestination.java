package ca.gc.cra.conduit.testutil;

import ca.gc.cra.conduit.application.port.DestinationPort;
import ca.gc.cra.conduit.domain.sink.DeliveryOutcome;
import ca.gc.cra.conduit.domain.sink.DeliveryResult;
import ca.gc.cra.conduit.domain.sink.RegistrationResult;
import ca.gc.cra.conduit.domain.sink.SenderItem;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Destination replaying queued outcomes; once the script runs out every send gets the fallback result.
 */
public final class ScriptedDestination implements DestinationPort {
  private final String id;
  private final Deque<DeliveryResult> script = new ArrayDeque<>();
  private final Deque<RegistrationResult> registrations = new ArrayDeque<>();
  private final List<SenderItem> delivered = new CopyOnWriteArrayList<>();
  private final AtomicInteger sends = new AtomicInteger();
  private final AtomicInteger registerCalls = new AtomicInteger();
  private final AtomicBoolean closed = new AtomicBoolean();
  private volatile DeliveryResult fallback = DeliveryResult.success();
  private volatile boolean hang;

  public ScriptedDestination(String id) {
    this.id = id;
  }

  public synchronized ScriptedDestination thenReply(DeliveryResult result, int times) {
    for (int i = 0; i < times; i++) {
      script.addLast(result);
    }
    return this;
  }

  public synchronized ScriptedDestination thenFail(DeliveryOutcome outcome, int times) {
    return thenReply(DeliveryResult.failure(outcome, "scripted " + outcome), times);
  }

  public ScriptedDestination otherwise(DeliveryResult result) {
    this.fallback = result;
    return this;
  }

  public synchronized ScriptedDestination registrations(RegistrationResult... results) {
    registrations.addAll(List.of(results));
    return this;
  }

  /** Returns futures that never complete, as an unreachable endpoint would. */
  public ScriptedDestination hang() {
    this.hang = true;
    return this;
  }

  @Override
  public String id() {
    return id;
  }

  @Override
  public CompletableFuture<DeliveryResult> send(SenderItem item) {
    sends.incrementAndGet();
    if (hang) {
      return new CompletableFuture<>();
    }
    DeliveryResult next;
    synchronized (this) {
      next = script.isEmpty() ? fallback : script.pollFirst();
    }
    if (next.isSuccess()) {
      delivered.add(item);
    }
    return CompletableFuture.completedFuture(next);
  }

  @Override
  public synchronized RegistrationResult register() {
    registerCalls.incrementAndGet();
    return registrations.isEmpty() ? RegistrationResult.ok() : registrations.pollFirst();
  }

  @Override
  public void close() {
    closed.set(true);
  }

  public List<SenderItem> delivered() {
    return List.copyOf(delivered);
  }

  public int deliveredEvents() {
    int total = 0;
    for (SenderItem item : delivered) {
      total += item.eventCount();
    }
    return total;
  }

  public int sends() {
    return sends.get();
  }

  public int registerCalls() {
    return registerCalls.get();
  }

  public boolean isClosed() {
    return closed.get();
  }
}
