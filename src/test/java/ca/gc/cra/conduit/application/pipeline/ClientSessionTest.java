package ca.gc.cra.conduit.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.conduit.application.metrics.MetricNames;
import ca.gc.cra.conduit.application.metrics.MetricsRecord;
import ca.gc.cra.conduit.application.metrics.MetricsRegistry;
import ca.gc.cra.conduit.application.port.DestinationPort;
import ca.gc.cra.conduit.domain.sink.DeliveryResult;
import ca.gc.cra.conduit.domain.sink.RegistrationResult;
import ca.gc.cra.conduit.domain.sink.RegistrationState;
import ca.gc.cra.conduit.domain.sink.SenderItem;
import ca.gc.cra.conduit.testutil.ScriptedDestination;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class ClientSessionTest {
  private final MetricsRecord record = new MetricsRegistry().register(Map.of("runner_name", "flusher_runner"));

  @Test
  void registersOnceAndReusesSession() {
    ScriptedDestination destination = new ScriptedDestination("dest-a");
    ClientSession session = new ClientSession(destination, 3, record);
    assertEquals(RegistrationState.UNREGISTERED, session.state());

    assertTrue(session.ensureRegistered());
    assertTrue(session.ensureRegistered());

    assertEquals(1, destination.registerCalls());
    assertEquals(RegistrationState.REGISTERED, session.state());
    assertEquals(RegistrationState.REGISTERED.ordinal(), record.value(MetricNames.RUNNER_CLIENT_REGISTER_STATE));
  }

  @Test
  void retriesRegistrationWithinAttemptBudget() {
    ScriptedDestination destination = new ScriptedDestination("dest-a")
        .registrations(RegistrationResult.failed("busy"), RegistrationResult.ok());
    ClientSession session = new ClientSession(destination, 3, record);

    assertTrue(session.ensureRegistered());

    assertEquals(2, destination.registerCalls());
    assertEquals(1, record.value(MetricNames.RUNNER_CLIENT_REGISTER_RETRY_TOTAL));
  }

  @Test
  void exhaustedAttemptsMarkDestinationFailedUntilReset() {
    ScriptedDestination destination = new ScriptedDestination("dest-a").registrations(
        RegistrationResult.failed("denied"), RegistrationResult.failed("denied"));
    ClientSession session = new ClientSession(destination, 2, record);

    assertFalse(session.ensureRegistered());
    assertEquals(RegistrationState.FAILED, session.state());
    assertFalse(session.ensureRegistered());
    assertEquals(2, destination.registerCalls());

    assertTrue(session.reset());
    assertEquals(RegistrationState.UNREGISTERED, session.state());
    assertTrue(session.ensureRegistered());
    assertEquals(3, destination.registerCalls());
  }

  @Test
  void invalidateOnlyAffectsRegisteredSession() {
    ClientSession session = new ClientSession(new ScriptedDestination("dest-a"), 1, record);
    assertFalse(session.invalidate());

    session.ensureRegistered();

    assertTrue(session.invalidate());
    assertEquals(RegistrationState.UNREGISTERED, session.state());
    assertFalse(session.reset());
  }

  @Test
  void registrationExceptionCountsAsFailedAttempt() {
    AtomicInteger calls = new AtomicInteger();
    DestinationPort destination = new DestinationPort() {
      @Override
      public String id() {
        return "dest-a";
      }

      @Override
      public CompletableFuture<DeliveryResult> send(SenderItem item) {
        return CompletableFuture.completedFuture(DeliveryResult.success());
      }

      @Override
      public RegistrationResult register() {
        calls.incrementAndGet();
        throw new IllegalStateException("endpoint down");
      }
    };
    ClientSession session = new ClientSession(destination, 2, record);

    assertFalse(session.ensureRegistered());
    assertEquals(2, calls.get());
    assertEquals(RegistrationState.FAILED, session.state());
  }
}
