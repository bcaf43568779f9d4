package ca.gc.cra.conduit.application.pipeline;

import ca.gc.cra.conduit.application.metrics.MetricNames;
import ca.gc.cra.conduit.application.metrics.MetricsRecord;
import ca.gc.cra.conduit.application.port.DestinationPort;
import ca.gc.cra.conduit.domain.sink.RegistrationResult;
import ca.gc.cra.conduit.domain.sink.RegistrationState;
import ca.gc.cra.conduit.logging.Logs;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Client-registration state machine of one destination.
 * <p><strong>Why:</strong> Session-based destinations reject writes until a client is registered; workers must
 * observe {@link RegistrationState#REGISTERED} before sending, and a destination whose registration keeps
 * failing short-circuits to discard until an external reset.</p>
 * <p><strong>Thread-safety:</strong> State moves by compare-and-set; at most one worker runs
 * {@link DestinationPort#register()} at a time, the others wait on the registration lock and reuse its result.</p>
 * <p><strong>Observability:</strong> Publishes {@code client_register_state} (state ordinal) and
 * {@code client_register_retry_total} on the runner record of the destination.</p>
 *
 * @since 0.1.0
 */
public final class ClientSession {
  private static final Logger log = LoggerFactory.getLogger(ClientSession.class);
  private static final int MAX_LOGGED_MESSAGE_BYTES = 256;

  private final DestinationPort destination;
  private final int maxAttempts;
  private final MetricsRecord record;
  private final AtomicReference<RegistrationState> state =
      new AtomicReference<>(RegistrationState.UNREGISTERED);
  private final ReentrantLock registerLock = new ReentrantLock();

  /**
   * Creates a session in {@link RegistrationState#UNREGISTERED}.
   *
   * @param destination destination to register against
   * @param maxAttempts registration attempts before the destination is marked failed; must be positive
   * @param record runner record of the destination
   */
  public ClientSession(DestinationPort destination, int maxAttempts, MetricsRecord record) {
    this.destination = Objects.requireNonNull(destination, "destination");
    if (maxAttempts <= 0) {
      throw new IllegalArgumentException("maxAttempts must be positive");
    }
    this.maxAttempts = maxAttempts;
    this.record = Objects.requireNonNull(record, "record");
    publish(RegistrationState.UNREGISTERED);
  }

  public RegistrationState state() {
    return state.get();
  }

  /**
   * Makes sure the destination is registered, registering it if needed.
   *
   * @return {@code true} when sends may proceed; {@code false} when the destination is marked failed
   */
  public boolean ensureRegistered() {
    RegistrationState current = state.get();
    if (current == RegistrationState.REGISTERED) {
      return true;
    }
    if (current == RegistrationState.FAILED) {
      return false;
    }
    registerLock.lock();
    try {
      current = state.get();
      if (current != RegistrationState.UNREGISTERED) {
        return current == RegistrationState.REGISTERED;
      }
      transition(RegistrationState.UNREGISTERED, RegistrationState.REGISTERING);
      for (int attempt = 1; attempt <= maxAttempts; attempt++) {
        if (attempt > 1) {
          record.counter(MetricNames.RUNNER_CLIENT_REGISTER_RETRY_TOTAL).increment();
        }
        RegistrationResult result = attemptRegistration();
        if (result.registered()) {
          transition(RegistrationState.REGISTERING, RegistrationState.REGISTERED);
          log.info("Destination {} registered after {} attempt(s)", destination.id(), attempt);
          return true;
        }
        log.debug("Registration attempt {} of {} for {} failed: {}",
            attempt, maxAttempts, destination.id(), Logs.truncate(result.message(), MAX_LOGGED_MESSAGE_BYTES));
      }
      transition(RegistrationState.REGISTERING, RegistrationState.FAILED);
      log.warn("Destination {} marked failed after {} registration attempts", destination.id(), maxAttempts);
      return false;
    } finally {
      registerLock.unlock();
    }
  }

  /**
   * Drops a registered session after the destination rejected its credentials, so the next send re-registers.
   *
   * @return {@code true} if the session was registered and is now unregistered
   */
  public boolean invalidate() {
    boolean changed = state.compareAndSet(RegistrationState.REGISTERED, RegistrationState.UNREGISTERED);
    if (changed) {
      publish(RegistrationState.UNREGISTERED);
      log.info("Destination {} session invalidated; re-registration required", destination.id());
    }
    return changed;
  }

  /**
   * External re-registration trigger: moves a failed destination back to unregistered.
   *
   * @return {@code true} if the destination was failed
   */
  public boolean reset() {
    boolean changed = state.compareAndSet(RegistrationState.FAILED, RegistrationState.UNREGISTERED);
    if (changed) {
      publish(RegistrationState.UNREGISTERED);
      log.info("Destination {} registration reset", destination.id());
    }
    return changed;
  }

  private RegistrationResult attemptRegistration() {
    try {
      return Objects.requireNonNullElse(destination.register(), RegistrationResult.failed("no result"));
    } catch (RuntimeException ex) {
      return RegistrationResult.failed(ex.getClass().getSimpleName() + ": " + ex.getMessage());
    }
  }

  private void transition(RegistrationState from, RegistrationState to) {
    if (!from.canTransitionTo(to)) {
      throw new IllegalStateException("Illegal registration transition " + from + " -> " + to);
    }
    if (!state.compareAndSet(from, to)) {
      throw new IllegalStateException(
          "Registration state of " + destination.id() + " changed concurrently; expected " + from);
    }
    publish(to);
  }

  private void publish(RegistrationState current) {
    record.gauge(MetricNames.RUNNER_CLIENT_REGISTER_STATE).set(current.ordinal());
  }
}
