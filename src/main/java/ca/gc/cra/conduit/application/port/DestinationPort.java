package ca.gc.cra.conduit.application.port;

import ca.gc.cra.conduit.domain.sink.DeliveryResult;
import ca.gc.cra.conduit.domain.sink.RegistrationResult;
import ca.gc.cra.conduit.domain.sink.SenderItem;
import java.util.concurrent.CompletableFuture;

/**
 * <strong>What:</strong> Port for a remote destination that accepts sender items.
 * <p><strong>Why:</strong> Keeps wire protocols out of the pipeline core; the flusher runner only sees classified
 * {@link DeliveryResult}s.</p>
 * <p><strong>Role:</strong> Outbound port implemented by adapters such as {@code LoggingDestination} and
 * {@code KafkaDestination}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Deliver one item per call, completing the returned future with a classified result.</li>
 *   <li>Establish a client session in {@link #register()}; stateless destinations keep the default.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Implementations must accept concurrent {@link #send(SenderItem)} calls from
 * up to {@code flusher.concurrency} workers.</p>
 * <p><strong>Observability:</strong> {@link #id()} becomes the {@code flusher_plugin_id} label.</p>
 *
 * @implNote A future completed exceptionally is classified by the runner; implementations should prefer
 *     completing normally with a failure result when they know the outcome class.
 * @since 0.1.0
 */
public interface DestinationPort extends AutoCloseable {
  /**
   * Returns a stable identifier for metrics labels and logs.
   *
   * @return destination id; non-blank
   */
  String id();

  /**
   * Starts an asynchronous delivery of {@code item}.
   *
   * @param item item to deliver; payload must not be modified
   * @return future completed with the classified outcome
   */
  CompletableFuture<DeliveryResult> send(SenderItem item);

  /**
   * Establishes a client session. Called by the runner before the first send and after an unauthorized reply;
   * the default suits destinations without sessions.
   *
   * @return registration outcome
   */
  default RegistrationResult register() {
    return RegistrationResult.ok();
  }

  /**
   * Releases destination resources.
   *
   * @throws Exception when the underlying client fails to close
   */
  @Override
  default void close() throws Exception {}
}
