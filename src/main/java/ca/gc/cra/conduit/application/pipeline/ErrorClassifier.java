package ca.gc.cra.conduit.application.pipeline;

import ca.gc.cra.conduit.application.metrics.MetricNames;
import ca.gc.cra.conduit.domain.sink.DeliveryOutcome;
import ca.gc.cra.conduit.domain.sink.DeliveryResult;
import java.io.IOException;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * <strong>What:</strong> Maps destination replies and exceptions to a {@link DeliveryOutcome}.
 * <p><strong>Why:</strong> The retry policy is decided by outcome class only; keeping the mapping in one place
 * lets destination adapters report raw status codes and error codes.</p>
 * <p>Write-quota, project-quota, sequence-id, and expired-request error codes signal transient contention and are
 * classified as network errors (retryable) regardless of the accompanying status.</p>
 * <p><strong>Thread-safety:</strong> Stateless utility.</p>
 *
 * @since 0.1.0
 */
public final class ErrorClassifier {
  private static final Map<String, String> TRANSIENT_ERROR_COUNTERS = Map.of(
      "writequotaexceed", MetricNames.RUNNER_SHARD_WRITE_QUOTA_ERROR,
      "shardwritequotaexceed", MetricNames.RUNNER_SHARD_WRITE_QUOTA_ERROR,
      "projectquotaexceed", MetricNames.RUNNER_PROJECT_QUOTA_ERROR,
      "invalidsequenceid", MetricNames.RUNNER_SEQUENCE_ID_ERROR,
      "sequenceiderror", MetricNames.RUNNER_SEQUENCE_ID_ERROR,
      "requesttimeexpired", MetricNames.RUNNER_REQUEST_EXPIRED_ERROR);

  private ErrorClassifier() {
    // Utility
  }

  /**
   * Classifies an HTTP-style reply.
   *
   * @param status response status; {@code 0} when no response was received
   * @param errorCode destination error code; may be {@code null}
   * @param message detail for logs; may be {@code null}
   * @return classified result
   */
  public static DeliveryResult fromStatus(int status, String errorCode, String message) {
    if (status >= 200 && status < 300) {
      return DeliveryResult.success();
    }
    if (errorCode != null && TRANSIENT_ERROR_COUNTERS.containsKey(normalize(errorCode))) {
      return DeliveryResult.failure(DeliveryOutcome.NETWORK_ERROR, errorCode, message);
    }
    DeliveryOutcome outcome;
    if (status <= 0 || status == 408 || status == 429) {
      outcome = DeliveryOutcome.NETWORK_ERROR;
    } else if (status == 401 || status == 403) {
      outcome = DeliveryOutcome.UNAUTHORIZED_ERROR;
    } else if (status == 400 || status == 404 || status == 413) {
      outcome = DeliveryOutcome.PARAMS_ERROR;
    } else if (status >= 500 && status < 600) {
      outcome = DeliveryOutcome.SERVER_ERROR;
    } else {
      outcome = DeliveryOutcome.OTHER_ERROR;
    }
    return DeliveryResult.failure(outcome, errorCode, message);
  }

  /**
   * Classifies an exception that completed a delivery future.
   *
   * @param failure thrown failure; wrapper exceptions are unwrapped
   * @return classified result
   */
  public static DeliveryResult fromThrowable(Throwable failure) {
    Throwable cause = unwrap(failure);
    String message = cause.getClass().getSimpleName()
        + (cause.getMessage() == null ? "" : ": " + cause.getMessage());
    if (cause instanceof TimeoutException || cause instanceof IOException) {
      return DeliveryResult.failure(DeliveryOutcome.NETWORK_ERROR, message);
    }
    if (cause instanceof SecurityException) {
      return DeliveryResult.failure(DeliveryOutcome.UNAUTHORIZED_ERROR, message);
    }
    if (cause instanceof IllegalArgumentException) {
      return DeliveryResult.failure(DeliveryOutcome.PARAMS_ERROR, message);
    }
    return DeliveryResult.failure(DeliveryOutcome.OTHER_ERROR, message);
  }

  /**
   * Returns the dedicated counter for a transient destination error code.
   *
   * @param errorCode destination error code
   * @return counter name, or empty for codes without a dedicated counter
   */
  public static Optional<String> errorCodeCounter(String errorCode) {
    if (errorCode == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(TRANSIENT_ERROR_COUNTERS.get(normalize(errorCode)));
  }

  private static Throwable unwrap(Throwable failure) {
    Throwable current = failure;
    while ((current instanceof CompletionException || current instanceof ExecutionException)
        && current.getCause() != null) {
      current = current.getCause();
    }
    if (current instanceof CancellationException) {
      return new TimeoutException("delivery cancelled");
    }
    return current;
  }

  private static String normalize(String errorCode) {
    return errorCode.trim().toLowerCase(Locale.ROOT);
  }
}
