package ca.gc.cra.conduit.domain.sink;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of one delivery attempt reported by a destination.
 *
 * @param outcome classified outcome
 * @param errorCode destination-specific error code, when one was returned
 * @param message human readable detail; empty on success
 * @since 0.1.0
 */
public record DeliveryResult(DeliveryOutcome outcome, Optional<String> errorCode, String message) {
  private static final DeliveryResult SUCCESS = new DeliveryResult(DeliveryOutcome.SUCCESS, Optional.empty(), "");

  public DeliveryResult {
    Objects.requireNonNull(outcome, "outcome");
    errorCode = Objects.requireNonNullElse(errorCode, Optional.empty());
    message = Objects.requireNonNullElse(message, "");
  }

  public static DeliveryResult success() {
    return SUCCESS;
  }

  public static DeliveryResult failure(DeliveryOutcome outcome, String message) {
    return new DeliveryResult(outcome, Optional.empty(), message);
  }

  public static DeliveryResult failure(DeliveryOutcome outcome, String errorCode, String message) {
    return new DeliveryResult(outcome, Optional.ofNullable(errorCode), message);
  }

  public boolean isSuccess() {
    return outcome == DeliveryOutcome.SUCCESS;
  }
}
