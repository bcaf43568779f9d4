package ca.gc.cra.conduit.domain.sink;

import java.util.Objects;

/**
 * Result of a client registration (session establishment) attempt.
 *
 * @param registered whether the destination accepted the registration
 * @param message detail for logs; empty on success
 * @since 0.1.0
 */
public record RegistrationResult(boolean registered, String message) {
  public RegistrationResult {
    message = Objects.requireNonNullElse(message, "");
  }

  public static RegistrationResult ok() {
    return new RegistrationResult(true, "");
  }

  public static RegistrationResult failed(String message) {
    return new RegistrationResult(false, message);
  }
}
