package ca.gc.cra.conduit.domain.sink;

import java.util.EnumSet;
import java.util.Set;

/**
 * <strong>What:</strong> Client-registration state of a session-based destination.
 * <p><strong>Why:</strong> Makes the legal session transitions explicit instead of tracking them with flags.</p>
 * <p>Legal transitions:
 * <ul>
 *   <li>{@code UNREGISTERED -> REGISTERING}</li>
 *   <li>{@code REGISTERING -> REGISTERED | UNREGISTERED | FAILED}</li>
 *   <li>{@code REGISTERED -> UNREGISTERED} (credentials rejected)</li>
 *   <li>{@code FAILED -> UNREGISTERED} (external re-registration trigger)</li>
 * </ul>
 *
 * @since 0.1.0
 */
public enum RegistrationState {
  UNREGISTERED,
  REGISTERING,
  REGISTERED,
  FAILED;

  /**
   * Returns whether moving from this state to {@code next} is allowed.
   *
   * @param next candidate state
   * @return {@code true} when the transition is legal
   */
  public boolean canTransitionTo(RegistrationState next) {
    return successors().contains(next);
  }

  private Set<RegistrationState> successors() {
    return switch (this) {
      case UNREGISTERED -> EnumSet.of(REGISTERING);
      case REGISTERING -> EnumSet.of(REGISTERED, UNREGISTERED, FAILED);
      case REGISTERED -> EnumSet.of(UNREGISTERED);
      case FAILED -> EnumSet.of(UNREGISTERED);
    };
  }
}
