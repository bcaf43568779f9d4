package ca.gc.cra.conduit.domain.sink;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class RegistrationStateTest {

  @Test
  void legalTransitions() {
    assertTrue(RegistrationState.UNREGISTERED.canTransitionTo(RegistrationState.REGISTERING));
    assertTrue(RegistrationState.REGISTERING.canTransitionTo(RegistrationState.REGISTERED));
    assertTrue(RegistrationState.REGISTERING.canTransitionTo(RegistrationState.FAILED));
    assertTrue(RegistrationState.REGISTERED.canTransitionTo(RegistrationState.UNREGISTERED));
    assertTrue(RegistrationState.FAILED.canTransitionTo(RegistrationState.UNREGISTERED));
  }

  @Test
  void illegalTransitions() {
    assertFalse(RegistrationState.UNREGISTERED.canTransitionTo(RegistrationState.REGISTERED));
    assertFalse(RegistrationState.FAILED.canTransitionTo(RegistrationState.REGISTERED));
    assertFalse(RegistrationState.REGISTERED.canTransitionTo(RegistrationState.REGISTERING));
  }
}
