package ca.gc.cra.conduit.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class LogsTest {

  @Test
  void shortValuesAreUnchanged() {
    assertEquals("ok", Logs.truncate("ok", 10));
    assertEquals("<null>", Logs.truncate(null, 10));
  }

  @Test
  void longValuesAreCutOnCharacterBoundary() {
    String truncated = Logs.truncate("ééé", 3);

    assertTrue(truncated.startsWith("é..."), truncated);
    assertTrue(truncated.endsWith("(truncated, 3 of 6)"), truncated);
  }

  @Test
  void rejectsNonPositiveLimit() {
    assertThrows(IllegalArgumentException.class, () -> Logs.truncate("x", 0));
  }
}
