package ca.gc.cra.conduit.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class NumbersTest {

  @Test
  void requireRangeReturnsValueWithinBounds() {
    assertEquals(5, Numbers.requireRange("batch.maxEvents", 5, 1, 10));
    assertEquals(1, Numbers.requireRange("batch.maxEvents", 1, 1, 10));
  }

  @Test
  void requireRangeNamesTheParameter() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> Numbers.requireRange("flusher.concurrency", 0, 1, 256));
    assertEquals("flusher.concurrency must be between 1 and 256 (was 0)", ex.getMessage());
  }
}
