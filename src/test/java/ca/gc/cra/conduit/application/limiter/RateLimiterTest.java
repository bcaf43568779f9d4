package ca.gc.cra.conduit.application.limiter;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.conduit.testutil.ManualClock;
import org.junit.jupiter.api.Test;

class RateLimiterTest {
  private final ManualClock clock = new ManualClock(10_000);

  @Test
  void permitsRefillOncePerInterval() {
    RateLimiter limiter = new RateLimiter(2, 1_000, clock);

    assertTrue(limiter.tryAcquire());
    assertTrue(limiter.tryAcquire());
    assertFalse(limiter.tryAcquire());

    clock.advance(999);
    assertFalse(limiter.tryAcquire());
    clock.advance(1);
    assertTrue(limiter.tryAcquire());
    assertEquals(1, limiter.available());
  }

  @Test
  void unusedPermitsDoNotAccumulate() {
    RateLimiter limiter = new RateLimiter(3, 100, clock);
    clock.advance(10_000);

    assertEquals(3, limiter.available());
  }

  @Test
  void windowBoundaryNeverGrantsMoreThanQuota() {
    RateLimiter limiter = new RateLimiter(1, 100, clock);
    clock.advance(99);
    assertTrue(limiter.tryAcquire());

    clock.advance(1);
    assertEquals(1, limiter.available());
    assertTrue(limiter.tryAcquire());
    assertFalse(limiter.tryAcquire());
    assertEquals(0, limiter.available());
  }

  @Test
  void rejectsNonPositiveQuota() {
    assertThrows(IllegalArgumentException.class, () -> new RateLimiter(0, 100, clock));
    assertThrows(IllegalArgumentException.class, () -> new RateLimiter(1, 0, clock));
  }
}
