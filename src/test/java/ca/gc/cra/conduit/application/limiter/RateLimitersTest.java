package ca.gc.cra.conduit.application.limiter;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.conduit.domain.queue.QueueKey;
import ca.gc.cra.conduit.testutil.ManualClock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class RateLimitersTest {
  private final ManualClock clock = new ManualClock(0);
  private final QueueKey appLogs = QueueKey.of("ca-central-1", "agent", "app-logs");
  private final QueueKey audit = QueueKey.of("ca-central-1", "agent", "audit");

  @Test
  void unlimitedSettingsAlwaysAdmit() {
    RateLimiters limiters = new RateLimiters(RateLimitSettings.unlimited(), clock);
    for (int i = 0; i < 1_000; i++) {
      assertTrue(limiters.tryAcquireAll(appLogs).isEmpty());
    }
  }

  @Test
  void logstoreBucketsAreIndependent() {
    RateLimiters limiters = new RateLimiters(
        new RateLimitSettings(Map.of(RateLimiterScope.LOGSTORE, 1L), 1_000), clock);

    assertTrue(limiters.tryAcquireAll(appLogs).isEmpty());
    assertEquals(Optional.of(RateLimiterScope.LOGSTORE), limiters.tryAcquireAll(appLogs));
    assertTrue(limiters.tryAcquireAll(audit).isEmpty());
  }

  @Test
  void projectBucketIsSharedAcrossLogstores() {
    RateLimiters limiters = new RateLimiters(
        new RateLimitSettings(Map.of(RateLimiterScope.PROJECT, 1L), 1_000), clock);

    assertTrue(limiters.tryAcquireAll(appLogs).isEmpty());
    assertEquals(Optional.of(RateLimiterScope.PROJECT), limiters.tryAcquireAll(audit));
  }

  @Test
  void rejectionTakesNoPermitFromWiderScopes() {
    RateLimiters limiters = new RateLimiters(
        new RateLimitSettings(Map.of(RateLimiterScope.GLOBAL, 2L, RateLimiterScope.LOGSTORE, 1L), 1_000), clock);

    assertTrue(limiters.tryAcquireAll(appLogs).isEmpty());
    assertEquals(Optional.of(RateLimiterScope.LOGSTORE), limiters.tryAcquireAll(appLogs));

    assertEquals(1, limiters.limiterFor(RateLimiterScope.GLOBAL, appLogs).available());
    assertTrue(limiters.tryAcquireAll(audit).isEmpty());
    assertEquals(Optional.of(RateLimiterScope.GLOBAL), limiters.tryAcquireAll(
        QueueKey.of("ca-central-1", "agent", "metrics")));
  }

  @Test
  void refusalAcrossWindowBoundaryKeepsGlobalWithinQuota() {
    RateLimiters limiters = new RateLimiters(
        new RateLimitSettings(Map.of(RateLimiterScope.GLOBAL, 1L, RateLimiterScope.LOGSTORE, 1L), 1_000), clock);
    QueueKey metrics = QueueKey.of("ca-central-1", "agent", "metrics");

    assertTrue(limiters.tryAcquireAll(appLogs).isEmpty());
    clock.advance(999);
    assertEquals(Optional.of(RateLimiterScope.GLOBAL), limiters.tryAcquireAll(appLogs));
    clock.advance(1);

    assertTrue(limiters.tryAcquireAll(metrics).isEmpty());
    assertEquals(Optional.of(RateLimiterScope.GLOBAL), limiters.tryAcquireAll(audit));
  }

  @Test
  void retainOnlyEvictsBucketsOfClosedStreams() {
    RateLimiters limiters = new RateLimiters(new RateLimitSettings(Map.of(
        RateLimiterScope.GLOBAL, 100L,
        RateLimiterScope.REGION, 100L,
        RateLimiterScope.PROJECT, 100L,
        RateLimiterScope.LOGSTORE, 100L), 1_000), clock);
    QueueKey other = QueueKey.of("us-east-1", "edge", "traces");
    limiters.tryAcquireAll(appLogs);
    limiters.tryAcquireAll(audit);
    limiters.tryAcquireAll(other);
    assertEquals(8, limiters.bucketCount());

    assertEquals(1, limiters.retainOnly(List.of(appLogs, other)));
    assertEquals(7, limiters.bucketCount());

    assertEquals(3, limiters.retainOnly(List.of(appLogs)));
    assertEquals(4, limiters.bucketCount());
    assertEquals(3, limiters.retainOnly(List.of()));
    assertEquals(1, limiters.bucketCount());
  }
}
