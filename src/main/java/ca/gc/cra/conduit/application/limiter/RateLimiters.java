package ca.gc.cra.conduit.application.limiter;

import ca.gc.cra.conduit.application.port.ClockPort;
import ca.gc.cra.conduit.domain.queue.QueueKey;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * <strong>What:</strong> Registry of rate limiters for the global, region, project, and logstore scopes.
 * <p><strong>Why:</strong> A sender item may only be fetched when every applicable scope has a token; a refusal is
 * flow control, not a failure, so the item stays queued and no retry budget is spent.</p>
 * <p><strong>Thread-safety:</strong> Admission is checked and taken under this registry's monitor, so a refused
 * fetch takes no token from any scope. Buckets of streams that no longer have a lane are evicted through
 * {@link #retainOnly(Collection)}.</p>
 *
 * @since 0.1.0
 */
public final class RateLimiters {
  private final RateLimitSettings settings;
  private final ClockPort clock;
  private final Map<String, RateLimiter> buckets = new HashMap<>();

  public RateLimiters(RateLimitSettings settings, ClockPort clock) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Takes one token from every enabled scope of {@code key}, or none at all.
   *
   * @param key stream identity of the candidate item
   * @return empty when all scopes admitted the fetch, otherwise the first scope that refused
   */
  public synchronized Optional<RateLimiterScope> tryAcquireAll(QueueKey key) {
    Objects.requireNonNull(key, "key");
    List<RateLimiter> scoped = new ArrayList<>(RateLimiterScope.values().length);
    for (RateLimiterScope scope : RateLimiterScope.values()) {
      RateLimiter limiter = limiterFor(scope, key);
      if (limiter == null) {
        continue;
      }
      if (limiter.available() <= 0) {
        return Optional.of(scope);
      }
      scoped.add(limiter);
    }
    // Only this monitor consumes from these buckets and refills only add tokens
    for (RateLimiter limiter : scoped) {
      limiter.tryAcquire();
    }
    return Optional.empty();
  }

  /**
   * Drops the region, project, and logstore buckets no longer used by any of {@code liveKeys}.
   *
   * @param liveKeys streams that still have a sender lane
   * @return number of buckets evicted
   */
  public synchronized int retainOnly(Collection<QueueKey> liveKeys) {
    Objects.requireNonNull(liveKeys, "liveKeys");
    Set<String> live = new HashSet<>();
    for (QueueKey key : liveKeys) {
      for (RateLimiterScope scope : RateLimiterScope.values()) {
        live.add(bucketId(scope, key));
      }
    }
    int before = buckets.size();
    buckets.keySet().removeIf(id -> !id.startsWith(RateLimiterScope.GLOBAL.name() + ':') && !live.contains(id));
    return before - buckets.size();
  }

  synchronized int bucketCount() {
    return buckets.size();
  }

  /**
   * Returns the limiter guarding {@code key} in {@code scope}.
   *
   * @param scope limiter scope
   * @param key stream identity
   * @return limiter, or {@code null} when the scope is unlimited
   */
  synchronized RateLimiter limiterFor(RateLimiterScope scope, QueueKey key) {
    long quota = settings.quota(scope);
    if (quota <= 0) {
      return null;
    }
    return buckets.computeIfAbsent(
        bucketId(scope, key), k -> new RateLimiter(quota, settings.refillIntervalMillis(), clock));
  }

  private static String bucketId(RateLimiterScope scope, QueueKey key) {
    return scope.name() + ':' + scope.bucketOf(key);
  }
}
