package ca.gc.cra.conduit.application.limiter;

import ca.gc.cra.conduit.validation.Numbers;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Quotas per limiter scope, in fetches per refill interval. A quota of {@code 0} disables the scope.
 *
 * @param quotas quota per scope; missing scopes are unlimited
 * @param refillIntervalMillis window length
 * @since 0.1.0
 */
public record RateLimitSettings(Map<RateLimiterScope, Long> quotas, long refillIntervalMillis) {
  private static final RateLimitSettings UNLIMITED = new RateLimitSettings(Map.of(), 1_000L);

  public RateLimitSettings {
    Objects.requireNonNull(quotas, "quotas");
    EnumMap<RateLimiterScope, Long> copy = new EnumMap<>(RateLimiterScope.class);
    quotas.forEach((scope, quota) -> copy.put(
        Objects.requireNonNull(scope, "scope"),
        Numbers.requireRange("rateLimit." + scope.name().toLowerCase(Locale.ROOT),
            Objects.requireNonNull(quota, "quota"), 0, Long.MAX_VALUE)));
    quotas = Map.copyOf(copy);
    Numbers.requireRange("rateLimit.refillIntervalMillis", refillIntervalMillis, 1, 3_600_000);
  }

  public static RateLimitSettings unlimited() {
    return UNLIMITED;
  }

  /**
   * Returns the quota of a scope.
   *
   * @param scope limiter scope
   * @return permits per interval, {@code 0} when unlimited
   */
  public long quota(RateLimiterScope scope) {
    return quotas.getOrDefault(scope, 0L);
  }
}
