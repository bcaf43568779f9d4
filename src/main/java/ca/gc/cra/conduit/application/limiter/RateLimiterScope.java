package ca.gc.cra.conduit.application.limiter;

import ca.gc.cra.conduit.application.metrics.MetricNames;
import ca.gc.cra.conduit.domain.queue.QueueKey;

/**
 * Independent throttling scopes consulted before a sender item is fetched. Acquisition order follows declaration
 * order, widest scope first.
 *
 * @since 0.1.0
 */
public enum RateLimiterScope {
  GLOBAL(MetricNames.FETCH_REJECTED_BY_GLOBAL_LIMITER),
  REGION(MetricNames.FETCH_REJECTED_BY_REGION_LIMITER),
  PROJECT(MetricNames.FETCH_REJECTED_BY_PROJECT_LIMITER),
  LOGSTORE(MetricNames.FETCH_REJECTED_BY_LOGSTORE_LIMITER);

  private final String rejectionMetric;

  RateLimiterScope(String rejectionMetric) {
    this.rejectionMetric = rejectionMetric;
  }

  /**
   * Returns the sender-queue counter incremented when this scope rejects a fetch.
   *
   * @return metric name
   */
  public String rejectionMetric() {
    return rejectionMetric;
  }

  /**
   * Derives the limiter bucket a key falls into for this scope.
   *
   * @param key stream identity
   * @return bucket name; constant for {@link #GLOBAL}
   */
  public String bucketOf(QueueKey key) {
    return switch (this) {
      case GLOBAL -> "*";
      case REGION -> key.region();
      case PROJECT -> key.region() + "/" + key.project();
      case LOGSTORE -> key.region() + "/" + key.project() + "/" + key.logstore();
    };
  }
}
