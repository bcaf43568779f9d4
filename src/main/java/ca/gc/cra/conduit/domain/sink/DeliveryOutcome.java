package ca.gc.cra.conduit.domain.sink;

/**
 * <strong>What:</strong> Classification of a single delivery attempt.
 * <p><strong>Role:</strong> Drives the flusher retry policy; never persisted.</p>
 *
 * @since 0.1.0
 */
public enum DeliveryOutcome {
  /** Destination accepted the payload. */
  SUCCESS("send_success_total"),
  /** Transport failure, timeout, or transient contention (quota, sequence id). */
  NETWORK_ERROR("send_network_error_total"),
  /** Destination-side failure (5xx equivalent). */
  SERVER_ERROR("send_server_error_total"),
  /** Credentials rejected; the client session must be re-established. */
  UNAUTHORIZED_ERROR("send_unauth_error_total"),
  /** Request rejected as malformed; never retried. */
  PARAMS_ERROR("send_params_error_total"),
  /** Anything else; retried once. */
  OTHER_ERROR("send_other_error_total");

  private final String metricName;

  DeliveryOutcome(String metricName) {
    this.metricName = metricName;
  }

  /**
   * Returns the runner counter incremented for this outcome.
   *
   * @return metric name
   */
  public String metricName() {
    return metricName;
  }
}
