/**
 * Delivery-side domain types: sender items, outcomes, registration state and payload encodings.
 * <p><strong>Metrics:</strong> {@link ca.gc.cra.conduit.domain.sink.DeliveryOutcome#metricName()} names the
 * per-outcome send counters.</p>
 */
package ca.gc.cra.conduit.domain.sink;
