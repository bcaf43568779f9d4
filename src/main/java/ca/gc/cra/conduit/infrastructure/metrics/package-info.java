/**
 * Metrics adapters that bridge the metrics port and the component registry to OpenTelemetry.
 * <p><strong>Role:</strong> Adapter layer on the observability plane.</p>
 * <p><strong>Concurrency:</strong> Implementations are thread-safe and support concurrent metric updates.</p>
 * <p><strong>Metrics:</strong> Histograms under {@code flusher.*} and {@code batcher.*}; registry values as
 * observable gauges carrying the record labels as attributes.</p>
 * <p><strong>Security:</strong> Never exports payload contents; only labels and counts.</p>
 */
package ca.gc.cra.conduit.infrastructure.metrics;
