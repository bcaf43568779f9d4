/**
 * Pipeline use cases that move event groups from the process queue to destinations.
 * <p>A {@link ca.gc.cra.conduit.application.pipeline.Pipeline} owns one process runner thread, one batch sweep
 * timer, one retry timer and {@code flusher.concurrency} send workers. Thread names follow the
 * {@code <pipeline>-process-*}, {@code <pipeline>-sweep-*}, {@code <pipeline>-retry-*} and
 * {@code <pipeline>-flusher-*} conventions; runner and sweep threads carry the {@code pipeline} MDC key.</p>
 * <p>Components count into {@link ca.gc.cra.conduit.application.metrics.MetricsRecord}s registered per pipeline;
 * latency histograms go through {@link ca.gc.cra.conduit.application.port.MetricsPort}.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.conduit.application.pipeline;
