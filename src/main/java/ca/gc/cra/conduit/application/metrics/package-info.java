/**
 * In-process metric records keyed by label sets, exported as flat string maps.
 * <p><strong>Concurrency:</strong> Counters are {@link java.util.concurrent.atomic.LongAdder}s and gauges
 * {@link java.util.concurrent.atomic.AtomicLong}s; records can be read while they are updated.</p>
 */
package ca.gc.cra.conduit.application.metrics;
