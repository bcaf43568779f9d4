/**
 * Bounded, keyed queues between the producers, the process runner and the flusher runner.
 * <p><strong>Role:</strong> Backpressure boundary; each lane publishes a {@code valid_to_push_status} gauge.</p>
 * <p><strong>Concurrency:</strong> Lanes are guarded by their own monitor; managers wake waiting runners through
 * a shared work signal.</p>
 */
package ca.gc.cra.conduit.application.queue;
