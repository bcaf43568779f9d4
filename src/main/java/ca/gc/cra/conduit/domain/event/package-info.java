/**
 * Log events, the event groups producers submit, and the batches the batcher closes.
 * <p><strong>Concurrency:</strong> Immutable; safe to share across threads.</p>
 */
package ca.gc.cra.conduit.domain.event;
