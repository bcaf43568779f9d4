/**
 * Time-related infrastructure adapters implementing clock ports.
 * <p><strong>Role:</strong> Adapter layer providing concrete time sources.</p>
 * <p><strong>Concurrency:</strong> Implementations are thread-safe.</p>
 */
package ca.gc.cra.conduit.infrastructure.time;
