/**
 * Outbound ports of the pipeline: destinations, serializers, compressors, metrics and clock.
 * <p><strong>Concurrency:</strong> Implementations are called from several worker threads and must be
 * thread-safe unless documented otherwise.</p>
 */
package ca.gc.cra.conduit.application.port;
