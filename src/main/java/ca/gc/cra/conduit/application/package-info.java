/**
 * Application layer of the output data path: ports, pipeline use cases, queues, limiters and metric records.
 * <p>Depends on {@code ca.gc.cra.conduit.domain} and {@code ca.gc.cra.conduit.config}; adapters plug in through
 * {@link ca.gc.cra.conduit.application.port}.</p>
 */
package ca.gc.cra.conduit.application;
