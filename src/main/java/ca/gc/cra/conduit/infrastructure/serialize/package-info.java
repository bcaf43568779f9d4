/**
 * Batch encoders implementing {@link ca.gc.cra.conduit.application.port.BatchSerializer} with the Jackson
 * streaming API.
 */
package ca.gc.cra.conduit.infrastructure.serialize;
