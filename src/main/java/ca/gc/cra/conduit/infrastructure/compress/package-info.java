/**
 * Payload codecs implementing {@link ca.gc.cra.conduit.application.port.PayloadCompressor}.
 */
package ca.gc.cra.conduit.infrastructure.compress;
