/**
 * Local {@link ca.gc.cra.conduit.application.port.DestinationPort} implementations.
 */
package ca.gc.cra.conduit.infrastructure.sink;
