/**
 * Queue element contract and the key that identifies a destination stream.
 */
package ca.gc.cra.conduit.domain.queue;
