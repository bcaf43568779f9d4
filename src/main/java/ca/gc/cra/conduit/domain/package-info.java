/**
 * Domain value types of the output data path: events, batches, queue keys and delivery outcomes.
 */
package ca.gc.cra.conduit.domain;
