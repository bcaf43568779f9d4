/**
 * Kafka adapters for the delivery side of the pipeline.
 */
package ca.gc.cra.conduit.adapter.kafka;
