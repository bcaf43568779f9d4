/**
 * Executor factories producing named worker pools and timer threads for pipelines.
 */
package ca.gc.cra.conduit.infrastructure.exec;
