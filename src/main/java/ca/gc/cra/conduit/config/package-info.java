/**
 * Configuration snapshots and composition root wiring for CONDUIT pipelines.
 * <p><strong>Role:</strong> Bootstrap layer selecting serializer, compressor and destination adapters.</p>
 * <p><strong>Concurrency:</strong> Configuration records are immutable; safe to share.</p>
 * <p><strong>Security:</strong> Identifiers are validated with {@code ca.gc.cra.conduit.validation} before they
 * reach metric labels or broker requests.</p>
 */
package ca.gc.cra.conduit.config;
