/**
 * <strong>Purpose:</strong> Validation helpers used while building configuration snapshots.
 * <p><strong>Pipeline role:</strong> Rejects malformed thresholds and identifiers at pipeline start so nothing
 * fails on them at runtime.
 * <p><strong>Concurrency:</strong> Stateless utilities safe for concurrent invocation.
 * <p><strong>Observability:</strong> No direct metrics or logging; failures surface via {@link IllegalArgumentException}.
 *
 * @since 0.1.0
 */
package ca.gc.cra.conduit.validation;
