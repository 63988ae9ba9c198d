/**
 * Metrics adapters that bridge the SMAE metrics port to OpenTelemetry or no-op implementations.
 * <p><strong>Role:</strong> Adapter layer on the observability plane.</p>
 * <p><strong>Concurrency:</strong> Implementations are thread-safe; intake workers record concurrently.</p>
 * <p><strong>Metrics:</strong> Publishes under the {@code pipeline.*}, {@code intake.*}, {@code triage.*} and
 * {@code verify.*} namespaces.</p>
 */
package org.smae.infrastructure.metrics;
