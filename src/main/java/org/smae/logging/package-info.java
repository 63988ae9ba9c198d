/**
 * <strong>Purpose:</strong> Logging utilities that tune verbosity and bound externally sourced text before emission.
 * <p><strong>Pipeline role:</strong> Cross-cutting support for intake and orchestration diagnostics.
 * <p><strong>Concurrency:</strong> Stateless helpers; thread-safe when invoked from intake workers.
 * <p><strong>Observability:</strong> Coordinates with SLF4J/Logback; no custom metrics.
 *
 * @since 0.1.0
 */
package org.smae.logging;
