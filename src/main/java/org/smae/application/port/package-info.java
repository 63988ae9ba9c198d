/**
 * <strong>Purpose:</strong> Ports defining the intake -> analysis -> result workflow contracts.
 * <p><strong>Pipeline role:</strong> Application boundary; feed adapters and observability backends implement these
 * interfaces to integrate external systems.</p>
 * <p><strong>Concurrency:</strong> Port implementations must be thread-safe unless documented otherwise.</p>
 * <p><strong>Observability:</strong> Ports expose hooks for metrics/logging but do not prescribe implementations.</p>
 *
 * @since 0.1.0
 */
package org.smae.application.port;
