/**
 * Core event model: events, actors, coordinates, and triage levels.
 * <p><strong>Role:</strong> Domain layer aggregates produced by source adapters and transformed by the analytical
 * pipeline; no infrastructure dependencies.</p>
 * <p><strong>Concurrency:</strong> Types are immutable; safe to share across intake threads.</p>
 *
 * @since 0.1.0
 */
package org.smae.domain.events;
