/**
 * Core domain model for the SMAE intake -> analysis -> triage pipeline.
 * <p><strong>Role:</strong> Domain layer describing events, thresholds, sources, and convergence without
 * infrastructure dependencies.</p>
 * <p><strong>Concurrency:</strong> Types are immutable; safe to share across threads.</p>
 * <p><strong>Metrics:</strong> Domain attributes feed tagging on {@code intake.*}, {@code triage.*}, and
 * {@code verify.*} metrics.</p>
 */
package org.smae.domain;
