/**
 * Configuration loading and wiring for the SMAE pipeline.
 * <p><strong>Precedence:</strong> programmatic overrides, then the YAML {@code pipeline} section (over
 * {@code common}), then {@link org.smae.config.PipelineConfig#defaults()}.</p>
 * <p><strong>Thread-safety:</strong> Records are immutable; loaders and the composition root run at startup.</p>
 */
package org.smae.config;
