package org.smae.domain.ontology;

/**
 * Six-layer schema applied within each metabolic network.
 *
 * @since 0.1.0
 */
public enum AnalyticalLayer {
  STOCK,
  FLOW,
  ACCUMULATION,
  EXTERNALITY,
  GOVERNANCE,
  CONTESTATION
}
