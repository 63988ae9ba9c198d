package org.smae.domain.ontology;

/**
 * Four-node decomposition applied to every event.
 *
 * @since 0.1.0
 */
public enum OntologyNode {
  APPROPRIATION,
  DISPLACEMENT,
  GOVERNANCE,
  RESISTANCE
}
