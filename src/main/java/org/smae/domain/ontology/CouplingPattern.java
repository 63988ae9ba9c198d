package org.smae.domain.ontology;

/**
 * Eleven structural coupling patterns tracked across cases.
 *
 * <p>Patterns are qualitative tags only; no pipeline stage scores or triages on them.</p>
 *
 * @since 0.1.0
 */
public enum CouplingPattern {
  EXTRACTIVE_CASCADE(1, "Extractive Cascade"),
  REGULATORY_ARBITRAGE(2, "Regulatory Arbitrage Loop"),
  GREEN_TRANSITION_PARADOX(3, "Green Transition Paradox"),
  ATMOSPHERIC_ENCLOSURE(4, "Atmospheric Enclosure"),
  DEBT_NATURE_TRAP(5, "Debt-Nature Trap"),
  SACRIFICE_ZONE_SPIRAL(6, "Sacrifice Zone Intensification Spiral"),
  MILITARIZED_CONSERVATION(7, "Militarized Conservation Enclosure"),
  FOOD_SOVEREIGNTY_EROSION(8, "Food Sovereignty Erosion Loop"),
  HUMANITARIAN_SECURITY_FEEDBACK(9, "Humanitarian-Security Feedback"),
  KNOWLEDGE_ENCLOSURE(10, "Knowledge Enclosure Circuit"),
  INFRASTRUCTURE_LOCKIN(11, "Infrastructure Lock-in Ratchet");

  private final int index;
  private final String label;

  CouplingPattern(int index, String label) {
    this.index = index;
    this.label = label;
  }

  public int index() {
    return index;
  }

  public String label() {
    return label;
  }
}
