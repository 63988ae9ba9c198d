package org.smae.domain.ontology;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class MetabolicNetworkTest {

  @Test
  void eightNetworksIndexedFromOne() {
    assertEquals(8, MetabolicNetwork.values().length);
    assertEquals(MetabolicNetwork.CARBON, MetabolicNetwork.fromIndex(1));
    assertEquals("VIII", MetabolicNetwork.LABOR.roman());
    assertEquals("Labor & Embodied Health", MetabolicNetwork.LABOR.label());
  }

  @Test
  void unknownIndexRejected() {
    assertThrows(IllegalArgumentException.class, () -> MetabolicNetwork.fromIndex(9));
  }

  @Test
  void vocabularySizes() {
    assertEquals(6, AnalyticalLayer.values().length);
    assertEquals(4, OntologyNode.values().length);
    assertEquals(11, CouplingPattern.values().length);
    assertEquals("Infrastructure Lock-in Ratchet", CouplingPattern.INFRASTRUCTURE_LOCKIN.label());
    assertEquals(11, CouplingPattern.INFRASTRUCTURE_LOCKIN.index());
  }
}
