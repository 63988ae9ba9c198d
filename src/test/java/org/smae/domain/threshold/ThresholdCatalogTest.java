package org.smae.domain.threshold;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.smae.domain.ontology.MetabolicNetwork;

class ThresholdCatalogTest {

  @Test
  void catalogHoldsSixteenDefinitionsGroupedByCategory() {
    Map<ThresholdCategory, List<ThresholdDefinition>> grouped = ThresholdCatalog.groupedByCategory();

    assertEquals(16, ThresholdCatalog.all().size());
    assertEquals(5, grouped.get(ThresholdCategory.ABSOLUTE).size());
    assertEquals(4, grouped.get(ThresholdCategory.RATE_OF_CHANGE).size());
    assertEquals(3, grouped.get(ThresholdCategory.RELATIONAL).size());
    assertEquals(4, grouped.get(ThresholdCategory.GOVERNANCE_DECAY).size());
  }

  @Test
  void catalogOrderFollowsCategoryOrder() {
    List<ThresholdDefinition> all = ThresholdCatalog.all();
    for (int i = 1; i < all.size(); i++) {
      assertTrue(all.get(i - 1).category().compareTo(all.get(i).category()) <= 0,
          "catalog must stay grouped by category");
    }
  }

  @Test
  void findLooksUpByName() {
    assertEquals(
        ThresholdCatalog.DISPLACEMENT_BRIGHT_LINE,
        ThresholdCatalog.find("displacement_single_event").orElseThrow());
    assertTrue(ThresholdCatalog.find("unknown").isEmpty());
    assertTrue(ThresholdCatalog.find(null).isEmpty());
  }

  @Test
  void forNetworkIncludesCatalogWideDefinitions() {
    List<ThresholdDefinition> ocean = ThresholdCatalog.forNetwork(MetabolicNetwork.OCEAN);

    assertTrue(ocean.contains(ThresholdCatalog.DEFENDER_KILLINGS_BRIGHT_LINE));
    assertTrue(ocean.stream().allMatch(def -> def.appliesTo(MetabolicNetwork.OCEAN)));
  }

  @Test
  void categoryKeysMatchCatalogVocabulary() {
    assertEquals("rate_of_change", ThresholdCategory.RATE_OF_CHANGE.key());
    assertEquals("governance_decay", ThresholdCategory.GOVERNANCE_DECAY.key());
  }
}
