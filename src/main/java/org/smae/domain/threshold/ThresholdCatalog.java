package org.smae.domain.threshold;

import static org.smae.domain.ontology.MetabolicNetwork.ATMOSPHERIC;
import static org.smae.domain.ontology.MetabolicNetwork.CARBON;
import static org.smae.domain.ontology.MetabolicNetwork.MINERAL;
import static org.smae.domain.ontology.MetabolicNetwork.SOIL;
import static org.smae.domain.ontology.MetabolicNetwork.WATER;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.smae.domain.ontology.MetabolicNetwork;

/**
 * <strong>What:</strong> The fixed catalog of bright-line, rate-of-change, relational, and governance-decay thresholds.
 * <p><strong>Why:</strong> Reporting layers list and compare against the same bounds the sources use when they
 * attach crossings to events.</p>
 * <p><strong>Role:</strong> Read-only reference data; the pipeline's threshold stage does not consult it.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe for concurrent reads.</p>
 *
 * @since 0.1.0
 */
public final class ThresholdCatalog {
  private static final List<MetabolicNetwork> ALL_NETWORKS = List.of(MetabolicNetwork.values());

  public static final ThresholdDefinition DISPLACEMENT_BRIGHT_LINE = new ThresholdDefinition(
      "displacement_single_event", ThresholdCategory.ABSOLUTE,
      "Displacement >100 000 persons in single event/campaign",
      List.of(CARBON, WATER, MINERAL), 100_000, "persons");

  public static final ThresholdDefinition CONTAMINATION_BRIGHT_LINE = new ThresholdDefinition(
      "contamination_who_limits", ThresholdCategory.ABSOLUTE,
      "Contamination above WHO limits affecting >50 000 persons",
      List.of(WATER, ATMOSPHERIC), 50_000, "persons");

  public static final ThresholdDefinition ARMED_CONFLICT_BRIGHT_LINE = new ThresholdDefinition(
      "armed_conflict_fatalities", ThresholdCategory.ABSOLUTE,
      "Armed conflict >1 000 fatalities in 30-day window",
      List.of(MINERAL, CARBON), 1_000, "fatalities/30d");

  public static final ThresholdDefinition REGULATORY_ROLLBACK_BRIGHT_LINE = new ThresholdDefinition(
      "regulatory_rollback", ThresholdCategory.ABSOLUTE,
      "Regulatory rollback eliminating >10% governance coverage in any network",
      ALL_NETWORKS, 10, "% governance coverage");

  public static final ThresholdDefinition DEFENDER_KILLINGS_BRIGHT_LINE = new ThresholdDefinition(
      "defender_killings", ThresholdCategory.ABSOLUTE,
      "Land/environmental defender killings >5 in 90-day window per jurisdiction",
      ALL_NETWORKS, 5, "killings/90d/jurisdiction");

  public static final ThresholdDefinition DISPLACEMENT_RATE_DOUBLING = new ThresholdDefinition(
      "displacement_rate_doubling", ThresholdCategory.RATE_OF_CHANGE,
      "Displacement rate doubling within 30-day window",
      ALL_NETWORKS, 2.0, "rate multiplier/30d");

  public static final ThresholdDefinition DEFORESTATION_SIGMA = new ThresholdDefinition(
      "deforestation_anomaly", ThresholdCategory.RATE_OF_CHANGE,
      "Deforestation >3 sigma above 5-year mean for any jurisdiction",
      List.of(CARBON, SOIL), 3.0, "sigma above 5y mean");

  public static final ThresholdDefinition CONFLICT_FATALITIES_ACCELERATION = new ThresholdDefinition(
      "conflict_fatalities_acceleration", ThresholdCategory.RATE_OF_CHANGE,
      "Conflict fatalities >50% month-on-month for 3 consecutive months",
      List.of(MINERAL, CARBON), 50, "% MoM increase");

  public static final ThresholdDefinition REGULATORY_ROLLBACK_CLUSTER = new ThresholdDefinition(
      "regulatory_rollback_cluster", ThresholdCategory.RATE_OF_CHANGE,
      "3 significant regulatory rollbacks in single jurisdiction within 60 days",
      ALL_NETWORKS, 3, "rollbacks/60d");

  public static final ThresholdDefinition EMISSIONS_INEQUITY = new ThresholdDefinition(
      "emissions_inequity", ThresholdCategory.RELATIONAL,
      "Per capita emissions of A >20x B, where B bears >5x climate vulnerability",
      List.of(CARBON, ATMOSPHERIC), 20, "emissions ratio");

  public static final ThresholdDefinition CORPORATE_WATER_EXTRACTION = new ThresholdDefinition(
      "corporate_water_vs_domestic", ThresholdCategory.RELATIONAL,
      "Corporate water extraction exceeding domestic supply for community >10 000 persons",
      List.of(WATER), 1.0, "extraction/supply ratio");

  public static final ThresholdDefinition EJ_POLLUTION_EXPOSURE = new ThresholdDefinition(
      "ej_pollution_exposure", ThresholdCategory.RELATIONAL,
      "EJ community pollution exposure >3x jurisdictional mean",
      List.of(ATMOSPHERIC), 3.0, "exposure ratio");

  public static final ThresholdDefinition TREATY_NONCOMPLIANCE = new ThresholdDefinition(
      "treaty_noncompliance", ThresholdCategory.GOVERNANCE_DECAY,
      "Treaty withdrawal or non-compliance",
      ALL_NETWORKS, 1, "event");

  public static final ThresholdDefinition AGENCY_BUDGET_CUT = new ThresholdDefinition(
      "agency_budget_cut", ThresholdCategory.GOVERNANCE_DECAY,
      "Regulatory agency budget/staffing cut >20%",
      ALL_NETWORKS, 20, "% cut");

  public static final ThresholdDefinition FPIC_WEAKENED = new ThresholdDefinition(
      "fpic_weakened", ThresholdCategory.GOVERNANCE_DECAY,
      "FPIC requirement removed or weakened",
      ALL_NETWORKS, 1, "event");

  public static final ThresholdDefinition WHISTLEBLOWER_PROTECTION_ELIMINATED = new ThresholdDefinition(
      "whistleblower_protection_eliminated", ThresholdCategory.GOVERNANCE_DECAY,
      "Whistleblower/transparency protection eliminated",
      ALL_NETWORKS, 1, "event");

  private static final List<ThresholdDefinition> ALL = List.of(
      DISPLACEMENT_BRIGHT_LINE,
      CONTAMINATION_BRIGHT_LINE,
      ARMED_CONFLICT_BRIGHT_LINE,
      REGULATORY_ROLLBACK_BRIGHT_LINE,
      DEFENDER_KILLINGS_BRIGHT_LINE,
      DISPLACEMENT_RATE_DOUBLING,
      DEFORESTATION_SIGMA,
      CONFLICT_FATALITIES_ACCELERATION,
      REGULATORY_ROLLBACK_CLUSTER,
      EMISSIONS_INEQUITY,
      CORPORATE_WATER_EXTRACTION,
      EJ_POLLUTION_EXPOSURE,
      TREATY_NONCOMPLIANCE,
      AGENCY_BUDGET_CUT,
      FPIC_WEAKENED,
      WHISTLEBLOWER_PROTECTION_ELIMINATED);

  private ThresholdCatalog() {}

  /**
   * Returns every threshold in catalog order (grouped by category).
   *
   * @return immutable ordered list
   */
  public static List<ThresholdDefinition> all() {
    return ALL;
  }

  /**
   * Returns thresholds of a single category in catalog order.
   *
   * @param category category filter
   * @return immutable list; empty when none match
   */
  public static List<ThresholdDefinition> byCategory(ThresholdCategory category) {
    Objects.requireNonNull(category, "category");
    return ALL.stream().filter(def -> def.category() == category).toList();
  }

  /**
   * Returns thresholds that apply to {@code network}.
   *
   * @param network network filter
   * @return immutable list in catalog order
   */
  public static List<ThresholdDefinition> forNetwork(MetabolicNetwork network) {
    Objects.requireNonNull(network, "network");
    return ALL.stream().filter(def -> def.appliesTo(network)).toList();
  }

  /**
   * Looks up a threshold by name.
   *
   * @param name threshold name
   * @return matching definition, if any
   */
  public static Optional<ThresholdDefinition> find(String name) {
    if (name == null) {
      return Optional.empty();
    }
    return ALL.stream().filter(def -> def.name().equals(name)).findFirst();
  }

  /**
   * Groups the catalog by category, preserving category declaration order and catalog order within a group.
   *
   * @return unmodifiable category map
   */
  public static Map<ThresholdCategory, List<ThresholdDefinition>> groupedByCategory() {
    Map<ThresholdCategory, List<ThresholdDefinition>> grouped = new EnumMap<>(ThresholdCategory.class);
    Arrays.stream(ThresholdCategory.values()).forEach(category -> grouped.put(category, new ArrayList<>()));
    for (ThresholdDefinition definition : ALL) {
      grouped.get(definition.category()).add(definition);
    }
    grouped.replaceAll((category, list) -> List.copyOf(list));
    return Collections.unmodifiableMap(grouped);
  }
}
