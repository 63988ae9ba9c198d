package org.smae.domain.threshold;

import java.util.List;
import java.util.Objects;
import org.smae.domain.ontology.MetabolicNetwork;
import org.smae.validation.Numbers;
import org.smae.validation.Strings;

/**
 * A fixed analytical threshold from the SMAE catalog.
 *
 * @param name stable threshold name (e.g., {@code displacement_single_event})
 * @param category threshold category
 * @param description human-readable rule
 * @param networks networks the threshold applies to; never empty
 * @param thresholdValue numeric bound
 * @param unit measurement unit
 * @since 0.1.0
 */
public record ThresholdDefinition(
    String name,
    ThresholdCategory category,
    String description,
    List<MetabolicNetwork> networks,
    double thresholdValue,
    String unit) {

  public ThresholdDefinition {
    name = Strings.requireNonBlank("name", name);
    category = Objects.requireNonNull(category, "category");
    description = Strings.requireNonBlank("description", description);
    networks = List.copyOf(Objects.requireNonNull(networks, "networks"));
    if (networks.isEmpty()) {
      throw new IllegalArgumentException("threshold " + name + " must apply to at least one network");
    }
    Numbers.requireFinite("thresholdValue", thresholdValue);
    unit = Strings.requireNonBlank("unit", unit);
  }

  /**
   * Returns whether the threshold applies to {@code network}.
   *
   * @param network network to test
   * @return {@code true} when listed
   */
  public boolean appliesTo(MetabolicNetwork network) {
    return networks.contains(network);
  }
}
