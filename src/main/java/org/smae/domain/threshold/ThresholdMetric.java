package org.smae.domain.threshold;

import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import org.smae.domain.ontology.MetabolicNetwork;
import org.smae.validation.Numbers;
import org.smae.validation.Strings;

/**
 * A single measured quantity using the baseline, delta, current, threshold comparison.
 *
 * @param name metric name, usually a {@link ThresholdDefinition#name()}
 * @param category threshold category
 * @param networks networks the metric applies to
 * @param baselineValue baseline reading
 * @param baselineDate date of the baseline reading
 * @param delta change since the baseline
 * @param currentValue live reading
 * @param thresholdValue threshold bound
 * @param unit measurement unit
 * @param status last computed status; recomputed by the threshold stage
 * @since 0.1.0
 */
public record ThresholdMetric(
    String name,
    ThresholdCategory category,
    List<MetabolicNetwork> networks,
    double baselineValue,
    LocalDate baselineDate,
    double delta,
    double currentValue,
    double thresholdValue,
    String unit,
    ThresholdStatus status) {

  public ThresholdMetric {
    name = Strings.requireNonBlank("name", name);
    category = Objects.requireNonNull(category, "category");
    networks = networks == null ? List.of() : List.copyOf(networks);
    Numbers.requireFinite("baselineValue", baselineValue);
    baselineDate = Objects.requireNonNull(baselineDate, "baselineDate");
    Numbers.requireFinite("delta", delta);
    Numbers.requireFinite("currentValue", currentValue);
    Numbers.requireFinite("thresholdValue", thresholdValue);
    unit = Strings.requireNonBlank("unit", unit);
    status = Objects.requireNonNullElse(status, ThresholdStatus.BELOW);
  }

  /**
   * Returns a copy carrying {@code newStatus}; returns {@code this} when the status is unchanged.
   *
   * @param newStatus status to apply
   * @return metric with the given status
   */
  public ThresholdMetric withStatus(ThresholdStatus newStatus) {
    Objects.requireNonNull(newStatus, "newStatus");
    if (newStatus == status) {
      return this;
    }
    return new ThresholdMetric(
        name, category, networks, baselineValue, baselineDate, delta, currentValue, thresholdValue, unit, newStatus);
  }

  /**
   * Returns the status implied by the live values, ignoring the stored {@link #status()}.
   *
   * @return derived status
   */
  public ThresholdStatus evaluatedStatus() {
    return ThresholdStatus.classify(currentValue, thresholdValue);
  }

  /**
   * Formats {@code Baseline unit (date) + Delta = Current <= Threshold [EXCEEDED]}.
   *
   * @return comparison line used in briefings
   */
  public String comparisonString() {
    String statusTag = status == ThresholdStatus.EXCEEDED ? " [" + status.name() + "]" : "";
    return String.format(Locale.ROOT, "%,.1f %s (%s) + %+,.1f = %,.1f <= %,.1f%s",
        baselineValue, unit, baselineDate, delta, currentValue, thresholdValue, statusTag);
  }
}
