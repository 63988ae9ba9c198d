package org.smae.domain.threshold;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.smae.domain.ontology.MetabolicNetwork;

class ThresholdMetricTest {

  @Test
  void classifyUsesStrictComparisons() {
    assertEquals(ThresholdStatus.EXCEEDED, ThresholdStatus.classify(100_001, 100_000));
    assertEquals(ThresholdStatus.APPROACHING, ThresholdStatus.classify(100_000, 100_000));
    assertEquals(ThresholdStatus.APPROACHING, ThresholdStatus.classify(80_001, 100_000));
    assertEquals(ThresholdStatus.BELOW, ThresholdStatus.classify(80_000, 100_000));
    assertEquals(ThresholdStatus.BELOW, ThresholdStatus.classify(0, 100_000));
  }

  @Test
  void withStatusIsIdempotent() {
    ThresholdMetric metric = metric(120_000, null);
    ThresholdMetric evaluated = metric.withStatus(metric.evaluatedStatus());

    assertEquals(ThresholdStatus.EXCEEDED, evaluated.status());
    assertSame(evaluated, evaluated.withStatus(evaluated.evaluatedStatus()));
  }

  @Test
  void nullStatusDefaultsToBelow() {
    assertEquals(ThresholdStatus.BELOW, metric(1, null).status());
  }

  @Test
  void comparisonStringTagsExceeded() {
    ThresholdMetric metric = metric(120_000, ThresholdStatus.EXCEEDED);

    assertEquals(
        "40,000.0 persons (2024-01-01) + +80,000.0 = 120,000.0 <= 100,000.0 [EXCEEDED]",
        metric.comparisonString());
  }

  @Test
  void comparisonStringOmitsTagWhenNotExceeded() {
    ThresholdMetric metric = metric(90_000, ThresholdStatus.APPROACHING);

    assertEquals(
        "40,000.0 persons (2024-01-01) + +50,000.0 = 90,000.0 <= 100,000.0",
        metric.comparisonString());
  }

  @Test
  void rejectsNonFiniteReadings() {
    assertThrows(IllegalArgumentException.class, () -> metric(Double.NaN, null));
  }

  private static ThresholdMetric metric(double current, ThresholdStatus status) {
    return new ThresholdMetric(
        "displacement_single_event",
        ThresholdCategory.ABSOLUTE,
        List.of(MetabolicNetwork.CARBON),
        40_000,
        LocalDate.of(2024, 1, 1),
        current - 40_000,
        current,
        100_000,
        "persons",
        status);
  }
}
