package org.smae.domain.threshold;

import java.time.Instant;
import java.util.Objects;
import org.smae.domain.events.AlertLevel;

/**
 * A detected threshold crossing owned by an event.
 *
 * @param metric measured metric
 * @param detectedAt detection timestamp
 * @param alertLevel alert level recorded by the reporting source
 * @param notes free-text notes; never {@code null}
 * @since 0.1.0
 */
public record ThresholdCrossing(
    ThresholdMetric metric,
    Instant detectedAt,
    AlertLevel alertLevel,
    String notes) {

  public ThresholdCrossing {
    metric = Objects.requireNonNull(metric, "metric");
    detectedAt = Objects.requireNonNull(detectedAt, "detectedAt");
    alertLevel = Objects.requireNonNull(alertLevel, "alertLevel");
    notes = notes == null ? "" : notes;
  }

  /**
   * Returns a copy with the supplied metric.
   *
   * @param newMetric replacement metric
   * @return crossing carrying {@code newMetric}; {@code this} when identical
   */
  public ThresholdCrossing withMetric(ThresholdMetric newMetric) {
    Objects.requireNonNull(newMetric, "newMetric");
    if (newMetric.equals(metric)) {
      return this;
    }
    return new ThresholdCrossing(newMetric, detectedAt, alertLevel, notes);
  }

  /**
   * Convenience accessor for the metric status.
   *
   * @return current metric status
   */
  public ThresholdStatus status() {
    return metric.status();
  }
}
