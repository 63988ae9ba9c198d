package org.smae.domain.threshold;

/**
 * Whether a threshold metric has been crossed.
 *
 * @since 0.1.0
 */
public enum ThresholdStatus {
  BELOW,
  /** Within 20% of the threshold bound. */
  APPROACHING,
  EXCEEDED;

  private static final double APPROACHING_RATIO = 0.8d;

  /**
   * Classifies a live reading against its bound.
   *
   * <p>{@code EXCEEDED} when {@code current > threshold}, {@code APPROACHING} when
   * {@code current > 0.8 * threshold}, otherwise {@code BELOW}. Both comparisons are strict.</p>
   *
   * @param currentValue current reading
   * @param thresholdValue threshold bound
   * @return derived status
   */
  public static ThresholdStatus classify(double currentValue, double thresholdValue) {
    if (currentValue > thresholdValue) {
      return EXCEEDED;
    }
    if (currentValue > thresholdValue * APPROACHING_RATIO) {
      return APPROACHING;
    }
    return BELOW;
  }
}
