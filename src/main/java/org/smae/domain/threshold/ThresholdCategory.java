package org.smae.domain.threshold;

/**
 * Categories of analytical thresholds.
 *
 * @since 0.1.0
 */
public enum ThresholdCategory {
  /** Bright-line magnitude bounds. */
  ABSOLUTE("absolute"),
  /** Velocity bounds. */
  RATE_OF_CHANGE("rate_of_change"),
  /** Ratio and equity bounds. */
  RELATIONAL("relational"),
  /** Institutional decay bounds. */
  GOVERNANCE_DECAY("governance_decay");

  private final String key;

  ThresholdCategory(String key) {
    this.key = key;
  }

  /**
   * Returns the lowercase key used by reporting layers.
   *
   * @return category key
   */
  public String key() {
    return key;
  }
}
