package org.smae.domain.events;

/**
 * Triage classification for analytical products, ordered from least to most severe.
 *
 * @since 0.1.0
 */
public enum AlertLevel {
  /** Default level; nothing noteworthy yet. */
  WATCH,
  /** Approaching a threshold or touching two or more networks. */
  MONITOR,
  /** At least one threshold exceeded. */
  ALERT,
  /** Threshold exceeded on an event spanning three or more networks. */
  CRITICAL,
  /** Threshold exceeded on an event spanning four or more networks. */
  SYSTEMIC;

  /**
   * Returns whether this level is at least as severe as {@code other}.
   *
   * @param other level to compare against; must not be {@code null}
   * @return {@code true} when this level ranks at or above {@code other}
   */
  public boolean isAtLeast(AlertLevel other) {
    return compareTo(other) >= 0;
  }
}
