package org.smae.domain.source;

/**
 * Source hierarchy in strict priority order; rank 1 is the most authoritative.
 *
 * @since 0.1.0
 */
public enum SourceTier {
  FRONTLINE_EJ(1),
  INDIGENOUS_MONITORING(2),
  UN_OPERATIONAL(3),
  SPECIALIZED_RESEARCH(4),
  ACADEMIC_PEER_REVIEWED(5),
  INVESTIGATIVE_MEDIA(6),
  GOVERNMENT_REGULATORY(7);

  private final int rank;

  SourceTier(int rank) {
    this.rank = rank;
  }

  public int rank() {
    return rank;
  }

  /**
   * Returns whether this tier ranks at or above (numerically at or below) {@code other}.
   *
   * @param other tier to compare against
   * @return {@code true} when this tier is at least as authoritative as {@code other}
   */
  public boolean isAtLeast(SourceTier other) {
    return rank <= other.rank;
  }
}
