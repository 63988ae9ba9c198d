package org.smae.domain.ontology;

/**
 * The eight metabolic networks through which every event is analyzed.
 *
 * <p>Each network carries a stable ordinal index (1-based), a Roman numeral used in briefings, and a display
 * label. The index, not {@link #ordinal()}, is the published identifier.</p>
 *
 * @since 0.1.0
 */
public enum MetabolicNetwork {
  CARBON(1, "I", "Carbon Accumulation"),
  WATER(2, "II", "Water Appropriation"),
  SOIL(3, "III", "Soil Fertility Transfer"),
  MINERAL(4, "IV", "Mineral Extraction"),
  ATMOSPHERIC(5, "V", "Atmospheric Commons Degradation"),
  BIODIVERSITY(6, "VI", "Biodiversity & Genetic Commons"),
  OCEAN(7, "VII", "Ocean & Marine Appropriation"),
  LABOR(8, "VIII", "Labor & Embodied Health");

  private final int index;
  private final String roman;
  private final String label;

  MetabolicNetwork(int index, String roman, String label) {
    this.index = index;
    this.roman = roman;
    this.label = label;
  }

  /**
   * Returns the published 1-based network index.
   *
   * @return index in {@code [1, 8]}
   */
  public int index() {
    return index;
  }

  /**
   * Returns the Roman numeral label (e.g., {@code IV}).
   *
   * @return Roman numeral
   */
  public String roman() {
    return roman;
  }

  /**
   * Returns the human-readable network name.
   *
   * @return display label
   */
  public String label() {
    return label;
  }

  /**
   * Resolves a network from its published index.
   *
   * @param index 1-based index
   * @return matching network
   * @throws IllegalArgumentException when no network carries the index
   */
  public static MetabolicNetwork fromIndex(int index) {
    for (MetabolicNetwork network : values()) {
      if (network.index == index) {
        return network;
      }
    }
    throw new IllegalArgumentException("Unknown metabolic network index: " + index);
  }
}
