package org.smae.domain.events;

/**
 * Latitude/longitude pair in decimal degrees.
 *
 * @param latitude latitude in {@code [-90, 90]}
 * @param longitude longitude in {@code [-180, 180]}
 * @since 0.1.0
 */
public record GeoPoint(double latitude, double longitude) {

  public GeoPoint {
    if (Double.isNaN(latitude) || latitude < -90d || latitude > 90d) {
      throw new IllegalArgumentException("latitude must be within [-90,90] (was " + latitude + ')');
    }
    if (Double.isNaN(longitude) || longitude < -180d || longitude > 180d) {
      throw new IllegalArgumentException("longitude must be within [-180,180] (was " + longitude + ')');
    }
  }
}
