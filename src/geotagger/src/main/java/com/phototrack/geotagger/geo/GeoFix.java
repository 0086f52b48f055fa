package com.phototrack.geotagger.geo;

import java.time.LocalDateTime;

/**
 * A single geographic position sample.
 *
 * @param latitude decimal degrees, south negative
 * @param longitude decimal degrees, west negative
 * @param altitudeMeters altitude in meters, 0 when unknown
 * @param capturedAt naive local time of the sample, {@code null} when unknown
 */
public record GeoFix(double latitude, double longitude, double altitudeMeters, LocalDateTime capturedAt) {
  public GeoFix {
    if (Double.isNaN(latitude) || latitude < -90.0 || latitude > 90.0) {
      throw new IllegalArgumentException("latitude must be within [-90,90]: " + latitude);
    }
    if (Double.isNaN(longitude) || longitude < -180.0 || longitude > 180.0) {
      throw new IllegalArgumentException("longitude must be within [-180,180]: " + longitude);
    }
  }

  public GeoFix(double latitude, double longitude) {
    this(latitude, longitude, 0.0, null);
  }

  public boolean hasCaptureTime() {
    return capturedAt != null;
  }
}
