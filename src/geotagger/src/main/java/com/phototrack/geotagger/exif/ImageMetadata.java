package com.phototrack.geotagger.exif;

import com.phototrack.geotagger.geo.GeoFix;
import java.time.LocalDateTime;

/**
 * Normalized view of one image's metadata, independent of the tag dialect it was read from.
 *
 * @param gps complete GPS fix, {@code null} when the image carries none
 * @param originalCaptureTime naive local capture time, {@code null} when absent or unparsable
 */
public record ImageMetadata(GeoFix gps, LocalDateTime originalCaptureTime) {
  private static final ImageMetadata EMPTY = new ImageMetadata(null, null);

  public static ImageMetadata empty() {
    return EMPTY;
  }

  public boolean hasGps() {
    return gps != null;
  }

  public boolean hasCaptureTime() {
    return originalCaptureTime != null;
  }
}
