package com.phototrack.geotagger.track;

import com.phototrack.geotagger.geo.GeoFix;
import java.time.LocalDateTime;

/**
 * One row of the track log.
 *
 * @param time naive local time of the fix
 * @param lat latitude in decimal degrees
 * @param lon longitude in decimal degrees
 * @param alt altitude in meters, 0 when the log has none
 */
public record TrackPoint(LocalDateTime time, double lat, double lon, double alt) {
  public GeoFix toFix() {
    return new GeoFix(lat, lon, alt, time);
  }
}
