package com.phototrack.geotagger.config;

import java.time.Duration;
import java.time.ZoneId;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "geotagger")
public record GeotaggerProperties(
    int workers,
    Scan scan,
    Track track,
    Match match,
    Holding holding,
    Report report) {
  public static final Duration DEFAULT_TOLERANCE = Duration.ofSeconds(600);
  public static final String DEFAULT_HOLDING_DIRECTORY = "_nogps_";
  public static final List<String> DEFAULT_EXTENSIONS =
      List.of("jpg", "jpeg", "tif", "tiff", "hif", "heic");

  public record Scan(String folder, List<String> extensions) {}

  public record Track(String path, String zone) {}

  public record Match(Duration tolerance, boolean overwrite) {}

  public record Holding(boolean enabled, String directoryName) {}

  public record Report(boolean showCoordinates) {}

  public int effectiveWorkers() {
    return workers > 0 ? workers : Runtime.getRuntime().availableProcessors();
  }

  public Duration tolerance() {
    return match == null || match.tolerance() == null ? DEFAULT_TOLERANCE : match.tolerance();
  }

  public boolean overwrite() {
    return match != null && match.overwrite();
  }

  public boolean moveNoGps() {
    return holding != null && holding.enabled();
  }

  public String holdingDirectoryName() {
    if (holding == null || holding.directoryName() == null || holding.directoryName().isBlank()) {
      return DEFAULT_HOLDING_DIRECTORY;
    }
    return holding.directoryName();
  }

  public boolean showCoordinates() {
    return report != null && report.showCoordinates();
  }

  public List<String> extensions() {
    if (scan == null || scan.extensions() == null || scan.extensions().isEmpty()) {
      return DEFAULT_EXTENSIONS;
    }
    return scan.extensions();
  }

  // Epoch timestamps in the track log are shifted into this zone; blank means the host zone.
  public ZoneId trackZone() {
    if (track == null || track.zone() == null || track.zone().isBlank()) {
      return ZoneId.systemDefault();
    }
    return ZoneId.of(track.zone());
  }
}
