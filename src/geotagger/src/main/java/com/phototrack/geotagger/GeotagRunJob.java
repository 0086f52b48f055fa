package com.phototrack.geotagger;

import com.phototrack.geotagger.batch.BatchOrchestrator;
import com.phototrack.geotagger.batch.BatchReport;
import com.phototrack.geotagger.batch.BatchSummary;
import com.phototrack.geotagger.batch.ImageFileScanner;
import com.phototrack.geotagger.batch.ProcessingResult;
import com.phototrack.geotagger.config.GeotaggerProperties;
import com.phototrack.geotagger.track.TrackLog;
import com.phototrack.geotagger.track.TrackLogLoadException;
import com.phototrack.geotagger.track.TrackLogLoader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * One-shot run over the configured folder.
 *
 * <p>The first non-option argument overrides {@code geotagger.scan.folder}. An unusable folder or
 * a configured track log that does not exist aborts the run before any file is touched; a track
 * log that exists but cannot be parsed only disables matching.
 */
@Component
@ConditionalOnProperty(
    prefix = "geotagger.runner",
    name = "enabled",
    havingValue = "true",
    matchIfMissing = true)
public class GeotagRunJob implements ApplicationRunner {
  private static final Logger log = LoggerFactory.getLogger(GeotagRunJob.class);
  private static final DateTimeFormatter REPORT_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

  private final GeotaggerProperties properties;
  private final ImageFileScanner scanner;
  private final TrackLogLoader trackLogLoader;
  private final BatchOrchestrator orchestrator;
  private final Clock clock;

  public GeotagRunJob(
      GeotaggerProperties properties,
      ImageFileScanner scanner,
      TrackLogLoader trackLogLoader,
      BatchOrchestrator orchestrator,
      Clock clock) {
    this.properties = properties;
    this.scanner = scanner;
    this.trackLogLoader = trackLogLoader;
    this.orchestrator = orchestrator;
    this.clock = clock;
  }

  @Override
  public void run(ApplicationArguments args) throws Exception {
    Path folder = resolveFolder(args);
    Path trackPath = resolveTrackPath();
    execute(folder, trackPath);
  }

  BatchReport execute(Path folder, Path trackPath) throws IOException {
    log.info("Scanning folder {}", folder);
    TrackLog trackLog = null;
    if (trackPath != null) {
      try {
        trackLog = trackLogLoader.load(trackPath);
      } catch (TrackLogLoadException ex) {
        log.warn("Unable to load GPS data ({}), only checking and moving files", ex.getMessage());
      }
    }

    List<Path> files = scanner.scan(folder);
    if (files.isEmpty()) {
      log.info("No supported images found in {}", folder);
      return new BatchReport(List.of(), BatchSummary.of(List.of()), false);
    }
    log.info("Found {} images", files.size());
    if (properties.moveNoGps()) {
      log.info("Images without GPS will be moved to {}", folder.resolve(properties.holdingDirectoryName()));
    }

    BatchReport report = orchestrator.run(files, trackLog);
    logReport(folder, report, trackLog != null);
    return report;
  }

  private void logReport(Path folder, BatchReport report, boolean matching) {
    log.info("Report - {}", LocalDateTime.now(clock).format(REPORT_TIME));
    log.info("Folder: {}", folder);
    for (ProcessingResult result : report.results()) {
      log.info("{}", result.statusLine());
    }
    BatchSummary summary = report.summary();
    log.info("Total images:     {}", summary.total());
    log.info("With GPS:         {}", summary.withGps());
    log.info("Without GPS:      {}", summary.withoutGps());
    if (matching) {
      log.info("GPS added:        {}", summary.added());
    }
    if (properties.moveNoGps()) {
      log.info("Moved:            {}", summary.moved());
    }
    if (summary.readFailed() > 0) {
      log.warn("Unreadable files: {}", summary.readFailed());
    }
    if (report.cancelled()) {
      log.warn("Run was cancelled before all files were processed");
    }
  }

  private Path resolveFolder(ApplicationArguments args) {
    String folder = args.getNonOptionArgs().isEmpty()
        ? (properties.scan() == null ? null : properties.scan().folder())
        : args.getNonOptionArgs().get(0);
    if (folder == null || folder.isBlank()) {
      throw new PreflightException(PreflightException.INVALID_FOLDER, "No folder to scan configured");
    }
    Path path = Path.of(folder);
    if (!Files.isDirectory(path)) {
      throw new PreflightException(PreflightException.INVALID_FOLDER, "Folder " + path + " is not a directory");
    }
    return path;
  }

  private Path resolveTrackPath() {
    if (properties.track() == null || properties.track().path() == null || properties.track().path().isBlank()) {
      return null;
    }
    Path path = Path.of(properties.track().path());
    if (!Files.isRegularFile(path)) {
      throw new PreflightException(PreflightException.TRACK_LOG_MISSING, "GPS track log " + path + " not found");
    }
    return path;
  }
}
