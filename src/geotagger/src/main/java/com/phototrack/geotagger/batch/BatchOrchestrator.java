package com.phototrack.geotagger.batch;

import com.phototrack.geotagger.config.GeotaggerProperties;
import com.phototrack.geotagger.exif.ImageMetadata;
import com.phototrack.geotagger.exif.MetadataReadException;
import com.phototrack.geotagger.exif.MetadataReader;
import com.phototrack.geotagger.exif.MetadataWriteException;
import com.phototrack.geotagger.exif.MetadataWriter;
import com.phototrack.geotagger.geo.GeoFix;
import com.phototrack.geotagger.track.TrackLog;
import com.phototrack.geotagger.track.TrackPoint;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.io.IOException;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Runs the per-file geotagging pipeline over a batch of images.
 *
 * <p>Each file goes through read, optional match and write, re-read, classification and an
 * optional move into the holding directory. Files run concurrently on a fixed pool and share only
 * the immutable {@link TrackLog}; every failure is turned into a {@link ProcessingResult}.
 */
@Component
public class BatchOrchestrator {
  private static final Logger log = LoggerFactory.getLogger(BatchOrchestrator.class);
  private static final DateTimeFormatter CLOCK_TIME = DateTimeFormatter.ofPattern("HH:mm:ss");

  private final MetadataReader reader;
  private final MetadataWriter writer;
  private final GeotaggerProperties properties;
  private final HoldingDirectory holdingDirectory;
  private final Counter processedCounter;
  private final Counter addedCounter;
  private final Counter movedCounter;
  private final Counter errorCounter;
  private final Timer fileTimer;
  private final AtomicBoolean cancelRequested = new AtomicBoolean(false);

  public BatchOrchestrator(
      MetadataReader reader,
      MetadataWriter writer,
      GeotaggerProperties properties,
      MeterRegistry meterRegistry) {
    this.reader = reader;
    this.writer = writer;
    this.properties = properties;
    this.holdingDirectory = new HoldingDirectory(properties.holdingDirectoryName());
    this.processedCounter = meterRegistry.counter("geotagger.files.processed");
    this.addedCounter = meterRegistry.counter("geotagger.gps.added");
    this.movedCounter = meterRegistry.counter("geotagger.files.moved");
    this.errorCounter = meterRegistry.counter("geotagger.errors");
    this.fileTimer = meterRegistry.timer("geotagger.file.duration");
  }

  private record IndexedResult(int index, ProcessingResult result) {}

  /**
   * Processes {@code files} and waits for all started files to finish.
   *
   * @param files images to process; the report keeps this order
   * @param trackLog source of fixes, or {@code null} to only check and move
   * @return per-file results and summary
   */
  public BatchReport run(List<Path> files, TrackLog trackLog) {
    cancelRequested.set(false);
    if (files.isEmpty()) {
      return new BatchReport(List.of(), BatchSummary.of(List.of()), false);
    }

    int workers = Math.min(properties.effectiveWorkers(), files.size());
    AtomicInteger threadIndex = new AtomicInteger();
    ExecutorService executor = Executors.newFixedThreadPool(workers, runnable -> {
      Thread thread = new Thread(runnable, "geotagger-worker-" + threadIndex.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    });
    log.info("Processing {} files with {} workers", files.size(), workers);

    List<IndexedResult> collected = new ArrayList<>(files.size());
    try {
      CompletionService<IndexedResult> completion = new ExecutorCompletionService<>(executor);
      Map<Future<IndexedResult>, Integer> submitted = new HashMap<>();
      for (int i = 0; i < files.size(); i++) {
        int index = i;
        Path file = files.get(i);
        Future<IndexedResult> future = completion.submit(
            () -> cancelRequested.get() ? null : new IndexedResult(index, processSafely(file, trackLog)));
        submitted.put(future, index);
      }

      for (int i = 0; i < files.size(); i++) {
        Future<IndexedResult> future = completion.take();
        try {
          IndexedResult indexed = future.get();
          if (indexed != null) {
            collected.add(indexed);
          }
        } catch (ExecutionException ex) {
          int index = submitted.get(future);
          Path file = files.get(index);
          errorCounter.increment();
          log.error("Worker failed processing {}", file.getFileName(), ex.getCause());
          collected.add(new IndexedResult(index, failureResult(file, ex.getCause())));
        }
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      cancelRequested.set(true);
      log.warn("Batch interrupted after {} of {} files", collected.size(), files.size());
    } finally {
      executor.shutdownNow();
    }

    List<ProcessingResult> results = collected.stream()
        .sorted(Comparator.comparingInt(IndexedResult::index))
        .map(IndexedResult::result)
        .collect(Collectors.toList());
    boolean cancelled = cancelRequested.get() && results.size() < files.size();
    if (cancelled) {
      log.warn("Batch cancelled, {} of {} files processed", results.size(), files.size());
    }
    return new BatchReport(results, BatchSummary.of(results), cancelled);
  }

  /** Stops dispatch of files that have not started; files in progress still finish. */
  public void cancel() {
    log.info("Cancellation requested");
    cancelRequested.set(true);
  }

  ProcessingResult processSafely(Path file, TrackLog trackLog) {
    Timer.Sample sample = Timer.start();
    try {
      return process(file, trackLog);
    } catch (Exception | StackOverflowError ex) {
      errorCounter.increment();
      log.error("Unexpected failure processing {}", file.getFileName(), ex);
      return failureResult(file, ex);
    } finally {
      sample.stop(fileTimer);
      processedCounter.increment();
    }
  }

  private static ProcessingResult failureResult(Path file, Throwable cause) {
    String reason = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    return new ProcessingResult(String.valueOf(file.getFileName()), false, false, false, false, "[error: " + reason + "]");
  }

  ProcessingResult process(Path file, TrackLog trackLog) {
    String filename = file.getFileName().toString();
    StringBuilder note = new StringBuilder();

    ImageMetadata metadata;
    boolean readFailed = false;
    try {
      metadata = reader.readStrict(file);
    } catch (MetadataReadException ex) {
      errorCounter.increment();
      log.error("Failed to read metadata from {}", filename, ex);
      metadata = ImageMetadata.empty();
      readFailed = true;
      note.append("[read failed]");
    }

    boolean hasGps = metadata.hasGps();
    boolean added = false;
    if (!readFailed && trackLog != null && (!hasGps || properties.overwrite())) {
      LocalDateTime captureTime = metadata.originalCaptureTime();
      if (captureTime == null) {
        if (!hasGps) {
          note.append("[no capture time]");
        }
      } else {
        Optional<TrackPoint> match = trackLog.findNearest(captureTime, properties.tolerance());
        if (match.isPresent()) {
          try {
            writer.writeGps(file, match.get().toFix());
            added = true;
            addedCounter.increment();
            // Classify from what is on disk now, not from the fix just written.
            metadata = reader.read(file);
            hasGps = metadata.hasGps();
          } catch (MetadataWriteException ex) {
            errorCounter.increment();
            log.warn("Failed to add GPS to {}: {}", filename, ex.getMessage());
            note.append("[add failed]");
          }
        } else if (!hasGps) {
          note.append("[no matching GPS (").append(captureTime.format(CLOCK_TIME)).append(")]");
        }
      }
    }

    boolean moved = false;
    if (hasGps) {
      appendWord(note, "has GPS");
      if (properties.showCoordinates()) {
        GeoFix gps = metadata.gps();
        note.append(String.format(Locale.ROOT, " (%.6f, %.6f)", gps.latitude(), gps.longitude()));
      }
    } else {
      if (note.length() == 0) {
        note.append("no GPS");
      }
      if (properties.moveNoGps()) {
        try {
          holdingDirectory.moveInto(file);
          moved = true;
          movedCounter.increment();
          note.append(" -> moved");
        } catch (IOException ex) {
          errorCounter.increment();
          log.error("Failed to move {} into {}", filename, holdingDirectory.name(), ex);
          note.append(" -> move failed");
        }
      }
    }

    return new ProcessingResult(filename, hasGps, added, moved, readFailed, note.toString());
  }

  private static void appendWord(StringBuilder note, String word) {
    if (note.length() > 0) {
      note.append(' ');
    }
    note.append(word);
  }
}
