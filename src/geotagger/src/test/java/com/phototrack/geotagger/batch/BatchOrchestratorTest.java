package com.phototrack.geotagger.batch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.phototrack.geotagger.config.GeotaggerProperties;
import com.phototrack.geotagger.exif.ImageMetadata;
import com.phototrack.geotagger.exif.MetadataReader;
import com.phototrack.geotagger.exif.MetadataWriteException;
import com.phototrack.geotagger.exif.MetadataWriter;
import com.phototrack.geotagger.geo.GeoFix;
import com.phototrack.geotagger.support.TestImages;
import com.phototrack.geotagger.track.TrackLog;
import com.phototrack.geotagger.track.TrackPoint;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class BatchOrchestratorTest {
  private static final TrackLog TRACK = new TrackLog(List.of(
      new TrackPoint(LocalDateTime.of(2024, 5, 1, 10, 2, 0), 10.0, 20.0, 0.0)));

  @TempDir
  Path dir;

  private final MetadataReader reader = new MetadataReader();
  private final MetadataWriter writer = new MetadataWriter();

  private static GeotaggerProperties properties(int workers, boolean overwrite, boolean move, boolean showCoordinates) {
    return new GeotaggerProperties(
        workers,
        null,
        null,
        new GeotaggerProperties.Match(Duration.ofSeconds(300), overwrite),
        new GeotaggerProperties.Holding(move, null),
        new GeotaggerProperties.Report(showCoordinates));
  }

  private BatchOrchestrator orchestrator(GeotaggerProperties properties) {
    return new BatchOrchestrator(reader, writer, properties, new SimpleMeterRegistry());
  }

  @Test
  void backfillsMatchesAndMovesWhatStillLacksGps() throws Exception {
    Path a = TestImages.jpegWithExif(dir, "a.jpg", "2024:05:01 09:00:00", 1.0, 2.0);
    Path b = TestImages.jpegWithExif(dir, "b.jpg", "2024:05:01 10:00:00", null, null);
    Path c = TestImages.jpeg(dir, "c.jpg");
    byte[] aBefore = Files.readAllBytes(a);
    SimpleMeterRegistry registry = new SimpleMeterRegistry();
    BatchOrchestrator orchestrator =
        new BatchOrchestrator(reader, writer, properties(2, false, true, false), registry);

    BatchReport report = orchestrator.run(List.of(a, b, c), TRACK);

    assertEquals(new BatchSummary(3, 2, 1, 1, 1, 0), report.summary());
    assertThat(report.cancelled()).isFalse();
    assertThat(report.results()).extracting(ProcessingResult::statusLine)
        .containsExactly("a.jpg: has GPS", "b.jpg: has GPS", "c.jpg: [no capture time] -> moved");

    assertArrayEquals(aBefore, Files.readAllBytes(a));
    GeoFix added = reader.readStrict(b).gps();
    assertThat(added.latitude()).isCloseTo(10.0, within(1e-6));
    assertThat(added.longitude()).isCloseTo(20.0, within(1e-6));
    assertThat(Files.exists(c)).isFalse();
    assertThat(Files.exists(dir.resolve("_nogps_").resolve("c.jpg"))).isTrue();
    assertEquals(1.0, registry.counter("geotagger.gps.added").count());
    assertEquals(3.0, registry.counter("geotagger.files.processed").count());
  }

  @Test
  void secondRunLeavesTaggedFilesAlone() throws Exception {
    Path b = TestImages.jpegWithExif(dir, "b.jpg", "2024:05:01 10:00:00", null, null);
    orchestrator(properties(1, false, false, false)).run(List.of(b), TRACK);
    byte[] afterFirstRun = Files.readAllBytes(b);
    MetadataWriter untouchedWriter = mock(MetadataWriter.class);

    BatchOrchestrator second =
        new BatchOrchestrator(reader, untouchedWriter, properties(1, false, false, false), new SimpleMeterRegistry());
    ProcessingResult withoutTrack = second.run(List.of(b), null).results().get(0);
    ProcessingResult withTrack = second.run(List.of(b), TRACK).results().get(0);

    assertThat(withoutTrack.hasGps()).isTrue();
    assertThat(withoutTrack.gpsAdded()).isFalse();
    assertThat(withTrack.gpsAdded()).isFalse();
    verifyNoInteractions(untouchedWriter);
    assertArrayEquals(afterFirstRun, Files.readAllBytes(b));
  }

  @Test
  void unreadableFileDoesNotStopTheBatch() throws Exception {
    Path one = TestImages.jpegWithExif(dir, "1.jpg", "2024:05:01 10:00:00", 1.0, 1.0);
    Path two = TestImages.jpeg(dir, "2.jpg");
    Path broken = TestImages.garbage(dir, "3.jpg");
    Path four = TestImages.jpegWithExif(dir, "4.jpg", "2024:05:01 10:00:00", null, null);

    BatchReport report = orchestrator(properties(3, false, false, false)).run(List.of(one, two, broken, four), TRACK);

    assertEquals(4, report.results().size());
    assertThat(report.results()).filteredOn(ProcessingResult::readFailed)
        .extracting(ProcessingResult::filename)
        .containsExactly("3.jpg");
    assertThat(report.results()).extracting(ProcessingResult::statusLine)
        .containsExactly("1.jpg: has GPS", "2.jpg: [no capture time]", "3.jpg: [read failed]", "4.jpg: has GPS");
    assertEquals(new BatchSummary(4, 2, 2, 1, 0, 1), report.summary());
  }

  @Test
  void corruptExifIsIsolatedToItsFile() throws Exception {
    Path one = TestImages.jpegWithExif(dir, "1.jpg", "2024:05:01 10:00:00", 1.0, 1.0);
    Path two = TestImages.jpegWithExif(dir, "2.jpg", "2024:05:01 10:00:00", null, null);
    Path corrupt = TestImages.jpegWithCorruptExif(dir, "3.jpg");
    Path four = TestImages.jpeg(dir, "4.jpg");
    byte[] corruptBefore = Files.readAllBytes(corrupt);

    BatchReport report = orchestrator(properties(2, false, false, false)).run(List.of(one, two, corrupt, four), TRACK);

    assertThat(report.results()).filteredOn(ProcessingResult::readFailed)
        .extracting(ProcessingResult::filename)
        .containsExactly("3.jpg");
    assertThat(report.results()).extracting(ProcessingResult::statusLine)
        .containsExactly("1.jpg: has GPS", "2.jpg: has GPS", "3.jpg: [read failed]", "4.jpg: [no capture time]");
    assertEquals(new BatchSummary(4, 2, 2, 1, 0, 1), report.summary());
    assertArrayEquals(corruptBefore, Files.readAllBytes(corrupt));
  }

  @Test
  void reportsCaptureTimeWhenNothingMatches() throws Exception {
    Path b = TestImages.jpegWithExif(dir, "b.jpg", "2024:05:01 08:30:15", null, null);

    ProcessingResult result = orchestrator(properties(1, false, false, false)).run(List.of(b), TRACK).results().get(0);

    assertEquals("b.jpg: [no matching GPS (08:30:15)]", result.statusLine());
    assertThat(result.hasGps()).isFalse();
  }

  @Test
  void overwriteReplacesExistingGps() throws Exception {
    Path a = TestImages.jpegWithExif(dir, "a.jpg", "2024:05:01 10:00:00", 1.0, 2.0);

    ProcessingResult result =
        orchestrator(properties(1, true, false, true)).run(List.of(a), TRACK).results().get(0);

    assertThat(result.gpsAdded()).isTrue();
    assertEquals("a.jpg: has GPS (10.000000, 20.000000)", result.statusLine());
  }

  @Test
  void writeFailureIsReportedPerFile() throws Exception {
    Path b = TestImages.jpegWithExif(dir, "b.jpg", "2024:05:01 10:00:00", null, null);
    MetadataWriter failingWriter = mock(MetadataWriter.class);
    doThrow(new MetadataWriteException(b, "disk full", null)).when(failingWriter).writeGps(any(), any());
    BatchOrchestrator orchestrator =
        new BatchOrchestrator(reader, failingWriter, properties(1, false, true, false), new SimpleMeterRegistry());

    ProcessingResult result = orchestrator.run(List.of(b), TRACK).results().get(0);

    assertEquals("b.jpg: [add failed] -> moved", result.statusLine());
    assertThat(result.gpsAdded()).isFalse();
    assertThat(result.moved()).isTrue();
  }

  @Test
  void moveNeverOverwritesAHeldFile() throws Exception {
    Path c = TestImages.jpeg(dir, "c.jpg");
    Files.createDirectories(dir.resolve("_nogps_"));
    Files.writeString(dir.resolve("_nogps_").resolve("c.jpg"), "older copy");

    ProcessingResult result = orchestrator(properties(1, false, true, false)).run(List.of(c), null).results().get(0);

    assertEquals("c.jpg: no GPS -> move failed", result.statusLine());
    assertThat(result.moved()).isFalse();
    assertThat(Files.exists(c)).isTrue();
    assertEquals("older copy", Files.readString(dir.resolve("_nogps_").resolve("c.jpg")));
  }

  @Test
  void cancelStopsDispatchOfRemainingFiles() {
    MetadataReader slowReader = mock(MetadataReader.class);
    BatchOrchestrator orchestrator =
        new BatchOrchestrator(slowReader, writer, properties(1, false, false, false), new SimpleMeterRegistry());
    when(slowReader.readStrict(any())).thenAnswer(invocation -> {
      orchestrator.cancel();
      return ImageMetadata.empty();
    });

    BatchReport report = orchestrator.run(List.of(dir.resolve("1.jpg"), dir.resolve("2.jpg"), dir.resolve("3.jpg")), null);

    assertThat(report.cancelled()).isTrue();
    assertThat(report.results()).extracting(ProcessingResult::statusLine).containsExactly("1.jpg: no GPS");
    assertEquals(1, report.summary().total());
  }

  @Test
  void unexpectedFailureBecomesAResult() {
    MetadataReader explodingReader = mock(MetadataReader.class);
    when(explodingReader.readStrict(any())).thenThrow(new IllegalStateException("boom"));
    BatchOrchestrator orchestrator =
        new BatchOrchestrator(explodingReader, writer, properties(2, false, false, false), new SimpleMeterRegistry());

    BatchReport report = orchestrator.run(List.of(dir.resolve("x.jpg"), dir.resolve("y.jpg")), TRACK);

    assertThat(report.results()).extracting(ProcessingResult::statusLine)
        .containsExactly("x.jpg: [error: boom]", "y.jpg: [error: boom]");
    assertEquals(new BatchSummary(2, 0, 2, 0, 0, 0), report.summary());
  }

  @Test
  void errorThrownByADecoderStaysWithItsFile() {
    MetadataReader recursingReader = mock(MetadataReader.class);
    Path deep = dir.resolve("deep.jpg");
    Path fine = dir.resolve("fine.jpg");
    when(recursingReader.readStrict(deep)).thenThrow(new StackOverflowError());
    when(recursingReader.readStrict(fine)).thenReturn(ImageMetadata.empty());
    SimpleMeterRegistry registry = new SimpleMeterRegistry();
    BatchOrchestrator orchestrator =
        new BatchOrchestrator(recursingReader, writer, properties(2, false, false, false), registry);

    BatchReport report = orchestrator.run(List.of(deep, fine), null);

    assertThat(report.cancelled()).isFalse();
    assertThat(report.results()).extracting(ProcessingResult::statusLine)
        .containsExactly("deep.jpg: [error: StackOverflowError]", "fine.jpg: no GPS");
    assertEquals(new BatchSummary(2, 0, 2, 0, 0, 0), report.summary());
    assertEquals(1.0, registry.counter("geotagger.errors").count());
  }

  @Test
  void checkedExceptionFromAWorkerBecomesAResult() {
    MetadataReader sneakyReader = mock(MetadataReader.class);
    when(sneakyReader.readStrict(any())).thenAnswer(invocation -> {
      throw new IOException("device gone");
    });
    BatchOrchestrator orchestrator =
        new BatchOrchestrator(sneakyReader, writer, properties(1, false, false, false), new SimpleMeterRegistry());

    BatchReport report = orchestrator.run(List.of(dir.resolve("z.jpg")), TRACK);

    assertThat(report.results()).extracting(ProcessingResult::statusLine).containsExactly("z.jpg: [error: device gone]");
  }
}
