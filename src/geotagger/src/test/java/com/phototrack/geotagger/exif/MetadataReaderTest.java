package com.phototrack.geotagger.exif;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.drew.imaging.ImageProcessingException;
import com.phototrack.geotagger.support.TestImages;
import java.nio.file.Path;
import java.time.LocalDateTime;
import org.apache.commons.imaging.ImageReadException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MetadataReaderTest {
  @TempDir
  Path dir;

  private final MetadataReader reader = new MetadataReader();

  @Test
  void readsGpsAndCaptureTimeFromJpeg() throws Exception {
    Path image = TestImages.jpegWithExif(dir, "a.jpg", "2024:05:01 10:00:00", -33.8568, 151.2153);

    ImageMetadata metadata = reader.read(image);

    assertThat(metadata.hasGps()).isTrue();
    assertThat(metadata.gps().latitude()).isCloseTo(-33.8568, within(1e-5));
    assertThat(metadata.gps().longitude()).isCloseTo(151.2153, within(1e-5));
    assertEquals(LocalDateTime.of(2024, 5, 1, 10, 0, 0), metadata.originalCaptureTime());
  }

  @Test
  void prefersStructuredTreeWhenExifIsPresent() throws Exception {
    Path image = TestImages.jpegWithExif(dir, "a.jpg", "2024:05:01 10:00:00", 10.0, 20.0);

    MetadataShape shape = reader.readShape(image);

    assertThat(shape).isInstanceOf(MetadataShape.StructuredTree.class);
    assertThat(((MetadataShape.StructuredTree) shape).section(ExifTags.SECTION_GPS))
        .containsKeys(ExifTags.GPS_LATITUDE, ExifTags.GPS_LONGITUDE);
  }

  @Test
  void fallsBackToFlatTagsWhenStructuredReadFails() throws Exception {
    Path image = TestImages.jpegWithExif(dir, "a.jpg", "2024:05:01 10:00:00", 10.0, 20.0);
    TiffTreeExtractor failing = mock(TiffTreeExtractor.class);
    when(failing.extract(any(Path.class))).thenThrow(new ImageReadException("corrupt IFD"));
    MetadataReader fallbackReader = new MetadataReader(failing, new FlatTagExtractor());

    MetadataShape shape = fallbackReader.readShape(image);

    assertThat(shape).isInstanceOf(MetadataShape.FlatTagMap.class);
    ImageMetadata viaFlat = fallbackReader.readStrict(image);
    ImageMetadata viaTree = reader.readStrict(image);
    assertThat(viaFlat.gps().latitude()).isCloseTo(viaTree.gps().latitude(), within(1e-9));
    assertThat(viaFlat.gps().longitude()).isCloseTo(viaTree.gps().longitude(), within(1e-9));
    assertEquals(viaTree.originalCaptureTime(), viaFlat.originalCaptureTime());
  }

  @Test
  void jpegWithoutExifHasNoGpsAndNoCaptureTime() throws Exception {
    Path image = TestImages.jpeg(dir, "plain.jpg");

    ImageMetadata metadata = reader.readStrict(image);

    assertThat(metadata.hasGps()).isFalse();
    assertThat(metadata.hasCaptureTime()).isFalse();
  }

  @Test
  void unreadableFileDegradesToEmptyMetadata() throws Exception {
    Path broken = TestImages.garbage(dir, "broken.jpg");

    assertEquals(ImageMetadata.empty(), reader.read(broken));
    MetadataReadException ex = assertThrows(MetadataReadException.class, () -> reader.readStrict(broken));
    assertEquals(broken, ex.path());
  }

  @Test
  void corruptExifBlobFailsBothParsers() throws Exception {
    Path corrupt = TestImages.jpegWithCorruptExif(dir, "corrupt.jpg");

    assertThrows(ImageProcessingException.class, () -> new FlatTagExtractor().extract(corrupt));
    MetadataReadException ex = assertThrows(MetadataReadException.class, () -> reader.readStrict(corrupt));
    assertEquals(corrupt, ex.path());
    assertEquals(ImageMetadata.empty(), reader.read(corrupt));
  }
}
