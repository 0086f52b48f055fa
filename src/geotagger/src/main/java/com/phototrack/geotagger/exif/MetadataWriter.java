package com.phototrack.geotagger.exif;

import com.phototrack.geotagger.geo.CoordinateMath;
import com.phototrack.geotagger.geo.CoordinateMath.Axis;
import com.phototrack.geotagger.geo.DmsTriple;
import com.phototrack.geotagger.geo.GeoFix;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.LocalDateTime;
import java.util.ArrayList;
import org.apache.commons.imaging.ImageFormat;
import org.apache.commons.imaging.ImageFormats;
import org.apache.commons.imaging.ImageReadException;
import org.apache.commons.imaging.ImageWriteException;
import org.apache.commons.imaging.Imaging;
import org.apache.commons.imaging.common.RationalNumber;
import org.apache.commons.imaging.formats.jpeg.exif.ExifRewriter;
import org.apache.commons.imaging.formats.tiff.TiffImageMetadata;
import org.apache.commons.imaging.formats.tiff.constants.GpsTagConstants;
import org.apache.commons.imaging.formats.tiff.write.TiffImageWriterLossless;
import org.apache.commons.imaging.formats.tiff.write.TiffOutputDirectory;
import org.apache.commons.imaging.formats.tiff.write.TiffOutputField;
import org.apache.commons.imaging.formats.tiff.write.TiffOutputSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Replaces the GPS section of a JPEG or TIFF file.
 *
 * <p>The new file is written next to the original and moved over it, so a failure never leaves a
 * partially written image behind. Every other EXIF directory and the image data are kept as-is.
 */
@Component
public class MetadataWriter {
  private static final Logger log = LoggerFactory.getLogger(MetadataWriter.class);
  private static final byte ALTITUDE_ABOVE_SEA_LEVEL = 0;
  private static final int ALTITUDE_DENOMINATOR = 100;

  /**
   * Writes {@code fix} as the image's GPS section.
   *
   * <p>Does not check whether GPS tags already exist; callers decide whether overwriting is
   * allowed.
   *
   * @param path JPEG or TIFF file, rewritten in place
   * @param fix position to write; its capture time, when present, becomes the GPS date/time stamp
   * @throws MetadataWriteException when the container is unsupported or cannot be rewritten
   */
  public void writeGps(Path path, GeoFix fix) {
    ImageFormat format = detectFormat(path);
    if (format != ImageFormats.JPEG && format != ImageFormats.TIFF) {
      throw new MetadataWriteException(path, "unsupported container " + format, null);
    }

    Path temp = null;
    try {
      TiffOutputSet outputSet = loadOutputSet(path, format);
      replaceGpsDirectory(outputSet, fix);

      Path directory = path.toAbsolutePath().getParent();
      temp = Files.createTempFile(directory, "." + path.getFileName() + ".", ".tmp");
      try (OutputStream os = new BufferedOutputStream(Files.newOutputStream(temp))) {
        if (format == ImageFormats.JPEG) {
          new ExifRewriter().updateExifMetadataLossless(path.toFile(), os, outputSet);
        } else {
          new TiffImageWriterLossless(outputSet.byteOrder, Files.readAllBytes(path)).write(os, outputSet);
        }
      }
      copyPermissions(path, temp);
      replace(temp, path);
      temp = null;
      log.debug("Wrote GPS ({}, {}) to {}", fix.latitude(), fix.longitude(), path.getFileName());
    } catch (ImageReadException | ImageWriteException | IOException ex) {
      throw new MetadataWriteException(path, String.valueOf(ex.getMessage()), ex);
    } finally {
      deleteTemp(temp);
    }
  }

  /** Drops every existing GPS field and writes the fields derived from {@code fix}. */
  static void replaceGpsDirectory(TiffOutputSet outputSet, GeoFix fix) throws ImageWriteException {
    TiffOutputDirectory gps = outputSet.getOrCreateGPSDirectory();
    for (TiffOutputField field : new ArrayList<>(gps.getFields())) {
      gps.removeField(field.tag);
    }

    gps.add(GpsTagConstants.GPS_TAG_GPS_VERSION_ID, (byte) 2, (byte) 0, (byte) 0, (byte) 0);
    gps.add(
        GpsTagConstants.GPS_TAG_GPS_LATITUDE_REF,
        String.valueOf(CoordinateMath.referenceFor(fix.latitude(), Axis.LATITUDE)));
    gps.add(GpsTagConstants.GPS_TAG_GPS_LATITUDE, rationals(CoordinateMath.dmsFromDegrees(fix.latitude())));
    gps.add(
        GpsTagConstants.GPS_TAG_GPS_LONGITUDE_REF,
        String.valueOf(CoordinateMath.referenceFor(fix.longitude(), Axis.LONGITUDE)));
    gps.add(GpsTagConstants.GPS_TAG_GPS_LONGITUDE, rationals(CoordinateMath.dmsFromDegrees(fix.longitude())));
    gps.add(GpsTagConstants.GPS_TAG_GPS_ALTITUDE_REF, ALTITUDE_ABOVE_SEA_LEVEL);
    gps.add(
        GpsTagConstants.GPS_TAG_GPS_ALTITUDE,
        new RationalNumber((int) (Math.abs(fix.altitudeMeters()) * ALTITUDE_DENOMINATOR), ALTITUDE_DENOMINATOR));

    LocalDateTime capturedAt = fix.capturedAt();
    if (capturedAt != null) {
      gps.add(
          GpsTagConstants.GPS_TAG_GPS_TIME_STAMP,
          new RationalNumber(capturedAt.getHour(), 1),
          new RationalNumber(capturedAt.getMinute(), 1),
          new RationalNumber(capturedAt.getSecond(), 1));
      gps.add(GpsTagConstants.GPS_TAG_GPS_DATE_STAMP, capturedAt.format(MetadataNormalizer.EXIF_DATE));
    }
  }

  private static RationalNumber[] rationals(DmsTriple dms) {
    return new RationalNumber[] {
      new RationalNumber(dms.degrees(), 1),
      new RationalNumber(dms.minutes(), 1),
      new RationalNumber(dms.secondsNumerator(), DmsTriple.SECONDS_DENOMINATOR)
    };
  }

  private static ImageFormat detectFormat(Path path) {
    try {
      return Imaging.guessFormat(path.toFile());
    } catch (IOException ex) {
      throw new MetadataWriteException(path, "unable to identify container", ex);
    }
  }

  private static TiffOutputSet loadOutputSet(Path path, ImageFormat format)
      throws ImageReadException, ImageWriteException, IOException {
    TiffImageMetadata exif = TiffTreeExtractor.exifOf(Imaging.getMetadata(path.toFile()));
    if (exif != null) {
      TiffOutputSet outputSet = exif.getOutputSet();
      if (outputSet != null) {
        return outputSet;
      }
    }
    if (format == ImageFormats.TIFF) {
      throw new ImageReadException("TIFF container has no readable directories");
    }
    return new TiffOutputSet();
  }

  // Temp files are created owner-only; keep the original's mode where the filesystem has one.
  private static void copyPermissions(Path original, Path temp) {
    try {
      Files.setPosixFilePermissions(temp, Files.getPosixFilePermissions(original));
    } catch (UnsupportedOperationException | IOException ex) {
      log.debug("Unable to copy file permissions to {}", temp, ex);
    }
  }

  private static void replace(Path source, Path target) throws IOException {
    try {
      Files.move(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    } catch (AtomicMoveNotSupportedException ex) {
      log.debug("Atomic move not supported for {}, replacing directly", target);
      Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
    }
  }

  private static void deleteTemp(Path temp) {
    if (temp == null) {
      return;
    }
    try {
      Files.deleteIfExists(temp);
    } catch (IOException ex) {
      log.warn("Unable to delete temporary file {}", temp, ex);
    }
  }
}
