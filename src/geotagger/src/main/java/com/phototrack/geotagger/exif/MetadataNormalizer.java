package com.phototrack.geotagger.exif;

import com.phototrack.geotagger.geo.CoordinateConversionException;
import com.phototrack.geotagger.geo.CoordinateMath;
import com.phototrack.geotagger.geo.CoordinateMath.Axis;
import com.phototrack.geotagger.geo.GeoFix;
import java.nio.charset.StandardCharsets;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves a {@link MetadataShape} into the canonical {@link ImageMetadata}.
 *
 * <p>A GPS fix is only reported when latitude, latitude reference, longitude and longitude
 * reference are all present. Partial GPS sections count as no GPS.
 */
public final class MetadataNormalizer {
  private static final Logger log = LoggerFactory.getLogger(MetadataNormalizer.class);

  public static final DateTimeFormatter EXIF_DATE_TIME = DateTimeFormatter.ofPattern("yyyy:MM:dd HH:mm:ss");
  public static final DateTimeFormatter EXIF_DATE = DateTimeFormatter.ofPattern("yyyy:MM:dd");

  private MetadataNormalizer() {}

  /**
   * Normalizes either metadata shape.
   *
   * @param shape structured tree or flat tag map
   * @param source file name used in log messages
   * @return normalized metadata, never {@code null}
   */
  public static ImageMetadata normalize(MetadataShape shape, String source) {
    Map<Integer, Object> gpsTags;
    Object captureTime;
    if (shape instanceof MetadataShape.StructuredTree) {
      MetadataShape.StructuredTree tree = (MetadataShape.StructuredTree) shape;
      gpsTags = tree.section(ExifTags.SECTION_GPS);
      captureTime = firstPresent(
          tree.section(ExifTags.SECTION_EXIF).get(ExifTags.DATE_TIME_ORIGINAL),
          tree.section(ExifTags.SECTION_ROOT).get(ExifTags.DATE_TIME));
    } else if (shape instanceof MetadataShape.FlatTagMap) {
      Map<Integer, Object> tags = ((MetadataShape.FlatTagMap) shape).tags();
      gpsTags = nestedTags(tags.get(ExifTags.GPS_INFO));
      captureTime = firstPresent(tags.get(ExifTags.DATE_TIME_ORIGINAL), tags.get(ExifTags.DATE_TIME));
    } else {
      throw new IllegalArgumentException("Unsupported metadata shape: " + shape);
    }

    return new ImageMetadata(toFix(gpsTags, source), parseCaptureTime(captureTime, source));
  }

  static GeoFix toFix(Map<Integer, Object> gps, String source) {
    Object latitude = gps.get(ExifTags.GPS_LATITUDE);
    Object latitudeRef = gps.get(ExifTags.GPS_LATITUDE_REF);
    Object longitude = gps.get(ExifTags.GPS_LONGITUDE);
    Object longitudeRef = gps.get(ExifTags.GPS_LONGITUDE_REF);
    if (latitude == null
        || longitude == null
        || CoordinateMath.decodeReference(latitudeRef) == null
        || CoordinateMath.decodeReference(longitudeRef) == null) {
      if (!gps.isEmpty()) {
        log.debug("GPS section of {} lacks latitude/longitude or their references", source);
      }
      return null;
    }

    try {
      double lat = CoordinateMath.applyReference(
          CoordinateMath.degreesFromDms(latitude), latitudeRef, Axis.LATITUDE);
      double lon = CoordinateMath.applyReference(
          CoordinateMath.degreesFromDms(longitude), longitudeRef, Axis.LONGITUDE);
      return new GeoFix(lat, lon, altitude(gps), gpsTimestamp(gps));
    } catch (CoordinateConversionException ex) {
      log.warn("Unable to convert GPS coordinates of {} ({}): {}", source, ex.reason(), ex.getMessage());
      return null;
    } catch (IllegalArgumentException ex) {
      log.warn("GPS coordinates of {} are out of range: {}", source, ex.getMessage());
      return null;
    }
  }

  static LocalDateTime parseCaptureTime(Object raw, String source) {
    String text = text(raw);
    if (text == null) {
      return null;
    }
    try {
      return LocalDateTime.parse(text, EXIF_DATE_TIME);
    } catch (DateTimeParseException ex) {
      log.warn("Unable to parse capture time '{}' of {}", text, source);
      return null;
    }
  }

  private static double altitude(Map<Integer, Object> gps) {
    Object raw = gps.get(ExifTags.GPS_ALTITUDE);
    if (raw == null) {
      return 0.0;
    }
    Double value = ratioValue(raw);
    if (value == null) {
      return 0.0;
    }
    Double ref = ratioValue(gps.get(ExifTags.GPS_ALTITUDE_REF));
    return ref != null && ref.intValue() == 1 ? -Math.abs(value) : value;
  }

  // GPSDateStamp + GPSTimeStamp, both in the camera's wall clock as written by this tool.
  private static LocalDateTime gpsTimestamp(Map<Integer, Object> gps) {
    String date = text(gps.get(ExifTags.GPS_DATE_STAMP));
    Object time = gps.get(ExifTags.GPS_TIME_STAMP);
    List<Object> parts = elementsOf(time);
    if (date == null || parts == null || parts.size() != 3) {
      return null;
    }
    try {
      Double hours = ratioValue(parts.get(0));
      Double minutes = ratioValue(parts.get(1));
      Double seconds = ratioValue(parts.get(2));
      if (hours == null || minutes == null || seconds == null) {
        return null;
      }
      LocalTime clock = LocalTime.of(hours.intValue(), minutes.intValue(), seconds.intValue());
      return LocalDate.parse(date, EXIF_DATE).atTime(clock);
    } catch (DateTimeException ex) {
      log.debug("Ignoring malformed GPS date/time stamp {} {}", date, time);
      return null;
    }
  }

  private static Double ratioValue(Object raw) {
    if (raw == null) {
      return null;
    }
    if (raw instanceof Number) {
      double value = ((Number) raw).doubleValue();
      return Double.isFinite(value) ? value : null;
    }
    if (raw instanceof byte[]) {
      byte[] bytes = (byte[]) raw;
      return bytes.length == 0 ? null : (double) (bytes[0] & 0xFF);
    }
    List<Object> parts = elementsOf(raw);
    if (parts != null && parts.size() == 1) {
      return ratioValue(parts.get(0));
    }
    if (parts != null && parts.size() == 2 && parts.get(0) instanceof Number && parts.get(1) instanceof Number) {
      double denominator = ((Number) parts.get(1)).doubleValue();
      return denominator == 0.0 ? null : ((Number) parts.get(0)).doubleValue() / denominator;
    }
    return null;
  }

  private static List<Object> elementsOf(Object raw) {
    if (raw instanceof List) {
      return new ArrayList<>((List<?>) raw);
    }
    if (raw instanceof Object[]) {
      return Arrays.asList((Object[]) raw);
    }
    List<Object> elements = new ArrayList<>();
    if (raw instanceof long[]) {
      for (long element : (long[]) raw) {
        elements.add(element);
      }
    } else if (raw instanceof int[]) {
      for (int element : (int[]) raw) {
        elements.add(element);
      }
    } else if (raw instanceof short[]) {
      for (short element : (short[]) raw) {
        elements.add(element);
      }
    } else if (raw instanceof double[]) {
      for (double element : (double[]) raw) {
        elements.add(element);
      }
    } else {
      return null;
    }
    return elements;
  }

  private static String text(Object raw) {
    String text;
    if (raw == null) {
      return null;
    } else if (raw instanceof byte[]) {
      text = new String((byte[]) raw, StandardCharsets.US_ASCII);
    } else if (raw instanceof String[]) {
      String[] values = (String[]) raw;
      text = values.length == 0 ? null : values[0];
    } else {
      text = raw.toString();
    }
    if (text == null) {
      return null;
    }
    String cleaned = text.replace("\0", "").trim();
    return cleaned.isEmpty() ? null : cleaned;
  }

  private static Object firstPresent(Object primary, Object fallback) {
    return text(primary) != null ? primary : fallback;
  }

  private static Map<Integer, Object> nestedTags(Object raw) {
    if (!(raw instanceof Map)) {
      return Map.of();
    }
    Map<Integer, Object> tags = new HashMap<>();
    for (Map.Entry<?, ?> entry : ((Map<?, ?>) raw).entrySet()) {
      if (entry.getKey() instanceof Integer && entry.getValue() != null) {
        tags.put((Integer) entry.getKey(), entry.getValue());
      }
    }
    return tags;
  }
}
