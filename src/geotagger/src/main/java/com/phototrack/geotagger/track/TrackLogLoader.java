package com.phototrack.geotagger.track;

import com.phototrack.geotagger.config.GeotaggerProperties;
import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Loads a CSV track log with a header row.
 *
 * <p>Columns are located by header name; when the header cannot be resolved the loader falls back
 * to a fixed layout (time, -, lon, lat, alt) and says so in the log. Bad rows are skipped.
 */
@Component
public class TrackLogLoader {
  private static final Logger log = LoggerFactory.getLogger(TrackLogLoader.class);

  static final List<String> TIMESTAMP_ALIASES = List.of("timestamp", "time", "gpstime", "时间戳", "datatime");
  static final List<String> LATITUDE_ALIASES = List.of("latitude", "lat", "纬度");
  static final List<String> LONGITUDE_ALIASES = List.of("longitude", "lon", "long", "经度");
  static final List<String> ALTITUDE_ALIASES = List.of("altitude", "alt", "高度", "海拔");

  private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
  private static final Pattern EPOCH_PATTERN = Pattern.compile("^(\\d+\\.?\\d*|\\.\\d+)$");
  private static final char BOM = '\uFEFF';

  private final ZoneId zone;

  @Autowired
  public TrackLogLoader(GeotaggerProperties properties) {
    this(properties.trackZone());
  }

  public TrackLogLoader(ZoneId zone) {
    this.zone = zone;
  }

  record Columns(int timestamp, int latitude, int longitude, int altitude) {
    int required() {
      return Math.max(timestamp, Math.max(latitude, longitude));
    }
  }

  /**
   * Loads and sorts the track log.
   *
   * @param source CSV file
   * @return track log with at least one point
   * @throws TrackLogLoadException when the file is missing, unreadable, empty or has no usable rows
   */
  public TrackLog load(Path source) {
    log.info("Loading GPS track log {}", source);
    try (BufferedReader reader = Files.newBufferedReader(source, StandardCharsets.UTF_8)) {
      String headerLine = reader.readLine();
      if (headerLine == null) {
        throw new TrackLogLoadException("Track log " + source + " is empty");
      }
      if (!headerLine.isEmpty() && headerLine.charAt(0) == BOM) {
        headerLine = headerLine.substring(1);
      }
      List<String> header = splitRow(headerLine);
      Columns columns = resolveColumns(header);

      List<TrackPoint> points = new ArrayList<>();
      String line;
      int lineNumber = 1;
      while ((line = reader.readLine()) != null) {
        lineNumber++;
        TrackPoint point = parseRow(splitRow(line), columns, lineNumber);
        if (point != null) {
          points.add(point);
        }
      }

      if (points.isEmpty()) {
        throw new TrackLogLoadException("Track log " + source + " has no usable rows");
      }
      TrackLog trackLog = new TrackLog(points);
      log.info("Loaded and sorted {} GPS track points", trackLog.size());
      return trackLog;
    } catch (NoSuchFileException ex) {
      throw new TrackLogLoadException("Track log " + source + " not found", ex);
    } catch (IOException ex) {
      throw new TrackLogLoadException("Unable to read track log " + source, ex);
    }
  }

  static Columns resolveColumns(List<String> header) {
    List<String> normalized = new ArrayList<>(header.size());
    for (String name : header) {
      normalized.add(name.trim().toLowerCase(Locale.ROOT));
    }

    int timestamp = indexOfAny(normalized, TIMESTAMP_ALIASES);
    int latitude = indexOfAny(normalized, LATITUDE_ALIASES);
    int longitude = indexOfAny(normalized, LONGITUDE_ALIASES);
    int altitude = indexOfAny(normalized, ALTITUDE_ALIASES);

    Columns columns;
    if (timestamp == -1 || latitude == -1 || longitude == -1) {
      columns = new Columns(0, 3, 2, header.size() > 4 ? 4 : -1);
      log.warn(
          "Unable to identify track log columns from header {}, guessing timestamp=0, latitude=3, longitude=2. Check the result!",
          header);
    } else {
      columns = new Columns(timestamp, latitude, longitude, altitude);
    }
    log.info(
        "Track log columns: timestamp={}, latitude={}, longitude={}, altitude={}",
        columns.timestamp(),
        columns.latitude(),
        columns.longitude(),
        columns.altitude() == -1 ? "n/a" : columns.altitude());
    return columns;
  }

  TrackPoint parseRow(List<String> row, Columns columns, int lineNumber) {
    if (row.isEmpty() || (row.size() == 1 && row.get(0).isBlank()) || row.size() <= columns.required()) {
      log.warn("Skipping track log line {} (empty or too few columns): {}", lineNumber, row);
      return null;
    }
    try {
      LocalDateTime time = parseTimestamp(row.get(columns.timestamp()).trim());
      double lat = Double.parseDouble(row.get(columns.latitude()).trim());
      double lon = Double.parseDouble(row.get(columns.longitude()).trim());
      double alt = 0.0;
      int altIdx = columns.altitude();
      if (altIdx != -1 && altIdx < row.size() && !row.get(altIdx).isBlank()) {
        alt = Double.parseDouble(row.get(altIdx).trim());
      }
      if (!inRange(lat, 90.0) || !inRange(lon, 180.0) || !Double.isFinite(alt)) {
        log.warn("Skipping track log line {} (coordinates out of range): {}", lineNumber, row);
        return null;
      }
      return new TrackPoint(time, lat, lon, alt);
    } catch (NumberFormatException | DateTimeException | ArithmeticException ex) {
      log.warn("Skipping track log line {} {}: {}", lineNumber, row, ex.getMessage());
      return null;
    }
  }

  // Numeric cells are epoch seconds, shifted into the configured zone like the camera clock.
  LocalDateTime parseTimestamp(String value) {
    if (EPOCH_PATTERN.matcher(value).matches()) {
      double seconds = Double.parseDouble(value);
      long wholeSeconds = (long) Math.floor(seconds);
      long nanos = Math.round((seconds - wholeSeconds) * 1_000_000_000L);
      return LocalDateTime.ofInstant(Instant.ofEpochSecond(wholeSeconds, nanos), zone);
    }
    return LocalDateTime.parse(value, TIMESTAMP_FORMAT);
  }

  // NaN fails both comparisons.
  private static boolean inRange(double value, double limit) {
    return value >= -limit && value <= limit;
  }

  private static int indexOfAny(List<String> header, List<String> aliases) {
    for (String alias : aliases) {
      int idx = header.indexOf(alias);
      if (idx != -1) {
        return idx;
      }
    }
    return -1;
  }

  // Comma separated, with double quotes around cells that contain commas.
  static List<String> splitRow(String line) {
    List<String> cells = new ArrayList<>();
    StringBuilder cell = new StringBuilder();
    boolean quoted = false;
    for (int i = 0; i < line.length(); i++) {
      char c = line.charAt(i);
      if (c == '"') {
        if (quoted && i + 1 < line.length() && line.charAt(i + 1) == '"') {
          cell.append('"');
          i++;
        } else {
          quoted = !quoted;
        }
      } else if (c == ',' && !quoted) {
        cells.add(cell.toString());
        cell.setLength(0);
      } else {
        cell.append(c);
      }
    }
    cells.add(cell.toString());
    return cells;
  }
}
