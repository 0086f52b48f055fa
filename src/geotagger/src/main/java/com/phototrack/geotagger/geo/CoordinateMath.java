package com.phototrack.geotagger.geo;

import com.drew.lang.Rational;
import com.phototrack.geotagger.geo.CoordinateConversionException.Reason;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import org.apache.commons.imaging.common.RationalNumber;

/**
 * Conversions between EXIF degree/minute/second values and decimal degrees.
 *
 * <p>Producers disagree on how a DMS triple is represented in memory. Three element shapes are
 * accepted, as long as all three elements share one shape:
 * <ul>
 *   <li>numerator/denominator pairs ({@code long[]}, {@code int[]} or a two-element list)</li>
 *   <li>plain numbers</li>
 *   <li>ratio objects ({@link RationalNumber} from Commons Imaging, {@link Rational} from
 *       metadata-extractor)</li>
 * </ul>
 */
public final class CoordinateMath {
  public enum Axis {
    LATITUDE,
    LONGITUDE
  }

  private enum Shape {
    PAIR,
    PLAIN,
    RATIO,
    UNKNOWN
  }

  private CoordinateMath() {}

  /**
   * Converts a DMS triple into unsigned decimal degrees ({@code d + m/60 + s/3600}).
   *
   * @param triple three-element array or list
   * @return decimal degrees
   * @throws CoordinateConversionException when the triple is malformed
   */
  public static double degreesFromDms(Object triple) {
    List<Object> elements = elementsOf(triple);
    if (elements == null || elements.size() != 3) {
      throw new CoordinateConversionException(
          Reason.UNRECOGNIZED_FORMAT, "DMS value is not a three-element sequence: " + describe(triple));
    }

    Shape shape = shapeOf(elements.get(0));
    if (shape == Shape.UNKNOWN) {
      throw new CoordinateConversionException(
          Reason.UNRECOGNIZED_FORMAT, "Unknown DMS element shape: " + describe(triple));
    }
    for (int i = 1; i < 3; i++) {
      if (shapeOf(elements.get(i)) != shape) {
        throw new CoordinateConversionException(
            Reason.INCONSISTENT_FORMAT, "DMS elements mix shapes: " + describe(triple));
      }
    }

    double d = valueOf(elements.get(0), shape);
    double m = valueOf(elements.get(1), shape);
    double s = valueOf(elements.get(2), shape);
    return d + (m / 60.0) + (s / 3600.0);
  }

  /**
   * Splits decimal degrees into an unsigned DMS triple with seconds kept to 1/10000.
   *
   * <p>The sign is dropped; carry it separately through {@link #referenceFor(double, Axis)}.
   */
  public static DmsTriple dmsFromDegrees(double decimalDegrees) {
    double value = Math.abs(decimalDegrees);
    int degrees = (int) value;
    double minutesFloat = (value - degrees) * 60.0;
    int minutes = (int) minutesFloat;
    double secondsFloat = (minutesFloat - minutes) * 60.0;
    return new DmsTriple(degrees, minutes, (int) (secondsFloat * DmsTriple.SECONDS_DENOMINATOR));
  }

  /**
   * Applies a hemisphere reference to an unsigned magnitude. "S" negates a latitude, "W"
   * negates a longitude.
   *
   * @param magnitude unsigned decimal degrees
   * @param reference {@link String}, {@link Character} or ASCII {@code byte[]}
   * @param axis which axis the reference belongs to
   */
  public static double applyReference(double magnitude, Object reference, Axis axis) {
    String ref = decodeReference(reference);
    String negative = axis == Axis.LATITUDE ? "S" : "W";
    return negative.equals(ref) ? -Math.abs(magnitude) : Math.abs(magnitude);
  }

  /** Returns N/S for latitudes and E/W for longitudes. */
  public static char referenceFor(double decimalDegrees, Axis axis) {
    if (axis == Axis.LATITUDE) {
      return decimalDegrees >= 0 ? 'N' : 'S';
    }
    return decimalDegrees >= 0 ? 'E' : 'W';
  }

  /**
   * Decodes a hemisphere reference that may arrive as text or as raw bytes.
   *
   * @return upper-case reference with NUL padding and whitespace removed, or {@code null}
   */
  public static String decodeReference(Object reference) {
    String text;
    if (reference == null) {
      return null;
    } else if (reference instanceof byte[]) {
      text = new String((byte[]) reference, StandardCharsets.US_ASCII);
    } else if (reference instanceof String[]) {
      String[] values = (String[]) reference;
      text = values.length == 0 ? "" : values[0];
    } else {
      text = reference.toString();
    }
    String cleaned = text.replace("\0", "").trim().toUpperCase(Locale.ROOT);
    return cleaned.isEmpty() ? null : cleaned;
  }

  // Arrays as returned by Commons Imaging and metadata-extractor.
  private static List<Object> elementsOf(Object value) {
    if (value instanceof List) {
      return new ArrayList<>((List<?>) value);
    }
    if (value instanceof Object[]) {
      return new ArrayList<>(Arrays.asList((Object[]) value));
    }
    List<Object> elements = new ArrayList<>();
    if (value instanceof long[]) {
      for (long element : (long[]) value) {
        elements.add(element);
      }
    } else if (value instanceof int[]) {
      for (int element : (int[]) value) {
        elements.add(element);
      }
    } else if (value instanceof short[]) {
      for (short element : (short[]) value) {
        elements.add(element);
      }
    } else if (value instanceof double[]) {
      for (double element : (double[]) value) {
        elements.add(element);
      }
    } else if (value instanceof float[]) {
      for (float element : (float[]) value) {
        elements.add(element);
      }
    } else {
      return null;
    }
    return elements;
  }

  private static Shape shapeOf(Object element) {
    if (element instanceof RationalNumber || element instanceof Rational) {
      return Shape.RATIO;
    }
    if (element instanceof Number) {
      return Shape.PLAIN;
    }
    List<Object> pair = elementsOf(element);
    if (pair != null && pair.size() == 2 && pair.get(0) instanceof Number && pair.get(1) instanceof Number) {
      return Shape.PAIR;
    }
    return Shape.UNKNOWN;
  }

  private static double valueOf(Object element, Shape shape) {
    return switch (shape) {
      case PLAIN -> ((Number) element).doubleValue();
      case PAIR -> {
        List<Object> pair = elementsOf(element);
        yield divide(((Number) pair.get(0)).doubleValue(), ((Number) pair.get(1)).doubleValue());
      }
      case RATIO -> {
        if (element instanceof RationalNumber) {
          RationalNumber rational = (RationalNumber) element;
          yield divide(rational.numerator, rational.divisor);
        }
        Rational rational = (Rational) element;
        yield divide(rational.getNumerator(), rational.getDenominator());
      }
      default -> throw new CoordinateConversionException(
          Reason.UNRECOGNIZED_FORMAT, "Unknown DMS element: " + describe(element));
    };
  }

  private static double divide(double numerator, double denominator) {
    if (denominator == 0.0) {
      throw new CoordinateConversionException(
          Reason.DIVISION_BY_ZERO, "DMS rational has a zero denominator: " + numerator + "/0");
    }
    return numerator / denominator;
  }

  private static String describe(Object value) {
    if (value == null) {
      return "null";
    }
    List<Object> elements = value instanceof List ? null : elementsOf(value);
    if (elements != null) {
      List<String> rendered = new ArrayList<>();
      for (Object element : elements) {
        rendered.add(describe(element));
      }
      return rendered.toString();
    }
    return value.toString();
  }
}
