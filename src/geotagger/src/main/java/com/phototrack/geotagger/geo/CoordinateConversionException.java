package com.phototrack.geotagger.geo;

/**
 * Raised when an EXIF degree/minute/second value cannot be turned into decimal degrees.
 *
 * <p>Always recoverable: callers log it and treat the coordinate as absent.
 */
public class CoordinateConversionException extends RuntimeException {
  public enum Reason {
    INCONSISTENT_FORMAT,
    DIVISION_BY_ZERO,
    UNRECOGNIZED_FORMAT
  }

  private final Reason reason;

  public CoordinateConversionException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
