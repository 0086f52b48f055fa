package com.phototrack.geotagger.geo;

/**
 * Unsigned degree/minute/second value in the rational layout EXIF GPS tags use.
 *
 * @param degrees whole degrees, denominator 1
 * @param minutes whole minutes, denominator 1
 * @param secondsNumerator seconds scaled by {@link #SECONDS_DENOMINATOR}
 */
public record DmsTriple(int degrees, int minutes, int secondsNumerator) {
  public static final int SECONDS_DENOMINATOR = 10_000;

  /** Returns {@code {{d,1},{m,1},{s,10000}}}. */
  public long[][] asPairs() {
    return new long[][] {
      {degrees, 1},
      {minutes, 1},
      {secondsNumerator, SECONDS_DENOMINATOR}
    };
  }
}
