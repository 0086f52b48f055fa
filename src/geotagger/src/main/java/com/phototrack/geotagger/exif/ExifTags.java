package com.phototrack.geotagger.exif;

/** Section names and tag ids shared by both metadata shapes. */
public final class ExifTags {
  public static final String SECTION_ROOT = "0th";
  public static final String SECTION_EXIF = "Exif";
  public static final String SECTION_GPS = "GPS";
  public static final String SECTION_INTEROP = "Interop";

  public static final int DATE_TIME = 0x0132;
  public static final int DATE_TIME_ORIGINAL = 0x9003;
  public static final int GPS_INFO = 0x8825;

  public static final int GPS_LATITUDE_REF = 0x0001;
  public static final int GPS_LATITUDE = 0x0002;
  public static final int GPS_LONGITUDE_REF = 0x0003;
  public static final int GPS_LONGITUDE = 0x0004;
  public static final int GPS_ALTITUDE_REF = 0x0005;
  public static final int GPS_ALTITUDE = 0x0006;
  public static final int GPS_TIME_STAMP = 0x0007;
  public static final int GPS_DATE_STAMP = 0x001d;

  private ExifTags() {}
}
