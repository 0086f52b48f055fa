package com.phototrack.geotagger.batch;

/**
 * Outcome of one file's pipeline.
 *
 * @param filename file name without directory
 * @param hasGps classification after any write
 * @param gpsAdded a fix from the track log was written
 * @param moved the file now lives in the holding directory
 * @param readFailed the initial metadata read failed
 * @param note human readable status
 */
public record ProcessingResult(
    String filename,
    boolean hasGps,
    boolean gpsAdded,
    boolean moved,
    boolean readFailed,
    String note) {

  public String statusLine() {
    return filename + ": " + note;
  }
}
