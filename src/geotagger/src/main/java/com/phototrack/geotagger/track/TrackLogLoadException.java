package com.phototrack.geotagger.track;

/** The track log could not be loaded; matching is disabled for the run. */
public class TrackLogLoadException extends RuntimeException {
  public TrackLogLoadException(String message) {
    super(message);
  }

  public TrackLogLoadException(String message, Throwable cause) {
    super(message, cause);
  }
}
