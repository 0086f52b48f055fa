package com.phototrack.geotagger;

import org.springframework.boot.ExitCodeGenerator;

/** A run cannot start; the process exits with {@link #getExitCode()}. */
public class PreflightException extends RuntimeException implements ExitCodeGenerator {
  public static final int INVALID_FOLDER = 2;
  public static final int TRACK_LOG_MISSING = 3;

  private final int exitCode;

  public PreflightException(int exitCode, String message) {
    super(message);
    this.exitCode = exitCode;
  }

  @Override
  public int getExitCode() {
    return exitCode;
  }
}
