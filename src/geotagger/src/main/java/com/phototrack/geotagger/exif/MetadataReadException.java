package com.phototrack.geotagger.exif;

import java.nio.file.Path;

/** The image container could not be opened or its metadata blob could not be decoded. */
public class MetadataReadException extends RuntimeException {
  private final Path path;

  public MetadataReadException(Path path, Throwable cause) {
    super("Unable to read metadata from " + path + ": " + cause.getMessage(), cause);
    this.path = path;
  }

  public Path path() {
    return path;
  }
}
