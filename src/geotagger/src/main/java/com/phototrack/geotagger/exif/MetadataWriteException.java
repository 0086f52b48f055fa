package com.phototrack.geotagger.exif;

import java.nio.file.Path;

/** Writing GPS tags failed; the original file is left as it was. */
public class MetadataWriteException extends RuntimeException {
  private final Path path;

  public MetadataWriteException(Path path, String message, Throwable cause) {
    super("Unable to write GPS metadata to " + path + ": " + message, cause);
    this.path = path;
  }

  public Path path() {
    return path;
  }
}
