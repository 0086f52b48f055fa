package com.phototrack.geotagger.batch;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/** Sibling directory that receives images still lacking GPS after processing. */
public class HoldingDirectory {
  private final String name;

  public HoldingDirectory(String name) {
    this.name = name;
  }

  public String name() {
    return name;
  }

  public Path locationFor(Path file) {
    return file.toAbsolutePath().getParent().resolve(name);
  }

  /**
   * Moves {@code file} into the holding directory next to it, creating the directory on first use.
   *
   * @return new location of the file
   * @throws java.nio.file.FileAlreadyExistsException when a file of the same name is already held
   */
  public Path moveInto(Path file) throws IOException {
    Path directory = locationFor(file);
    // createDirectories tolerates a concurrent creator.
    Files.createDirectories(directory);
    return Files.move(file, directory.resolve(file.getFileName()));
  }
}
