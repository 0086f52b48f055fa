package com.phototrack.geotagger.batch;

import com.phototrack.geotagger.config.GeotaggerProperties;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/** Lists the supported images directly inside a folder; subdirectories are not descended. */
@Component
public class ImageFileScanner {
  private final Set<String> extensions;

  @Autowired
  public ImageFileScanner(GeotaggerProperties properties) {
    this(properties.extensions());
  }

  ImageFileScanner(List<String> extensions) {
    this.extensions = extensions.stream()
        .map(ext -> ext.startsWith(".") ? ext.substring(1) : ext)
        .map(ext -> ext.toLowerCase(Locale.ROOT))
        .collect(Collectors.toSet());
  }

  public List<Path> scan(Path folder) throws IOException {
    try (Stream<Path> entries = Files.list(folder)) {
      return entries
          .filter(Files::isRegularFile)
          .filter(this::isSupported)
          .sorted(Comparator.comparing(path -> path.getFileName().toString()))
          .collect(Collectors.toList());
    }
  }

  boolean isSupported(Path path) {
    String name = path.getFileName().toString();
    int dot = name.lastIndexOf('.');
    if (dot < 0 || dot == name.length() - 1) {
      return false;
    }
    return extensions.contains(name.substring(dot + 1).toLowerCase(Locale.ROOT));
  }
}
