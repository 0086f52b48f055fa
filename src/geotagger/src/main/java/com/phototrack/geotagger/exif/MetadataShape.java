package com.phototrack.geotagger.exif;

import java.util.Map;

/**
 * Raw EXIF content in one of the two layouts extractors hand back.
 *
 * <p>Resolved once into {@link ImageMetadata} by {@link MetadataNormalizer}; nothing downstream
 * of the reader sees a shape.
 */
public interface MetadataShape {

  /**
   * Tags grouped by IFD section name ({@code "0th"}, {@code "Exif"}, {@code "GPS"}, ...).
   *
   * @param sections section name to tag id/value map
   */
  record StructuredTree(Map<String, Map<Integer, Object>> sections) implements MetadataShape {
    public StructuredTree {
      sections = Map.copyOf(sections);
    }

    public Map<Integer, Object> section(String name) {
      return sections.getOrDefault(name, Map.of());
    }
  }

  /**
   * One tag id/value map, with the GPS tags nested as a map under {@link ExifTags#GPS_INFO}.
   *
   * @param tags tag id to value
   */
  record FlatTagMap(Map<Integer, Object> tags) implements MetadataShape {
    public FlatTagMap {
      tags = Map.copyOf(tags);
    }
  }
}
