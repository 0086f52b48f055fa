package com.phototrack.geotagger.exif;

import com.drew.imaging.ImageMetadataReader;
import com.drew.imaging.ImageProcessingException;
import com.drew.metadata.Directory;
import com.drew.metadata.ErrorDirectory;
import com.drew.metadata.Metadata;
import com.drew.metadata.Tag;
import com.drew.metadata.exif.ExifIFD0Directory;
import com.drew.metadata.exif.ExifSubIFDDirectory;
import com.drew.metadata.exif.GpsDirectory;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads EXIF through metadata-extractor into a single tag map.
 *
 * <p>IFD0 and SubIFD tags share the map; the GPS directory is nested under the GPSInfo tag id.
 * Used when Commons Imaging cannot parse the container (HEIF for example).
 */
class FlatTagExtractor {

  MetadataShape.FlatTagMap extract(Path path) throws ImageProcessingException, IOException {
    Metadata metadata = ImageMetadataReader.readMetadata(path.toFile());
    List<String> errors = exifErrors(metadata);
    if (!errors.isEmpty()) {
      throw new ImageProcessingException("Malformed EXIF in " + path.getFileName() + ": " + errors);
    }

    Map<Integer, Object> tags = new HashMap<>();
    copyTags(metadata.getDirectoriesOfType(ExifIFD0Directory.class), tags);
    copyTags(metadata.getDirectoriesOfType(ExifSubIFDDirectory.class), tags);

    GpsDirectory gps = metadata.getFirstDirectoryOfType(GpsDirectory.class);
    if (gps != null) {
      Map<Integer, Object> gpsTags = new HashMap<>();
      copyTags(List.of(gps), gpsTags);
      tags.put(ExifTags.GPS_INFO, gpsTags);
    }
    return new MetadataShape.FlatTagMap(tags);
  }

  // Damage in the EXIF blob is recorded on its directories instead of thrown.
  private static List<String> exifErrors(Metadata metadata) {
    List<String> errors = new ArrayList<>();
    for (Directory directory : metadata.getDirectories()) {
      boolean exifRelated = directory instanceof ExifIFD0Directory
          || directory instanceof ExifSubIFDDirectory
          || directory instanceof GpsDirectory
          || directory instanceof ErrorDirectory;
      if (exifRelated && directory.hasErrors()) {
        for (String error : directory.getErrors()) {
          errors.add(directory.getName() + ": " + error);
        }
      }
    }
    return errors;
  }

  private static void copyTags(Collection<? extends Directory> directories, Map<Integer, Object> target) {
    for (Directory directory : directories) {
      for (Tag tag : directory.getTags()) {
        Object value = directory.getObject(tag.getTagType());
        if (value != null) {
          target.putIfAbsent(tag.getTagType(), value);
        }
      }
    }
  }
}
