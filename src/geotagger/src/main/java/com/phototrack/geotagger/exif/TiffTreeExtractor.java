package com.phototrack.geotagger.exif;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.apache.commons.imaging.ImageReadException;
import org.apache.commons.imaging.Imaging;
import org.apache.commons.imaging.common.ImageMetadata;
import org.apache.commons.imaging.formats.jpeg.JpegImageMetadata;
import org.apache.commons.imaging.formats.tiff.TiffField;
import org.apache.commons.imaging.formats.tiff.TiffImageMetadata;
import org.apache.commons.imaging.formats.tiff.constants.TiffDirectoryConstants;

/** Reads EXIF through Commons Imaging and groups every field under its IFD section name. */
class TiffTreeExtractor {

  /**
   * Returns the structured tree, or empty when the container parses but carries no EXIF.
   *
   * @throws ImageReadException when the container or its TIFF directories are corrupt
   */
  Optional<MetadataShape.StructuredTree> extract(Path path) throws ImageReadException, IOException {
    TiffImageMetadata exif = exifOf(Imaging.getMetadata(path.toFile()));
    if (exif == null) {
      return Optional.empty();
    }

    Map<String, Map<Integer, Object>> sections = new LinkedHashMap<>();
    for (TiffField field : exif.getAllFields()) {
      Object value = field.getValue();
      if (value == null) {
        continue;
      }
      sections
          .computeIfAbsent(sectionName(field.getDirectoryType()), name -> new LinkedHashMap<>())
          .putIfAbsent(field.getTag(), value);
    }
    return Optional.of(new MetadataShape.StructuredTree(sections));
  }

  static TiffImageMetadata exifOf(ImageMetadata metadata) {
    if (metadata instanceof JpegImageMetadata) {
      return ((JpegImageMetadata) metadata).getExif();
    }
    if (metadata instanceof TiffImageMetadata) {
      return (TiffImageMetadata) metadata;
    }
    return null;
  }

  private static String sectionName(int directoryType) {
    return switch (directoryType) {
      case TiffDirectoryConstants.DIRECTORY_TYPE_ROOT -> ExifTags.SECTION_ROOT;
      case TiffDirectoryConstants.DIRECTORY_TYPE_EXIF -> ExifTags.SECTION_EXIF;
      case TiffDirectoryConstants.DIRECTORY_TYPE_GPS -> ExifTags.SECTION_GPS;
      case TiffDirectoryConstants.DIRECTORY_TYPE_INTEROPERABILITY -> ExifTags.SECTION_INTEROP;
      default -> "IFD" + directoryType;
    };
  }
}
