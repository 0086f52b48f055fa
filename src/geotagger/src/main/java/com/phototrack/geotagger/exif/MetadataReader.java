package com.phototrack.geotagger.exif;

import com.drew.imaging.ImageProcessingException;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;
import org.apache.commons.imaging.ImageReadException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Extracts {@link ImageMetadata} from an image file.
 *
 * <p>The structured tree from Commons Imaging is tried first; the flat tag map from
 * metadata-extractor is the fallback. Both shapes normalize to the same result.
 */
@Component
public class MetadataReader {
  private static final Logger log = LoggerFactory.getLogger(MetadataReader.class);

  private final TiffTreeExtractor structuredExtractor;
  private final FlatTagExtractor flatExtractor;

  public MetadataReader() {
    this(new TiffTreeExtractor(), new FlatTagExtractor());
  }

  MetadataReader(TiffTreeExtractor structuredExtractor, FlatTagExtractor flatExtractor) {
    this.structuredExtractor = structuredExtractor;
    this.flatExtractor = flatExtractor;
  }

  /**
   * Reads metadata, degrading to {@link ImageMetadata#empty()} on any read failure.
   *
   * @param path image file
   * @return normalized metadata, never {@code null}
   */
  public ImageMetadata read(Path path) {
    try {
      return readStrict(path);
    } catch (MetadataReadException ex) {
      log.error("Failed to read metadata from {}", path.getFileName(), ex);
      return ImageMetadata.empty();
    }
  }

  /**
   * Reads metadata and reports unreadable files.
   *
   * @throws MetadataReadException when neither extractor can decode the file
   */
  public ImageMetadata readStrict(Path path) {
    return MetadataNormalizer.normalize(readShape(path), String.valueOf(path.getFileName()));
  }

  /**
   * Returns the raw metadata shape, structured tree first.
   *
   * @throws MetadataReadException when neither extractor can decode the file
   */
  public MetadataShape readShape(Path path) {
    Exception structuredFailure = null;
    try {
      Optional<MetadataShape.StructuredTree> tree = structuredExtractor.extract(path);
      if (tree.isPresent()) {
        return tree.get();
      }
    } catch (ImageReadException | IOException | RuntimeException ex) {
      structuredFailure = ex;
      log.debug("Structured EXIF read failed for {}, falling back to flat tags", path.getFileName(), ex);
    }

    try {
      return flatExtractor.extract(path);
    } catch (ImageProcessingException | IOException | RuntimeException ex) {
      MetadataReadException failure = new MetadataReadException(path, ex);
      if (structuredFailure != null) {
        failure.addSuppressed(structuredFailure);
      }
      throw failure;
    }
  }
}
