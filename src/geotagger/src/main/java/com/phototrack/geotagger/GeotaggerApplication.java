package com.phototrack.geotagger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Spring Boot entrypoint for the geotagger.
 *
 * <p>On startup the {@link GeotagRunJob} scans the configured folder, backfills missing GPS tags
 * from the optional track log and logs a per-file report.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class GeotaggerApplication {
  public static void main(String[] args) {
    SpringApplication.run(GeotaggerApplication.class, args);
  }
}
