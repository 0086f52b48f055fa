package com.phototrack.geotagger.batch;

import java.util.Collection;

public record BatchSummary(int total, int withGps, int withoutGps, int added, int moved, int readFailed) {

  public static BatchSummary of(Collection<ProcessingResult> results) {
    int withGps = 0;
    int added = 0;
    int moved = 0;
    int readFailed = 0;
    for (ProcessingResult result : results) {
      if (result.hasGps()) {
        withGps++;
      }
      if (result.gpsAdded()) {
        added++;
      }
      if (result.moved()) {
        moved++;
      }
      if (result.readFailed()) {
        readFailed++;
      }
    }
    return new BatchSummary(results.size(), withGps, results.size() - withGps, added, moved, readFailed);
  }
}
