package com.phototrack.geotagger.batch;

import java.util.List;

/**
 * Results of one batch run in input order.
 *
 * <p>When {@code cancelled} is set, files that were never started are absent from {@code results}.
 */
public record BatchReport(List<ProcessingResult> results, BatchSummary summary, boolean cancelled) {
  public BatchReport {
    results = List.copyOf(results);
  }
}
