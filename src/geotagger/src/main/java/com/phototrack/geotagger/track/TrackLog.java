package com.phototrack.geotagger.track;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Time-ordered GPS fixes with nearest-timestamp lookup.
 *
 * <p>Immutable after construction and safe to share between worker threads. Points with equal
 * timestamps are all kept, in load order.
 */
public final class TrackLog {
  private final List<TrackPoint> points;
  private final LocalDateTime[] times;

  public TrackLog(List<TrackPoint> points) {
    List<TrackPoint> sorted = new ArrayList<>(points);
    // List.sort is stable.
    sorted.sort(Comparator.comparing(TrackPoint::time));
    this.points = Collections.unmodifiableList(sorted);
    this.times = new LocalDateTime[sorted.size()];
    for (int i = 0; i < sorted.size(); i++) {
      times[i] = sorted.get(i).time();
    }
  }

  public List<TrackPoint> points() {
    return points;
  }

  public int size() {
    return points.size();
  }

  public boolean isEmpty() {
    return points.isEmpty();
  }

  /**
   * Finds the fix closest in time to {@code target}.
   *
   * <p>Only the neighbours on either side of the insertion point are compared, which keeps the
   * lookup O(log n). When both are equally far the earlier one is returned.
   *
   * @param target capture time to match
   * @param maxTolerance largest accepted distance, inclusive
   * @return the closer neighbour when within tolerance
   */
  public Optional<TrackPoint> findNearest(LocalDateTime target, Duration maxTolerance) {
    if (target == null || points.isEmpty()) {
      return Optional.empty();
    }

    int idx = lowerBound(target);
    TrackPoint closest = null;
    Duration closestDiff = null;
    if (idx > 0) {
      closest = points.get(idx - 1);
      closestDiff = Duration.between(closest.time(), target).abs();
    }
    if (idx < points.size()) {
      TrackPoint candidate = points.get(idx);
      Duration diff = Duration.between(candidate.time(), target).abs();
      if (closestDiff == null || diff.compareTo(closestDiff) < 0) {
        closest = candidate;
        closestDiff = diff;
      }
    }

    if (closestDiff.compareTo(maxTolerance) <= 0) {
      return Optional.of(closest);
    }
    return Optional.empty();
  }

  // First index whose time is not before target.
  private int lowerBound(LocalDateTime target) {
    int low = 0;
    int high = times.length;
    while (low < high) {
      int mid = (low + high) >>> 1;
      if (times[mid].isBefore(target)) {
        low = mid + 1;
      } else {
        high = mid;
      }
    }
    return low;
  }
}
