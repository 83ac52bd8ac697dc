package com.ospicorp.userloads.series.model;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * Immutable load series with strictly increasing timestamps.
 *
 * <p>Arithmetic is aligned on timestamps: {@link #plus(LoadSeries)} requires both operands to
 * share the same timestamp index.
 */
public final class LoadSeries implements Iterable<DataPoint> {
  private static final LoadSeries EMPTY = new LoadSeries(List.of());

  private final List<DataPoint> points;

  private LoadSeries(List<DataPoint> points) {
    this.points = points;
  }

  public static LoadSeries of(List<DataPoint> points) {
    Objects.requireNonNull(points, "points");
    LocalDateTime previous = null;
    for (DataPoint point : points) {
      Objects.requireNonNull(point, "point");
      if (previous != null && !point.timestamp().isAfter(previous)) {
        throw new IllegalArgumentException("Timestamps must be strictly increasing; "
            + point.timestamp() + " follows " + previous);
      }
      previous = point.timestamp();
    }
    return new LoadSeries(List.copyOf(points));
  }

  public List<DataPoint> points() {
    return points;
  }

  public List<LocalDateTime> timestamps() {
    List<LocalDateTime> out = new ArrayList<>(points.size());
    for (DataPoint p : points) {
      out.add(p.timestamp());
    }
    return out;
  }

  public double[] values() {
    double[] out = new double[points.size()];
    for (int i = 0; i < out.length; i++) {
      out[i] = points.get(i).value();
    }
    return out;
  }

  public int size() {
    return points.size();
  }

  public boolean isEmpty() {
    return points.isEmpty();
  }

  public LocalDateTime firstTimestamp() {
    return points.isEmpty() ? null : points.get(0).timestamp();
  }

  public LocalDateTime lastTimestamp() {
    return points.isEmpty() ? null : points.get(points.size() - 1).timestamp();
  }

  /**
   * Points whose timestamp lies in {@code [start, end]}. A {@code null} bound leaves that side
   * open.
   */
  public LoadSeries between(LocalDateTime start, LocalDateTime end) {
    if (start != null && end != null && start.isAfter(end)) {
      return EMPTY;
    }
    int from = start == null ? 0 : firstIndexNotBefore(start);
    int to = end == null ? points.size() : firstIndexAfter(end);
    if (from == 0 && to == points.size()) {
      return this;
    }
    if (from >= to) {
      return EMPTY;
    }
    return new LoadSeries(List.copyOf(points.subList(from, to)));
  }

  public LoadSeries plus(LoadSeries other) {
    Objects.requireNonNull(other, "other");
    if (other.size() != size()) {
      throw misaligned(other);
    }
    List<DataPoint> out = new ArrayList<>(points.size());
    for (int i = 0; i < points.size(); i++) {
      DataPoint left = points.get(i);
      DataPoint right = other.points.get(i);
      if (!left.timestamp().equals(right.timestamp())) {
        throw misaligned(other);
      }
      out.add(new DataPoint(left.timestamp(), left.value() + right.value()));
    }
    return new LoadSeries(List.copyOf(out));
  }

  public LoadSeries dividedBy(double divisor) {
    List<DataPoint> out = new ArrayList<>(points.size());
    for (DataPoint p : points) {
      out.add(new DataPoint(p.timestamp(), p.value() / divisor));
    }
    return new LoadSeries(List.copyOf(out));
  }

  public boolean anyZero() {
    for (DataPoint p : points) {
      if (p.value() == 0d) {
        return true;
      }
    }
    return false;
  }

  @Override
  public Iterator<DataPoint> iterator() {
    return points.iterator();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    return o instanceof LoadSeries other && points.equals(other.points);
  }

  @Override
  public int hashCode() {
    return points.hashCode();
  }

  @Override
  public String toString() {
    if (points.isEmpty()) {
      return "LoadSeries[]";
    }
    return "LoadSeries[" + points.size() + " points, " + firstTimestamp() + " .. "
        + lastTimestamp() + "]";
  }

  private IllegalArgumentException misaligned(LoadSeries other) {
    return new IllegalArgumentException("Cannot add series with different timestamp indexes: "
        + this + " and " + other);
  }

  private int firstIndexNotBefore(LocalDateTime t) {
    int lo = 0;
    int hi = points.size();
    while (lo < hi) {
      int mid = (lo + hi) >>> 1;
      if (points.get(mid).timestamp().isBefore(t)) {
        lo = mid + 1;
      } else {
        hi = mid;
      }
    }
    return lo;
  }

  private int firstIndexAfter(LocalDateTime t) {
    int lo = 0;
    int hi = points.size();
    while (lo < hi) {
      int mid = (lo + hi) >>> 1;
      if (points.get(mid).timestamp().isAfter(t)) {
        hi = mid;
      } else {
        lo = mid + 1;
      }
    }
    return lo;
  }
}
