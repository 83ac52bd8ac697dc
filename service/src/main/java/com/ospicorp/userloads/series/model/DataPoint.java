package com.ospicorp.userloads.series.model;

import java.time.LocalDateTime;
import java.util.Objects;

// One hourly (or coarser) meter reading
public record DataPoint(LocalDateTime timestamp, double value) {

  public DataPoint {
    Objects.requireNonNull(timestamp, "timestamp");
  }
}
