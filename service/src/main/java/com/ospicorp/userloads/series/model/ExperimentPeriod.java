package com.ospicorp.userloads.series.model;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;

/**
 * Fixed analysis window, inclusive on both ends.
 *
 * <p>The two periods are the longest stretches with consecutive load values for an acceptable
 * number of meters on the feeder with temperature recordings. Temperature readings start
 * 2004-03-22, loads start 2004-02-01.
 */
public record ExperimentPeriod(LocalDateTime start, LocalDateTime end) {

  public static final ExperimentPeriod FIRST = new ExperimentPeriod(
      LocalDateTime.of(2004, 2, 1, 0, 0), LocalDateTime.of(2005, 7, 1, 0, 0));

  public static final ExperimentPeriod SECOND = new ExperimentPeriod(
      LocalDateTime.of(2005, 10, 1, 0, 0), LocalDateTime.of(2006, 10, 1, 0, 0));

  public static final List<ExperimentPeriod> ALL = List.of(FIRST, SECOND);

  // Start of the evaluation part of SECOND
  public static final LocalDateTime TEST_PERIOD_START = LocalDateTime.of(2005, 10, 1, 0, 0);

  public ExperimentPeriod {
    Objects.requireNonNull(start, "start");
    Objects.requireNonNull(end, "end");
    if (start.isAfter(end)) {
      throw new IllegalArgumentException("start must be before or equal to end");
    }
  }
}
