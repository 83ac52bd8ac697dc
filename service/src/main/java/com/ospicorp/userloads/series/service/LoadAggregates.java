package com.ospicorp.userloads.series.service;

import com.ospicorp.userloads.series.EmptyUserSetException;
import com.ospicorp.userloads.series.model.ExperimentPeriod;
import com.ospicorp.userloads.series.model.LoadSeries;
import com.ospicorp.userloads.series.model.SubsetLoad;
import com.ospicorp.userloads.series.model.UserSubset;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class LoadAggregates {
  private static final Logger log = LoggerFactory.getLogger(LoadAggregates.class);

  // Auto-generated seeds are drawn from [MIN_SEED, MAX_SEED)
  static final long MIN_SEED = 1L;
  static final long MAX_SEED = 1L << 16;

  private LoadAggregates() {
  }

  public static LoadSeries restrict(LoadSeries series, LocalDateTime start, LocalDateTime end) {
    Objects.requireNonNull(series, "series");
    return series.between(start, end);
  }

  public static LoadSeries totalLoad(UserLoads loads, Collection<Long> userIds,
      ExperimentPeriod period) {
    Objects.requireNonNull(period, "period");
    return totalLoad(loads, userIds, period.start(), period.end());
  }

  /**
   * Sum of the loads of {@code userIds} within {@code [start, end]}. All restricted series must
   * share the same timestamps.
   *
   * @throws EmptyUserSetException if {@code userIds} is empty
   */
  public static LoadSeries totalLoad(UserLoads loads, Collection<Long> userIds,
      LocalDateTime start, LocalDateTime end) {
    Objects.requireNonNull(loads, "loads");
    Objects.requireNonNull(userIds, "userIds");
    if (userIds.isEmpty()) {
      throw new EmptyUserSetException();
    }
    log.debug("Summing loads of {} users between {} and {}", userIds.size(), start, end);
    Iterator<Long> it = userIds.iterator();
    LoadSeries total = loads.get(it.next()).between(start, end);
    while (it.hasNext()) {
      total = total.plus(loads.get(it.next()).between(start, end));
    }
    return total;
  }

  /** One total per {@link ExperimentPeriod#ALL} entry, in the same order. */
  public static List<LoadSeries> totalLoadInExperimentPeriods(UserLoads loads,
      Collection<Long> userIds) {
    List<LoadSeries> out = new ArrayList<>(ExperimentPeriod.ALL.size());
    for (ExperimentPeriod period : ExperimentPeriod.ALL) {
      out.add(totalLoad(loads, userIds, period));
    }
    return out;
  }

  public static List<LoadSeries> totalExperimentLoad(UserLoads loads) {
    return totalLoadInExperimentPeriods(loads, loads.userIdList());
  }

  /**
   * Total of the complete series of a feeder's meters. Series are re-read from the store, so
   * in-memory modifications of those users are discarded.
   */
  public static LoadSeries feederTotal(UserLoads loads, Collection<Long> userIds) {
    Objects.requireNonNull(userIds, "userIds");
    if (userIds.isEmpty()) {
      throw new EmptyUserSetException();
    }
    Iterator<Long> it = userIds.iterator();
    LoadSeries total = loads.forceRead(it.next());
    while (it.hasNext()) {
      total = total.plus(loads.forceRead(it.next()));
    }
    return total;
  }

  /**
   * Users without a zero reading from {@link ExperimentPeriod#TEST_PERIOD_START} onwards, so a
   * MAPE can be computed over the test period.
   */
  public static List<Long> nonZeroTestPeriodUsers(UserLoads loads) {
    List<Long> out = new ArrayList<>();
    for (Long userId : loads.userIds()) {
      if (!loads.get(userId).between(ExperimentPeriod.TEST_PERIOD_START, null).anyZero()) {
        out.add(userId);
      }
    }
    return out;
  }

  public static UserSubset randomUserSubset(List<Long> userIds, int count) {
    return randomUserSubset(userIds, count, newSeed());
  }

  /**
   * First {@code count} entries of a permutation of {@code userIds} seeded with {@code seed}. The
   * result depends only on the seed and the order of {@code userIds}.
   */
  public static UserSubset randomUserSubset(List<Long> userIds, int count, long seed) {
    Objects.requireNonNull(userIds, "userIds");
    if (count < 0) {
      throw new IllegalArgumentException("count must not be negative");
    }
    List<Long> shuffled = new ArrayList<>(userIds);
    Collections.shuffle(shuffled, new Random(seed));
    return new UserSubset(seed, shuffled.subList(0, Math.min(count, shuffled.size())));
  }

  public static SubsetLoad meanExperimentLoadForUserSubset(UserLoads loads, int count) {
    return meanExperimentLoadForUserSubset(loads, count, newSeed());
  }

  /** Mean load per user in each experiment period, for a random subset of {@code loads}. */
  public static SubsetLoad meanExperimentLoadForUserSubset(UserLoads loads, int count,
      long seed) {
    UserSubset subset = randomUserSubset(loads.userIdList(), count, seed);
    log.info("Computing mean experiment load for {} users drawn with seed {}", subset.size(),
        seed);
    List<LoadSeries> totals = totalLoadInExperimentPeriods(loads, subset.userIds());
    List<LoadSeries> means = new ArrayList<>(totals.size());
    for (LoadSeries total : totals) {
      means.add(total.dividedBy(subset.size()));
    }
    return new SubsetLoad(subset, means);
  }

  static long newSeed() {
    return ThreadLocalRandom.current().nextLong(MIN_SEED, MAX_SEED);
  }
}
