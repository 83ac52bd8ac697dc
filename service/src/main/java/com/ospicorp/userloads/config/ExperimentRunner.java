package com.ospicorp.userloads.config;

import com.ospicorp.userloads.exports.LoadSeriesCsvWriter;
import com.ospicorp.userloads.series.model.LoadSeries;
import com.ospicorp.userloads.series.model.SubsetLoad;
import com.ospicorp.userloads.series.service.LoadAggregates;
import com.ospicorp.userloads.series.service.UserLoads;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

@Component
public class ExperimentRunner implements CommandLineRunner {

  private static final Logger log = LoggerFactory.getLogger(ExperimentRunner.class);

  private final ObjectProvider<UserLoads> experimentLoads;
  private final LoadSeriesCsvWriter csvWriter = new LoadSeriesCsvWriter();
  private final boolean enabled;
  private final int subsetSize;
  private final Long seed;
  private final Path outputDir;

  public ExperimentRunner(@Qualifier("tempfeederExp") ObjectProvider<UserLoads> experimentLoads,
      @Value("${userloads.experiment.enabled:false}") boolean enabled,
      @Value("${userloads.experiment.subset-size:10}") int subsetSize,
      @Value("${userloads.experiment.seed:#{null}}") Long seed,
      @Value("${userloads.experiment.output-dir:build/experiment}") String outputDir) {
    this.experimentLoads = experimentLoads;
    this.enabled = enabled;
    this.subsetSize = subsetSize;
    this.seed = seed;
    this.outputDir = Path.of(outputDir);
  }

  @Override
  public void run(String... args) {
    if (!enabled) {
      log.info("Experiment run disabled via property userloads.experiment.enabled=false");
      return;
    }
    if (subsetSize < 1) {
      throw new IllegalStateException(
          "userloads.experiment.subset-size must be positive, was " + subsetSize);
    }
    UserLoads loads = experimentLoads.getObject();
    SubsetLoad result = seed == null
        ? LoadAggregates.meanExperimentLoadForUserSubset(loads, subsetSize)
        : LoadAggregates.meanExperimentLoadForUserSubset(loads, subsetSize, seed);
    log.info("Drew {} of {} experiment users with seed {}", result.subset().size(),
        loads.size(), result.subset().seed());
    writePeriods(result.periodLoads());
  }

  private void writePeriods(List<LoadSeries> periodLoads) {
    for (int i = 0; i < periodLoads.size(); i++) {
      Path file = outputDir.resolve("period-" + (i + 1) + ".csv");
      try {
        csvWriter.write(periodLoads.get(i), file);
      } catch (IOException ex) {
        throw new UncheckedIOException("Unable to write " + file, ex);
      }
      log.info("Wrote {} mean load values to {}", periodLoads.get(i).size(), file);
    }
  }
}
