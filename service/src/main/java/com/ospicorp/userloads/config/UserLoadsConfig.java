package com.ospicorp.userloads.config;

import com.ospicorp.userloads.series.repository.IdentifierSelector;
import com.ospicorp.userloads.series.service.UserLoads;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Lazy;

/**
 * Load data sets of the feeder with temperature readings. Duplicates in the original meter
 * exports have been eliminated in the store, keeping the first value encountered.
 *
 * <p>Both beans are lazy, so the store is only opened once something asks for it, and are
 * closed with the context.
 */
@Configuration
public class UserLoadsConfig {
  private static final Logger log = LoggerFactory.getLogger(UserLoadsConfig.class);

  private final Path storePath;

  public UserLoadsConfig(
      @Value("${userloads.store.path:data/sintef/eb_without_duplicates.mv.db}") String storePath) {
    this.storePath = Path.of(storePath);
  }

  @Bean(destroyMethod = "close")
  @Lazy
  UserLoads tempfeederNodup() {
    log.info("Opening all-user loads from {}", storePath);
    return UserLoads.open(storePath, IdentifierSelector.ALL);
  }

  // Only the meters selected for further processing in the clean+predict experiment
  @Bean(destroyMethod = "close")
  @Lazy
  UserLoads tempfeederExp() {
    log.info("Opening experiment user loads from {}", storePath);
    return UserLoads.open(storePath, IdentifierSelector.EXPERIMENT);
  }
}
