package com.ospicorp.userloads.series.repository;

import com.ospicorp.userloads.series.StoreClosedException;
import com.ospicorp.userloads.series.StoreUnavailableException;
import com.ospicorp.userloads.series.UnknownUserIdException;
import com.ospicorp.userloads.series.model.DataPoint;
import com.ospicorp.userloads.series.model.LoadSeries;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;

/**
 * {@link LoadStore} backed by an H2 database file opened in read-only mode over a single JDBC
 * connection.
 *
 * <p>Expected tables: {@code user_id_sets(selector, user_id)} holding one row per user ID and
 * selector, and {@code user_loads(user_id, ts, load_value)} holding the readings.
 */
public final class H2LoadStore implements LoadStore {
  private static final Logger log = LoggerFactory.getLogger(H2LoadStore.class);

  public static final String FILE_SUFFIX = ".mv.db";
  static final String USER = "sa";
  static final String PASSWORD = "";

  private static final String USER_IDS_SQL = """
      SELECT user_id
      FROM user_id_sets
      WHERE selector = ?
      ORDER BY user_id
      """;

  private static final String SERIES_SQL = """
      SELECT ts, load_value
      FROM user_loads
      WHERE user_id = ?
      ORDER BY ts
      """;

  private final Path path;
  private final SingleConnectionDataSource dataSource;
  private final JdbcTemplate jdbc;
  private final Set<Long> allUserIds;
  private boolean closed;

  private H2LoadStore(Path path, SingleConnectionDataSource dataSource, JdbcTemplate jdbc,
      Set<Long> allUserIds) {
    this.path = path;
    this.dataSource = dataSource;
    this.jdbc = jdbc;
    this.allUserIds = allUserIds;
  }

  public static H2LoadStore open(Path path) {
    Objects.requireNonNull(path, "path");
    if (!Files.isRegularFile(path)) {
      throw new StoreUnavailableException(path, "Load store not found: " + path);
    }
    String fileName = path.getFileName().toString();
    if (!fileName.endsWith(FILE_SUFFIX)) {
      throw new StoreUnavailableException(path,
          "Load store must be an H2 database file ending in " + FILE_SUFFIX + ": " + path);
    }

    SingleConnectionDataSource dataSource = new SingleConnectionDataSource(jdbcUrl(path), USER,
        PASSWORD, true);
    dataSource.setDriverClassName("org.h2.Driver");
    JdbcTemplate jdbc = new JdbcTemplate(dataSource);
    try {
      Set<Long> allUserIds = queryUserIds(jdbc, IdentifierSelector.ALL);
      log.info("Opened load store {} with {} user IDs", path, allUserIds.size());
      return new H2LoadStore(path, dataSource, jdbc, allUserIds);
    } catch (DataAccessException ex) {
      dataSource.destroy();
      throw new StoreUnavailableException(path,
          "Unable to open load store " + path + ": " + ex.getMessage(), ex);
    }
  }

  static String jdbcUrl(Path path) {
    String absolute = path.toAbsolutePath().toString();
    String name = absolute.substring(0, absolute.length() - FILE_SUFFIX.length());
    return "jdbc:h2:file:" + name + ";ACCESS_MODE_DATA=r;IFEXISTS=TRUE";
  }

  @Override
  public Path path() {
    return path;
  }

  @Override
  public Set<Long> userIds(IdentifierSelector selector) {
    Objects.requireNonNull(selector, "selector");
    checkOpen();
    if (selector == IdentifierSelector.ALL) {
      return allUserIds;
    }
    try {
      return queryUserIds(jdbc, selector);
    } catch (DataAccessException ex) {
      throw new StoreUnavailableException(path,
          "Unable to read " + selector.entryName() + " from " + path + ": " + ex.getMessage(), ex);
    }
  }

  @Override
  public LoadSeries readSeries(long userId) {
    checkOpen();
    if (!allUserIds.contains(userId)) {
      throw new UnknownUserIdException(userId);
    }
    try {
      List<DataPoint> points = jdbc.query(SERIES_SQL,
          (rs, i) -> new DataPoint(rs.getObject(1, LocalDateTime.class), rs.getDouble(2)),
          userId);
      log.debug("Read {} load values for user {} from {}", points.size(), userId, path);
      return LoadSeries.of(points);
    } catch (DataAccessException ex) {
      throw new StoreUnavailableException(path,
          "Unable to read loads for user " + userId + " from " + path + ": " + ex.getMessage(),
          ex);
    }
  }

  @Override
  public boolean isClosed() {
    return closed;
  }

  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    dataSource.destroy();
    log.info("Closed load store {}", path);
  }

  private void checkOpen() {
    if (closed) {
      throw new StoreClosedException(path);
    }
  }

  private static Set<Long> queryUserIds(JdbcTemplate jdbc, IdentifierSelector selector) {
    List<Long> ids = jdbc.queryForList(USER_IDS_SQL, Long.class, selector.entryName());
    return Collections.unmodifiableSet(new TreeSet<>(ids));
  }

  @Override
  public String toString() {
    return "H2LoadStore[" + path + (closed ? ", closed" : "") + "]";
  }
}
