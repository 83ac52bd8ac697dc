package com.ospicorp.userloads.series.repository;

import static com.ospicorp.userloads.test.LoadStoreFixture.hourly;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ospicorp.userloads.series.StoreClosedException;
import com.ospicorp.userloads.series.StoreUnavailableException;
import com.ospicorp.userloads.series.UnknownUserIdException;
import com.ospicorp.userloads.series.model.LoadSeries;
import com.ospicorp.userloads.test.LoadStoreFixture;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;

class H2LoadStoreTest {
  private static final LocalDateTime T0 = LocalDateTime.of(2004, 2, 1, 0, 0);

  @TempDir
  Path dir;

  private H2LoadStore store;

  @AfterEach
  void tearDown() {
    if (store != null) {
      store.close();
    }
  }

  @Test
  void openFailsForMissingFile() {
    Path missing = dir.resolve("missing.mv.db");

    assertThatThrownBy(() -> H2LoadStore.open(missing))
        .isInstanceOf(StoreUnavailableException.class)
        .hasMessageContaining("not found");
  }

  @Test
  void openFailsForFileWithoutH2Suffix() throws IOException {
    Path other = Files.writeString(dir.resolve("loads.h5"), "not a database");

    assertThatThrownBy(() -> H2LoadStore.open(other))
        .isInstanceOf(StoreUnavailableException.class);
  }

  @Test
  void openFailsForCorruptFile() throws IOException {
    Path corrupt = dir.resolve("corrupt.mv.db");
    Files.writeString(corrupt, "x".repeat(16 * 1024));

    assertThatThrownBy(() -> H2LoadStore.open(corrupt))
        .isInstanceOfSatisfying(StoreUnavailableException.class,
            ex -> assertThat(ex.path()).isEqualTo(corrupt));
  }

  @Test
  void openFailsWhenTablesAreMissing() {
    Path file = dir.resolve("empty.mv.db");
    SingleConnectionDataSource dataSource = LoadStoreFixture.openWritable(file);
    try {
      new JdbcTemplate(dataSource).execute("CREATE TABLE unrelated (id INT)");
    } finally {
      dataSource.destroy();
    }

    assertThatThrownBy(() -> H2LoadStore.open(file))
        .isInstanceOf(StoreUnavailableException.class)
        .hasCauseInstanceOf(DataAccessException.class);
  }

  @Test
  void listsUserIdsPerSelector() {
    store = H2LoadStore.open(threeUsers());

    assertThat(store.userIds(IdentifierSelector.ALL)).containsExactly(1L, 2L, 3L);
    assertThat(store.userIds(IdentifierSelector.EXPERIMENT)).containsExactly(1L, 3L);
  }

  @Test
  void userIdSetIsReadOnly() {
    store = H2LoadStore.open(threeUsers());

    assertThatThrownBy(() -> store.userIds(IdentifierSelector.ALL).add(4L))
        .isInstanceOf(UnsupportedOperationException.class);
  }

  @Test
  void readSeriesReturnsStoredValuesInTimestampOrder() {
    store = H2LoadStore.open(threeUsers());

    LoadSeries series = store.readSeries(2L);

    assertThat(series).isEqualTo(hourly(T0, 10d, 11d, 12d, 13d));
    assertThat(series.firstTimestamp()).isEqualTo(T0);
  }

  @Test
  void readSeriesReturnsFreshCopies() {
    store = H2LoadStore.open(threeUsers());

    LoadSeries first = store.readSeries(1L);
    LoadSeries second = store.readSeries(1L);

    assertThat(second).isEqualTo(first).isNotSameAs(first);
  }

  @Test
  void readSeriesRejectsUnknownUser() {
    store = H2LoadStore.open(threeUsers());

    assertThatThrownBy(() -> store.readSeries(4L))
        .isInstanceOfSatisfying(UnknownUserIdException.class,
            ex -> assertThat(ex.userId()).isEqualTo(4L));
  }

  @Test
  void readsFailAfterClose() {
    store = H2LoadStore.open(threeUsers());
    store.close();
    store.close();

    assertThat(store.isClosed()).isTrue();
    assertThatThrownBy(() -> store.readSeries(1L)).isInstanceOf(StoreClosedException.class);
    assertThatThrownBy(() -> store.userIds(IdentifierSelector.ALL))
        .isInstanceOf(StoreClosedException.class);
  }

  @Test
  void jdbcUrlOpensFileReadOnly() {
    String url = H2LoadStore.jdbcUrl(dir.resolve("loads.mv.db"));

    assertThat(url)
        .startsWith("jdbc:h2:file:")
        .doesNotContain(".mv.db")
        .contains("ACCESS_MODE_DATA=r")
        .contains("IFEXISTS=TRUE");
  }

  private Path threeUsers() {
    return LoadStoreFixture.create()
        .user(1L, hourly(T0, 1d, 2d, 3d, 4d))
        .user(2L, hourly(T0, 10d, 11d, 12d, 13d))
        .user(3L, hourly(T0, 100d, 101d, 102d, 103d))
        .experimentUsers(1L, 3L)
        .writeTo(dir);
  }
}
