package com.ospicorp.userloads.exports;

import static com.ospicorp.userloads.test.LoadStoreFixture.hourly;
import static org.assertj.core.api.Assertions.assertThat;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class LoadSeriesCsvWriterTest {
  private static final LocalDateTime T0 = LocalDateTime.of(2004, 2, 1, 0, 0);

  private final LoadSeriesCsvWriter writer = new LoadSeriesCsvWriter();

  @Test
  void writesHeaderAndOneRowPerPoint() throws IOException {
    ByteArrayOutputStream out = new ByteArrayOutputStream();

    writer.write(hourly(T0, 1.5d, 2.25d), out);

    List<String> lines = out.toString(StandardCharsets.UTF_8).lines().toList();
    assertThat(lines).hasSize(3);
    assertThat(lines.get(0)).isEqualTo("timestamp,value");
    assertThat(lines.get(1)).startsWith("2004-02-01T00:00").endsWith(",1.5");
    assertThat(lines.get(2)).startsWith("2004-02-01T01:00").endsWith(",2.25");
  }

  @Test
  void createsParentDirectories(@TempDir Path dir) throws IOException {
    Path file = dir.resolve("nested/out.csv");

    writer.write(hourly(T0, 3d), file);

    assertThat(file).exists();
    List<String> lines = Files.readAllLines(file);
    assertThat(lines).hasSize(2);
    assertThat(lines.get(0)).isEqualTo("timestamp,value");
  }
}
