package com.ospicorp.userloads.exports;

import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.ospicorp.userloads.series.model.DataPoint;
import com.ospicorp.userloads.series.model.LoadSeries;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;

public class LoadSeriesCsvWriter {
  private static final CsvSchema SCHEMA = CsvSchema.builder()
      .addColumn("timestamp")
      .addColumn("value", CsvSchema.ColumnType.NUMBER)
      .setUseHeader(true)
      .build();

  private final CsvMapper mapper = new CsvMapper();

  public LoadSeriesCsvWriter() {
    mapper.findAndRegisterModules();
    mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
  }

  public void write(LoadSeries series, OutputStream out) throws IOException {
    try (SequenceWriter writer = mapper.writer(SCHEMA).writeValues(out)) {
      for (DataPoint point : series) {
        writer.write(point);
      }
    }
  }

  public void write(LoadSeries series, Path file) throws IOException {
    Path parent = file.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    try (OutputStream out = Files.newOutputStream(file)) {
      write(series, out);
    }
  }
}
