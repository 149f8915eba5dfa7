package com.quantori.rsl.core.output;

import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvGenerator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.quantori.rsl.api.model.HierarchyRow;
import com.quantori.rsl.core.GenerationException;
import com.quantori.rsl.core.model.HierarchyTable;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import lombok.extern.slf4j.Slf4j;

/**
 * Writes the library table as delimited text with a header row and no index column. Values containing the separator
 * are quoted.
 */
@Slf4j
public class CsvTableWriter {
  private final CsvMapper mapper;
  private final CsvSchema schema;

  public CsvTableWriter(char columnSeparator) {
    this.mapper = CsvMapper.builder()
        .enable(CsvGenerator.Feature.STRICT_CHECK_FOR_QUOTING)
        .build();
    this.schema = mapper.schemaFor(HierarchyRow.class)
        .withHeader()
        .withColumnSeparator(columnSeparator);
  }

  public void write(HierarchyTable table, Writer writer) throws IOException {
    try (SequenceWriter rows = mapper.writer(schema).writeValues(writer)) {
      rows.writeAll(table.getRows());
    }
  }

  /**
   * Writes the table to a UTF-8 file, replacing an existing one.
   *
   * @throws GenerationException if the file cannot be written
   */
  public void write(HierarchyTable table, Path file) {
    try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
      write(table, writer);
    } catch (IOException e) {
      throw new GenerationException("Unable to write table to " + file, e);
    }
    log.info("Table saved to file: {}", file);
  }

  public CsvSchema getSchema() {
    return schema;
  }
}
