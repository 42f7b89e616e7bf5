package com.example.datalake.dsdust.column;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.input.BOMInputStream;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/** Reads the header row of CSV or TSV files; only column names are needed, never the data. */
@Slf4j
public class SchemaReader {

  public TabularSchema read(Path file) {
    String source = file.getFileName() == null ? file.toString() : file.getFileName().toString();
    try (InputStream in = Files.newInputStream(file)) {
      return read(source, in);
    } catch (IOException e) {
      throw new SchemaReadException(source, "Cannot open " + source + ": " + e.getMessage(), e);
    }
  }

  public TabularSchema read(String source, InputStream in) {
    CSVFormat format = CSVFormat.DEFAULT.builder()
        .setDelimiter(delimiterFor(source))
        .setHeader()
        .setSkipHeaderRecord(true)
        .setIgnoreSurroundingSpaces(true)
        .setAllowMissingColumnNames(true)
        .build();
    // spreadsheet exports often start with a UTF-8 byte-order mark
    try (Reader reader = new InputStreamReader(BOMInputStream.builder().setInputStream(in).get(), StandardCharsets.UTF_8);
         CSVParser parser = format.parse(reader)) {
      List<String> names = parser.getHeaderNames();
      if (names == null || names.isEmpty()) {
        throw new SchemaReadException(source, source + " has no header row", null);
      }
      log.debug("Read {} columns from {}", names.size(), source);
      return new TabularSchema(source, names);
    } catch (IOException | IllegalArgumentException | IllegalStateException e) {
      throw new SchemaReadException(source, "Cannot read header of " + source + ": " + e.getMessage(), e);
    }
  }

  private static char delimiterFor(String source) {
    String name = source == null ? "" : source.toLowerCase(Locale.ROOT);
    return name.endsWith(".tsv") || name.endsWith(".tab") ? '\t' : ',';
  }
}
