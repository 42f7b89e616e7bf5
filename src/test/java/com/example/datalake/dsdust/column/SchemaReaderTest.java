package com.example.datalake.dsdust.column;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SchemaReaderTest {

  private final SchemaReader reader = new SchemaReader();

  @Test
  void readsHeaderFromCsvFile(@TempDir Path dir) throws Exception {
    Path csv = dir.resolve("sales.csv");
    Files.writeString(csv, "order_id,\"unit price\", region\n1,9.99,EU\n");

    TabularSchema schema = reader.read(csv);

    assertThat(schema.source()).isEqualTo("sales.csv");
    assertThat(schema.columns()).containsExactly("order_id", "unit price", "region");
  }

  @Test
  void tsvUsesTabDelimiter() {
    TabularSchema schema = reader.read("patients.tsv", stream("age\tdiagnosis\n42\tflu\n"));

    assertThat(schema.columns()).containsExactly("age", "diagnosis");
  }

  @Test
  void byteOrderMarkIsNotPartOfTheFirstColumn() {
    TabularSchema schema = reader.read("excel.csv", stream("\uFEFFamount,category\n1,a\n"));

    assertThat(schema.columns()).containsExactly("amount", "category");
  }

  @Test
  void emptyInputIsUnreadable() {
    assertThatThrownBy(() -> reader.read("empty.csv", stream("")))
        .isInstanceOfSatisfying(SchemaReadException.class,
            e -> assertThat(e.getSource()).isEqualTo("empty.csv"));
  }

  @Test
  void missingFileIsUnreadable(@TempDir Path dir) {
    assertThatThrownBy(() -> reader.read(dir.resolve("nope.csv")))
        .isInstanceOf(SchemaReadException.class)
        .hasMessageContaining("nope.csv");
  }

  private static ByteArrayInputStream stream(String content) {
    return new ByteArrayInputStream(content.getBytes(StandardCharsets.UTF_8));
  }
}
