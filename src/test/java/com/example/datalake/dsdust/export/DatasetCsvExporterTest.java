package com.example.datalake.dsdust.export;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.datalake.dsdust.model.DatasetRecord;
import java.util.List;
import org.junit.jupiter.api.Test;

class DatasetCsvExporterTest {

  private final DatasetCsvExporter exporter = new DatasetCsvExporter();

  @Test
  void writesHeaderAndOneRowPerDataset() {
    DatasetRecord record = DatasetRecord.builder()
        .reference("acme/prices")
        .title("Prices, daily")
        .description("closing prices")
        .sizeBytes(3 * 1024 * 1024)
        .lastUpdated("2024-01-01")
        .downloadCount(12)
        .voteCount(3)
        .usabilityRating(0.5)
        .tag("finance")
        .tag("markets")
        .fileType("csv")
        .estimatedRowCount(31457)
        .searchScore(12.345)
        .searchMethod("keyword:prices")
        .build();

    String[] lines = exporter.toCsv(List.of(record)).split("\n");

    assertThat(lines[0]).isEqualTo(String.join(",", DatasetCsvExporter.HEADERS));
    assertThat(lines[1]).isEqualTo(
        "acme/prices,\"Prices, daily\",closing prices,3145728,3.00,2024-01-01,12,3,0.5,\"finance, markets\","
            + "12.35,keyword:prices,csv,31457");
  }

  @Test
  void emptyListGivesHeaderOnly() {
    assertThat(exporter.toCsv(List.of())).isEqualTo(String.join(",", DatasetCsvExporter.HEADERS) + "\n");
  }
}
