package com.example.datalake.dsdust.export;

import com.example.datalake.dsdust.model.DatasetRecord;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/** Writes ranked datasets as CSV, one row per record in the order given. */
@Slf4j
@Component
public class DatasetCsvExporter {

  static final String[] HEADERS = {
      "ref", "title", "description", "size_bytes", "size_mb", "last_updated", "download_count",
      "vote_count", "usability_rating", "tags", "search_score", "search_method", "file_types",
      "estimated_rows"};

  private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
      .setHeader(HEADERS)
      .setRecordSeparator("\n")
      .build();

  public String toCsv(List<DatasetRecord> records) {
    StringWriter out = new StringWriter();
    try {
      write(records, out);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
    return out.toString();
  }

  public void write(List<DatasetRecord> records, Writer out) throws IOException {
    CSVPrinter printer = new CSVPrinter(out, FORMAT);
    for (DatasetRecord r : records == null ? List.<DatasetRecord>of() : records) {
      printer.printRecord(
          r.getReference(),
          r.getTitle(),
          r.getDescription(),
          r.getSizeBytes(),
          round(r.sizeMegabytes(), 2),
          r.getLastUpdated(),
          r.getDownloadCount(),
          r.getVoteCount(),
          r.getUsabilityRating(),
          String.join(", ", r.getTags()),
          round(r.getSearchScore(), 2),
          r.getSearchMethod(),
          String.join(", ", r.getFileTypes()),
          r.getEstimatedRowCount());
    }
    printer.flush();
    log.debug("Exported {} datasets as CSV", records == null ? 0 : records.size());
  }

  private static String round(double value, int scale) {
    return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP).toPlainString();
  }
}
