package com.example.datalake.dsdust.expand;

import java.util.Collection;
import java.util.Locale;
import java.util.Map;

/** Advisory row count from byte size and the primary file type. Never authoritative. */
public final class RowCountEstimator {

  public static final String UNKNOWN = "unknown";

  private static final Map<String, Integer> BYTES_PER_ROW = Map.of(
      "csv", 100,
      "json", 200,
      "parquet", 50,
      "xlsx", 150,
      "tsv", 100
  );

  private RowCountEstimator() {}

  /**
   * @param fileTypes file types in discovery order; the first one is treated as primary
   * @return 0 when the types are undetermined
   */
  public static long estimate(long sizeBytes, Collection<String> fileTypes) {
    if (fileTypes == null || fileTypes.isEmpty() || fileTypes.contains(UNKNOWN)) {
      return 0L;
    }
    String primary = fileTypes.iterator().next().toLowerCase(Locale.ROOT);
    int perRow = BYTES_PER_ROW.getOrDefault(primary, BYTES_PER_ROW.get("csv"));
    return Math.max(sizeBytes, 0L) / perRow;
  }
}
