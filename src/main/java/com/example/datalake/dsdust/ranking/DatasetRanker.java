package com.example.datalake.dsdust.ranking;

import com.example.datalake.dsdust.model.DatasetRecord;
import com.example.datalake.dsdust.model.SortKey;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/**
 * Collapses records by identity, orders them and applies the caller's cap. The first occurrence of
 * a reference wins, so callers must pass records in discovery order.
 */
public class DatasetRanker {

  public List<DatasetRecord> dedupeAndRank(List<DatasetRecord> records, SortKey sortKey, int maxResults) {
    List<DatasetRecord> unique = dedupe(records);
    unique.sort(sortKey.ranking());
    if (maxResults >= 0 && unique.size() > maxResults) {
      return new ArrayList<>(unique.subList(0, maxResults));
    }
    return unique;
  }

  public List<DatasetRecord> dedupe(List<DatasetRecord> records) {
    return dedupeBy(records, DatasetRecord::getReference);
  }

  /** Dedup key used when merging column searches across several uploaded files. */
  public List<DatasetRecord> dedupeByTitleAndReference(List<DatasetRecord> records) {
    return dedupeBy(records, r -> List.of(Objects.toString(r.getTitle(), ""), Objects.toString(r.getReference(), "")));
  }

  private static List<DatasetRecord> dedupeBy(List<DatasetRecord> records, Function<DatasetRecord, ?> key) {
    Set<Object> seen = new HashSet<>();
    List<DatasetRecord> out = new ArrayList<>();
    if (records == null) {
      return out;
    }
    for (DatasetRecord r : records) {
      if (r != null && seen.add(key.apply(r))) {
        out.add(r);
      }
    }
    return out;
  }
}
