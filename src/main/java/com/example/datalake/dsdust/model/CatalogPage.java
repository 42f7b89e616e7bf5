package com.example.datalake.dsdust.model;

import java.util.List;

/** One page of catalog results. An empty page is the only end-of-results signal. */
public record CatalogPage(List<RawDatasetRecord> records) {

  public CatalogPage {
    records = records == null ? List.of() : List.copyOf(records);
  }

  public static CatalogPage empty() {
    return new CatalogPage(List.of());
  }

  public boolean hasMore() {
    return !records.isEmpty();
  }

  public boolean isEmpty() {
    return records.isEmpty();
  }
}
