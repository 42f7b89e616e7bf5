package com.example.datalake.dsdust.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.Accessors;

@Data
@NoArgsConstructor
@Accessors(chain = true, fluent = false)
public class CollectionStats {
  private int keywordSearches;
  private int tagSearches;
  private int fileTypeSearches;
  private int columnSearches;
  private int cacheHits;
  private int totalDatasetsFound;

  public void recordQuery(IntentKind kind) {
    switch (kind) {
      case KEYWORD -> keywordSearches++;
      case TAG -> tagSearches++;
      case FILE_TYPE -> fileTypeSearches++;
      case COLUMN -> columnSearches++;
    }
  }

  public void recordFound(int count) {
    totalDatasetsFound += count;
  }

  public void recordCacheHit() {
    cacheHits++;
  }

  public CollectionStats merge(CollectionStats other) {
    if (other != null) {
      keywordSearches += other.keywordSearches;
      tagSearches += other.tagSearches;
      fileTypeSearches += other.fileTypeSearches;
      columnSearches += other.columnSearches;
      cacheHits += other.cacheHits;
      totalDatasetsFound += other.totalDatasetsFound;
    }
    return this;
  }
}
