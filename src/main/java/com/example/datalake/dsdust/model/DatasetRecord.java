package com.example.datalake.dsdust.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Set;

/**
 * One discovered dataset. Equality for deduplication is decided by {@link #reference} alone, so the
 * same dataset found by two different queries may carry different scores and provenance.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class DatasetRecord {
  /** Owner/slug identity, e.g. {@code "zillow/zecon"}. */
  String reference;
  String title;
  String description;
  long sizeBytes;
  /** Passed through verbatim from the catalog. */
  String lastUpdated;
  long downloadCount;
  long voteCount;
  double usabilityRating;
  @Singular Set<String> tags;
  @Singular Set<String> fileTypes;
  long estimatedRowCount;
  double searchScore;
  /** Which intent produced this hit, e.g. {@code "keyword:finance data"}. Never part of identity. */
  String searchMethod;

  public DatasetRecord withSearchScore(double score) {
    return toBuilder().searchScore(score).build();
  }

  public double sizeMegabytes() {
    return sizeBytes / (1024.0 * 1024.0);
  }
}
