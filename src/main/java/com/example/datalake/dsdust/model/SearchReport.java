package com.example.datalake.dsdust.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/** Outcome of one aggregation: ranked records plus whatever was skipped along the way. */
@Value
@Builder(toBuilder = true)
public class SearchReport {
  @Singular List<DatasetRecord> datasets;
  @Singular List<QueryFailure> failures;
  @Singular List<String> notices;
  CollectionStats stats;
  boolean cancelled;
}
