package com.example.datalake.dsdust.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/** One search dimension: its kind, the terms to expand and how many records to keep per query. */
@Value
@Builder
public class SearchIntent {
  IntentKind kind;
  @Singular List<String> terms;
  int perQueryLimit;

  public static SearchIntent of(IntentKind kind, List<String> terms, int perQueryLimit) {
    return SearchIntent.builder().kind(kind).terms(terms).perQueryLimit(perQueryLimit).build();
  }
}
