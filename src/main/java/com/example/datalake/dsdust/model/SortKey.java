package com.example.datalake.dsdust.model;

import java.util.Comparator;

public enum SortKey {
  SCORE(Comparator.comparingDouble(DatasetRecord::getSearchScore)),
  VOTES(Comparator.comparingLong(DatasetRecord::getVoteCount)),
  SIZE(Comparator.comparingLong(DatasetRecord::getSizeBytes));

  private final Comparator<DatasetRecord> ascending;

  SortKey(Comparator<DatasetRecord> ascending) {
    this.ascending = ascending;
  }

  /** Descending by this key, ties broken by reference ascending. */
  public Comparator<DatasetRecord> ranking() {
    return ascending.reversed()
        .thenComparing(DatasetRecord::getReference, Comparator.nullsLast(Comparator.naturalOrder()));
  }
}
