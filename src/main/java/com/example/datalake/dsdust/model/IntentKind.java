package com.example.datalake.dsdust.model;

/** Search dimensions a caller can ask for, with the ranking key each one sorts by on its own. */
public enum IntentKind {
  KEYWORD("keyword", SortKey.SCORE),
  TAG("tag", SortKey.VOTES),
  FILE_TYPE("file_type", SortKey.SIZE),
  COLUMN("column", SortKey.SCORE);

  private final String label;
  private final SortKey sortKey;

  IntentKind(String label, SortKey sortKey) {
    this.label = label;
    this.sortKey = sortKey;
  }

  /** Provenance prefix written into {@link DatasetRecord#getSearchMethod()}. */
  public String label() {
    return label;
  }

  public SortKey sortKey() {
    return sortKey;
  }

  public String provenance(String detail) {
    return label + ":" + detail;
  }
}
