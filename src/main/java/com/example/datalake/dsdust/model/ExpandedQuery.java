package com.example.datalake.dsdust.model;

/**
 * A concrete catalog call produced by expanding one intent term.
 *
 * @param text free-text search string, empty for pure file-type queries
 * @param fileType file-type filter or {@code null}
 * @param scoringTerm the term relevance is scored against
 * @param provenance value written to {@link DatasetRecord#getSearchMethod()}
 */
public record ExpandedQuery(IntentKind kind, String text, String fileType, String scoringTerm, String provenance) {

  public String describe() {
    return fileType == null ? "'" + text + "'" : "'" + text + "' [filetype=" + fileType + "]";
  }
}
