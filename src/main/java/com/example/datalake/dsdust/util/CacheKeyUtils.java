package com.example.datalake.dsdust.util;

import com.example.datalake.dsdust.model.ExpandedQuery;

import java.util.Locale;

public final class CacheKeyUtils {

  private CacheKeyUtils() {}

  /** Key for one concrete catalog query, including the paging settings that shape its result. */
  public static String buildKey(ExpandedQuery query, int maxPages, int fileDetailsPerPage) {
    String text = normalizeKey(query.text());
    String fileType = normalizeKey(query.fileType());
    return (text == null ? "" : text)
        + "::filetype=" + (fileType == null ? "*" : fileType)
        + "::pages=" + Math.max(maxPages, 0)
        + "::files=" + fileDetailsPerPage;
  }

  /** Trims, lowercases and collapses inner whitespace; {@code null} for blank input. */
  public static String normalizeKey(String key) {
    if (key == null) {
      return null;
    }
    String trimmed = key.trim().replaceAll("\\s+", " ");
    return trimmed.isEmpty() ? null : trimmed.toLowerCase(Locale.ROOT);
  }
}
