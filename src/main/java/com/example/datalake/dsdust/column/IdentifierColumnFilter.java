package com.example.datalake.dsdust.column;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Drops identifier-like columns (surrogate keys, row indexes, UUIDs) that say nothing about a
 * dataset's content. Names are split on punctuation, spaces and camelCase humps; a column is
 * identifier-like when a token is one of the markers, when a token ends in {@code index},
 * {@code uuid} or {@code guid}, or when it is a common glued key such as {@code userid}. So
 * {@code user_id}, {@code customerId}, {@code INDEX} and {@code pk_value} go while
 * {@code identity_theft_rate}, {@code bid_price} and {@code valid} stay.
 */
public class IdentifierColumnFilter {

  private static final Set<String> MARKERS = Set.of("id", "index", "key", "pk", "uuid", "guid");
  private static final List<String> SUFFIX_MARKERS = List.of("index", "uuid", "guid");
  private static final Set<String> GLUED_KEYS = Set.of("userid", "rowid", "recordid", "objectid");
  private static final Pattern CAMEL_HUMP = Pattern.compile("(?<=[a-z0-9])(?=[A-Z])");
  private static final Pattern TOKEN_SPLIT = Pattern.compile("[^a-z0-9]+");

  public boolean isIdentifier(String columnName) {
    if (columnName == null) {
      return true;
    }
    String trimmed = columnName.trim();
    if (trimmed.isEmpty()) {
      return true;
    }
    String name = CAMEL_HUMP.matcher(trimmed).replaceAll("_").toLowerCase(Locale.ROOT);
    for (String token : TOKEN_SPLIT.split(name)) {
      if (token.isEmpty()) continue;
      if (MARKERS.contains(token) || GLUED_KEYS.contains(token)) {
        return true;
      }
      for (String marker : SUFFIX_MARKERS) {
        if (token.endsWith(marker)) {
          return true;
        }
      }
    }
    return false;
  }

  /** Content columns in input order, trimmed, without duplicates. */
  public List<String> contentColumns(Collection<String> columns) {
    List<String> out = new ArrayList<>();
    for (String c : columns) {
      if (isIdentifier(c)) continue;
      String trimmed = c.trim();
      if (!out.contains(trimmed)) out.add(trimmed);
    }
    return out;
  }
}
