package com.example.datalake.dsdust.model;

import java.util.Locale;

/**
 * Catalog tags arrive either as bare strings or as category objects carrying a name. Both collapse
 * to one lowercase string through {@link #normalized()}, applied once when a record is ingested.
 */
public interface Tag {

  String normalized();

  static Tag of(String value) {
    return new Plain(value);
  }

  static Tag named(String name, String ref) {
    return new Named(name, ref);
  }

  record Plain(String value) implements Tag {
    @Override
    public String normalized() {
      return clean(value);
    }
  }

  record Named(String name, String ref) implements Tag {
    @Override
    public String normalized() {
      String n = clean(name);
      return n.isEmpty() ? clean(ref) : n;
    }
  }

  private static String clean(String raw) {
    return raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
  }
}
