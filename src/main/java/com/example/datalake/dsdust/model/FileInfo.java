package com.example.datalake.dsdust.model;

import java.util.Locale;

public record FileInfo(String name, long totalBytes) {

  /** Lowercase extension after the last dot, or empty when the name has none. */
  public String extension() {
    if (name == null || name.isBlank()) {
      return "";
    }
    String trimmed = name.trim();
    int dot = trimmed.lastIndexOf('.');
    return dot < 0 ? "" : trimmed.substring(dot + 1).toLowerCase(Locale.ROOT);
  }
}
