package com.example.datalake.dsdust.validation;

import com.example.datalake.dsdust.request.SearchRequest;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/** Trims terms, drops blanks and case-insensitive duplicates, and lowercases file types. */
@Component
public class TermNormalizationValidator implements Validator {

  @Override
  public ValidationStage stage() {
    return ValidationStage.NORMALIZE;
  }

  @Override
  public void validate(ValidationContext context) {
    SearchRequest request = context.getRequest();
    context.setRequest(request.toBuilder()
        .keywords(clean(request.getKeywords(), false))
        .tags(clean(request.getTags(), false))
        .fileTypes(clean(request.getFileTypes(), true))
        .columnKeywords(clean(request.getColumnKeywords(), false))
        .build());
  }

  private static List<String> clean(List<String> terms, boolean fileType) {
    if (terms == null) {
      return new ArrayList<>();
    }
    Map<String, String> unique = new LinkedHashMap<>();
    for (String term : terms) {
      if (term == null) continue;
      String t = term.trim();
      if (fileType) {
        t = t.toLowerCase(Locale.ROOT);
        while (t.startsWith(".")) t = t.substring(1);
      }
      if (!t.isEmpty()) {
        unique.putIfAbsent(t.toLowerCase(Locale.ROOT), t);
      }
    }
    return new ArrayList<>(unique.values());
  }
}
