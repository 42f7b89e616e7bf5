package com.example.datalake.dsdust.expand;

import com.example.datalake.dsdust.model.ExpandedQuery;
import com.example.datalake.dsdust.model.IntentKind;
import com.example.datalake.dsdust.model.SearchIntent;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/** Deterministic mapping from intent terms to the concrete catalog queries that cover them. */
public class QueryExpander {

  private static final List<String> KEYWORD_SUFFIXES = List.of(
      "", " data", " dataset", " analytics", " analysis", " machine learning", " csv", " json");

  private static final List<String> COLUMN_PATTERNS = List.of(
      "%s", "column %s", "field %s", "feature %s", "variable %s", "%s data");

  public List<ExpandedQuery> expand(SearchIntent intent) {
    List<ExpandedQuery> out = new ArrayList<>();
    for (String term : intent.getTerms()) {
      out.addAll(expand(intent.getKind(), term));
    }
    return out;
  }

  public List<ExpandedQuery> expand(IntentKind kind, String rawTerm) {
    String term = rawTerm == null ? "" : rawTerm.trim();
    if (term.isEmpty()) {
      return List.of();
    }
    return switch (kind) {
      case KEYWORD -> keywordVariations(term);
      case TAG -> tagQueries(term);
      case FILE_TYPE -> List.of(new ExpandedQuery(kind, "", term, term, kind.provenance(term)));
      case COLUMN -> columnVariations(term);
    };
  }

  private List<ExpandedQuery> keywordVariations(String term) {
    List<ExpandedQuery> out = new ArrayList<>(KEYWORD_SUFFIXES.size());
    for (String suffix : KEYWORD_SUFFIXES) {
      String variation = term + suffix;
      out.add(new ExpandedQuery(IntentKind.KEYWORD, variation, null, variation,
          IntentKind.KEYWORD.provenance(variation)));
    }
    return out;
  }

  private List<ExpandedQuery> tagQueries(String term) {
    Set<String> tags = new LinkedHashSet<>(TagTaxonomy.expand(term));
    List<ExpandedQuery> out = new ArrayList<>(tags.size());
    for (String tag : tags) {
      out.add(new ExpandedQuery(IntentKind.TAG, "tag:" + tag, null, tag, IntentKind.TAG.provenance(tag)));
    }
    return out;
  }

  private List<ExpandedQuery> columnVariations(String term) {
    List<ExpandedQuery> out = new ArrayList<>(COLUMN_PATTERNS.size());
    for (String pattern : COLUMN_PATTERNS) {
      out.add(new ExpandedQuery(IntentKind.COLUMN, pattern.formatted(term), null, term,
          IntentKind.COLUMN.provenance(term)));
    }
    return out;
  }
}
