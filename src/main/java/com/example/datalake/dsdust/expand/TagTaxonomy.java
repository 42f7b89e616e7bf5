package com.example.datalake.dsdust.expand;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/** Fixed tag families used to widen a tag search, plus the column vocabulary of each domain. */
public final class TagTaxonomy {

  private static final Map<String, List<String>> TAG_EXPANSIONS = Map.of(
      "finance", List.of("business", "economics", "banking", "investment", "financial",
          "money", "credit", "loan", "market", "trading"),
      "healthcare", List.of("health", "medical", "medicine", "patient", "clinical",
          "hospital", "diagnosis", "treatment"),
      "technology", List.of("tech", "software", "computer", "ai", "machine learning",
          "data science", "programming"),
      "business", List.of("marketing", "sales", "customer", "revenue", "profit", "company", "corporate"),
      "education", List.of("student", "learning", "academic", "school", "university", "course", "training")
  );

  private static final Map<String, List<String>> DOMAIN_COLUMNS = Map.of(
      "finance", List.of("amount", "price", "cost", "revenue", "profit", "transaction",
          "payment", "balance", "account", "interest"),
      "healthcare", List.of("patient", "diagnosis", "treatment", "symptom", "medication",
          "age", "gender", "blood", "pressure"),
      "technology", List.of("user", "session", "click", "download", "performance", "error",
          "log", "timestamp", "device"),
      "business", List.of("customer", "order", "product", "sales", "marketing", "campaign",
          "conversion", "retention"),
      "education", List.of("student", "grade", "course", "assignment", "score", "attendance",
          "teacher", "subject")
  );

  private static final List<String> GENERIC_COLUMNS = List.of("id", "name", "date", "value", "type", "category");

  private TagTaxonomy() {}

  /** Related tags for {@code tag}, or just {@code tag} itself when it has no family. */
  public static List<String> expand(String tag) {
    List<String> family = TAG_EXPANSIONS.get(key(tag));
    return family == null ? List.of(tag) : family;
  }

  public static List<String> domainColumns(String domain) {
    return DOMAIN_COLUMNS.getOrDefault(key(domain), GENERIC_COLUMNS);
  }

  private static String key(String s) {
    return s == null ? "" : s.trim().toLowerCase(Locale.ROOT);
  }
}
