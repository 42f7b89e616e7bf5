package com.example.datalake.dsdust.scoring;

import com.example.datalake.dsdust.model.DatasetRecord;

import java.util.Collection;
import java.util.List;
import java.util.Locale;

/**
 * Fixed linear relevance formula: term matches in title, description and tags plus capped
 * popularity signals. Scores are only comparable within one search call.
 */
public class RelevanceScorer {

  static final double TITLE_MATCH = 10.0;
  static final double DESCRIPTION_MATCH = 5.0;
  static final double TAG_MATCH = 8.0;
  static final double USABILITY_WEIGHT = 2.0;
  static final double VOTE_CAP = 5.0;
  static final double DOWNLOAD_CAP = 3.0;

  static final double KEYWORD_BOOST = 2.0;
  static final double TAG_BOOST = 3.0;
  static final double COLUMN_BOOST = 1.5;

  public double score(DatasetRecord record, String searchTerm) {
    String term = lower(searchTerm);
    double score = 0.0;
    if (!term.isEmpty()) {
      if (lower(record.getTitle()).contains(term)) {
        score += TITLE_MATCH;
      }
      if (lower(record.getDescription()).contains(term)) {
        score += DESCRIPTION_MATCH;
      }
      if (record.getTags().stream().anyMatch(t -> lower(t).contains(term))) {
        score += TAG_MATCH;
      }
    }
    score += record.getUsabilityRating() * USABILITY_WEIGHT;
    score += Math.min(record.getVoteCount() / 100.0, VOTE_CAP);
    score += Math.min(record.getDownloadCount() / 1000.0, DOWNLOAD_CAP);
    return score;
  }

  /**
   * Extra credit applied when several dimensions are ranked together: per keyword found in the
   * title, per tag present on the record and per column term found in the description.
   */
  public double multiCriteriaBoost(DatasetRecord record, Collection<String> keywords,
                                   Collection<String> tags, Collection<String> columns) {
    String title = lower(record.getTitle());
    String description = lower(record.getDescription());
    List<String> recordTags = record.getTags().stream().map(RelevanceScorer::lower).toList();

    double boost = 0.0;
    for (String kw : safe(keywords)) {
      String k = lower(kw);
      if (!k.isEmpty() && title.contains(k)) {
        boost += KEYWORD_BOOST;
      }
    }
    for (String tag : safe(tags)) {
      if (recordTags.contains(lower(tag))) {
        boost += TAG_BOOST;
      }
    }
    for (String col : safe(columns)) {
      String c = lower(col);
      if (!c.isEmpty() && description.contains(c)) {
        boost += COLUMN_BOOST;
      }
    }
    return boost;
  }

  private static Collection<String> safe(Collection<String> terms) {
    return terms == null ? List.of() : terms;
  }

  private static String lower(String s) {
    return s == null ? "" : s.toLowerCase(Locale.ROOT);
  }
}
