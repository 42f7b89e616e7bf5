package com.example.datalake.dsdust.ingest;

import com.example.datalake.dsdust.catalog.MalformedRecordException;
import com.example.datalake.dsdust.expand.RowCountEstimator;
import com.example.datalake.dsdust.model.DatasetRecord;
import com.example.datalake.dsdust.model.ExpandedQuery;
import com.example.datalake.dsdust.model.FileInfo;
import com.example.datalake.dsdust.model.RawDatasetRecord;
import com.example.datalake.dsdust.model.Tag;
import com.example.datalake.dsdust.scoring.RelevanceScorer;
import lombok.RequiredArgsConstructor;

import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/** Turns a raw catalog entry into a scored {@link DatasetRecord} for one query context. */
@RequiredArgsConstructor
public class RecordNormalizer {

  private final RelevanceScorer scorer;
  private final int descriptionMaxLength;

  /**
   * @throws MalformedRecordException when the entry has no reference or title
   */
  public DatasetRecord normalize(RawDatasetRecord raw, ExpandedQuery query) {
    if (raw == null || isBlank(raw.getRef())) {
      throw new MalformedRecordException("Catalog entry without a reference");
    }
    if (isBlank(raw.getTitle())) {
      throw new MalformedRecordException("Catalog entry " + raw.getRef() + " has no title");
    }

    Set<String> tags = new LinkedHashSet<>();
    if (raw.getTags() != null) {
      for (Tag tag : raw.getTags()) {
        if (tag == null) continue;
        String t = tag.normalized();
        if (!t.isEmpty()) tags.add(t);
      }
    }

    Set<String> fileTypes = new LinkedHashSet<>();
    if (raw.getFiles() != null) {
      for (FileInfo f : raw.getFiles()) {
        String ext = f == null ? "" : f.extension();
        if (!ext.isEmpty()) fileTypes.add(ext);
      }
    }
    if (fileTypes.isEmpty()) {
      fileTypes.add(RowCountEstimator.UNKNOWN);
    }

    long size = orZero(raw.getTotalBytes());
    DatasetRecord unscored = DatasetRecord.builder()
        .reference(raw.getRef().trim())
        .title(raw.getTitle().trim())
        .description(clip(firstNonBlank(raw.getDescription(), raw.getSubtitle())))
        .sizeBytes(size)
        .lastUpdated(raw.getLastUpdated() == null ? "N/A" : raw.getLastUpdated())
        .downloadCount(orZero(raw.getDownloadCount()))
        .voteCount(orZero(raw.getVoteCount()))
        .usabilityRating(raw.getUsabilityRating() == null ? 0.0 : raw.getUsabilityRating())
        .tags(tags)
        .fileTypes(fileTypes)
        .estimatedRowCount(RowCountEstimator.estimate(size, fileTypes))
        .searchMethod(query.provenance())
        .build();

    return unscored.withSearchScore(scorer.score(unscored, query.scoringTerm()));
  }

  private String clip(String text) {
    String s = Objects.requireNonNullElse(text, "");
    if (s.length() <= descriptionMaxLength) {
      return s;
    }
    int end = descriptionMaxLength;
    if (end > 0 && Character.isHighSurrogate(s.charAt(end - 1))) {
      end--;
    }
    return s.substring(0, end);
  }

  private static long orZero(Long v) {
    return v == null ? 0L : v;
  }

  private static String firstNonBlank(String a, String b) {
    return isBlank(a) ? b : a;
  }

  private static boolean isBlank(String s) {
    return s == null || s.isBlank();
  }
}
