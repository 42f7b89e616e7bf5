package com.example.datalake.dsdust.service;

import com.example.datalake.dsdust.cache.QueryCache;
import com.example.datalake.dsdust.catalog.CatalogException;
import com.example.datalake.dsdust.catalog.MalformedRecordException;
import com.example.datalake.dsdust.config.SearchProperties;
import com.example.datalake.dsdust.expand.QueryExpander;
import com.example.datalake.dsdust.expand.TagTaxonomy;
import com.example.datalake.dsdust.fetch.Accumulation;
import com.example.datalake.dsdust.fetch.PaginatedAccumulator;
import com.example.datalake.dsdust.fetch.SearchCancellation;
import com.example.datalake.dsdust.fetch.Sleeper;
import com.example.datalake.dsdust.ingest.RecordNormalizer;
import com.example.datalake.dsdust.model.CollectionStats;
import com.example.datalake.dsdust.model.DatasetRecord;
import com.example.datalake.dsdust.model.ExpandedQuery;
import com.example.datalake.dsdust.model.IntentKind;
import com.example.datalake.dsdust.model.QueryFailure;
import com.example.datalake.dsdust.model.RawDatasetRecord;
import com.example.datalake.dsdust.model.SearchIntent;
import com.example.datalake.dsdust.model.SearchReport;
import com.example.datalake.dsdust.model.SortKey;
import com.example.datalake.dsdust.ranking.DatasetRanker;
import com.example.datalake.dsdust.request.SearchRequest;
import com.example.datalake.dsdust.scoring.RelevanceScorer;
import com.example.datalake.dsdust.util.CacheKeyUtils;
import com.example.datalake.dsdust.validation.ValidationContext;
import com.example.datalake.dsdust.validation.ValidationException;
import com.example.datalake.dsdust.validation.ValidationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Aggregates catalog searches: expands each intent into concrete queries, fetches them through the
 * cache and paced fetcher, normalizes and scores the hits, then dedupes and ranks the union.
 *
 * <p>A query whose pages cannot be fetched is dropped whole and reported as a {@link QueryFailure};
 * the remaining queries still contribute. Cancellation keeps whatever was collected so far.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DatasetSearchService {

  static final int COLLECT_KEYWORD_LIMIT = 30;
  static final int COLLECT_TAG_LIMIT = 20;
  static final int COLLECT_FILE_TYPE_LIMIT = 15;
  static final int COLLECT_COLUMN_LIMIT = 10;
  static final List<String> COLLECT_FILE_TYPES = List.of("csv", "json", "xlsx");

  private final QueryExpander expander;
  private final QueryCache cache;
  private final PaginatedAccumulator accumulator;
  private final RecordNormalizer normalizer;
  private final RelevanceScorer scorer;
  private final DatasetRanker ranker;
  private final ValidationService validationService;
  private final SearchProperties props;
  private final Sleeper sleeper;

  /**
   * Validates the request, then runs a single-dimension search when only one dimension is filled
   * in, or a boosted multi-criteria search otherwise.
   *
   * @throws ValidationException when no dimension carries a term
   */
  public SearchReport search(SearchRequest request, SearchCancellation cancellation) {
    ValidationContext ctx = validationService.validate(request);
    SearchRequest r = ctx.getRequest();
    List<SearchIntent> intents = intentsOf(r);

    SearchReport report;
    if (intents.size() == 1) {
      SearchIntent only = intents.get(0);
      report = rank(collect(intents, cancellation), only.getKind().sortKey(), r.getMaxResults());
    } else {
      report = multiCriteria(r, intents, cancellation);
    }
    return report.toBuilder().notices(ctx.getNotices()).build();
  }

  public SearchReport searchByKeywords(List<String> keywords, int maxResults, int perQueryLimit,
                                       SearchCancellation cancellation) {
    return searchDimension(SearchIntent.of(IntentKind.KEYWORD, keywords, perQueryLimit), maxResults, cancellation);
  }

  public SearchReport searchByTags(List<String> tags, int maxResults, int perQueryLimit,
                                   SearchCancellation cancellation) {
    return searchDimension(SearchIntent.of(IntentKind.TAG, tags, perQueryLimit), maxResults, cancellation);
  }

  public SearchReport searchByFileTypes(List<String> fileTypes, int maxResults, int perQueryLimit,
                                        SearchCancellation cancellation) {
    return searchDimension(SearchIntent.of(IntentKind.FILE_TYPE, fileTypes, perQueryLimit), maxResults, cancellation);
  }

  /** @param maxResults cap on the result, negative for none */
  public SearchReport searchByColumns(List<String> columns, int maxResults, int perQueryLimit,
                                      SearchCancellation cancellation) {
    return searchDimension(SearchIntent.of(IntentKind.COLUMN, columns, perQueryLimit), maxResults, cancellation);
  }

  /**
   * Runs every non-empty dimension of an already validated request and ranks the union by score,
   * after adding the cross-dimension boost to each record.
   */
  public SearchReport multiCriteriaSearch(SearchRequest request, SearchCancellation cancellation) {
    ValidationContext ctx = validationService.validate(request);
    SearchRequest r = ctx.getRequest();
    return multiCriteria(r, intentsOf(r), cancellation).toBuilder().notices(ctx.getNotices()).build();
  }

  /**
   * Broad sweep over one domain: keyword and tag searches on the domain name, the common file
   * types, and the columns typical for the domain.
   */
  public SearchReport comprehensiveCollection(String domain, Integer maxTotal, SearchCancellation cancellation) {
    String d = domain == null ? "" : domain.trim().toLowerCase(Locale.ROOT);
    if (d.isEmpty()) {
      throw new ValidationException("domain must not be blank");
    }
    int cap = clampCap(maxTotal);
    log.info("Comprehensive collection for domain '{}' (cap {})", d, cap);
    List<SearchIntent> intents = List.of(
        SearchIntent.of(IntentKind.KEYWORD, List.of(d), COLLECT_KEYWORD_LIMIT),
        SearchIntent.of(IntentKind.TAG, List.of(d), COLLECT_TAG_LIMIT),
        SearchIntent.of(IntentKind.FILE_TYPE, COLLECT_FILE_TYPES, COLLECT_FILE_TYPE_LIMIT),
        SearchIntent.of(IntentKind.COLUMN, TagTaxonomy.domainColumns(d), COLLECT_COLUMN_LIMIT));
    return rank(collect(intents, cancellation), SortKey.SCORE, cap);
  }

  /** Keyword search with configured defaults, for the title/reference listing. */
  public SearchReport quickSearch(String keyword, SearchCancellation cancellation) {
    if (keyword == null || keyword.isBlank()) {
      throw new ValidationException("keyword must not be blank");
    }
    return searchByKeywords(List.of(keyword.trim()), props.getDefaultMaxResults(),
        props.getDefaultPerQueryLimit(), cancellation);
  }

  private SearchReport searchDimension(SearchIntent intent, int maxResults, SearchCancellation cancellation) {
    return rank(collect(List.of(intent), cancellation), intent.getKind().sortKey(), maxResults);
  }

  private SearchReport multiCriteria(SearchRequest r, List<SearchIntent> intents, SearchCancellation cancellation) {
    if (intents.isEmpty()) {
      throw new ValidationException("At least one search dimension is required");
    }
    Run run = collect(intents, cancellation);
    List<DatasetRecord> boosted = new ArrayList<>();
    for (DatasetRecord record : ranker.dedupe(run.records)) {
      double boost = scorer.multiCriteriaBoost(record, r.getKeywords(), r.getTags(), r.getColumnKeywords());
      boosted.add(boost == 0.0 ? record : record.withSearchScore(record.getSearchScore() + boost));
    }
    run.records.clear();
    run.records.addAll(boosted);
    return rank(run, SortKey.SCORE, r.getMaxResults());
  }

  private SearchReport rank(Run run, SortKey sortKey, int maxResults) {
    List<DatasetRecord> ranked = ranker.dedupeAndRank(run.records, sortKey, maxResults);
    log.info("Search finished: {} unique of {} collected, {} failed queries{}",
        ranked.size(), run.records.size(), run.failures.size(), run.cancelled ? " (cancelled)" : "");
    return SearchReport.builder()
        .datasets(ranked)
        .failures(run.failures)
        .stats(run.stats)
        .cancelled(run.cancelled)
        .build();
  }

  private Run collect(List<SearchIntent> intents, SearchCancellation cancellation) {
    Run run = new Run(cancellation == null ? SearchCancellation.create() : cancellation);
    for (SearchIntent intent : intents) {
      for (ExpandedQuery query : expander.expand(intent)) {
        if (run.cancellation.isCancelled()) {
          run.cancelled = true;
          return run;
        }
        if (run.queriesRun > 0) {
          pause(props.getInterQueryDelay(), run);
          if (run.cancelled) {
            return run;
          }
        }
        runQuery(query, intent.getPerQueryLimit(), run);
        run.queriesRun++;
        if (run.cancelled) {
          return run;
        }
      }
    }
    return run;
  }

  private void runQuery(ExpandedQuery query, int perQueryLimit, Run run) {
    String key = CacheKeyUtils.buildKey(query, props.getMaxPages(), props.getFileDetailsPerPage());
    List<RawDatasetRecord> raw = cache.get(key).orElse(null);
    if (raw != null) {
      run.stats.recordCacheHit();
      log.debug("Cache hit for {}", query.describe());
    } else {
      Accumulation acc;
      try {
        acc = accumulator.fetchAll(query.text(), query.fileType(), props.getMaxPages(),
            props.getFileDetailsPerPage(), run.cancellation);
      } catch (CatalogException e) {
        log.warn("Query {} failed: {}", query.describe(), e.getMessage());
        run.failures.add(new QueryFailure(query.describe(), e.getMessage()));
        return;
      }
      raw = acc.records();
      if (acc.cancelled()) {
        run.cancelled = true;
      } else {
        cache.put(key, raw);
      }
    }
    run.stats.recordQuery(query.kind());

    int limit = perQueryLimit <= 0 ? raw.size() : Math.min(perQueryLimit, raw.size());
    int kept = 0;
    for (RawDatasetRecord entry : raw.subList(0, limit)) {
      DatasetRecord record;
      try {
        record = normalizer.normalize(entry, query);
      } catch (MalformedRecordException e) {
        log.warn("Skipping catalog entry from {}: {}", query.describe(), e.getMessage());
        continue;
      }
      if (query.kind() == IntentKind.TAG && props.isStrictTagMatch()
          && !record.getTags().contains(query.scoringTerm().toLowerCase(Locale.ROOT))) {
        continue;
      }
      run.records.add(record);
      kept++;
    }
    run.stats.recordFound(kept);
    log.debug("Query {} -> {} records", query.describe(), kept);
  }

  private void pause(Duration delay, Run run) {
    if (delay == null || delay.isZero() || delay.isNegative()) {
      return;
    }
    try {
      sleeper.sleep(delay);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      run.cancelled = true;
    }
  }

  private int clampCap(Integer requested) {
    if (requested == null || requested <= 0) {
      return props.getDefaultMaxResults();
    }
    return Math.min(requested, props.getMaxResultsLimit());
  }

  private static List<SearchIntent> intentsOf(SearchRequest r) {
    int perQuery = r.getPerQueryLimit() == null ? 0 : r.getPerQueryLimit();
    List<SearchIntent> intents = new ArrayList<>(4);
    addIfPresent(intents, IntentKind.KEYWORD, r.getKeywords(), perQuery);
    addIfPresent(intents, IntentKind.TAG, r.getTags(), perQuery);
    addIfPresent(intents, IntentKind.FILE_TYPE, r.getFileTypes(), perQuery);
    addIfPresent(intents, IntentKind.COLUMN, r.getColumnKeywords(), perQuery);
    return intents;
  }

  private static void addIfPresent(List<SearchIntent> intents, IntentKind kind, List<String> terms, int perQuery) {
    if (terms != null && !terms.isEmpty()) {
      intents.add(SearchIntent.of(kind, terms, perQuery));
    }
  }

  private static final class Run {
    final SearchCancellation cancellation;
    final List<DatasetRecord> records = new ArrayList<>();
    final List<QueryFailure> failures = new ArrayList<>();
    final CollectionStats stats = new CollectionStats();
    int queriesRun;
    boolean cancelled;

    Run(SearchCancellation cancellation) {
      this.cancellation = cancellation;
    }
  }
}
