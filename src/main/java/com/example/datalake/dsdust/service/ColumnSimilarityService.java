package com.example.datalake.dsdust.service;

import com.example.datalake.dsdust.column.IdentifierColumnFilter;
import com.example.datalake.dsdust.column.SchemaReadException;
import com.example.datalake.dsdust.column.SchemaReader;
import com.example.datalake.dsdust.column.TabularSchema;
import com.example.datalake.dsdust.column.UploadedTable;
import com.example.datalake.dsdust.config.SearchProperties;
import com.example.datalake.dsdust.fetch.SearchCancellation;
import com.example.datalake.dsdust.fetch.Sleeper;
import com.example.datalake.dsdust.model.CollectionStats;
import com.example.datalake.dsdust.model.DatasetRecord;
import com.example.datalake.dsdust.model.QueryFailure;
import com.example.datalake.dsdust.model.SearchReport;
import com.example.datalake.dsdust.model.SortKey;
import com.example.datalake.dsdust.ranking.DatasetRanker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.ByteArrayInputStream;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Finds datasets that look like the caller's own tables: reads each file's header, drops
 * identifier-like columns, and runs a column search per remaining column name.
 *
 * <p>Unreadable files are skipped with a notice. Column searches are spaced by the configured
 * inter-column delay because each one fans out into several catalog queries.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ColumnSimilarityService {

  private final DatasetSearchService searchService;
  private final SchemaReader schemaReader;
  private final IdentifierColumnFilter columnFilter;
  private final DatasetRanker ranker;
  private final SearchProperties props;
  private final Sleeper sleeper;

  public SearchReport findSimilar(List<UploadedTable> tables, Integer maxResults, SearchCancellation cancellation) {
    SearchCancellation token = cancellation == null ? SearchCancellation.create() : cancellation;
    List<String> notices = new ArrayList<>();
    int cap = clampCap(maxResults, notices);

    List<TabularSchema> schemas = new ArrayList<>();
    for (UploadedTable table : tables == null ? List.<UploadedTable>of() : tables) {
      try {
        schemas.add(schemaReader.read(table.filename(), new ByteArrayInputStream(table.content())));
      } catch (SchemaReadException e) {
        log.warn("Skipping {}: {}", e.getSource(), e.getMessage());
        notices.add("Skipped " + e.getSource() + ": " + e.getMessage());
      }
    }
    return searchSchemas(schemas, cap, notices, token);
  }

  SearchReport searchSchemas(List<TabularSchema> schemas, int cap, List<String> notices, SearchCancellation token) {
    List<DatasetRecord> found = new ArrayList<>();
    List<QueryFailure> failures = new ArrayList<>();
    CollectionStats stats = new CollectionStats();
    boolean cancelled = false;
    int searched = 0;

    outer:
    for (TabularSchema schema : schemas) {
      List<String> columns = columnFilter.contentColumns(schema.columns());
      if (columns.isEmpty()) {
        notices.add("No searchable columns in " + schema.source());
        continue;
      }
      log.info("Searching {} content columns of {}", columns.size(), schema.source());
      for (String column : columns) {
        if (token.isCancelled()) {
          cancelled = true;
          break outer;
        }
        if (searched > 0 && !pause(props.getInterColumnDelay())) {
          cancelled = true;
          break outer;
        }
        SearchReport report = searchService.searchByColumns(List.of(column), -1,
            props.getDefaultPerQueryLimit(), token);
        searched++;
        found.addAll(report.getDatasets());
        failures.addAll(report.getFailures());
        stats.merge(report.getStats());
        if (report.isCancelled()) {
          cancelled = true;
          break outer;
        }
      }
    }

    List<DatasetRecord> unique = ranker.dedupeByTitleAndReference(found);
    List<DatasetRecord> ranked = ranker.dedupeAndRank(unique, SortKey.SCORE, cap);
    log.info("Column similarity: {} columns searched, {} datasets", searched, ranked.size());
    return SearchReport.builder()
        .datasets(ranked)
        .failures(failures)
        .notices(notices)
        .stats(stats)
        .cancelled(cancelled)
        .build();
  }

  private boolean pause(Duration delay) {
    if (delay == null || delay.isZero() || delay.isNegative()) {
      return true;
    }
    try {
      sleeper.sleep(delay);
      return true;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  private int clampCap(Integer requested, List<String> notices) {
    if (requested == null || requested <= 0) {
      return props.getDefaultMaxResults();
    }
    if (requested > props.getMaxResultsLimit()) {
      notices.add(String.format("maxResults reduced from %d to %d to respect the catalog request budget.",
          requested, props.getMaxResultsLimit()));
      return props.getMaxResultsLimit();
    }
    return requested;
  }
}
