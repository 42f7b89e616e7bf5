package com.example.datalake.dsdust.fetch;

import com.example.datalake.dsdust.catalog.CatalogException;
import com.example.datalake.dsdust.model.CatalogPage;
import com.example.datalake.dsdust.model.FileInfo;
import com.example.datalake.dsdust.model.RawDatasetRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Walks catalog pages from 1 upward until an empty page, or until {@code maxPages} pages when
 * bounded. Optionally fetches file listings for the first {@code fileDetailsPerPage} records of each
 * page; a failed listing leaves that record with no file details.
 */
@Slf4j
@RequiredArgsConstructor
public class PaginatedAccumulator {

  /** Pass as {@code fileDetailsPerPage} to enrich every record. */
  public static final int ALL_RECORDS = -1;

  private final RateLimitedFetcher fetcher;

  public Accumulation fetchAll(String query, String fileType) {
    return fetchAll(query, fileType, 0, 0, SearchCancellation.create());
  }

  /**
   * @param maxPages page cap, {@code <= 0} for unbounded
   * @param fileDetailsPerPage records per page to enrich, {@link #ALL_RECORDS} for all, 0 for none
   * @throws CatalogException when a page cannot be fetched; the query is then abandoned whole
   */
  public Accumulation fetchAll(String query, String fileType, int maxPages, int fileDetailsPerPage,
                               SearchCancellation cancellation) {
    List<RawDatasetRecord> out = new ArrayList<>();
    int fetches = 0;
    int page = 1;
    while (maxPages <= 0 || page <= maxPages) {
      if (cancellation.isCancelled()) {
        log.info("Search cancelled before page {} of '{}'; keeping {} records", page, query, out.size());
        return new Accumulation(out, fetches, true);
      }
      CatalogPage result;
      try {
        result = fetcher.fetch(query, page, fileType);
      } catch (SearchCancelledException e) {
        return new Accumulation(out, fetches, true);
      }
      fetches++;
      if (result.isEmpty()) {
        break;
      }
      List<RawDatasetRecord> records = new ArrayList<>(result.records());
      try {
        enrich(records, fileDetailsPerPage, cancellation);
      } catch (SearchCancelledException e) {
        out.addAll(records);
        return new Accumulation(out, fetches, true);
      }
      out.addAll(records);
      page++;
    }
    log.debug("'{}' exhausted after {} page requests, {} records", query, fetches, out.size());
    return new Accumulation(out, fetches, false);
  }

  private void enrich(List<RawDatasetRecord> records, int perPage, SearchCancellation cancellation) {
    if (perPage == 0) {
      return;
    }
    int limit = perPage < 0 ? records.size() : Math.min(perPage, records.size());
    for (int i = 0; i < limit; i++) {
      if (cancellation.isCancelled()) {
        throw new SearchCancelledException("Cancelled during file enrichment");
      }
      RawDatasetRecord record = records.get(i);
      if (record.getFiles() != null && !record.getFiles().isEmpty()) {
        continue;
      }
      try {
        List<FileInfo> files = fetcher.fetchFiles(record.getRef());
        record.setFiles(new ArrayList<>(files));
      } catch (CatalogException e) {
        log.warn("File listing for {} unavailable: {}", record.getRef(), e.getMessage());
        record.setFiles(new ArrayList<>());
      }
    }
  }
}
