package com.example.datalake.dsdust.catalog;

import com.example.datalake.dsdust.model.CatalogPage;
import com.example.datalake.dsdust.model.FileInfo;

import java.util.List;

/**
 * Remote dataset catalog. Both calls are idempotent and side-effect free; failures surface as
 * {@link RateLimitedException}, {@link TransientCatalogException} or {@link FatalCatalogException}.
 */
public interface DatasetCatalogClient {

  /**
   * Lists one page of datasets.
   *
   * @param query free-text search, may be empty when only a file type is given
   * @param page 1-based page number
   * @param fileType optional file-type filter, {@code null} for none
   */
  CatalogPage list(String query, int page, String fileType);

  List<FileInfo> listFiles(String reference);
}
