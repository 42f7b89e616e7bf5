package com.example.datalake.dsdust.support;

import com.example.datalake.dsdust.catalog.DatasetCatalogClient;
import com.example.datalake.dsdust.model.CatalogPage;
import com.example.datalake.dsdust.model.FileInfo;
import com.example.datalake.dsdust.model.RawDatasetRecord;
import com.example.datalake.dsdust.model.Tag;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Scripted catalog. Pages are keyed by query text, or by {@code "filetype:<type>"} for pure
 * file-type queries; anything unscripted falls back to {@link #defaultPages(Function)}.
 */
public class StubCatalogClient implements DatasetCatalogClient {

  private final Map<String, List<CatalogPage>> pages = new HashMap<>();
  private final Map<String, Deque<RuntimeException>> listFailures = new HashMap<>();
  private final Map<String, List<FileInfo>> files = new HashMap<>();
  private final Map<String, RuntimeException> fileFailures = new HashMap<>();
  private final List<String> listCalls = new ArrayList<>();
  private final List<String> fileCalls = new ArrayList<>();
  private Function<String, List<CatalogPage>> fallback = key -> List.of();
  private Runnable onList = () -> {};

  public static RawDatasetRecord raw(String ref, String title) {
    return RawDatasetRecord.builder()
        .ref(ref)
        .title(title)
        .description("")
        .totalBytes(1_000L)
        .lastUpdated("2024-01-01")
        .downloadCount(0L)
        .voteCount(0L)
        .usabilityRating(0.0)
        .files(new ArrayList<>())
        .build();
  }

  public static RawDatasetRecord raw(String ref, String title, long votes, String... tags) {
    RawDatasetRecord r = raw(ref, title);
    r.setVoteCount(votes);
    r.setTags(new ArrayList<>(Arrays.stream(tags).map(Tag::of).toList()));
    return r;
  }

  public static CatalogPage page(RawDatasetRecord... records) {
    return new CatalogPage(List.of(records));
  }

  public StubCatalogClient pages(String key, CatalogPage... scripted) {
    pages.put(key, List.of(scripted));
    return this;
  }

  public StubCatalogClient defaultPages(Function<String, List<CatalogPage>> fallback) {
    this.fallback = fallback;
    return this;
  }

  public StubCatalogClient failList(String key, RuntimeException... errors) {
    listFailures.computeIfAbsent(key, k -> new ArrayDeque<>()).addAll(List.of(errors));
    return this;
  }

  public StubCatalogClient files(String ref, FileInfo... listing) {
    files.put(ref, List.of(listing));
    return this;
  }

  public StubCatalogClient failFiles(String ref, RuntimeException error) {
    fileFailures.put(ref, error);
    return this;
  }

  public StubCatalogClient onList(Runnable hook) {
    this.onList = hook;
    return this;
  }

  @Override
  public synchronized CatalogPage list(String query, int page, String fileType) {
    String key = fileType == null ? query : "filetype:" + fileType;
    listCalls.add(key + "#" + page);
    onList.run();
    Deque<RuntimeException> failures = listFailures.get(key);
    if (failures != null && !failures.isEmpty()) {
      throw failures.poll();
    }
    List<CatalogPage> scripted = pages.containsKey(key) ? pages.get(key) : fallback.apply(key);
    return page - 1 < scripted.size() ? scripted.get(page - 1) : CatalogPage.empty();
  }

  @Override
  public synchronized List<FileInfo> listFiles(String reference) {
    fileCalls.add(reference);
    RuntimeException error = fileFailures.get(reference);
    if (error != null) {
      throw error;
    }
    return files.getOrDefault(reference, List.of());
  }

  public synchronized List<String> listCalls() {
    return List.copyOf(listCalls);
  }

  public synchronized List<String> fileCalls() {
    return List.copyOf(fileCalls);
  }
}
