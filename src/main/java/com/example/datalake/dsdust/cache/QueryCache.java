package com.example.datalake.dsdust.cache;

import com.example.datalake.dsdust.model.RawDatasetRecord;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Process-lifetime LRU cache of completed query results, keyed by normalized query. Only full
 * fetches are stored; cancelled or failed queries are never cached. Records are copied on the way
 * in and out, so callers may mutate what they get back.
 */
@Slf4j
public class QueryCache {

  private final int capacity;
  private final Map<String, List<RawDatasetRecord>> entries;
  private long hits;
  private long misses;

  public QueryCache(int capacity) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be positive");
    }
    this.capacity = capacity;
    this.entries = new LinkedHashMap<>(16, 0.75f, true) {
      @Override
      protected boolean removeEldestEntry(Map.Entry<String, List<RawDatasetRecord>> eldest) {
        boolean evict = size() > QueryCache.this.capacity;
        if (evict) {
          log.debug("Evicting cached query '{}'", eldest.getKey());
        }
        return evict;
      }
    };
  }

  public synchronized Optional<List<RawDatasetRecord>> get(String key) {
    List<RawDatasetRecord> value = key == null ? null : entries.get(key);
    if (value == null) {
      misses++;
      return Optional.empty();
    }
    hits++;
    return Optional.of(snapshot(value));
  }

  public synchronized void put(String key, List<RawDatasetRecord> records) {
    if (key == null || records == null) {
      return;
    }
    entries.put(key, snapshot(records));
  }

  private static List<RawDatasetRecord> snapshot(List<RawDatasetRecord> records) {
    return records.stream().filter(Objects::nonNull).map(RawDatasetRecord::copy).toList();
  }

  public synchronized int size() {
    return entries.size();
  }

  public synchronized long hits() {
    return hits;
  }

  public synchronized long misses() {
    return misses;
  }
}
