package com.example.datalake.dsdust.fetch;

import com.example.datalake.dsdust.model.RawDatasetRecord;

import java.util.List;

/**
 * Records gathered for one query.
 *
 * @param fetches number of page requests that completed
 * @param cancelled whether the run stopped early because the search was cancelled
 */
public record Accumulation(List<RawDatasetRecord> records, int fetches, boolean cancelled) {

  public Accumulation {
    records = List.copyOf(records);
  }
}
