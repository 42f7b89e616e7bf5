package com.example.datalake.dsdust.response;

import com.example.datalake.dsdust.model.DatasetRecord;

/** Title and reference only, as listed by the quick keyword search. */
public record DatasetSummary(String title, String reference) {

  public static DatasetSummary of(DatasetRecord record) {
    return new DatasetSummary(record.getTitle(), record.getReference());
  }
}
