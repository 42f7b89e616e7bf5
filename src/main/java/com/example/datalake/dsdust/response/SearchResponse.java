package com.example.datalake.dsdust.response;

import com.example.datalake.dsdust.model.CollectionStats;
import com.example.datalake.dsdust.model.DatasetRecord;
import com.example.datalake.dsdust.model.QueryFailure;
import com.example.datalake.dsdust.model.SearchReport;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchResponse {
  private int total;
  @Builder.Default private List<DatasetRecord> datasets = new ArrayList<>();
  @Builder.Default private List<QueryFailure> failures = new ArrayList<>();
  @Builder.Default private List<String> notices = new ArrayList<>();
  @Builder.Default private List<String> errors = new ArrayList<>();
  private CollectionStats stats;
  private boolean cancelled;

  public static SearchResponse of(SearchReport report) {
    return SearchResponse.builder()
        .total(report.getDatasets().size())
        .datasets(new ArrayList<>(report.getDatasets()))
        .failures(new ArrayList<>(report.getFailures()))
        .notices(new ArrayList<>(report.getNotices()))
        .stats(report.getStats())
        .cancelled(report.isCancelled())
        .build();
  }

  public static SearchResponse error(String message) {
    return errors(List.of(message));
  }

  public static SearchResponse errors(List<String> messages) {
    return SearchResponse.builder().errors(new ArrayList<>(messages)).build();
  }
}
