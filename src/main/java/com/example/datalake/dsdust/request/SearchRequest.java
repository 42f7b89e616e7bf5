package com.example.datalake.dsdust.request;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.Accessors;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Accessors(chain = true, fluent = false)
public class SearchRequest {
  @Builder.Default private List<String> keywords = new ArrayList<>();
  @Builder.Default private List<String> tags = new ArrayList<>();
  @Builder.Default private List<String> fileTypes = new ArrayList<>();
  @Builder.Default private List<String> columnKeywords = new ArrayList<>();

  /** Cap on the ranked result; defaults from configuration when absent. */
  private Integer maxResults;
  /** Records kept from each concrete catalog query. */
  private Integer perQueryLimit;

  public int dimensionCount() {
    int n = 0;
    if (!isEmpty(keywords)) n++;
    if (!isEmpty(tags)) n++;
    if (!isEmpty(fileTypes)) n++;
    if (!isEmpty(columnKeywords)) n++;
    return n;
  }

  private static boolean isEmpty(List<String> terms) {
    return terms == null || terms.isEmpty();
  }
}
