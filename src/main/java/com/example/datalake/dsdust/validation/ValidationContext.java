package com.example.datalake.dsdust.validation;

import com.example.datalake.dsdust.request.SearchRequest;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Carries a working copy of the search request through the validators. The caller's request is
 * never mutated; validators rewrite the copy and attach notices for the response.
 */
public class ValidationContext {

  private final SearchRequest original;
  private SearchRequest request;
  private final List<String> notices = new ArrayList<>();

  public ValidationContext(SearchRequest original) {
    this.original = original;
    this.request = original == null ? new SearchRequest() : original.toBuilder().build();
  }

  public SearchRequest getOriginal() {
    return original;
  }

  public SearchRequest getRequest() {
    return request;
  }

  public void setRequest(SearchRequest request) {
    this.request = request;
  }

  public void addNotice(String notice) {
    notices.add(Objects.requireNonNull(notice, "notice"));
  }

  public List<String> getNotices() {
    return Collections.unmodifiableList(notices);
  }
}
