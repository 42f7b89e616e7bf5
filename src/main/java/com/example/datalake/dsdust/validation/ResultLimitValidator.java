package com.example.datalake.dsdust.validation;

import com.example.datalake.dsdust.config.SearchProperties;
import com.example.datalake.dsdust.request.SearchRequest;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/** Fills in default result caps and clamps oversized ones to the configured maximum. */
@Component
public class ResultLimitValidator implements Validator {

  private final int defaultMaxResults;
  private final int maxResultsLimit;
  private final int defaultPerQueryLimit;

  @Autowired
  public ResultLimitValidator(SearchProperties props) {
    this(props.getDefaultMaxResults(), props.getMaxResultsLimit(), props.getDefaultPerQueryLimit());
  }

  public ResultLimitValidator(int defaultMaxResults, int maxResultsLimit, int defaultPerQueryLimit) {
    if (defaultMaxResults <= 0 || maxResultsLimit <= 0 || defaultPerQueryLimit <= 0) {
      throw new IllegalArgumentException("result limits must be positive");
    }
    this.defaultMaxResults = Math.min(defaultMaxResults, maxResultsLimit);
    this.maxResultsLimit = maxResultsLimit;
    this.defaultPerQueryLimit = defaultPerQueryLimit;
  }

  @Override
  public ValidationStage stage() {
    return ValidationStage.LIMITS;
  }

  @Override
  public void validate(ValidationContext context) {
    SearchRequest request = context.getRequest();
    Integer max = request.getMaxResults();
    if (max == null || max <= 0) {
      request.setMaxResults(defaultMaxResults);
    } else if (max > maxResultsLimit) {
      request.setMaxResults(maxResultsLimit);
      context.addNotice(String.format(
          "maxResults reduced from %d to %d to respect the catalog request budget.", max, maxResultsLimit));
    }
    Integer perQuery = request.getPerQueryLimit();
    if (perQuery == null || perQuery <= 0) {
      request.setPerQueryLimit(defaultPerQueryLimit);
    }
  }
}
