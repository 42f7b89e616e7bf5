package com.example.datalake.dsdust.validation;

import java.util.List;
import java.util.Objects;

/** The search request cannot be run as given. Never retried. */
public class ValidationException extends RuntimeException {

  private final List<String> reasons;

  public ValidationException(String message) {
    super(Objects.requireNonNull(message, "message"));
    this.reasons = List.of(message);
  }

  public ValidationException(List<String> reasons) {
    super(String.join("; ", requireReasons(reasons)));
    this.reasons = List.copyOf(reasons);
  }

  public List<String> getReasons() {
    return reasons;
  }

  private static List<String> requireReasons(List<String> reasons) {
    Objects.requireNonNull(reasons, "reasons");
    if (reasons.isEmpty() || reasons.stream().anyMatch(Objects::isNull)) {
      throw new IllegalArgumentException("reasons must be non-empty and free of nulls");
    }
    return reasons;
  }
}
