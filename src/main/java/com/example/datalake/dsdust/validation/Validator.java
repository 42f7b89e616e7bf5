package com.example.datalake.dsdust.validation;

/** One step of search request validation. */
public interface Validator {

  ValidationStage stage();

  /** Applies the check, optionally rewriting the request held by {@code context}. */
  void validate(ValidationContext context);
}
