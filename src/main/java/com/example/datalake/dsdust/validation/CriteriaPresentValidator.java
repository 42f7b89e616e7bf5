package com.example.datalake.dsdust.validation;

import org.springframework.stereotype.Component;

/** Rejects a search in which every dimension is empty. */
@Component
public class CriteriaPresentValidator implements Validator {

  static final String MESSAGE =
      "At least one of keywords, tags, fileTypes or columnKeywords must be provided.";

  @Override
  public ValidationStage stage() {
    return ValidationStage.REQUIRE;
  }

  @Override
  public void validate(ValidationContext context) {
    if (context.getRequest().dimensionCount() == 0) {
      throw new ValidationException(MESSAGE);
    }
  }
}
