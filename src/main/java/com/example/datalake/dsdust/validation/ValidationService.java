package com.example.datalake.dsdust.validation;

import com.example.datalake.dsdust.request.SearchRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Runs every registered {@link Validator} in stage order against a search request. Rejections
 * raised within one stage are gathered and reported together; later stages never run on a
 * rejected request.
 */
@Slf4j
@Service
public class ValidationService {

  private final List<Validator> orderedValidators;

  public ValidationService(List<Validator> validators) {
    List<Validator> safeValidators = validators == null ? List.of() : validators;
    this.orderedValidators = safeValidators.stream()
        .filter(Objects::nonNull)
        .sorted(Comparator.comparing(Validator::stage))
        .toList();
  }

  public ValidationContext validate(SearchRequest request) {
    ValidationContext context = new ValidationContext(request);
    List<String> rejections = new ArrayList<>();
    ValidationStage current = null;
    for (Validator validator : orderedValidators) {
      if (validator.stage() != current) {
        throwIfRejected(rejections);
        current = validator.stage();
      }
      try {
        validator.validate(context);
      } catch (ValidationException e) {
        rejections.addAll(e.getReasons());
      }
    }
    throwIfRejected(rejections);
    if (!context.getNotices().isEmpty()) {
      log.debug("Search request adjusted: {}", context.getNotices());
    }
    return context;
  }

  private static void throwIfRejected(List<String> rejections) {
    if (!rejections.isEmpty()) {
      throw new ValidationException(rejections);
    }
  }
}
