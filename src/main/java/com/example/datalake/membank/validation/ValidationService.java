package com.example.datalake.membank.validation;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import org.springframework.stereotype.Service;

/**
 * Coordinates all registered {@link Validator} beans and executes them in order for an incoming
 * query request.
 */
@Service
public class ValidationService {

  private final List<Validator> orderedValidators;

  public ValidationService(List<Validator> validators) {
    List<Validator> safeValidators = validators == null ? List.of() : validators;
    this.orderedValidators = safeValidators.stream()
        .filter(Objects::nonNull)
        .sorted(Comparator.comparingInt(Validator::order))
        .toList();
  }

  public ValidationContext validate(String rawQuery, Integer maxContentLength) {
    ValidationContext context = new ValidationContext(rawQuery, maxContentLength);
    for (Validator validator : orderedValidators) {
      validator.validate(context);
    }
    return context;
  }
}
