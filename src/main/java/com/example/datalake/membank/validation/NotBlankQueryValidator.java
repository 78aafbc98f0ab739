package com.example.datalake.membank.validation;

import org.springframework.stereotype.Component;

/** Rejects null or blank query text and strips surrounding whitespace. */
@Component
public class NotBlankQueryValidator implements Validator {

  @Override
  public int order() {
    return 0;
  }

  @Override
  public void validate(ValidationContext context) {
    String rawQuery = context.getRawQuery();
    if (rawQuery == null || rawQuery.trim().isEmpty()) {
      throw new ValidationException("Query text must not be blank.");
    }
    context.setProcessedQuery(rawQuery.strip());
  }
}
