package com.example.datalake.membank.validation;

import com.example.datalake.membank.model.ContentLimit;
import org.springframework.stereotype.Component;

/** Ensures an explicit content limit is either the unlimited sentinel or positive. */
@Component
public class ContentLimitValidator implements Validator {

  @Override
  public int order() {
    return 10;
  }

  @Override
  public void validate(ValidationContext context) {
    Integer limit = context.getMaxContentLength();
    if (limit == null) {
      return;
    }
    if (limit < 0) {
      throw new ValidationException(
          "maxContentLength must be positive, or " + ContentLimit.UNLIMITED_SENTINEL + " for full content.");
    }
    if (limit == ContentLimit.UNLIMITED_SENTINEL) {
      context.addNotice("Truncation disabled; full content returned.");
    }
  }
}
