package com.example.datalake.membank.validation;

import com.example.datalake.membank.config.RetrievalProperties;
import com.example.datalake.membank.model.QueryType;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/** Blocks statements that modify the store unless writes are explicitly enabled. */
@Component
public class ReadOnlyQueryValidator implements Validator {

  private final boolean allowWrites;

  @Autowired
  public ReadOnlyQueryValidator(RetrievalProperties properties) {
    this(properties.getQuery().isAllowWrites());
  }

  public ReadOnlyQueryValidator(boolean allowWrites) {
    this.allowWrites = allowWrites;
  }

  @Override
  public int order() {
    return 20;
  }

  @Override
  public void validate(ValidationContext context) {
    if (allowWrites) {
      return;
    }
    QueryType type = QueryType.detect(context.getProcessedQuery());
    if (!type.isReading()) {
      throw new ValidationException(
          "Only read queries are accepted (got " + type + "). Enable membank.query.allow-writes to run it.");
    }
  }
}
