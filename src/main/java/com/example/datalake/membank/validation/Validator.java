package com.example.datalake.membank.validation;

/** Contract for checks executed before a query reaches storage. */
public interface Validator {

  /** Lower values run first. */
  default int order() {
    return 0;
  }

  /** Applies the validation logic and optionally mutates the provided context. */
  void validate(ValidationContext context);
}
