package com.example.datalake.membank.validation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class NotBlankQueryValidatorTest {

  private final NotBlankQueryValidator validator = new NotBlankQueryValidator();

  @Test
  void shouldRejectBlankQuery() {
    ValidationContext context = new ValidationContext("   ", null);

    assertThatThrownBy(() -> validator.validate(context))
        .isInstanceOf(ValidationException.class)
        .hasMessageContaining("must not be blank");
  }

  @Test
  void shouldStripSurroundingWhitespace() {
    ValidationContext context = new ValidationContext("  SELECT 1 \n", null);

    validator.validate(context);

    assertThat(context.getProcessedQuery()).isEqualTo("SELECT 1");
  }
}
