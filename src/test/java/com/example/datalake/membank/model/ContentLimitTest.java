package com.example.datalake.membank.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class ContentLimitTest {

  @Test
  void zeroMeansUnlimited() {
    ContentLimit limit = ContentLimit.fromRequest(0);

    assertThat(limit.isExplicit()).isTrue();
    assertThat(limit.isUnlimited()).isTrue();
    assertThat(limit.chars()).isNull();
    assertThat(limit.toRequestValue()).isZero();
  }

  @Test
  void absentMeansStrategyDefault() {
    ContentLimit limit = ContentLimit.fromRequest(null);

    assertThat(limit.isExplicit()).isFalse();
    assertThat(limit.toRequestValue()).isNull();
  }

  @Test
  void positiveIsExplicitLimit() {
    ContentLimit limit = ContentLimit.of(250);

    assertThat(limit.chars()).isEqualTo(250);
    assertThat(limit).isEqualTo(ContentLimit.fromRequest(250));
  }

  @Test
  void negativeIsRejected() {
    assertThatThrownBy(() -> ContentLimit.of(-1)).isInstanceOf(IllegalArgumentException.class);
  }
}
