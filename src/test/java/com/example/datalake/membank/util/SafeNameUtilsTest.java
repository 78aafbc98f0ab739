package com.example.datalake.membank.util;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class SafeNameUtilsTest {

  @Test
  void slugsTitleAndKey() {
    assertThat(SafeNameUtils.safeName("Release Plan v2 (final)", "ABC-123-xyz"))
        .isEqualTo("release_plan_v2_final_abc_123");
  }

  @Test
  void emptyPartsGetPlaceholders() {
    assertThat(SafeNameUtils.safeName("!!!", null)).isEqualTo("untitled_unknown");
    assertThat(SafeNameUtils.safeName(null, "abc")).isEqualTo("untitled_abc");
  }

  @Test
  void titlePartIsCappedWithoutTrailingSeparator() {
    String title = "a".repeat(49) + " tail that is cut off";

    String name = SafeNameUtils.safeName(title, "k1");

    assertThat(name).isEqualTo("a".repeat(49) + "_k1");
  }
}
