package com.example.datalake.membank.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.datalake.membank.model.QueryIntent;
import com.example.datalake.membank.model.ResultRow;
import com.example.datalake.membank.model.TruncatedField;
import com.example.datalake.membank.model.TruncatedRow;
import com.example.datalake.membank.model.TruncationPolicy;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class TruncationEngineTest {

  private final TruncationEngine engine = new TruncationEngine();

  @Test
  void cutsAtPrecedingWhitespaceAndAppendsMarker() {
    String out = engine.truncate("The quick brown fox jumps over the lazy dog", 12);

    assertThat(out).isEqualTo("The quick...");
  }

  @Test
  void hardCutsWhenNoWhitespaceBeforeLimit() {
    String out = engine.truncate("abcdefghijklmnopqrstuvwxyz", 10);

    assertThat(out).isEqualTo("abcdefghij...");
  }

  @Test
  void keepsWordThatEndsExactlyAtLimit() {
    String out = engine.truncate("alpha beta gamma", 10);

    assertThat(out).isEqualTo("alpha beta...");
  }

  @Test
  void valueWithinLimitIsUnchanged() {
    TruncatedField field = engine.truncate("content", "short text", 10);

    assertThat(field.isWasTruncated()).isFalse();
    assertThat(field.getRenderedValue()).isEqualTo("short text");
    assertThat(field.getOriginalLength()).isEqualTo(10);
  }

  @Test
  void nullOrZeroLimitDisablesTruncation() {
    String text = "x".repeat(5000);

    assertThat(engine.truncate(text, null)).isSameAs(text);
    assertThat(engine.truncate(text, 0)).isSameAs(text);
  }

  @Test
  void truncationIsIdempotentAtSameLimit() {
    String text = "word ".repeat(200);

    String once = engine.truncate(text, 50);
    String twice = engine.truncate(once, 50);

    assertThat(twice).isEqualTo(once);
  }

  @Test
  void renderedLengthNeverExceedsLimitPlusMarker() {
    String text = "lorem ipsum dolor sit amet ".repeat(60);
    for (int limit = 1; limit < 200; limit += 7) {
      TruncatedField field = engine.truncate("content", text, limit);
      assertThat(field.isWasTruncated()).isTrue();
      assertThat(field.getRenderedValue().length()).isLessThanOrEqualTo(limit + TruncationEngine.MARKER.length());
      assertThat(field.getRenderedValue()).endsWith(TruncationEngine.MARKER);
    }
  }

  @Test
  void neverSplitsSurrogatePair() {
    // each emoji is two chars; a cut at 5 would land inside the third one
    String text = "😀😀😀😀😀😀";

    String out = engine.truncate(text, 5);

    String body = out.substring(0, out.length() - TruncationEngine.MARKER.length());
    assertThat(body).isEqualTo("😀😀");
    assertThat(Character.isHighSurrogate(body.charAt(body.length() - 1))).isFalse();
  }

  @Test
  void contentFocusedRowKeepsAtMost403Chars() {
    String content = ("Deployment notes for the staging cluster and its rollout plan. ").repeat(20).substring(0, 1200);
    Map<String, Object> values = new LinkedHashMap<>();
    values.put("uuid", "abc123");
    values.put("content", content);
    values.put("views", 42);
    TruncationPolicy policy = TruncationPolicy.builder()
        .strategy(QueryIntent.CONTENT_FOCUSED)
        .limit(400)
        .reason("test")
        .build();

    TruncatedRow row = engine.truncateRow(ResultRow.of(values), policy);

    assertThat(row.isTruncated()).isTrue();
    assertThat(row.getTruncatedFields()).singleElement().satisfies(f -> {
      assertThat(f.getColumn()).isEqualTo("content");
      assertThat(f.getOriginalLength()).isEqualTo(1200);
      assertThat(f.getRenderedValue().length()).isLessThanOrEqualTo(403);
    });
    assertThat(row.getValues().get("uuid")).isEqualTo("abc123");
    assertThat(row.getValues().get("views")).isEqualTo(42);
  }

  @Test
  void unlimitedPolicyReturnsContentUnchanged() {
    String content = "z".repeat(1200);
    TruncationPolicy policy = TruncationPolicy.builder()
        .strategy(QueryIntent.CONTENT_FOCUSED)
        .limit(null)
        .reason("Caller requested full content")
        .build();

    TruncatedRow row = engine.truncateRow(ResultRow.of(Map.of("content", content)), policy);

    assertThat(row.isTruncated()).isFalse();
    assertThat(row.getValues().get("content")).isSameAs(content);
  }
}
