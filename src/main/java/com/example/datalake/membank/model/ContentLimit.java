package com.example.datalake.membank.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;

/**
 * Caller supplied override for the truncation limit. Either the strategy default, no
 * truncation at all, or an explicit positive character count.
 */
@EqualsAndHashCode
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class ContentLimit {

  /** Outer surfaces use this value to ask for full content. */
  public static final int UNLIMITED_SENTINEL = 0;

  private static final ContentLimit STRATEGY_DEFAULT = new ContentLimit(false, null);
  private static final ContentLimit UNLIMITED = new ContentLimit(true, null);

  private final boolean explicit;
  private final Integer chars;

  public static ContentLimit strategyDefault() {
    return STRATEGY_DEFAULT;
  }

  public static ContentLimit unlimited() {
    return UNLIMITED;
  }

  public static ContentLimit of(int chars) {
    if (chars < 0) {
      throw new IllegalArgumentException("content limit must not be negative: " + chars);
    }
    return chars == UNLIMITED_SENTINEL ? UNLIMITED : new ContentLimit(true, chars);
  }

  /** Maps a nullable request field: absent means strategy default, 0 means unlimited. */
  public static ContentLimit fromRequest(Integer maxContentLength) {
    return maxContentLength == null ? STRATEGY_DEFAULT : of(maxContentLength);
  }

  public boolean isExplicit() {
    return explicit;
  }

  public boolean isUnlimited() {
    return explicit && chars == null;
  }

  /** Explicit limit, or null when unlimited or strategy default. */
  public Integer chars() {
    return chars;
  }

  /** Inverse of {@link #fromRequest(Integer)}. */
  public Integer toRequestValue() {
    if (!explicit) {
      return null;
    }
    return chars == null ? UNLIMITED_SENTINEL : chars;
  }

  @Override
  public String toString() {
    if (!explicit) {
      return "strategy-default";
    }
    return chars == null ? "unlimited" : chars + " chars";
  }
}
