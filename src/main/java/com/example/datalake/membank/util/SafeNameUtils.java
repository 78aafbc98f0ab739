package com.example.datalake.membank.util;

import java.util.Locale;
import java.util.regex.Pattern;

/** Filesystem-safe names for extracted records. */
public final class SafeNameUtils {

  public static final int MAX_TITLE_CHARS = 50;
  public static final int KEY_CHARS = 8;

  private static final Pattern NON_ALNUM_RUN = Pattern.compile("[^a-z0-9]+");

  private SafeNameUtils() {}

  /**
   * Lowercase slug of the title (at most {@value #MAX_TITLE_CHARS} characters, {@code untitled}
   * when nothing survives) followed by the first {@value #KEY_CHARS} slug characters of the key.
   */
  public static String safeName(String title, String key) {
    String titlePart = slug(title, MAX_TITLE_CHARS);
    if (titlePart.isEmpty()) {
      titlePart = "untitled";
    }
    String keyPart = slug(key, KEY_CHARS);
    if (keyPart.isEmpty()) {
      keyPart = "unknown";
    }
    return titlePart + "_" + keyPart;
  }

  public static String slug(String raw, int maxChars) {
    if (raw == null) {
      return "";
    }
    String lower = raw.toLowerCase(Locale.ROOT);
    String collapsed = NON_ALNUM_RUN.matcher(lower).replaceAll("_");
    String trimmed = trimSeparators(collapsed);
    if (trimmed.length() > maxChars) {
      trimmed = trimSeparators(trimmed.substring(0, maxChars));
    }
    return trimmed;
  }

  private static String trimSeparators(String s) {
    int start = 0;
    int end = s.length();
    while (start < end && s.charAt(start) == '_') start++;
    while (end > start && s.charAt(end - 1) == '_') end--;
    return s.substring(start, end);
  }
}
