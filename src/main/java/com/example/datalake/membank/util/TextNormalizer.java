package com.example.datalake.membank.util;

import java.util.Locale;
import java.util.regex.Pattern;

public final class TextNormalizer {

  private static final Pattern WHITESPACE = Pattern.compile("[\\s\\u00A0]+");

  private TextNormalizer() {}

  /** Lowercase, trimmed, with every whitespace run collapsed to one space. Null becomes "". */
  public static String normalizeTitle(String s) {
    if (s == null) {
      return "";
    }
    return WHITESPACE.matcher(s).replaceAll(" ").trim().toLowerCase(Locale.ROOT);
  }
}
