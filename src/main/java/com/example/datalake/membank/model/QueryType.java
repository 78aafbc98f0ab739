package com.example.datalake.membank.model;

import java.util.Locale;

/** Leading statement keyword of a query, used for diagnostics and the read-only guard. */
public enum QueryType {
  SELECT(true),
  WITH(true),
  PRAGMA(true),
  EXPLAIN(true),
  INSERT(false),
  UPDATE(false),
  DELETE(false),
  CREATE(false),
  DROP(false),
  ALTER(false),
  OTHER(false);

  private final boolean reading;

  QueryType(boolean reading) {
    this.reading = reading;
  }

  public boolean isReading() {
    return reading;
  }

  public static QueryType detect(String query) {
    if (query == null || query.isBlank()) {
      return OTHER;
    }
    String upper = query.strip().toUpperCase(Locale.ROOT);
    for (QueryType type : values()) {
      if (type != OTHER && upper.startsWith(type.name())) {
        return type == WITH ? afterCommonTableExpressions(upper) : type;
      }
    }
    return OTHER;
  }

  /**
   * A WITH clause can prefix writes as well as reads, so the statement type is taken from the
   * first keyword outside the parenthesised CTE bodies.
   */
  private static QueryType afterCommonTableExpressions(String upper) {
    int depth = 0;
    int i = WITH.name().length();
    while (i < upper.length()) {
      char c = upper.charAt(i);
      if (c == '\'' || c == '"' || c == '`') {
        int close = upper.indexOf(c, i + 1);
        if (close < 0) {
          return OTHER;
        }
        i = close + 1;
      } else if (c == '(') {
        depth++;
        i++;
      } else if (c == ')') {
        depth--;
        i++;
      } else if (depth == 0 && Character.isLetter(c)) {
        int end = i;
        while (end < upper.length() && (Character.isLetterOrDigit(upper.charAt(end)) || upper.charAt(end) == '_')) {
          end++;
        }
        switch (upper.substring(i, end)) {
          case "SELECT":
            return WITH;
          case "INSERT":
            return INSERT;
          case "UPDATE":
            return UPDATE;
          case "DELETE":
            return DELETE;
          case "REPLACE":
            return OTHER;
          default:
            i = end;
        }
      } else {
        i++;
      }
    }
    return OTHER;
  }
}
