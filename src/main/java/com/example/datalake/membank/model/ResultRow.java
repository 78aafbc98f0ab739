package com.example.datalake.membank.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * A single row as returned by storage. Column order is preserved; lookups by column name are
 * case-insensitive like SQLite's.
 */
public final class ResultRow {

  private final Map<String, Object> values;

  public ResultRow(Map<String, ?> values) {
    this.values = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(values, "values")));
  }

  public static ResultRow of(Map<String, ?> values) {
    return new ResultRow(values);
  }

  @JsonValue
  public Map<String, Object> values() {
    return values;
  }

  public boolean hasColumn(String column) {
    return resolveColumn(column) != null;
  }

  public Object get(String column) {
    String resolved = resolveColumn(column);
    return resolved == null ? null : values.get(resolved);
  }

  /** String view of a column, or null when absent or null. */
  public String getString(String column) {
    Object value = get(column);
    return value == null ? null : value.toString();
  }

  private String resolveColumn(String column) {
    if (column == null) {
      return null;
    }
    if (values.containsKey(column)) {
      return column;
    }
    String lower = column.toLowerCase(Locale.ROOT);
    for (String candidate : values.keySet()) {
      if (candidate != null && candidate.toLowerCase(Locale.ROOT).equals(lower)) {
        return candidate;
      }
    }
    return null;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof ResultRow other)) return false;
    return values.equals(other.values);
  }

  @Override
  public int hashCode() {
    return values.hashCode();
  }

  @Override
  public String toString() {
    return "ResultRow" + values;
  }
}
