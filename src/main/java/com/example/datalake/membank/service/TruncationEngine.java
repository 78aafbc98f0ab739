package com.example.datalake.membank.service;

import com.example.datalake.membank.model.ResultRow;
import com.example.datalake.membank.model.TruncatedField;
import com.example.datalake.membank.model.TruncatedRow;
import com.example.datalake.membank.model.TruncationPolicy;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Shortens long string values at a word boundary. Pure: rows are copied, never modified.
 *
 * <p>A shortened value is at most {@code limit + MARKER.length()} characters long, and running
 * it through the engine again with the same limit returns it unchanged.
 */
@Component
public class TruncationEngine {

  public static final String MARKER = "...";

  public List<TruncatedRow> truncateRows(List<ResultRow> rows, TruncationPolicy policy) {
    if (rows == null || rows.isEmpty()) {
      return List.of();
    }
    List<TruncatedRow> out = new ArrayList<>(rows.size());
    for (ResultRow row : rows) {
      out.add(truncateRow(row, policy));
    }
    return out;
  }

  public TruncatedRow truncateRow(ResultRow row, TruncationPolicy policy) {
    Integer limit = policy == null || policy.isUnlimited() ? null : policy.getLimit();
    Map<String, Object> values = new LinkedHashMap<>();
    List<TruncatedField> truncated = new ArrayList<>();

    for (Map.Entry<String, Object> entry : row.values().entrySet()) {
      Object value = entry.getValue();
      if (value instanceof String text) {
        TruncatedField field = truncate(entry.getKey(), text, limit);
        if (field.isWasTruncated()) {
          values.put(entry.getKey(), field);
          truncated.add(field);
          continue;
        }
      }
      values.put(entry.getKey(), value);
    }

    return TruncatedRow.builder()
        .values(values)
        .truncatedFields(List.copyOf(truncated))
        .source(row)
        .build();
  }

  /**
   * Truncates a single value. A null or non-positive limit disables truncation.
   */
  public TruncatedField truncate(String column, String value, Integer limit) {
    if (value == null) {
      return TruncatedField.builder().column(column).originalLength(0).renderedValue(null).build();
    }
    int length = value.length();
    if (limit == null || limit <= 0 || length <= limit || isAlreadyTruncated(value, limit)) {
      return TruncatedField.builder()
          .column(column)
          .originalLength(length)
          .renderedValue(value)
          .wasTruncated(false)
          .build();
    }

    int cut = boundaryCut(value, limit);
    return TruncatedField.builder()
        .column(column)
        .originalLength(length)
        .renderedValue(value.substring(0, cut) + MARKER)
        .wasTruncated(true)
        .build();
  }

  public String truncate(String value, Integer limit) {
    return truncate(null, value, limit).getRenderedValue();
  }

  static boolean isAlreadyTruncated(String value, int limit) {
    return value.endsWith(MARKER) && value.length() - MARKER.length() <= limit;
  }

  /** End index (exclusive) of the kept prefix; always {@code <= limit}. */
  static int boundaryCut(String value, int limit) {
    int cut = limit;
    if (cut > 0 && Character.isHighSurrogate(value.charAt(cut - 1)) && Character.isLowSurrogate(value.charAt(cut))) {
      cut--;
    }

    // the character at cut starts the dropped tail; if it is not whitespace we would split a word
    if (!Character.isWhitespace(value.charAt(cut))) {
      int space = lastWhitespaceBefore(value, cut);
      if (space > 0) {
        cut = space;
      }
    }

    int end = cut;
    while (end > 0 && Character.isWhitespace(value.charAt(end - 1))) {
      end--;
    }
    return end == 0 ? cut : end;
  }

  private static int lastWhitespaceBefore(String value, int index) {
    for (int i = index - 1; i >= 0; i--) {
      if (Character.isWhitespace(value.charAt(i))) {
        return i;
      }
    }
    return -1;
  }
}
