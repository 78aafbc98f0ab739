package com.example.datalake.membank.model;

import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * A row after truncation. Shortened string columns are replaced by their {@link TruncatedField};
 * every other column carries the raw storage value.
 */
@Value
@Builder
public class TruncatedRow {
  Map<String, Object> values;
  List<TruncatedField> truncatedFields;
  ResultRow source;

  public boolean isTruncated() {
    return truncatedFields != null && !truncatedFields.isEmpty();
  }
}
