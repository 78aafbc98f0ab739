package com.example.datalake.membank.model;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of query classification. A null {@code limit} disables truncation.
 */
@Value
@Builder
public class TruncationPolicy {
  QueryIntent strategy;
  Integer limit;
  String reason;

  public boolean isUnlimited() {
    return limit == null || limit <= 0;
  }
}
