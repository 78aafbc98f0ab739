package com.example.datalake.membank.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class SourceTableSummary {
  String name;
  String icon;
  int priorityRank;
  boolean present;
  /** Null when the table is missing from the store. */
  Long recordCount;
}
