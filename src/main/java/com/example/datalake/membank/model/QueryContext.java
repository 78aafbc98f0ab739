package com.example.datalake.membank.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.Accessors;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Mutable per-request state threaded through the query pipeline. Never shared between
 * requests.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Accessors(chain = true, fluent = false)
public class QueryContext {
  // input
  private String queryText;
  private ContentLimit contentLimit = ContentLimit.strategyDefault();

  // classification
  private QueryType queryType = QueryType.OTHER;
  private TruncationPolicy policy;

  // execution
  private List<ResultRow> rows = new ArrayList<>();
  private Integer affectedRows;

  // truncation + guidance
  private List<TruncatedRow> truncatedRows = new ArrayList<>();
  private List<Suggestion> suggestions = new ArrayList<>();

  private Instant now = Instant.now();

  // audit trail
  private List<StepLog> steps = new ArrayList<>();
  private List<String> notices = new ArrayList<>();

  public boolean isTruncated() {
    return truncatedRows != null && truncatedRows.stream().anyMatch(TruncatedRow::isTruncated);
  }

  public QueryContext addStep(String name, String note) {
    steps.add(new StepLog().setName(name).setNote(note).setAt(Instant.now()));
    return this;
  }
}
