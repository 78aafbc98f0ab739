package com.example.datalake.membank.response;

import com.example.datalake.membank.model.StepLog;
import com.example.datalake.membank.model.Suggestion;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.Accessors;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Accessors(chain = true, fluent = false)
public class QueryResponse {
  private String query;
  private String queryType;

  private String strategy;
  private Integer limit;
  private String reason;

  private List<Map<String, Object>> rows;
  private Integer affectedRows;
  private boolean truncated;
  private List<TruncatedFieldResponse> truncatedFields;
  private List<Suggestion> suggestions;

  private List<StepLog> steps;
  private List<String> notices;
  private List<String> errors;
}
