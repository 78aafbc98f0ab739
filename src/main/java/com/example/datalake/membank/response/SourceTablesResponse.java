package com.example.datalake.membank.response;

import com.example.datalake.membank.model.SourceTableSummary;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SourceTablesResponse {
  private List<SourceTableSummary> tables;
  private List<String> errors;
}
