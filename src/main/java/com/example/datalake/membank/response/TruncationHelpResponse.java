package com.example.datalake.membank.response;

import com.example.datalake.membank.model.TruncationStrategyHelp;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TruncationHelpResponse {
  private List<TruncationStrategyHelp> strategies;
  private List<String> overrides;
}
