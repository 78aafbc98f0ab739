package com.example.datalake.membank.model;

import java.util.List;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class TruncationStrategyHelp {
  QueryIntent strategy;
  int defaultLimit;
  String description;
  List<String> exampleQueries;
}
