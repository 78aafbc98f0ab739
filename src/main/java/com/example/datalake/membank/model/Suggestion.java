package com.example.datalake.membank.model;

import lombok.Builder;
import lombok.Value;

/** Advisory follow-up instruction attached to a truncated response. Never executed. */
@Value
@Builder
public class Suggestion {
  SuggestionKind kind;
  String renderedInstruction;
}
