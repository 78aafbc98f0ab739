package com.example.datalake.membank.model;

import java.time.Instant;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class MatchResult {
  SourceTableDescriptor table;
  String key;
  String title;
  String content;
  MatchKind matchKind;
  Instant createdAt;
  Instant modifiedAt;
}
