package com.example.datalake.membank.model;

import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/** Full, untruncated record with its provenance. */
@Value
@Builder
public class ExtractedDocument {
  String table;
  String icon;
  String key;
  String title;
  String content;
  String safeName;
  MatchKind matchKind;
  Instant createdAt;
  Instant modifiedAt;
  int contentLength;
}
