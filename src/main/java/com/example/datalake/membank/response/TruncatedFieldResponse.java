package com.example.datalake.membank.response;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class TruncatedFieldResponse {
  int row;
  String column;
  int originalLength;
  int renderedLength;
}
