package com.example.datalake.membank.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class TruncatedField {
  String column;
  int originalLength;
  String renderedValue;
  boolean wasTruncated;
}
