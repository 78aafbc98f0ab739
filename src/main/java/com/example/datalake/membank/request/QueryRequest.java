package com.example.datalake.membank.request;

import jakarta.validation.constraints.NotBlank;
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
public class QueryRequest {
  @NotBlank private String query;

  /** Absent: strategy default. 0: full content. */
  private Integer maxContentLength;
}
