package com.example.datalake.membank.response;

import com.example.datalake.membank.model.ExtractedDocument;
import java.util.List;
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
public class ExtractionResponse {
  private boolean found;
  private ExtractedDocument document;
  private String exportPath;

  private List<String> tablesTried;
  private List<String> strategiesTried;
  private List<String> errors;
}
