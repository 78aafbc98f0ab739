package com.example.datalake.membank.model;

import java.util.List;
import lombok.Builder;
import lombok.Value;

/** Extracted document, or the diagnostics of a search that found nothing. */
@Value
@Builder(toBuilder = true)
public class ExtractionResult {
  ExtractedDocument document;
  List<String> tablesTried;
  List<String> strategiesTried;
  /** Set only after an export. */
  String exportPath;

  public boolean isFound() {
    return document != null;
  }
}
