package com.example.datalake.membank.model;

import lombok.Builder;
import lombok.Value;

/**
 * One registered content table. Lower {@code priorityRank} is searched first.
 */
@Value
@Builder
public class SourceTableDescriptor {
  String name;
  String titleField;
  String contentField;
  String keyField;
  String icon;
  int priorityRank;

  /** Column holding the last modification time; optional. */
  String modifiedField;

  /** Column holding the creation time; optional. */
  String createdField;

  public boolean hasModifiedField() {
    return modifiedField != null && !modifiedField.isBlank();
  }

  public boolean hasCreatedField() {
    return createdField != null && !createdField.isBlank();
  }
}
