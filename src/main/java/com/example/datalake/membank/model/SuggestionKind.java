package com.example.datalake.membank.model;

public enum SuggestionKind {
  EXTRACT_BY_KEY,
  EXTRACT_BY_TITLE,
  RETRY_NO_LIMIT
}
