package com.example.datalake.membank.model;

public enum MatchKind {
  EXACT_KEY,
  KEY_PREFIX,
  EXACT_TITLE,
  FUZZY_TITLE
}
