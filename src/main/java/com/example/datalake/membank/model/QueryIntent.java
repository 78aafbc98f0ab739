package com.example.datalake.membank.model;

public enum QueryIntent {
  CONTENT_FOCUSED,
  OVERVIEW,
  BALANCED
}
