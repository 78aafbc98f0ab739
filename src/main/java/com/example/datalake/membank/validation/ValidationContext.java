package com.example.datalake.membank.validation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Carries the caller supplied query and limit through the validators. Validators can normalize
 * the query text and attach caller facing notices.
 */
public class ValidationContext {

  private final String rawQuery;
  private String processedQuery;
  private final Integer maxContentLength;
  private final List<String> notices = new ArrayList<>();

  public ValidationContext(String rawQuery, Integer maxContentLength) {
    this.rawQuery = rawQuery;
    this.processedQuery = rawQuery;
    this.maxContentLength = maxContentLength;
  }

  public String getRawQuery() {
    return rawQuery;
  }

  public String getProcessedQuery() {
    return processedQuery;
  }

  public void setProcessedQuery(String processedQuery) {
    this.processedQuery = processedQuery;
  }

  public Integer getMaxContentLength() {
    return maxContentLength;
  }

  public void addNotice(String notice) {
    notices.add(Objects.requireNonNull(notice, "notice"));
  }

  public List<String> getNotices() {
    return Collections.unmodifiableList(notices);
  }
}
