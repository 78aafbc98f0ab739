package com.example.datalake.membank.exception;

/** Storage rejected the query text. The message is the storage's own diagnostic. */
public class QuerySyntaxException extends StorageException {

  private final String query;

  public QuerySyntaxException(String query, String message, Throwable cause) {
    super(message, cause);
    this.query = query;
  }

  public String getQuery() {
    return query;
  }
}
