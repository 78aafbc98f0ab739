package com.example.datalake.membank.dao;

import com.example.datalake.membank.model.ResultRow;
import java.util.List;
import java.util.Set;

/**
 * Minimal view of the backing store. Implementations raise
 * {@link com.example.datalake.membank.exception.QuerySyntaxException} when a statement is
 * rejected and {@link com.example.datalake.membank.exception.StorageUnavailableException} when
 * the store cannot be reached.
 */
public interface StorageGateway {

  /** Runs caller supplied query text as-is. */
  QueryExecution execute(String queryText);

  /** Runs a statement with bound positional parameters and returns its rows. */
  List<ResultRow> query(String sql, Object... params);

  /** Names of the tables and views present in the store. */
  Set<String> listTables();

  /** Cheap round trip used by health checks. */
  void ping();

  /**
   * Rows of a statement that produced a result set, or the update count of one that did not.
   */
  record QueryExecution(List<ResultRow> rows, Integer affectedRows) {

    public QueryExecution {
      rows = rows == null ? List.of() : List.copyOf(rows);
    }
  }
}
