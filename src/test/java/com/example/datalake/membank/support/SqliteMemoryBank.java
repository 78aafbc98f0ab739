package com.example.datalake.membank.support;

import com.example.datalake.membank.dao.JdbcStorageGateway;
import com.example.datalake.membank.model.SourceTableDescriptor;
import com.example.datalake.membank.service.SourceTableRegistry;
import java.util.List;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;

/** In-memory SQLite store with the three memory bank tables, for integration tests. */
public final class SqliteMemoryBank implements AutoCloseable {

  private final SingleConnectionDataSource dataSource;
  private final JdbcTemplate jdbc;

  public SqliteMemoryBank() {
    this.dataSource = new SingleConnectionDataSource("jdbc:sqlite::memory:", true);
    this.jdbc = new JdbcTemplate(dataSource);
    jdbc.execute("CREATE TABLE documents_v2 (uuid TEXT PRIMARY KEY, title TEXT, content TEXT, "
        + "created_at TEXT, updated_at TEXT)");
    jdbc.execute("CREATE TABLE discussions (uuid TEXT PRIMARY KEY, summary TEXT, content TEXT, "
        + "created_at TEXT, updated_at TEXT)");
    jdbc.execute("CREATE TABLE artifacts (uuid TEXT PRIMARY KEY, title TEXT, content TEXT, "
        + "created_at TEXT, updated_at TEXT)");
  }

  public static SourceTableRegistry registry() {
    return new SourceTableRegistry(List.of(
        table("documents_v2", "title", "📄", 1),
        table("discussions", "summary", "💭", 2),
        table("artifacts", "title", "🎯", 3)));
  }

  private static SourceTableDescriptor table(String name, String titleField, String icon, int rank) {
    return SourceTableDescriptor.builder()
        .name(name)
        .titleField(titleField)
        .contentField("content")
        .keyField("uuid")
        .modifiedField("updated_at")
        .createdField("created_at")
        .icon(icon)
        .priorityRank(rank)
        .build();
  }

  public SqliteMemoryBank document(String uuid, String title, String content, String updatedAt) {
    return insert("documents_v2", "title", uuid, title, content, updatedAt);
  }

  public SqliteMemoryBank discussion(String uuid, String summary, String content, String updatedAt) {
    return insert("discussions", "summary", uuid, summary, content, updatedAt);
  }

  public SqliteMemoryBank artifact(String uuid, String title, String content, String updatedAt) {
    return insert("artifacts", "title", uuid, title, content, updatedAt);
  }

  private SqliteMemoryBank insert(String table, String titleColumn, String uuid, String title,
                                  String content, String updatedAt) {
    jdbc.update("INSERT INTO " + table + " (uuid, " + titleColumn + ", content, created_at, updated_at) "
        + "VALUES (?, ?, ?, ?, ?)", uuid, title, content, "2024-01-01 00:00:00", updatedAt);
    return this;
  }

  public JdbcTemplate jdbc() {
    return jdbc;
  }

  /** Gateway with writes disabled, as configured by default. */
  public JdbcStorageGateway gateway() {
    return new JdbcStorageGateway(jdbc, false);
  }

  public JdbcStorageGateway writableGateway() {
    return new JdbcStorageGateway(jdbc, true);
  }

  public int count(String table) {
    return jdbc.queryForObject("SELECT COUNT(*) FROM " + table, Integer.class);
  }

  @Override
  public void close() {
    dataSource.destroy();
  }
}
