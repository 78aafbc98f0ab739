package com.example.datalake.membank.dao;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.datalake.membank.exception.QuerySyntaxException;
import com.example.datalake.membank.exception.StorageException;
import com.example.datalake.membank.exception.StorageUnavailableException;
import com.example.datalake.membank.model.ResultRow;
import com.example.datalake.membank.support.SqliteMemoryBank;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

class JdbcStorageGatewayTest {

  private SqliteMemoryBank bank;
  private JdbcStorageGateway gateway;

  @BeforeEach
  void setUp() {
    bank = new SqliteMemoryBank();
    gateway = bank.gateway();
  }

  @AfterEach
  void tearDown() {
    bank.close();
  }

  @Test
  void executeReturnsRowsInColumnOrder() {
    bank.document("d-1", "Doc", "body", "2024-01-01 00:00:00");

    StorageGateway.QueryExecution execution = gateway.execute("SELECT uuid, title, content FROM documents_v2");

    assertThat(execution.affectedRows()).isNull();
    assertThat(execution.rows()).singleElement().satisfies(row ->
        assertThat(row.values().keySet()).containsExactly("uuid", "title", "content"));
  }

  @Test
  void executeReportsAffectedRowsForWrites() {
    bank.document("d-1", "Doc", "body", null).document("d-2", "Doc 2", "body", null);

    StorageGateway.QueryExecution execution =
        bank.writableGateway().execute("UPDATE documents_v2 SET title = 'x'");

    assertThat(execution.rows()).isEmpty();
    assertThat(execution.affectedRows()).isEqualTo(2);
  }

  @Test
  void readOnlyGatewayRefusesWritesHiddenBehindCte() {
    bank.discussion("s-1", "SSH", "body", null);

    assertThatThrownBy(() -> gateway.execute("WITH x AS (SELECT 1) DELETE FROM discussions"))
        .isInstanceOf(StorageException.class);

    assertThat(bank.count("discussions")).isEqualTo(1);
  }

  @Test
  void readOnlyModeIsLiftedAfterTheCall() {
    bank.discussion("s-1", "SSH", "body", null);
    assertThatThrownBy(() -> gateway.execute("DELETE FROM discussions")).isInstanceOf(StorageException.class);

    StorageGateway.QueryExecution execution = bank.writableGateway().execute("DELETE FROM discussions");

    assertThat(execution.affectedRows()).isEqualTo(1);
    assertThat(bank.count("discussions")).isZero();
  }

  @Test
  void boundParametersAreNotInterpolated() {
    bank.document("d-1", "Doc", "body", null);

    List<ResultRow> rows = gateway.query("SELECT uuid FROM documents_v2 WHERE title = ?", "Doc' OR '1'='1");

    assertThat(rows).isEmpty();
  }

  @Test
  void rejectedStatementBecomesQuerySyntaxException() {
    assertThatThrownBy(() -> gateway.execute("SELEC nonsense"))
        .isInstanceOf(QuerySyntaxException.class)
        .satisfies(ex -> assertThat(((QuerySyntaxException) ex).getQuery()).isEqualTo("SELEC nonsense"))
        .hasMessageContaining("syntax error");
  }

  @Test
  void unknownTableBecomesQuerySyntaxException() {
    assertThatThrownBy(() -> gateway.execute("SELECT * FROM missing_table"))
        .isInstanceOf(QuerySyntaxException.class)
        .hasMessageContaining("missing_table");
  }

  @Test
  void listTablesIsCaseInsensitive() {
    Set<String> tables = gateway.listTables();

    assertThat(tables).contains("documents_v2", "discussions", "artifacts");
    assertThat(tables.contains("DISCUSSIONS")).isTrue();
  }

  @Test
  void unreachableStoreBecomesStorageUnavailable() {
    DriverManagerDataSource dataSource = new DriverManagerDataSource("jdbc:sqlite:/nonexistent-dir/sub/memory.db");
    JdbcStorageGateway broken = new JdbcStorageGateway(new JdbcTemplate(dataSource), false);

    assertThatThrownBy(broken::ping).isInstanceOf(StorageUnavailableException.class);
  }
}
