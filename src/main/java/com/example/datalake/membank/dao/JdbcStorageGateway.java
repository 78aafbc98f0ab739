package com.example.datalake.membank.dao;

import com.example.datalake.membank.config.RetrievalProperties;
import com.example.datalake.membank.exception.QuerySyntaxException;
import com.example.datalake.membank.exception.StorageException;
import com.example.datalake.membank.exception.StorageUnavailableException;
import com.example.datalake.membank.model.ResultRow;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessResourceException;
import org.springframework.jdbc.core.ColumnMapRowMapper;
import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapperResultSetExtractor;
import org.springframework.stereotype.Repository;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

@Slf4j
@Repository
public class JdbcStorageGateway implements StorageGateway {

    private static final ColumnMapRowMapper ROW_MAPPER = new ColumnMapRowMapper();

    private final JdbcTemplate jdbcTemplate;
    private final boolean allowWrites;

    @Autowired
    public JdbcStorageGateway(JdbcTemplate jdbcTemplate, RetrievalProperties properties) {
        this(jdbcTemplate, properties.getQuery().isAllowWrites());
    }

    public JdbcStorageGateway(JdbcTemplate jdbcTemplate, boolean allowWrites) {
        this.jdbcTemplate = jdbcTemplate;
        this.allowWrites = allowWrites;
    }

    /**
     * Runs a caller-supplied statement. Unless writes are enabled the connection is switched to
     * {@code query_only} for the duration of the call, so SQLite itself refuses any change.
     */
    @Override
    public QueryExecution execute(String queryText) {
        try {
            return jdbcTemplate.execute((ConnectionCallback<QueryExecution>) con -> {
                if (!allowWrites) {
                    setQueryOnly(con, true);
                }
                try (Statement stmt = con.createStatement()) {
                    if (stmt.execute(queryText)) {
                        try (ResultSet rs = stmt.getResultSet()) {
                            return new QueryExecution(readRows(rs), null);
                        }
                    }
                    return new QueryExecution(List.of(), stmt.getUpdateCount());
                } finally {
                    if (!allowWrites) {
                        setQueryOnly(con, false);
                    }
                }
            });
        } catch (DataAccessException e) {
            throw translate(queryText, e);
        }
    }

    @Override
    public List<ResultRow> query(String sql, Object... params) {
        try {
            return jdbcTemplate.query(sql, ROW_MAPPER, params).stream()
                    .map(ResultRow::of)
                    .toList();
        } catch (DataAccessException e) {
            throw translate(sql, e);
        }
    }

    @Override
    public Set<String> listTables() {
        try {
            return jdbcTemplate.execute((ConnectionCallback<Set<String>>) con -> {
                DatabaseMetaData metaData = con.getMetaData();
                Set<String> names = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
                try (ResultSet rs = metaData.getTables(null, null, "%", new String[]{"TABLE", "VIEW"})) {
                    while (rs.next()) {
                        names.add(rs.getString("TABLE_NAME"));
                    }
                }
                return names;
            });
        } catch (DataAccessException e) {
            throw translate("<table metadata>", e);
        }
    }

    @Override
    public void ping() {
        query("SELECT 1");
    }

    private static void setQueryOnly(Connection con, boolean on) throws SQLException {
        try (Statement pragma = con.createStatement()) {
            pragma.execute(on ? "PRAGMA query_only = ON" : "PRAGMA query_only = OFF");
        }
    }

    private static List<ResultRow> readRows(ResultSet rs) throws SQLException {
        List<Map<String, Object>> raw = new RowMapperResultSetExtractor<>(ROW_MAPPER).extractData(rs);
        return raw.stream().map(ResultRow::of).toList();
    }

    private StorageException translate(String sql, DataAccessException e) {
        String detail = e.getMostSpecificCause().getMessage();
        if (detail == null || detail.isBlank()) {
            detail = e.getMessage();
        }
        if (e instanceof DataAccessResourceFailureException || e instanceof TransientDataAccessResourceException) {
            log.warn("[storage] store unavailable: {}", detail);
            return new StorageUnavailableException("Storage unavailable: " + detail, e);
        }
        log.warn("[storage] statement rejected: {}", detail);
        return new QuerySyntaxException(sql, detail, e);
    }
}
