package com.di.retailetl.load.metadata;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * JDBC repository for the {@code etl_load_runs} table.
 */
@Slf4j
@RequiredArgsConstructor
public class LoadRunRepository {

    private static final int MAX_ERROR_LENGTH = 2000;

    private final JdbcTemplate jdbc;

    // ------------------------------------------------------------------
    // RowMapper
    // ------------------------------------------------------------------

    private static final RowMapper<LoadRun> ROW_MAPPER = (rs, n) -> {
        LoadRun r = new LoadRun();
        r.setId(rs.getString("id"));
        r.setTargetTable(rs.getString("target_table"));
        r.setLoadMode(rs.getString("load_mode"));
        r.setSource(rs.getString("source"));
        r.setSchemaVersion(rs.getString("schema_version"));
        r.setStatus(rs.getString("status"));
        r.setRawRows(nullableInt(rs.getInt("raw_rows"), rs.wasNull()));
        r.setCleanedRows(nullableInt(rs.getInt("cleaned_rows"), rs.wasNull()));
        r.setRejectedRows(nullableInt(rs.getInt("rejected_rows"), rs.wasNull()));
        r.setDuplicatesDropped(nullableInt(rs.getInt("duplicates_dropped"), rs.wasNull()));
        r.setInsertedRows(nullableInt(rs.getInt("inserted_rows"), rs.wasNull()));
        r.setSkippedRows(nullableInt(rs.getInt("skipped_rows"), rs.wasNull()));
        r.setWatermarkBefore(rs.getString("watermark_before"));
        r.setWatermarkAfter(rs.getString("watermark_after"));
        r.setErrorCategory(rs.getString("error_category"));
        r.setErrorMessage(rs.getString("error_message"));
        r.setStartedAt(toInstant(rs.getTimestamp("started_at")));
        r.setCompletedAt(toInstant(rs.getTimestamp("completed_at")));
        return r;
    };

    // ------------------------------------------------------------------
    // Write operations
    // ------------------------------------------------------------------

    public void insert(LoadRun run) {
        jdbc.update("""
            INSERT INTO etl_load_runs
              (id, target_table, load_mode, source, schema_version, status,
               raw_rows, cleaned_rows, rejected_rows, duplicates_dropped,
               watermark_before, started_at)
            VALUES (?,?,?,?,?,?, ?,?,?,?, ?, CURRENT_TIMESTAMP)
            """,
            run.getId(), run.getTargetTable(), run.getLoadMode(), run.getSource(),
            run.getSchemaVersion(), LoadRun.STATUS_STARTED,
            run.getRawRows(), run.getCleanedRows(), run.getRejectedRows(), run.getDuplicatesDropped(),
            run.getWatermarkBefore());
    }

    public void markCommitted(String id, int insertedRows, int skippedRows, String watermarkAfter) {
        jdbc.update("""
            UPDATE etl_load_runs
               SET status = 'COMMITTED', inserted_rows = ?, skipped_rows = ?,
                   watermark_after = ?, completed_at = CURRENT_TIMESTAMP
             WHERE id = ?
            """, insertedRows, skippedRows, watermarkAfter, id);
    }

    public void markFailed(String id, String errorCategory, String errorMessage) {
        jdbc.update("""
            UPDATE etl_load_runs
               SET status = 'FAILED', error_category = ?, error_message = ?,
                   completed_at = CURRENT_TIMESTAMP
             WHERE id = ?
            """, errorCategory, truncate(errorMessage), id);
    }

    // ------------------------------------------------------------------
    // Read operations
    // ------------------------------------------------------------------

    public Optional<LoadRun> findById(String id) {
        List<LoadRun> rows = jdbc.query(
                "SELECT * FROM etl_load_runs WHERE id = ?", ROW_MAPPER, id);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public List<LoadRun> findByTable(String targetTable) {
        return jdbc.query(
                "SELECT * FROM etl_load_runs WHERE target_table = ? ORDER BY started_at DESC",
                ROW_MAPPER, targetTable);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static Integer nullableInt(int value, boolean wasNull) {
        return wasNull ? null : value;
    }

    private static Instant toInstant(Timestamp ts) {
        return ts == null ? null : ts.toInstant();
    }

    static String truncate(String message) {
        if (message == null || message.length() <= MAX_ERROR_LENGTH) {
            return message;
        }
        return message.substring(0, MAX_ERROR_LENGTH);
    }
}
