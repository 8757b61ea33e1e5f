package com.di.retailetl.load.jdbc;

import com.di.retailetl.load.WatermarkStore;
import com.di.retailetl.load.plan.Watermark;
import com.di.retailetl.util.InputValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.BadSqlGrammarException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.util.List;

/**
 * JDBC watermark store over the {@code etl_watermarks} table.
 *
 * <p>When a table has no watermark row yet, the newest (invoice_date, invoice) already present
 * in the target table is used, so a database loaded before watermarks existed is not reloaded.
 */
@Slf4j
@RequiredArgsConstructor
public class JdbcWatermarkStore implements WatermarkStore {

    static final String SELECT_WATERMARK =
            "SELECT last_invoice_id, last_timestamp FROM etl_watermarks WHERE table_name = ?";

    static final String UPDATE_WATERMARK = """
            UPDATE etl_watermarks
               SET last_invoice_id = ?, last_timestamp = ?, updated_at = CURRENT_TIMESTAMP
             WHERE table_name = ?
            """;

    static final String INSERT_WATERMARK = """
            INSERT INTO etl_watermarks (table_name, last_invoice_id, last_timestamp, updated_at)
            VALUES (?, ?, ?, CURRENT_TIMESTAMP)
            """;

    private static final RowMapper<Watermark> ROW_MAPPER = (rs, n) ->
            new Watermark(rs.getString("last_invoice_id"), toLocalDateTime(rs.getTimestamp("last_timestamp")));

    private static final RowMapper<Watermark> TARGET_ROW_MAPPER = (rs, n) ->
            new Watermark(rs.getString("invoice"), toLocalDateTime(rs.getTimestamp("invoice_date")));

    private final JdbcTemplate jdbc;

    @Override
    public Watermark readWatermark(String tableName) {
        InputValidator.validateTableName(tableName);
        try {
            List<Watermark> stored = jdbc.query(SELECT_WATERMARK, ROW_MAPPER, tableName);
            if (!stored.isEmpty()) {
                log.info("[WATERMARK] {} -> {}", tableName, stored.get(0));
                return stored.get(0);
            }
            List<Watermark> latest = jdbc.query(bootstrapQuery(tableName), TARGET_ROW_MAPPER);
            Watermark bootstrap = latest.isEmpty() ? Watermark.EMPTY : latest.get(0);
            log.info("[WATERMARK] {} has no stored watermark, derived {} from existing rows", tableName, bootstrap);
            return bootstrap;
        } catch (BadSqlGrammarException e) {
            // tables not created yet: nothing has ever been loaded
            log.warn("[WATERMARK] {} not readable ({}), treating as never loaded", tableName, e.getMessage());
            return Watermark.EMPTY;
        }
    }

    @Override
    public void advance(String tableName, Watermark watermark) {
        InputValidator.validateTableName(tableName);
        if (watermark == null || watermark.isEmpty()) {
            log.debug("[WATERMARK] {} not advanced: empty watermark", tableName);
            return;
        }
        Timestamp ts = watermark.lastTimestamp() == null ? null : Timestamp.valueOf(watermark.lastTimestamp());
        int updated = jdbc.update(UPDATE_WATERMARK, watermark.lastInvoiceId(), ts, tableName);
        if (updated == 0) {
            jdbc.update(INSERT_WATERMARK, tableName, watermark.lastInvoiceId(), ts);
        }
        log.info("[WATERMARK] {} advanced to {}", tableName, watermark);
    }

    static String bootstrapQuery(String tableName) {
        return "SELECT invoice, invoice_date FROM " + tableName
                + " ORDER BY invoice_date DESC, invoice DESC LIMIT 1";
    }

    private static LocalDateTime toLocalDateTime(Timestamp ts) {
        return ts == null ? null : ts.toLocalDateTime();
    }
}
