package com.di.retailetl.load.metadata;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Domain model for the {@code etl_load_runs} table.
 *
 * <p>One row per run that writes to the database; dry runs and clean-only runs leave no record.
 *
 * <pre>Status flow:
 *   STARTED → COMMITTED
 *   STARTED → FAILED
 * </pre>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LoadRun {

    public static final String STATUS_STARTED = "STARTED";
    public static final String STATUS_COMMITTED = "COMMITTED";
    public static final String STATUS_FAILED = "FAILED";

    private String  id;

    // ---- run description ---------------------------------------------------
    private String  targetTable;
    private String  loadMode;
    private String  source;
    private String  schemaVersion;

    // ---- counts ------------------------------------------------------------
    private Integer rawRows;
    private Integer cleanedRows;
    private Integer rejectedRows;
    private Integer duplicatesDropped;
    private Integer insertedRows;
    private Integer skippedRows;

    // ---- watermarks (rendered "timestamp|invoice") -------------------------
    private String  watermarkBefore;
    private String  watermarkAfter;

    // ---- lifecycle ---------------------------------------------------------
    private String  status;
    private String  errorCategory;
    private String  errorMessage;
    private Instant startedAt;
    private Instant completedAt;
}
