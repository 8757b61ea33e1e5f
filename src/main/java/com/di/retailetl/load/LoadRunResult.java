package com.di.retailetl.load;

import com.di.retailetl.load.plan.Watermark;

import java.nio.file.Path;

/**
 * Summary of one pipeline run as returned to the runner.
 */
public record LoadRunResult(String runId,
                            String status,
                            int rawRows,
                            int cleanedRows,
                            int rejectedRows,
                            int outsideWindow,
                            int insertedRows,
                            int skippedAsDuplicate,
                            Watermark watermarkBefore,
                            Watermark watermarkAfter,
                            Path reportDir) {

    public static final String STATUS_COMMITTED = "COMMITTED";
    public static final String STATUS_DRY_RUN = "DRY_RUN";
    public static final String STATUS_CLEAN_ONLY = "CLEAN_ONLY";
}
