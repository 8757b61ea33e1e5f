package com.di.retailetl.runner;

import com.di.retailetl.config.RetailEtlProperties;
import com.di.retailetl.exception.ErrorCategory;
import com.di.retailetl.load.LoadRunResult;
import com.di.retailetl.load.RetailLoadOrchestrator;
import com.di.retailetl.load.RunOptions;
import com.di.retailetl.load.jdbc.DatabaseSchemaInitializer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Runs the pipeline once with the configured options and reports success to the caller.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EtlRunnerService {

    private final RetailLoadOrchestrator orchestrator;
    private final DatabaseSchemaInitializer schemaInitializer;
    private final RetailEtlProperties properties;

    /** @return {@code true} when the run finished, {@code false} when it failed (already logged) */
    public boolean runPipeline() {
        try {
            RunOptions options = properties.toRunOptions();
            if (options.onlyClean()) {
                log.info("Clean-only run: database load skipped");
            } else if (options.dryRun()) {
                log.info("Dry run: nothing will be written to the database");
            } else {
                log.info("Starting {} load into {}", options.mode(), properties.getTargetTable());
                schemaInitializer.createTablesIfAbsent();
            }
            LoadRunResult result = orchestrator.run(options);
            log.info("ETL pipeline completed: status={} raw={} cleaned={} rejected={} inserted={} skipped={} reports={}",
                    result.status(), result.rawRows(), result.cleanedRows(), result.rejectedRows(),
                    result.insertedRows(), result.skippedAsDuplicate(), result.reportDir());
            return true;
        } catch (RuntimeException e) {
            ErrorCategory category = ErrorCategory.categorize(e);
            log.error("ETL pipeline failed [{}] {}: {}", category.name(), category.getDescription(), e.getMessage(), e);
            return false;
        }
    }
}
