package com.di.retailetl.load;

import com.di.retailetl.clean.CleanResult;
import com.di.retailetl.clean.Cleaner;
import com.di.retailetl.clean.CleaningRules;
import com.di.retailetl.exception.ErrorCategory;
import com.di.retailetl.load.metadata.LoadRun;
import com.di.retailetl.load.metadata.LoadRunRepository;
import com.di.retailetl.load.plan.IncrementalLoadPlanner;
import com.di.retailetl.load.plan.LoadMode;
import com.di.retailetl.load.plan.LoadPlan;
import com.di.retailetl.load.plan.Watermark;
import com.di.retailetl.model.Row;
import com.di.retailetl.report.RunReportWriter;
import com.di.retailetl.schema.SchemaContract;
import com.di.retailetl.source.RawBatchProvider;
import com.di.retailetl.util.DateFormatUtils;
import com.di.retailetl.util.PipelineMetrics;
import com.di.retailetl.validation.TaggedRow;
import com.di.retailetl.validation.Validator;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.transaction.support.TransactionOperations;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Runs one batch end to end.
 *
 * <pre>
 * ┌───────────────────────────────────────────────────────────────┐
 * │  READ      RawBatchProvider → raw rows                         │
 * │  VALIDATE  Validator → (row, verdict)                          │
 * │  CLEAN     Cleaner → cleaned rows + audit + rejected           │
 * │            optional invoice-date window                        │
 * │  REPORT    cleaning_metrics / transformation_audit / rejected  │
 * ├───────────────────────────────────────────────────────────────┤
 * │  only-clean stops here                                         │
 * ├───────────────────────────────────────────────────────────────┤
 * │  PLAN      WatermarkStore.read → IncrementalLoadPlanner        │
 * ├───────────────────────────────────────────────────────────────┤
 * │  dry-run stops here                                            │
 * ├───────────────────────────────────────────────────────────────┤
 * │  COMMIT    one transaction: TransactionLoader.load             │
 * │                           + WatermarkStore.advance             │
 * │            etl_load_runs: STARTED → COMMITTED | FAILED         │
 * └───────────────────────────────────────────────────────────────┘
 * </pre>
 *
 * <p>Insert and watermark advance share a transaction, so a failed commit leaves both unchanged
 * and the same input can be re-run.
 */
@Slf4j
public class RetailLoadOrchestrator {

    // ---- core ---------------------------------------------------------------
    private final SchemaContract          schema;
    private final CleaningRules           rules;
    private final Validator               validator;
    private final Cleaner                 cleaner;
    private final IncrementalLoadPlanner  planner;

    // ---- collaborators ------------------------------------------------------
    private final RawBatchProvider        source;
    private final WatermarkStore          watermarkStore;
    private final TransactionLoader       loader;
    private final TransactionOperations   transactions;
    private final LoadRunRepository       runRepo;
    private final RunReportWriter         reportWriter;
    private final PipelineMetrics         metrics;

    // ---- misc ---------------------------------------------------------------
    private final String                  targetTable;

    public RetailLoadOrchestrator(
            SchemaContract          schema,
            CleaningRules           rules,
            RawBatchProvider        source,
            WatermarkStore          watermarkStore,
            TransactionLoader       loader,
            TransactionOperations   transactions,
            LoadRunRepository       runRepo,
            RunReportWriter         reportWriter,
            PipelineMetrics         metrics,
            String                  targetTable) {

        this.schema         = schema;
        this.rules          = rules;
        this.validator      = new Validator(rules);
        this.cleaner        = new Cleaner(schema, rules);
        this.planner        = new IncrementalLoadPlanner(rules);
        this.source         = source;
        this.watermarkStore = watermarkStore;
        this.loader         = loader;
        this.transactions   = transactions;
        this.runRepo        = runRepo;
        this.reportWriter   = reportWriter;
        this.metrics        = metrics;
        this.targetTable    = targetTable;
    }

    /* ==================================================================== */
    /* Entry point                                                           */
    /* ==================================================================== */

    public LoadRunResult run(RunOptions options) {
        String runId = UUID.randomUUID().toString();
        long startedAt = System.currentTimeMillis();
        MDC.put("runId", runId);
        boolean runRecorded = false;
        try {
            log.info("[ORCHESTRATOR] runId={} source={} mode={} dryRun={} onlyClean={} window=[{}, {})",
                    runId, source.describe(), options.mode(), options.dryRun(), options.onlyClean(),
                    options.windowStart(), options.windowEnd());

            // ── read / validate / clean ─────────────────────────────────
            List<Row> raw = source.read();
            metrics.recordRead(raw.size());
            List<TaggedRow> tagged = validator.validate(raw, schema);
            CleanResult cleaned = cleaner.clean(tagged);
            metrics.recordCleaning(cleaned);

            CleanResult windowed = applyWindow(cleaned, options);
            int outsideWindow = cleaned.cleanedRows().size() - windowed.cleanedRows().size();

            if (options.onlyClean()) {
                Path reportDir = reportWriter.write(runId, cleaned, null);
                log.info("[ORCHESTRATOR] runId={} clean-only run finished, {} row(s) cleaned",
                        runId, cleaned.cleanedRows().size());
                metrics.recordRun(System.currentTimeMillis() - startedAt, true);
                return new LoadRunResult(runId, LoadRunResult.STATUS_CLEAN_ONLY, raw.size(),
                        cleaned.cleanedRows().size(), cleaned.rejected().size(), outsideWindow,
                        0, 0, null, null, reportDir);
            }

            // ── plan ────────────────────────────────────────────────────
            Watermark before = options.mode() == LoadMode.INCREMENTAL
                    ? watermarkStore.readWatermark(targetTable)
                    : Watermark.EMPTY;
            LoadPlan plan = planner.plan(windowed, before, options.mode());
            metrics.recordPlan(plan);
            Path reportDir = reportWriter.write(runId, cleaned, plan);

            if (options.dryRun()) {
                log.info("[ORCHESTRATOR] runId={} dry run: would insert {} row(s), skip {}, watermark {} → {}",
                        runId, plan.toInsert().size(), plan.skippedAsDuplicate(), before, plan.newWatermark());
                metrics.recordRun(System.currentTimeMillis() - startedAt, true);
                return new LoadRunResult(runId, LoadRunResult.STATUS_DRY_RUN, raw.size(),
                        cleaned.cleanedRows().size(), cleaned.rejected().size(), outsideWindow,
                        0, plan.skippedAsDuplicate(), before, plan.newWatermark(), reportDir);
            }

            // ── commit ──────────────────────────────────────────────────
            runRepo.insert(LoadRun.builder()
                    .id(runId)
                    .targetTable(targetTable)
                    .loadMode(options.mode().name())
                    .source(source.describe())
                    .schemaVersion(schema.getVersion())
                    .rawRows(raw.size())
                    .cleanedRows(cleaned.cleanedRows().size())
                    .rejectedRows(cleaned.rejected().size())
                    .duplicatesDropped(cleaned.metrics().getDuplicatesDropped())
                    .watermarkBefore(render(before))
                    .build());
            runRecorded = true;

            Integer inserted = transactions.execute(status -> {
                int count = loader.load(plan, schema.getVersion());
                if (!plan.isEmpty()) {
                    watermarkStore.advance(targetTable, plan.newWatermark());
                }
                return count;
            });
            int insertedRows = inserted == null ? 0 : inserted;
            metrics.recordInserted(insertedRows);
            Watermark after = plan.isEmpty() ? before : plan.newWatermark();
            runRepo.markCommitted(runId, insertedRows, plan.skippedAsDuplicate(), render(after));

            log.info("[ORCHESTRATOR] runId={} COMMITTED inserted={} skipped={} rejected={} watermark {} → {}",
                    runId, insertedRows, plan.skippedAsDuplicate(), cleaned.rejected().size(), before, after);
            metrics.recordRun(System.currentTimeMillis() - startedAt, true);
            return new LoadRunResult(runId, LoadRunResult.STATUS_COMMITTED, raw.size(),
                    cleaned.cleanedRows().size(), cleaned.rejected().size(), outsideWindow,
                    insertedRows, plan.skippedAsDuplicate(), before, after, reportDir);

        } catch (RuntimeException e) {
            ErrorCategory category = ErrorCategory.categorize(e);
            log.error("[ORCHESTRATOR] runId={} FAILED [{}]: {}", runId, category.getName(), e.getMessage());
            if (runRecorded) {
                runRepo.markFailed(runId, category.name(), e.getMessage());
            }
            metrics.recordRun(System.currentTimeMillis() - startedAt, false);
            throw e;
        } finally {
            MDC.remove("runId");
        }
    }

    /* ==================================================================== */
    /* Helpers                                                               */
    /* ==================================================================== */

    private CleanResult applyWindow(CleanResult cleaned, RunOptions options) {
        if (options.windowStart() == null && options.windowEnd() == null) {
            return cleaned;
        }
        List<Row> inWindow = new ArrayList<>();
        for (Row row : cleaned.cleanedRows()) {
            Object ts = row.get(rules.getTimestampColumn());
            if (ts instanceof LocalDateTime && options.inWindow((LocalDateTime) ts)) {
                inWindow.add(row);
            }
        }
        log.info("[ORCHESTRATOR] window kept {} of {} cleaned row(s)", inWindow.size(), cleaned.cleanedRows().size());
        return new CleanResult(inWindow, cleaned.audit(), cleaned.rejected(), cleaned.metrics());
    }

    private static String render(Watermark watermark) {
        if (watermark == null || watermark.isEmpty()) {
            return null;
        }
        return DateFormatUtils.toCanonical(watermark.lastTimestamp()) + "|" + watermark.lastInvoiceId();
    }
}
