package com.di.retailetl.util;

import com.di.retailetl.clean.CleanResult;
import com.di.retailetl.load.plan.LoadPlan;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.TimeUnit;

/**
 * Row counters per pipeline stage plus a run timer.
 */
@Slf4j
public class PipelineMetrics {

    private final MeterRegistry meterRegistry;

    private final Counter rawRowsCounter;
    private final Counter cleanedRowsCounter;
    private final Counter duplicateRowsCounter;
    private final Counter insertedRowsCounter;
    private final Counter skippedRowsCounter;
    private final Counter runSuccessCounter;
    private final Counter runErrorCounter;
    private final Timer runTimer;

    public PipelineMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.rawRowsCounter = Counter.builder("retailetl.rows.total")
                .description("Rows read from the raw batch")
                .tag("stage", "read")
                .register(meterRegistry);

        this.cleanedRowsCounter = Counter.builder("retailetl.rows.total")
                .description("Rows that survived cleaning")
                .tag("stage", "clean")
                .register(meterRegistry);

        this.duplicateRowsCounter = Counter.builder("retailetl.rows.duplicates")
                .description("Rows dropped as intra-batch duplicates")
                .register(meterRegistry);

        this.insertedRowsCounter = Counter.builder("retailetl.rows.total")
                .description("Rows inserted into the target table")
                .tag("stage", "load")
                .register(meterRegistry);

        this.skippedRowsCounter = Counter.builder("retailetl.rows.skipped")
                .description("Rows skipped as already loaded")
                .register(meterRegistry);

        this.runSuccessCounter = Counter.builder("retailetl.runs.total")
                .description("Completed pipeline runs")
                .tag("status", "success")
                .register(meterRegistry);

        this.runErrorCounter = Counter.builder("retailetl.runs.total")
                .description("Failed pipeline runs")
                .tag("status", "error")
                .register(meterRegistry);

        this.runTimer = Timer.builder("retailetl.run.duration")
                .description("Wall time of one pipeline run")
                .register(meterRegistry);
    }

    public void recordRead(int rows) {
        rawRowsCounter.increment(rows);
    }

    public void recordCleaning(CleanResult result) {
        cleanedRowsCounter.increment(result.cleanedRows().size());
        duplicateRowsCounter.increment(result.metrics().getDuplicatesDropped());
        result.metrics().getInvalidValues().forEach((reason, count) ->
                Counter.builder("retailetl.rows.rejected")
                        .description("Rows rejected, by reason")
                        .tag("reason", reason)
                        .register(meterRegistry)
                        .increment(count));
    }

    public void recordPlan(LoadPlan plan) {
        skippedRowsCounter.increment(plan.skippedAsDuplicate());
    }

    public void recordInserted(int rows) {
        insertedRowsCounter.increment(rows);
    }

    public void recordRun(long durationMs, boolean success) {
        runTimer.record(durationMs, TimeUnit.MILLISECONDS);
        if (success) {
            runSuccessCounter.increment();
        } else {
            runErrorCounter.increment();
        }
        log.debug("Recorded pipeline run: duration={}ms, success={}", durationMs, success);
    }
}
