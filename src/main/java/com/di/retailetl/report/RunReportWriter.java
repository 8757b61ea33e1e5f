package com.di.retailetl.report;

import com.di.retailetl.clean.CleanResult;
import com.di.retailetl.load.plan.LoadPlan;
import com.di.retailetl.model.RejectedRow;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Serialises the artefacts of one run to JSON under {@code {reportDir}/{runId}/}:
 * {@code cleaning_metrics.json}, {@code transformation_audit.json}, {@code rejected_rows.json}
 * and, when a plan exists, {@code load_plan.json}.
 */
@Slf4j
public class RunReportWriter {

    static final String METRICS_FILE = "cleaning_metrics.json";
    static final String AUDIT_FILE = "transformation_audit.json";
    static final String REJECTED_FILE = "rejected_rows.json";
    static final String PLAN_FILE = "load_plan.json";

    private final Path reportDir;
    private final ObjectMapper objectMapper;

    public RunReportWriter(Path reportDir) {
        this.reportDir = reportDir;
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * @param plan may be {@code null} for clean-only runs
     * @return the directory the reports were written to
     */
    public Path write(String runId, CleanResult result, LoadPlan plan) {
        Path runDir = reportDir.resolve(runId);
        try {
            Files.createDirectories(runDir);
            objectMapper.writeValue(runDir.resolve(METRICS_FILE).toFile(), result.metrics());
            objectMapper.writeValue(runDir.resolve(AUDIT_FILE).toFile(), result.audit());
            objectMapper.writeValue(runDir.resolve(REJECTED_FILE).toFile(), rejectedView(result.rejected()));
            if (plan != null) {
                objectMapper.writeValue(runDir.resolve(PLAN_FILE).toFile(), planView(plan));
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to write run report to " + runDir, e);
        }
        log.info("[REPORT] metrics, {} audit record(s) and {} rejected row(s) → {}",
                result.audit().size(), result.rejected().size(), runDir);
        return runDir;
    }

    private static List<Map<String, Object>> rejectedView(List<RejectedRow> rejected) {
        List<Map<String, Object>> view = new ArrayList<>(rejected.size());
        for (RejectedRow r : rejected) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("rowId", r.row().getRowId());
            entry.put("reason", r.reason());
            entry.put("values", r.row().asMap());
            view.add(entry);
        }
        return view;
    }

    private static Map<String, Object> planView(LoadPlan plan) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("mode", plan.mode());
        view.put("toInsert", plan.toInsert().size());
        view.put("skippedAsDuplicate", plan.skippedAsDuplicate());
        view.put("rejected", plan.rejected().size());
        view.put("newWatermark", plan.newWatermark());
        return view;
    }
}
