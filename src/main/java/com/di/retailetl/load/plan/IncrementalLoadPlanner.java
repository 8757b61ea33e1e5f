package com.di.retailetl.load.plan;

import com.di.retailetl.clean.CleanResult;
import com.di.retailetl.clean.CleaningRules;
import com.di.retailetl.model.RejectedRow;
import com.di.retailetl.model.Row;
import com.di.retailetl.util.CoercionFailure;
import com.di.retailetl.util.TypeCoercion;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Decides which cleaned rows a run writes.
 *
 * <p>FULL takes every row. INCREMENTAL keeps only rows whose (timestamp, invoice id) is strictly
 * greater than the stored watermark and counts the rest as skipped. Planning is pure: the
 * watermark is passed in and the store is never touched.
 */
@Slf4j
@RequiredArgsConstructor
public class IncrementalLoadPlanner {

    private final CleaningRules rules;

    public LoadPlan plan(List<Row> cleanedRows, Watermark watermark, LoadMode mode) {
        return plan(cleanedRows, List.of(), watermark, mode);
    }

    public LoadPlan plan(CleanResult result, Watermark watermark, LoadMode mode) {
        return plan(result.cleanedRows(), result.rejected(), watermark, mode);
    }

    private LoadPlan plan(List<Row> rows, List<RejectedRow> rejected, Watermark watermark, LoadMode mode) {
        Objects.requireNonNull(rows, "rows");
        Objects.requireNonNull(mode, "mode");
        Watermark current = watermark == null ? Watermark.EMPTY : watermark;

        if (rows.isEmpty()) {
            log.info("[PLAN] mode={} empty batch, watermark stays at {}", mode, current);
            return new LoadPlan(List.of(), 0, rejected, current, mode);
        }

        if (mode == LoadMode.FULL) {
            Watermark batchMax = Watermark.EMPTY;
            for (Row row : rows) {
                batchMax = batchMax.max(watermarkOf(row));
            }
            log.info("[PLAN] mode=FULL toInsert={} newWatermark={}", rows.size(), batchMax);
            return new LoadPlan(rows, 0, rejected, batchMax, mode);
        }

        List<Row> toInsert = new ArrayList<>();
        int skipped = 0;
        Watermark next = current;
        for (Row row : rows) {
            Watermark position = watermarkOf(row);
            if (current.isBefore(position.lastTimestamp(), position.lastInvoiceId())) {
                toInsert.add(row);
                next = next.max(position);
            } else {
                skipped++;
            }
        }
        log.info("[PLAN] mode=INCREMENTAL watermark={} toInsert={} skippedAsDuplicate={} newWatermark={}",
                current, toInsert.size(), skipped, next);
        return new LoadPlan(toInsert, skipped, rejected, next, mode);
    }

    private Watermark watermarkOf(Row row) {
        Object invoice = row.get(rules.getInvoiceColumn());
        Object timestamp = row.get(rules.getTimestampColumn());
        LocalDateTime ts;
        try {
            ts = timestamp == null ? null : TypeCoercion.toTimestamp(timestamp);
        } catch (CoercionFailure e) {
            throw new IllegalStateException("Row " + row.getRowId() + " has no usable "
                    + rules.getTimestampColumn() + ": " + timestamp, e);
        }
        return new Watermark(invoice == null ? null : String.valueOf(invoice), ts);
    }
}
