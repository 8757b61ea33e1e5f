package com.di.retailetl.clean;

import com.di.retailetl.model.RejectedRow;
import com.di.retailetl.model.Row;
import com.di.retailetl.model.TransformationRecord;

import java.util.List;

/**
 * Output of one cleaning pass. Cleaned rows keep the relative order of the input.
 */
public record CleanResult(List<Row> cleanedRows,
                          List<TransformationRecord> audit,
                          List<RejectedRow> rejected,
                          CleaningMetrics metrics) {

    public CleanResult {
        cleanedRows = List.copyOf(cleanedRows);
        audit = List.copyOf(audit);
        rejected = List.copyOf(rejected);
    }

    public static CleanResult empty() {
        return new CleanResult(List.of(), List.of(), List.of(), CleaningMetrics.empty());
    }
}
