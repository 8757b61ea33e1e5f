package com.di.retailetl.load.plan;

import com.di.retailetl.model.RejectedRow;
import com.di.retailetl.model.Row;

import java.util.List;

/**
 * What a run will write: the rows to insert in input order, how many cleaned rows were skipped
 * as already loaded, the rows rejected upstream, and the watermark to store after a successful
 * commit.
 */
public record LoadPlan(List<Row> toInsert,
                       int skippedAsDuplicate,
                       List<RejectedRow> rejected,
                       Watermark newWatermark,
                       LoadMode mode) {

    public LoadPlan {
        toInsert = List.copyOf(toInsert);
        rejected = List.copyOf(rejected);
    }

    public boolean isEmpty() {
        return toInsert.isEmpty();
    }
}
