package com.di.retailetl.source;

import com.di.retailetl.model.Row;

import java.util.List;

/**
 * Supplies one materialised batch of raw rows per run.
 */
public interface RawBatchProvider {

    List<Row> read();

    /** Human-readable origin used in logs and run audit records. */
    String describe();
}
