package com.di.retailetl.load;

import com.di.retailetl.load.plan.Watermark;

/**
 * Persistent high-water mark per target table.
 */
public interface WatermarkStore {

    /** @return the stored watermark, or {@link Watermark#EMPTY} when the table was never loaded */
    Watermark readWatermark(String tableName);

    /** Stores {@code watermark}; called inside the same transaction as the insert it covers. */
    void advance(String tableName, Watermark watermark);
}
