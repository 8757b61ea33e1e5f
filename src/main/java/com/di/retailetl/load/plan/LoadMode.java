package com.di.retailetl.load.plan;

public enum LoadMode {
    /** Reload everything in the batch; the stored watermark is not consulted. */
    FULL,
    /** Load only rows strictly after the stored watermark. */
    INCREMENTAL
}
