package com.di.retailetl.load;

import com.di.retailetl.load.plan.LoadMode;

import java.time.LocalDateTime;

/**
 * Per-run switches.
 *
 * @param windowStart inclusive lower bound on the row timestamp, or {@code null}
 * @param windowEnd   exclusive upper bound on the row timestamp, or {@code null}
 */
public record RunOptions(LoadMode mode,
                         boolean dryRun,
                         boolean onlyClean,
                         LocalDateTime windowStart,
                         LocalDateTime windowEnd) {

    public static RunOptions of(LoadMode mode) {
        return new RunOptions(mode, false, false, null, null);
    }

    public boolean writesToDatabase() {
        return !dryRun && !onlyClean;
    }

    public boolean inWindow(LocalDateTime timestamp) {
        if (windowStart == null && windowEnd == null) {
            return true;
        }
        if (timestamp == null) {
            return false;
        }
        return (windowStart == null || !timestamp.isBefore(windowStart))
                && (windowEnd == null || timestamp.isBefore(windowEnd));
    }
}
