package com.di.retailetl.clean;

import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Counters collected while cleaning one batch; written to {@code cleaning_metrics.json}.
 */
@Getter
@ToString
public class CleaningMetrics {

    private int originalRows;
    private int cleanedRows;
    private int rejectedRows;
    private int duplicatesDropped;
    private final Map<String, Integer> missingValues = new TreeMap<>();
    private final Map<String, Integer> invalidValues = new TreeMap<>();
    private final Map<String, Integer> transformations = new TreeMap<>();

    public static CleaningMetrics empty() {
        return new CleaningMetrics();
    }

    /** Rejected share of the input, rounded to four places; {@code 0.0} for an empty batch. */
    public double getRejectionRate() {
        if (originalRows == 0) {
            return 0.0;
        }
        return BigDecimal.valueOf(rejectedRows)
                .divide(BigDecimal.valueOf(originalRows), 4, RoundingMode.HALF_EVEN)
                .doubleValue();
    }

    public Map<String, Integer> getMissingValues() {
        return Collections.unmodifiableMap(missingValues);
    }

    public Map<String, Integer> getInvalidValues() {
        return Collections.unmodifiableMap(invalidValues);
    }

    public Map<String, Integer> getTransformations() {
        return Collections.unmodifiableMap(transformations);
    }

    void originalRows(int count) {
        this.originalRows = count;
    }

    void cleaned() {
        cleanedRows++;
    }

    void rejected(String reason) {
        rejectedRows++;
        invalidValues.merge(reason, 1, Integer::sum);
    }

    void duplicateDropped() {
        duplicatesDropped++;
    }

    void missing(String column) {
        missingValues.merge(column, 1, Integer::sum);
    }

    void transformed(String rule) {
        transformations.merge(rule, 1, Integer::sum);
    }
}
