package com.di.retailetl.schema;

import java.math.BigDecimal;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Declared constraint on a column. Bounds are inclusive and apply to numeric columns;
 * pattern and allowed values apply to the textual form of STRING and ENUM columns.
 */
public record ColumnConstraint(BigDecimal min,
                               BigDecimal max,
                               Pattern pattern,
                               Set<String> allowedValues,
                               ConstraintRepair repair) {

    public static final ColumnConstraint NONE =
            new ColumnConstraint(null, null, null, Set.of(), ConstraintRepair.NONE);

    public ColumnConstraint {
        allowedValues = allowedValues == null ? Set.of() : Set.copyOf(allowedValues);
        repair = repair == null ? ConstraintRepair.NONE : repair;
    }

    public boolean hasRange() {
        return min != null || max != null;
    }

    public boolean isEmpty() {
        return !hasRange() && pattern == null && allowedValues.isEmpty();
    }

    public boolean violatedBy(BigDecimal value) {
        if (value == null) {
            return false;
        }
        return (min != null && value.compareTo(min) < 0)
                || (max != null && value.compareTo(max) > 0);
    }

    public boolean violatedBy(String value) {
        if (value == null) {
            return false;
        }
        if (pattern != null && !pattern.matcher(value).matches()) {
            return true;
        }
        return !allowedValues.isEmpty() && !allowedValues.contains(value);
    }

    /** Pulls {@code value} into [min, max]; values already in range come back unchanged. */
    public BigDecimal clamp(BigDecimal value) {
        if (min != null && value.compareTo(min) < 0) {
            return min;
        }
        if (max != null && value.compareTo(max) > 0) {
            return max;
        }
        return value;
    }
}
