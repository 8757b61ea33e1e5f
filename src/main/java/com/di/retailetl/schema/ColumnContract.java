package com.di.retailetl.schema;

import java.util.List;

/**
 * Contract for a single column: semantic type, nullability, optional constraint and default,
 * plus the raw header aliases that resolve to it.
 */
public record ColumnContract(String name,
                             SemanticType type,
                             boolean nullable,
                             ColumnConstraint constraint,
                             String defaultValue,
                             List<String> aliases) {

    public ColumnContract {
        constraint = constraint == null ? ColumnConstraint.NONE : constraint;
        aliases = aliases == null ? List.of() : List.copyOf(aliases);
    }

    public static ColumnContract of(String name, SemanticType type, boolean nullable) {
        return new ColumnContract(name, type, nullable, ColumnConstraint.NONE, null, List.of());
    }

    public boolean hasDefault() {
        return defaultValue != null;
    }

    public boolean hasConstraint() {
        return !constraint.isEmpty();
    }

    /** A row may not leave this column empty. */
    public boolean isRequired() {
        return !nullable && !hasDefault();
    }
}
