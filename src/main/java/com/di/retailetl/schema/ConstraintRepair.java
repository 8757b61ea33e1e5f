package com.di.retailetl.schema;

import java.util.Locale;
import java.util.Optional;

/**
 * Repair attached to a column constraint. {@code NONE} means a violation rejects the row.
 */
public enum ConstraintRepair {
    NONE,
    CLAMP,
    DEFAULT;

    public static Optional<ConstraintRepair> fromTag(String tag) {
        if (tag == null || tag.isBlank()) {
            return Optional.of(NONE);
        }
        try {
            return Optional.of(valueOf(tag.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
