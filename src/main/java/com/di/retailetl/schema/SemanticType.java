package com.di.retailetl.schema;

import java.util.Locale;
import java.util.Optional;

/**
 * Semantic column types understood by the schema contract.
 */
public enum SemanticType {

    INTEGER("integer"),
    DECIMAL("decimal"),
    STRING("string"),
    DATE("date"),
    ENUM("enum");

    private final String tag;

    SemanticType(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }

    public boolean isNumeric() {
        return this == INTEGER || this == DECIMAL;
    }

    public boolean isText() {
        return this == STRING || this == ENUM;
    }

    /** Resolves a schema-file tag ({@code "integer"}, {@code "Decimal"}, ...); empty when unknown. */
    public static Optional<SemanticType> fromTag(String tag) {
        if (tag == null) {
            return Optional.empty();
        }
        String normalized = tag.trim().toLowerCase(Locale.ROOT);
        for (SemanticType type : values()) {
            if (type.tag.equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
