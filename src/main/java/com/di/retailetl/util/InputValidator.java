package com.di.retailetl.util;

import lombok.extern.slf4j.Slf4j;

import java.util.regex.Pattern;

/**
 * Guards for values that end up concatenated into SQL (table names) or sized into pools.
 */
@Slf4j
public final class InputValidator {

    private InputValidator() {}

    // ============================================================================
    // SQL Identifier Validation Patterns
    // ============================================================================

    /**
     * Unquoted MySQL identifier: starts with a letter or underscore, then letters, digits,
     * underscores or dollar signs, at most 64 characters.
     */
    private static final Pattern VALID_IDENTIFIER_PATTERN = Pattern.compile(
            "^[a-zA-Z_][a-zA-Z0-9_$]{0,63}$"
    );

    /**
     * Statement keywords as whole words, comment markers, terminators and quotes.
     */
    private static final Pattern SQL_INJECTION_PATTERN = Pattern.compile(
            "(?i)(\\b(SELECT|INSERT|UPDATE|DELETE|DROP|CREATE|ALTER|TRUNCATE|EXEC|EXECUTE|UNION)\\b|--|/\\*|\\*/|;|'|\")"
    );

    private static final int MAX_IDENTIFIER_LENGTH = 64;

    private static final int MIN_POOL_SIZE = 1;
    private static final int MAX_POOL_SIZE = 1000;

    // ============================================================================
    // SQL Identifier Validation
    // ============================================================================

    /**
     * @param identifier     the identifier to validate
     * @param identifierType used in error messages, e.g. "table name"
     * @return the trimmed identifier
     * @throws IllegalArgumentException if validation fails
     */
    public static String validateIdentifier(String identifier, String identifierType) {
        if (identifier == null) {
            throw new IllegalArgumentException(String.format("%s cannot be null", identifierType));
        }
        String trimmed = identifier.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException(String.format("%s cannot be empty", identifierType));
        }
        if (trimmed.length() > MAX_IDENTIFIER_LENGTH) {
            throw new IllegalArgumentException(
                    String.format("%s exceeds maximum length of %d characters: %s",
                            identifierType, MAX_IDENTIFIER_LENGTH, trimmed));
        }
        if (SQL_INJECTION_PATTERN.matcher(trimmed).find()) {
            log.warn("Potential SQL injection attempt detected in {}: {}", identifierType, trimmed);
            throw new IllegalArgumentException(
                    String.format("Invalid %s: contains potentially dangerous SQL patterns. "
                            + "Only alphanumeric characters, underscores, and dollar signs are allowed.",
                            identifierType));
        }
        if (!VALID_IDENTIFIER_PATTERN.matcher(trimmed).matches()) {
            throw new IllegalArgumentException(
                    String.format("Invalid %s format: '%s'. "
                            + "Must start with a letter or underscore, followed by letters, digits, underscores, or dollar signs.",
                            identifierType, trimmed));
        }
        return trimmed;
    }

    /**
     * Validates a table name, optionally qualified as {@code database.table}.
     *
     * @return the trimmed table name
     * @throws IllegalArgumentException if validation fails
     */
    public static String validateTableName(String tableName) {
        if (tableName == null || tableName.isBlank()) {
            throw new IllegalArgumentException("Table name cannot be null or empty");
        }
        String trimmed = tableName.trim();
        String[] parts = trimmed.split("\\.", 2);
        if (parts.length == 2) {
            validateIdentifier(parts[0], "Database name");
            validateIdentifier(parts[1], "Table name");
        } else {
            validateIdentifier(trimmed, "Table name");
        }
        return trimmed;
    }

    public static int validatePoolSize(int poolSize) {
        if (poolSize < MIN_POOL_SIZE || poolSize > MAX_POOL_SIZE) {
            throw new IllegalArgumentException(
                    String.format("Pool size must be between %d and %d, got: %d",
                            MIN_POOL_SIZE, MAX_POOL_SIZE, poolSize));
        }
        return poolSize;
    }
}
