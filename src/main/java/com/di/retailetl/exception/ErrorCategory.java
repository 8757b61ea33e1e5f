package com.di.retailetl.exception;

import com.di.retailetl.schema.SchemaError;
import com.di.retailetl.source.BatchReadException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.BadSqlGrammarException;
import org.springframework.transaction.TransactionException;

import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Failure categories recorded on a failed run and in the runner's error log.
 * <p>Usage: {@code ErrorCategory category = ErrorCategory.categorize(exception);}
 */
public enum ErrorCategory {

    SCHEMA_ERROR("Schema error", "The column contract could not be loaded"),
    INPUT_ERROR("Input error", "The raw batch could not be read"),
    CONNECTION_ERROR("Database connection error", "Failed to establish or maintain database connection"),
    CONSTRAINT_VIOLATION("Database constraint violation", "Database constraint check failed"),
    SQL_SYNTAX_ERROR("SQL syntax error", "Invalid SQL syntax or missing table"),
    TRANSACTION_ROLLBACK("Transaction rollback", "Transaction was rolled back"),
    DATABASE_ERROR("Database error", "General database operation error"),
    VALIDATION_ERROR("Validation error", "Invalid argument or configuration value"),
    CONFIGURATION_ERROR("Configuration error", "Application configuration issue"),
    APPLICATION_ERROR("Application error", "General application error"),
    UNKNOWN("Unknown error", "Unclassified or unknown error type");

    private final String name;
    private final String description;

    ErrorCategory(String name, String description) {
        this.name = name;
        this.description = description;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    /** Order matters: first match wins. */
    private static final Map<Predicate<Throwable>, ErrorCategory> MATCHERS = new LinkedHashMap<>();

    static {
        MATCHERS.put(t -> t instanceof SchemaError, SCHEMA_ERROR);
        MATCHERS.put(ErrorCategory::isInputError, INPUT_ERROR);
        MATCHERS.put(t -> t instanceof DataAccessResourceFailureException, CONNECTION_ERROR);
        MATCHERS.put(t -> t instanceof DataIntegrityViolationException, CONSTRAINT_VIOLATION);
        MATCHERS.put(t -> t instanceof BadSqlGrammarException, SQL_SYNTAX_ERROR);
        MATCHERS.put(t -> t instanceof TransactionException, TRANSACTION_ROLLBACK);
        MATCHERS.put(ErrorCategory::isConfigurationError, CONFIGURATION_ERROR);
        MATCHERS.put(ErrorCategory::isValidationError, VALIDATION_ERROR);
    }

    public static ErrorCategory categorize(Throwable exception) {
        if (exception == null) {
            return UNKNOWN;
        }
        if (exception instanceof SQLException) {
            return categorizeSqlException((SQLException) exception);
        }
        for (Map.Entry<Predicate<Throwable>, ErrorCategory> e : MATCHERS.entrySet()) {
            if (e.getKey().test(exception)) {
                return e.getValue();
            }
        }
        if (exception instanceof DataAccessException) {
            Throwable root = ((DataAccessException) exception).getMostSpecificCause();
            return root instanceof SQLException ? categorizeSqlException((SQLException) root) : DATABASE_ERROR;
        }
        return APPLICATION_ERROR;
    }

    private static ErrorCategory categorizeSqlException(SQLException sqlEx) {
        String sqlState = sqlEx.getSQLState();
        if (sqlState != null) {
            ErrorCategory byState = SQL_STATE_PREFIX.get(sqlState.substring(0, Math.min(2, sqlState.length())));
            if (byState != null) {
                return byState;
            }
        }
        String msg = sqlEx.getMessage();
        if (msg != null) {
            String lower = msg.toLowerCase();
            if (containsAny(lower, "connection", "refused", "closed")) return CONNECTION_ERROR;
            if (containsAny(lower, "constraint", "duplicate entry", "foreign key")) return CONSTRAINT_VIOLATION;
            if (containsAny(lower, "syntax", "doesn't exist")) return SQL_SYNTAX_ERROR;
        }
        return DATABASE_ERROR;
    }

    private static final Map<String, ErrorCategory> SQL_STATE_PREFIX = Map.of(
            "08", CONNECTION_ERROR,
            "23", CONSTRAINT_VIOLATION,
            "42", SQL_SYNTAX_ERROR,
            "40", TRANSACTION_ROLLBACK
    );

    // --- Matcher helpers ---

    private static boolean isInputError(Throwable t) {
        return t instanceof BatchReadException
                || t instanceof java.io.FileNotFoundException
                || t instanceof java.nio.file.NoSuchFileException;
    }

    private static boolean isConfigurationError(Throwable t) {
        return t instanceof org.springframework.beans.factory.BeanCreationException
                || t instanceof org.springframework.context.ApplicationContextException
                || t instanceof org.springframework.boot.context.properties.bind.BindException;
    }

    private static boolean isValidationError(Throwable t) {
        return t instanceof IllegalArgumentException
                || t instanceof IllegalStateException;
    }

    private static boolean containsAny(String text, String... parts) {
        for (String p : parts) {
            if (text.contains(p)) {
                return true;
            }
        }
        return false;
    }
}
