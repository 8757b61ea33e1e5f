package com.di.retailetl.schema;

import lombok.Getter;

/**
 * Raised when a schema definition is malformed. Fatal: no row is processed against a schema
 * that failed to load.
 */
@Getter
public class SchemaError extends RuntimeException {

    private final String column;
    private final String rule;

    public SchemaError(String column, String rule, String detail) {
        super(format(column, rule, detail));
        this.column = column;
        this.rule = rule;
    }

    public SchemaError(String column, String rule, String detail, Throwable cause) {
        super(format(column, rule, detail), cause);
        this.column = column;
        this.rule = rule;
    }

    private static String format(String column, String rule, String detail) {
        String where = column == null ? "schema" : "column '" + column + "'";
        return "Malformed " + where + " [" + rule + "]: " + detail;
    }
}
