package com.di.retailetl.model;

/**
 * A row excluded from loading, with the reason code that excluded it.
 */
public record RejectedRow(Row row, String reason) {
}
