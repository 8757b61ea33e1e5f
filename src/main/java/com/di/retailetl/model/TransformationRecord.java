package com.di.retailetl.model;

/**
 * One audit entry: a single change the cleaner made to a single field of a single row.
 * Values are kept in their rendered text form.
 */
public record TransformationRecord(int rowId,
                                   String field,
                                   String beforeValue,
                                   String afterValue,
                                   String ruleApplied) {
}
