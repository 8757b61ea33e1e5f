package com.di.retailetl.validation;

import com.di.retailetl.model.Row;

public record TaggedRow(Row row, ValidationVerdict verdict) {
}
