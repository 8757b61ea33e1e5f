package com.di.retailetl.validation;

import com.di.retailetl.clean.CleaningRules;
import com.di.retailetl.model.Row;
import com.di.retailetl.util.TypeCoercion;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Natural key of a row over {@link CleaningRules#getNaturalKeyColumns()}. Components are compared
 * in their normalised text form so raw and cleaned rows produce the same key; an absent
 * component is {@code null}.
 */
public record NaturalKey(List<String> parts) {

    public static NaturalKey of(Row row, CleaningRules rules) {
        List<String> parts = new ArrayList<>(rules.getNaturalKeyColumns().size());
        for (String column : rules.getNaturalKeyColumns()) {
            Object value = row.get(column);
            parts.add(TypeCoercion.isMissing(value) ? null : rules.normalizeText(column, TypeCoercion.render(value)));
        }
        return new NaturalKey(Collections.unmodifiableList(parts));
    }
}
