package com.di.retailetl.validation;

import com.di.retailetl.clean.CleaningRules;
import com.di.retailetl.model.Row;
import com.di.retailetl.schema.ColumnConstraint;
import com.di.retailetl.schema.ColumnContract;
import com.di.retailetl.schema.ConstraintRepair;
import com.di.retailetl.schema.SchemaContract;
import com.di.retailetl.util.CoercionFailure;
import com.di.retailetl.util.TypeCoercion;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Classifies every row of a batch against a {@link SchemaContract}.
 *
 * <p>Rules are checked in order and the first one that fires decides the verdict:
 * <ol>
 *   <li>a required column is absent, null or blank: {@code Rejected(missing_required)}</li>
 *   <li>a value is not in strict form for its type: {@code Repairable(type_mismatch)} when it
 *       has a coercible shape, otherwise {@code Rejected(uncoercible)}</li>
 *   <li>a value breaks its constraint: {@code Repairable(constraint_violation)} when a repair
 *       applies, otherwise {@code Rejected(constraint_violation)}</li>
 *   <li>the natural key was already seen in this batch: {@code Repairable(intra_batch_duplicate)}</li>
 * </ol>
 * Rows are never modified, so validating the same batch twice gives the same verdicts.
 */
@Slf4j
@RequiredArgsConstructor
public class Validator {

    private final CleaningRules rules;

    public List<TaggedRow> validate(List<Row> rows, SchemaContract schema) {
        Objects.requireNonNull(rows, "rows");
        Objects.requireNonNull(schema, "schema");

        List<TaggedRow> tagged = new ArrayList<>(rows.size());
        Set<NaturalKey> seen = new HashSet<>();
        Map<ValidationVerdict.Kind, Integer> counts = new EnumMap<>(ValidationVerdict.Kind.class);
        for (Row row : rows) {
            ValidationVerdict verdict = classify(row, schema, seen);
            counts.merge(verdict.getKind(), 1, Integer::sum);
            tagged.add(new TaggedRow(row, verdict));
        }
        log.info("[VALIDATE] rows={} valid={} repairable={} rejected={}",
                rows.size(),
                counts.getOrDefault(ValidationVerdict.Kind.VALID, 0),
                counts.getOrDefault(ValidationVerdict.Kind.REPAIRABLE, 0),
                counts.getOrDefault(ValidationVerdict.Kind.REJECTED, 0));
        return tagged;
    }

    private ValidationVerdict classify(Row row, SchemaContract schema, Set<NaturalKey> seen) {
        List<ColumnContract> columns = schema.columns();

        for (ColumnContract column : columns) {
            if (column.isRequired() && TypeCoercion.isMissing(row.get(column.name()))) {
                log.debug("[VALIDATE] row {} missing required column '{}'", row.getRowId(), column.name());
                return ValidationVerdict.rejected(RejectionReasons.MISSING_REQUIRED);
            }
        }

        boolean coercible = false;
        for (ColumnContract column : columns) {
            Object value = row.get(column.name());
            if (TypeCoercion.isMissing(value)) {
                continue;
            }
            TypeCoercion.Conformance conformance = TypeCoercion.conformance(value, column.type());
            if (conformance == TypeCoercion.Conformance.UNCOERCIBLE) {
                log.debug("[VALIDATE] row {} column '{}' value '{}' is not a {}",
                        row.getRowId(), column.name(), value, column.type().getTag());
                return ValidationVerdict.rejected(RejectionReasons.UNCOERCIBLE);
            }
            coercible |= conformance == TypeCoercion.Conformance.COERCIBLE;
        }
        if (coercible) {
            seen.add(NaturalKey.of(row, rules));
            return ValidationVerdict.repairable(RejectionReasons.TYPE_MISMATCH);
        }

        boolean repairable = false;
        for (ColumnContract column : columns) {
            Object value = row.get(column.name());
            if (!column.hasConstraint() || TypeCoercion.isMissing(value) || !violates(column, value)) {
                continue;
            }
            if (!repairAvailable(column, value, row)) {
                log.debug("[VALIDATE] row {} column '{}' value '{}' violates its constraint",
                        row.getRowId(), column.name(), value);
                return ValidationVerdict.rejected(RejectionReasons.CONSTRAINT_VIOLATION);
            }
            repairable = true;
        }
        if (repairable) {
            seen.add(NaturalKey.of(row, rules));
            return ValidationVerdict.repairable(RejectionReasons.CONSTRAINT_VIOLATION);
        }

        if (!seen.add(NaturalKey.of(row, rules))) {
            return ValidationVerdict.repairable(RejectionReasons.INTRA_BATCH_DUPLICATE);
        }
        return ValidationVerdict.valid();
    }

    private boolean violates(ColumnContract column, Object value) {
        ColumnConstraint constraint = column.constraint();
        if (column.type().isNumeric()) {
            return constraint.violatedBy(strictNumber(value));
        }
        if (column.type().isText()) {
            return constraint.violatedBy(rules.normalizeText(column.name(), TypeCoercion.render(value)));
        }
        return false;
    }

    private boolean repairAvailable(ColumnContract column, Object value, Row row) {
        if (isCancellation(column, value, row)) {
            return true;
        }
        return column.constraint().repair() != ConstraintRepair.NONE;
    }

    /** Negative quantity on an invoice that carries a cancellation prefix. */
    private boolean isCancellation(ColumnContract column, Object value, Row row) {
        if (!column.name().equals(rules.getQuantityColumn()) || !column.type().isNumeric()) {
            return false;
        }
        BigDecimal quantity = strictNumber(value);
        return quantity != null && quantity.signum() < 0
                && rules.isCancellationInvoice(row.get(rules.getInvoiceColumn()));
    }

    /** Values reaching the constraint rule are already in strict form, so the root locale reads them. */
    private static BigDecimal strictNumber(Object value) {
        try {
            return TypeCoercion.toDecimal(value instanceof String ? ((String) value).strip() : value, Locale.ROOT);
        } catch (CoercionFailure e) {
            throw new IllegalStateException("Value passed the type check but is not numeric: " + value, e);
        }
    }
}
