package com.di.retailetl.clean;

import com.di.retailetl.model.RejectedRow;
import com.di.retailetl.model.Row;
import com.di.retailetl.model.TransformationRecord;
import com.di.retailetl.schema.ColumnConstraint;
import com.di.retailetl.schema.ColumnContract;
import com.di.retailetl.schema.ConstraintRepair;
import com.di.retailetl.schema.SchemaContract;
import com.di.retailetl.schema.SemanticType;
import com.di.retailetl.util.CoercionFailure;
import com.di.retailetl.util.TypeCoercion;
import com.di.retailetl.validation.NaturalKey;
import com.di.retailetl.validation.RejectionReasons;
import com.di.retailetl.validation.TaggedRow;
import com.di.retailetl.validation.ValidationVerdict;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Turns validated rows into load-ready rows.
 *
 * <pre>
 *   Rejected                      → excluded, kept with its reason
 *   Repairable(intra_batch_dup)   → dropped, one audit record, once its key was emitted
 *   Valid / other Repairable      → normalise → repair constraints → derive fields
 *   already cleaned               → passed through untouched
 * </pre>
 *
 * Every value change is written to the audit trail with the rule that made it. A repair that
 * cannot be completed turns the row into a {@code repair_failed} rejection.
 */
@Slf4j
@RequiredArgsConstructor
public class Cleaner {

    static final String RULE_DROP_UNKNOWN = "drop_unknown_column";
    static final String RULE_TRIM = "trim_whitespace";
    static final String RULE_FILL_DEFAULT = "fill_default";
    static final String RULE_COERCE_NUMERIC = "coerce_numeric";
    static final String RULE_NORMALIZE_DATE = "normalize_date";
    static final String RULE_UPPERCASE = "uppercase_code";
    static final String RULE_RETAIN_CANCELLATION = "retain_cancellation";
    static final String RULE_CLAMP = "clamp_to_range";
    static final String RULE_DEFAULT_ON_VIOLATION = "default_on_violation";
    static final String RULE_DROP_DUPLICATE = "drop_intra_batch_duplicate";

    private static final String WHOLE_ROW = "*";

    private final SchemaContract schema;
    private final CleaningRules rules;

    public CleanResult clean(List<TaggedRow> taggedRows) {
        Objects.requireNonNull(taggedRows, "taggedRows");
        if (taggedRows.isEmpty()) {
            log.warn("[CLEAN] Received empty batch - nothing to clean");
            return CleanResult.empty();
        }

        List<Row> cleaned = new ArrayList<>(taggedRows.size());
        List<TransformationRecord> audit = new ArrayList<>();
        List<RejectedRow> rejected = new ArrayList<>();
        CleaningMetrics metrics = new CleaningMetrics();
        metrics.originalRows(taggedRows.size());
        Set<NaturalKey> emitted = new HashSet<>();

        for (TaggedRow tagged : taggedRows) {
            Row source = tagged.row();
            ValidationVerdict verdict = tagged.verdict();

            if (source.isCleaned() && !verdict.isRejected()) {
                if (emitted.add(NaturalKey.of(source, rules))) {
                    cleaned.add(source.copy());
                    metrics.cleaned();
                } else {
                    dropDuplicate(source, audit, metrics);
                }
                continue;
            }
            if (verdict.isRejected()) {
                rejected.add(new RejectedRow(source, verdict.getReason()));
                metrics.rejected(verdict.getReason());
                continue;
            }
            // the first occurrence may have failed its repair; then this row takes its place
            if (verdict.is(ValidationVerdict.Kind.REPAIRABLE, RejectionReasons.INTRA_BATCH_DUPLICATE)
                    && emitted.contains(NaturalKey.of(source, rules))) {
                dropDuplicate(source, audit, metrics);
                continue;
            }

            Row row = source.copy();
            List<TransformationRecord> rowAudit = new ArrayList<>();
            try {
                normalize(row, rowAudit, metrics);
                repairConstraints(row, rowAudit);
                derive(row);
            } catch (CoercionFailure e) {
                log.debug("[CLEAN] row {} could not be repaired: {}", source.getRowId(), e.getMessage());
                rejected.add(new RejectedRow(source, RejectionReasons.REPAIR_FAILED));
                metrics.rejected(RejectionReasons.REPAIR_FAILED);
                continue;
            }
            if (!emitted.add(NaturalKey.of(row, rules))) {
                dropDuplicate(source, audit, metrics);
                continue;
            }
            row.markCleaned();
            cleaned.add(row);
            metrics.cleaned();
            for (TransformationRecord record : rowAudit) {
                audit.add(record);
                metrics.transformed(record.ruleApplied());
            }
        }

        log.info("[CLEAN] original={} cleaned={} rejected={} duplicatesDropped={} auditRecords={}",
                metrics.getOriginalRows(), metrics.getCleanedRows(), metrics.getRejectedRows(),
                metrics.getDuplicatesDropped(), audit.size());
        return new CleanResult(cleaned, audit, rejected, metrics);
    }

    /* -------------------------------------------------------------------- */

    private void normalize(Row row, List<TransformationRecord> audit, CleaningMetrics metrics) throws CoercionFailure {
        for (String column : new ArrayList<>(row.columns())) {
            if (!schema.contains(column) && !rules.isDerived(column)) {
                Object removed = row.remove(column);
                audit.add(record(row, column, removed, null, RULE_DROP_UNKNOWN));
            }
        }

        for (ColumnContract column : schema.columns()) {
            String name = column.name();
            Object value = row.get(name);

            if (value instanceof String) {
                String trimmed = ((String) value).strip();
                if (!trimmed.equals(value) && !trimmed.isEmpty()) {
                    audit.add(record(row, name, value, trimmed, RULE_TRIM));
                }
                value = trimmed;
            }

            if (TypeCoercion.isMissing(value)) {
                metrics.missing(name);
                if (!column.hasDefault()) {
                    row.put(name, null);
                    continue;
                }
                Object filled = TypeCoercion.coerce(column.defaultValue(), column.type(), rules.getDecimalLocale());
                audit.add(record(row, name, row.get(name), filled, RULE_FILL_DEFAULT));
                row.put(name, filled);
                continue;
            }

            Object typed = TypeCoercion.coerce(value, column.type(), rules.getDecimalLocale());
            if (!Objects.equals(TypeCoercion.render(value), TypeCoercion.render(typed))) {
                audit.add(record(row, name, value, typed,
                        column.type() == SemanticType.DATE ? RULE_NORMALIZE_DATE : RULE_COERCE_NUMERIC));
            }
            if (typed instanceof String && rules.isUppercase(name)) {
                String upper = ((String) typed).toUpperCase(Locale.ROOT);
                if (!upper.equals(typed)) {
                    audit.add(record(row, name, typed, upper, RULE_UPPERCASE));
                }
                typed = upper;
            }
            row.put(name, typed);
        }
    }

    private void repairConstraints(Row row, List<TransformationRecord> audit) throws CoercionFailure {
        for (ColumnContract column : schema.columns()) {
            String name = column.name();
            Object value = row.get(name);
            if (!column.hasConstraint() || value == null) {
                continue;
            }
            ColumnConstraint constraint = column.constraint();

            if (column.type().isNumeric()) {
                BigDecimal number = TypeCoercion.toDecimal(value, rules.getDecimalLocale());
                if (!constraint.violatedBy(number)) {
                    continue;
                }
                if (name.equals(rules.getQuantityColumn()) && number.signum() < 0
                        && rules.isCancellationInvoice(row.get(rules.getInvoiceColumn()))) {
                    audit.add(record(row, name, value, value, RULE_RETAIN_CANCELLATION));
                    continue;
                }
                switch (constraint.repair()) {
                    case CLAMP:
                        BigDecimal clamped = constraint.clamp(number);
                        Object repaired = column.type() == SemanticType.INTEGER
                                ? TypeCoercion.toLong(clamped, rules.getDecimalLocale())
                                : clamped;
                        audit.add(record(row, name, value, repaired, RULE_CLAMP));
                        row.put(name, repaired);
                        break;
                    case DEFAULT:
                        substituteDefault(row, column, audit);
                        break;
                    default:
                        throw new CoercionFailure("'" + value + "' violates the constraint on " + name);
                }
            } else if (column.type().isText() && constraint.violatedBy((String) value)) {
                if (!column.hasDefault() || constraint.repair() != ConstraintRepair.DEFAULT) {
                    throw new CoercionFailure("'" + value + "' violates the constraint on " + name);
                }
                substituteDefault(row, column, audit);
            }
        }
    }

    private void substituteDefault(Row row, ColumnContract column, List<TransformationRecord> audit) throws CoercionFailure {
        Object replacement = TypeCoercion.coerce(column.defaultValue(), column.type(), rules.getDecimalLocale());
        audit.add(record(row, column.name(), row.get(column.name()), replacement, RULE_DEFAULT_ON_VIOLATION));
        row.put(column.name(), replacement);
    }

    private void derive(Row row) throws CoercionFailure {
        Object quantity = row.get(rules.getQuantityColumn());
        Object price = row.get(rules.getPriceColumn());
        BigDecimal lineTotal = null;
        if (quantity != null && price != null) {
            lineTotal = TypeCoercion.toDecimal(quantity, rules.getDecimalLocale())
                    .multiply(TypeCoercion.toDecimal(price, rules.getDecimalLocale()))
                    .setScale(CleaningRules.MONEY_SCALE, CleaningRules.LINE_TOTAL_ROUNDING);
        }
        row.put(CleaningRules.LINE_TOTAL, lineTotal);
        row.put(CleaningRules.IS_CANCELLATION, rules.isCancellationInvoice(row.get(rules.getInvoiceColumn())));
    }

    private void dropDuplicate(Row source, List<TransformationRecord> audit, CleaningMetrics metrics) {
        TransformationRecord record = new TransformationRecord(source.getRowId(), WHOLE_ROW,
                String.valueOf(NaturalKey.of(source, rules).parts()), null, RULE_DROP_DUPLICATE);
        audit.add(record);
        metrics.transformed(RULE_DROP_DUPLICATE);
        metrics.duplicateDropped();
    }

    private static TransformationRecord record(Row row, String field, Object before, Object after, String rule) {
        return new TransformationRecord(row.getRowId(), field,
                TypeCoercion.render(before), TypeCoercion.render(after), rule);
    }
}
