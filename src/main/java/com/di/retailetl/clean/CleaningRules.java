package com.di.retailetl.clean;

import lombok.Builder;
import lombok.Value;

import java.math.RoundingMode;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Explicit cleaning configuration handed to the validator, cleaner and planner at construction.
 *
 * <p>Column roles default to the retail schema names; the natural-key columns, the rounding
 * policy and the derived column names are fixed constants.
 */
@Value
@Builder(toBuilder = true)
public class CleaningRules {

    public static final RoundingMode LINE_TOTAL_ROUNDING = RoundingMode.HALF_EVEN;
    public static final int MONEY_SCALE = 2;

    public static final String LINE_TOTAL = "line_total";
    public static final String IS_CANCELLATION = "is_cancellation";
    public static final Set<String> DERIVED_COLUMNS = Set.of(LINE_TOTAL, IS_CANCELLATION);

    /** An absent {@code line_no} is a {@code null} part, so sources without it key on invoice and stock code. */
    public static final List<String> NATURAL_KEY_COLUMNS = List.of("invoice", "stock_code", "line_no");

    @Builder.Default
    String invoiceColumn = "invoice";
    @Builder.Default
    String quantityColumn = "quantity";
    @Builder.Default
    String priceColumn = "price";
    @Builder.Default
    String timestampColumn = "invoice_date";
    @Builder.Default
    String customerColumn = "customer_id";
    @Builder.Default
    String stockCodeColumn = "stock_code";
    @Builder.Default
    String descriptionColumn = "description";
    @Builder.Default
    String countryColumn = "country";

    @Builder.Default
    List<String> cancellationPrefixes = List.of("C");
    @Builder.Default
    Set<String> uppercaseColumns = Set.of("country", "currency");
    @Builder.Default
    Locale decimalLocale = Locale.US;

    public static CleaningRules defaults() {
        return builder().build();
    }

    public List<String> getNaturalKeyColumns() {
        return NATURAL_KEY_COLUMNS;
    }

    public boolean isDerived(String column) {
        return DERIVED_COLUMNS.contains(column);
    }

    public boolean isUppercase(String column) {
        return uppercaseColumns.contains(column);
    }

    /** An invoice whose trimmed, upper-cased id starts with a cancellation prefix. */
    public boolean isCancellationInvoice(Object invoice) {
        if (invoice == null) {
            return false;
        }
        String id = String.valueOf(invoice).strip().toUpperCase(Locale.ROOT);
        for (String prefix : cancellationPrefixes) {
            if (!prefix.isEmpty() && id.startsWith(prefix.toUpperCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }

    /** Text form a value takes after cleaning: trimmed, and upper-cased for code columns. */
    public String normalizeText(String column, String raw) {
        if (raw == null) {
            return null;
        }
        String trimmed = raw.strip();
        return isUppercase(column) ? trimmed.toUpperCase(Locale.ROOT) : trimmed;
    }
}
