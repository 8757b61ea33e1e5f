package com.di.retailetl.schema;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Header standardisation: {@code "InvoiceNo"}, {@code "Invoice No"} and {@code "invoice_no"}
 * all normalise to a lower-case snake form that is then looked up against column names and aliases.
 */
public final class ColumnNameNormalizer {

    private static final Pattern NON_ALNUM = Pattern.compile("[^a-z0-9]+");

    private ColumnNameNormalizer() {
    }

    public static String normalize(String header) {
        if (header == null) {
            return "";
        }
        String lower = header.replace("\uFEFF", "").trim().toLowerCase(Locale.ROOT);
        String snake = NON_ALNUM.matcher(lower).replaceAll("_");
        int start = 0;
        int end = snake.length();
        while (start < end && snake.charAt(start) == '_') {
            start++;
        }
        while (end > start && snake.charAt(end - 1) == '_') {
            end--;
        }
        return snake.substring(start, end);
    }
}
