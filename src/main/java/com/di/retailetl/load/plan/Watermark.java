package com.di.retailetl.load.plan;

import java.time.LocalDateTime;
import java.util.Comparator;

/**
 * Highest (timestamp, invoice id) already loaded into a target table.
 *
 * <p>Ordering compares the timestamp first and breaks ties on the invoice id lexicographically.
 * {@link #EMPTY} means nothing has been loaded and precedes every row.
 */
public record Watermark(String lastInvoiceId, LocalDateTime lastTimestamp) {

    public static final Watermark EMPTY = new Watermark(null, null);

    private static final Comparator<Watermark> ORDER = Comparator
            .comparing(Watermark::lastTimestamp, Comparator.nullsFirst(Comparator.<LocalDateTime>naturalOrder()))
            .thenComparing(Watermark::lastInvoiceId, Comparator.nullsFirst(Comparator.<String>naturalOrder()));

    public static Watermark of(String invoiceId, LocalDateTime timestamp) {
        return new Watermark(invoiceId, timestamp);
    }

    public boolean isEmpty() {
        return lastInvoiceId == null && lastTimestamp == null;
    }

    /** True when a row at ({@code timestamp}, {@code invoiceId}) sorts strictly after this watermark. */
    public boolean isBefore(LocalDateTime timestamp, String invoiceId) {
        if (isEmpty()) {
            return true;
        }
        return ORDER.compare(this, new Watermark(invoiceId, timestamp)) < 0;
    }

    public Watermark max(Watermark other) {
        if (other == null || other.isEmpty()) {
            return this;
        }
        if (isEmpty()) {
            return other;
        }
        return ORDER.compare(this, other) >= 0 ? this : other;
    }
}
