package com.di.retailetl.util;

import com.di.retailetl.schema.SemanticType;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.text.DecimalFormatSymbols;
import java.time.LocalDateTime;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Conversions between raw batch values and the Java types of each {@link SemanticType}.
 *
 * <p>INTEGER maps to {@link Long}, DECIMAL to {@link BigDecimal}, DATE to {@link LocalDateTime}
 * and STRING / ENUM to {@link String}.
 *
 * <p>Two levels are exposed. {@link #conformance(Object, SemanticType)} is a shape check used
 * during validation: it says whether a value is already in strict form, looks like something a
 * coercion rule could convert, or cannot be converted at all. The {@code to*} methods perform
 * the conversion and fail with {@link CoercionFailure} when the value turns out to be ambiguous
 * for the configured locale.
 */
public final class TypeCoercion {

    public enum Conformance {
        CONFORMANT,
        COERCIBLE,
        UNCOERCIBLE
    }

    private static final Pattern STRICT_INTEGER = Pattern.compile("-?\\d+");
    private static final Pattern STRICT_DECIMAL = Pattern.compile("-?\\d+(\\.\\d+)?");
    private static final Pattern NUMERIC_SHAPE = Pattern.compile("[+-]?\\d([\\d.,' \\u00A0]*\\d)?");
    private static final Pattern DIGITS = Pattern.compile("\\d+");

    private TypeCoercion() {
    }

    /** Null and blank strings count as missing. */
    public static boolean isMissing(Object value) {
        return value == null || (value instanceof String && ((String) value).isBlank());
    }

    // ------------------------------------------------------------------
    // Shape check
    // ------------------------------------------------------------------

    public static Conformance conformance(Object value, SemanticType type) {
        if (value == null) {
            return Conformance.CONFORMANT;
        }
        switch (type) {
            case INTEGER:
                return integerConformance(value);
            case DECIMAL:
                return decimalConformance(value);
            case DATE:
                return dateConformance(value);
            default:
                return Conformance.CONFORMANT;
        }
    }

    private static Conformance integerConformance(Object value) {
        if (isIntegralNumber(value)) {
            return Conformance.CONFORMANT;
        }
        if (value instanceof Number) {
            return isNonFinite(value) ? Conformance.UNCOERCIBLE : Conformance.COERCIBLE;
        }
        if (value instanceof String) {
            String s = ((String) value).strip();
            if (STRICT_INTEGER.matcher(s).matches()) {
                return Conformance.CONFORMANT;
            }
            return NUMERIC_SHAPE.matcher(s).matches() ? Conformance.COERCIBLE : Conformance.UNCOERCIBLE;
        }
        return Conformance.UNCOERCIBLE;
    }

    private static Conformance decimalConformance(Object value) {
        if (value instanceof Number) {
            return isNonFinite(value) ? Conformance.UNCOERCIBLE : Conformance.CONFORMANT;
        }
        if (value instanceof String) {
            String s = ((String) value).strip();
            if (STRICT_DECIMAL.matcher(s).matches()) {
                return Conformance.CONFORMANT;
            }
            return NUMERIC_SHAPE.matcher(s).matches() ? Conformance.COERCIBLE : Conformance.UNCOERCIBLE;
        }
        return Conformance.UNCOERCIBLE;
    }

    /** NaN and the infinities have no decimal form. */
    private static boolean isNonFinite(Object value) {
        if (value instanceof Double) {
            return !Double.isFinite((Double) value);
        }
        if (value instanceof Float) {
            return !Float.isFinite((Float) value);
        }
        return false;
    }

    private static Conformance dateConformance(Object value) {
        if (DateFormatUtils.isTemporal(value)) {
            return Conformance.CONFORMANT;
        }
        if (value instanceof String) {
            return DateFormatUtils.tryParse((String) value).isPresent()
                    ? Conformance.CONFORMANT
                    : Conformance.UNCOERCIBLE;
        }
        return Conformance.UNCOERCIBLE;
    }

    // ------------------------------------------------------------------
    // Conversion
    // ------------------------------------------------------------------

    public static Object coerce(Object value, SemanticType type, Locale locale) throws CoercionFailure {
        if (value == null) {
            return null;
        }
        switch (type) {
            case INTEGER:
                return toLong(value, locale);
            case DECIMAL:
                return toDecimal(value, locale);
            case DATE:
                return toTimestamp(value);
            default:
                return value instanceof String ? ((String) value).strip() : String.valueOf(value);
        }
    }

    public static Long toLong(Object value, Locale locale) throws CoercionFailure {
        if (value instanceof Long) {
            return (Long) value;
        }
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        BigDecimal decimal = toDecimal(value, locale);
        try {
            return decimal.longValueExact();
        } catch (ArithmeticException e) {
            throw new CoercionFailure("'" + value + "' is not a whole number in range", e);
        }
    }

    public static BigDecimal toDecimal(Object value, Locale locale) throws CoercionFailure {
        if (value instanceof BigDecimal) {
            return (BigDecimal) value;
        }
        if (value instanceof BigInteger) {
            return new BigDecimal((BigInteger) value);
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                throw new CoercionFailure("non-finite number " + value);
            }
            return BigDecimal.valueOf(d);
        }
        if (value instanceof Number) {
            return BigDecimal.valueOf(((Number) value).longValue());
        }
        if (value instanceof String) {
            return parseDecimal((String) value, locale);
        }
        throw new CoercionFailure("cannot read a number from " + value.getClass().getSimpleName());
    }

    public static LocalDateTime toTimestamp(Object value) throws CoercionFailure {
        try {
            return DateFormatUtils.toLocalDateTime(value);
        } catch (IllegalArgumentException e) {
            throw new CoercionFailure(e.getMessage(), e);
        }
    }

    /**
     * Parses a number written either in canonical form ({@code -12.50}) or in the locale's
     * notation, e.g. {@code 2,50} and {@code 1.234,56} for {@code de-DE} or {@code 1,234.56}
     * for {@code en-US}. Grouping separators must sit on thousands boundaries.
     */
    static BigDecimal parseDecimal(String raw, Locale locale) throws CoercionFailure {
        String s = raw.strip().replace("\u00A0", "").replace(" ", "");
        if (s.startsWith("+")) {
            s = s.substring(1);
        }
        if (STRICT_DECIMAL.matcher(s).matches()) {
            return new BigDecimal(s);
        }
        DecimalFormatSymbols symbols = DecimalFormatSymbols.getInstance(locale == null ? Locale.ROOT : locale);
        char decimalSeparator = symbols.getDecimalSeparator();
        char groupingSeparator = symbols.getGroupingSeparator();

        String sign = "";
        if (s.startsWith("-")) {
            sign = "-";
            s = s.substring(1);
        }
        int decimalAt = s.lastIndexOf(decimalSeparator);
        String integerPart = decimalAt >= 0 ? s.substring(0, decimalAt) : s;
        String fraction = decimalAt >= 0 ? s.substring(decimalAt + 1) : "";
        if (decimalAt >= 0 && !DIGITS.matcher(fraction).matches()) {
            throw new CoercionFailure("'" + raw + "' has an unreadable fraction for locale " + locale);
        }
        if (integerPart.indexOf(groupingSeparator) >= 0) {
            Pattern grouped = Pattern.compile("\\d{1,3}(" + Pattern.quote(String.valueOf(groupingSeparator)) + "\\d{3})+");
            if (!grouped.matcher(integerPart).matches()) {
                throw new CoercionFailure("'" + raw + "' has misplaced grouping separators for locale " + locale);
            }
            integerPart = integerPart.replace(String.valueOf(groupingSeparator), "");
        }
        if (!DIGITS.matcher(integerPart).matches()) {
            throw new CoercionFailure("'" + raw + "' is not a number for locale " + locale);
        }
        return new BigDecimal(sign + integerPart + (fraction.isEmpty() ? "" : "." + fraction));
    }

    // ------------------------------------------------------------------
    // Rendering
    // ------------------------------------------------------------------

    /** Canonical text form used by the audit trail to decide whether a value changed. */
    public static String render(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof LocalDateTime) {
            return DateFormatUtils.toCanonical((LocalDateTime) value);
        }
        if (value instanceof BigDecimal) {
            return ((BigDecimal) value).toPlainString();
        }
        return String.valueOf(value);
    }

    private static boolean isIntegralNumber(Object value) {
        return value instanceof Long || value instanceof Integer
                || value instanceof Short || value instanceof Byte
                || value instanceof BigInteger;
    }
}
