package com.di.retailetl.util;

import com.di.retailetl.schema.SemanticType;
import com.di.retailetl.util.TypeCoercion.Conformance;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.LocalDateTime;
import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TypeCoercion Tests")
class TypeCoercionTest {

    // ============================================================================
    // Missing values
    // ============================================================================

    @Test
    @DisplayName("Should treat null and blank strings as missing")
    void testIsMissing() {
        assertTrue(TypeCoercion.isMissing(null));
        assertTrue(TypeCoercion.isMissing(""));
        assertTrue(TypeCoercion.isMissing(" \t"));
        assertFalse(TypeCoercion.isMissing("0"));
        assertFalse(TypeCoercion.isMissing(0));
    }

    // ============================================================================
    // Conformance
    // ============================================================================

    @ParameterizedTest
    @CsvSource({
        "5,          INTEGER, CONFORMANT",
        "-3,         INTEGER, CONFORMANT",
        "6.0,        INTEGER, COERCIBLE",
        "'1,200',    INTEGER, COERCIBLE",
        "+7,         INTEGER, COERCIBLE",
        "five,       INTEGER, UNCOERCIBLE",
        "2.50,       DECIMAL, CONFORMANT",
        "-12,        DECIMAL, CONFORMANT",
        "'2,50',     DECIMAL, COERCIBLE",
        "'1 234.50', DECIMAL, COERCIBLE",
        "$2.50,      DECIMAL, UNCOERCIBLE",
        "12/1/2010 8:26, DATE, CONFORMANT",
        "someday,    DATE,    UNCOERCIBLE",
        "anything,   STRING,  CONFORMANT"
    })
    @DisplayName("Should classify string values by shape")
    void testConformance_Strings(String value, SemanticType type, Conformance expected) {
        assertEquals(expected, TypeCoercion.conformance(value, type));
    }

    @Test
    @DisplayName("Should classify native Java values")
    void testConformance_NativeValues() {
        assertEquals(Conformance.CONFORMANT, TypeCoercion.conformance(5L, SemanticType.INTEGER));
        assertEquals(Conformance.CONFORMANT, TypeCoercion.conformance(BigInteger.TEN, SemanticType.INTEGER));
        assertEquals(Conformance.COERCIBLE, TypeCoercion.conformance(6.0d, SemanticType.INTEGER));
        assertEquals(Conformance.CONFORMANT, TypeCoercion.conformance(2.5d, SemanticType.DECIMAL));
        assertEquals(Conformance.CONFORMANT, TypeCoercion.conformance(LocalDateTime.now(), SemanticType.DATE));
        assertEquals(Conformance.UNCOERCIBLE, TypeCoercion.conformance(Boolean.TRUE, SemanticType.INTEGER));
        assertEquals(Conformance.UNCOERCIBLE, TypeCoercion.conformance(42, SemanticType.DATE));
        assertEquals(Conformance.CONFORMANT, TypeCoercion.conformance(null, SemanticType.DATE));
    }

    @Test
    @DisplayName("Should classify NaN and infinities as uncoercible numbers")
    void testConformance_NonFiniteNumbers() {
        assertEquals(Conformance.UNCOERCIBLE, TypeCoercion.conformance(Double.NaN, SemanticType.DECIMAL));
        assertEquals(Conformance.UNCOERCIBLE, TypeCoercion.conformance(Double.NEGATIVE_INFINITY, SemanticType.DECIMAL));
        assertEquals(Conformance.UNCOERCIBLE, TypeCoercion.conformance(Float.NaN, SemanticType.DECIMAL));
        assertEquals(Conformance.UNCOERCIBLE, TypeCoercion.conformance(Double.POSITIVE_INFINITY, SemanticType.INTEGER));
    }

    // ============================================================================
    // Conversion
    // ============================================================================

    @Test
    @DisplayName("Should coerce to the Java type of each semantic type")
    void testCoerce() throws CoercionFailure {
        assertEquals(6L, TypeCoercion.coerce("6.0", SemanticType.INTEGER, Locale.US));
        assertEquals(new BigDecimal("2.50"), TypeCoercion.coerce("2.50", SemanticType.DECIMAL, Locale.US));
        assertEquals(LocalDateTime.of(2010, 12, 1, 8, 26),
                TypeCoercion.coerce("12/1/2010 8:26", SemanticType.DATE, Locale.US));
        assertEquals("GB", TypeCoercion.coerce(" GB ", SemanticType.STRING, Locale.US));
        assertEquals("17850", TypeCoercion.coerce(17850, SemanticType.ENUM, Locale.US));
        assertNull(TypeCoercion.coerce(null, SemanticType.INTEGER, Locale.US));
    }

    @Test
    @DisplayName("Should refuse fractional values for integers")
    void testToLong_Fractional() {
        CoercionFailure failure = assertThrows(CoercionFailure.class, () -> TypeCoercion.toLong("6.5", Locale.US));
        assertTrue(failure.getMessage().contains("whole number"));
    }

    @Test
    @DisplayName("Should refuse non-finite doubles")
    void testToDecimal_NonFinite() {
        assertThrows(CoercionFailure.class, () -> TypeCoercion.toDecimal(Double.NaN, Locale.US));
        assertThrows(CoercionFailure.class, () -> TypeCoercion.toDecimal(Double.POSITIVE_INFINITY, Locale.US));
    }

    @Test
    @DisplayName("Should wrap date parse failures")
    void testToTimestamp_Invalid() {
        assertThrows(CoercionFailure.class, () -> TypeCoercion.toTimestamp("not a date"));
    }

    // ============================================================================
    // Locale-aware decimals
    // ============================================================================

    @ParameterizedTest
    @CsvSource({
        "2.50,       en-US, 2.50",
        "'1,234.56', en-US, 1234.56",
        "'1,234',    en-US, 1234",
        "-0.75,      en-US, -0.75",
        "'2,50',     de-DE, 2.50",
        "'1.234,56', de-DE, 1234.56",
        "2.50,       de-DE, 2.50",
        "' 12 ',     en-US, 12"
    })
    @DisplayName("Should parse canonical and locale-specific decimals")
    void testParseDecimal_Valid(String raw, String languageTag, String expected) throws CoercionFailure {
        assertEquals(new BigDecimal(expected), TypeCoercion.parseDecimal(raw, Locale.forLanguageTag(languageTag)));
    }

    @ParameterizedTest
    @ValueSource(strings = {"2,50", "12,3456.7", "1,2,3", "1.2.3"})
    @DisplayName("Should reject ambiguous en-US decimals")
    void testParseDecimal_AmbiguousUs(String raw) {
        assertThrows(CoercionFailure.class, () -> TypeCoercion.parseDecimal(raw, Locale.US));
    }

    // ============================================================================
    // Rendering
    // ============================================================================

    @Test
    @DisplayName("Should render canonical text forms")
    void testRender() {
        assertEquals("2010-12-01T08:26:00", TypeCoercion.render(LocalDateTime.of(2010, 12, 1, 8, 26)));
        assertEquals("1000", TypeCoercion.render(new BigDecimal("1E+3")));
        assertEquals("5", TypeCoercion.render(5L));
        assertNull(TypeCoercion.render(null));
    }
}
