package com.di.retailetl.validation;

import com.di.retailetl.TestFixtures;
import com.di.retailetl.clean.CleaningRules;
import com.di.retailetl.model.Row;
import com.di.retailetl.schema.SchemaContract;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static com.di.retailetl.validation.RejectionReasons.*;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Validator Tests")
class ValidatorTest {

    private SchemaContract schema;
    private Validator validator;

    @BeforeEach
    void setUp() {
        schema = TestFixtures.scenarioSchema();
        validator = new Validator(CleaningRules.defaults());
    }

    private ValidationVerdict verdictOf(Row row) {
        return validator.validate(List.of(row), schema).get(0).verdict();
    }

    // ============================================================================
    // Scenario batch
    // ============================================================================

    @Test
    @DisplayName("Should tag valid, cancellation and duplicate rows of the scenario batch")
    void testValidate_ScenarioBatch() {
        List<TaggedRow> tagged = validator.validate(TestFixtures.scenarioRows(), schema);

        assertEquals(3, tagged.size());
        assertEquals(ValidationVerdict.valid(), tagged.get(0).verdict());
        assertEquals(ValidationVerdict.repairable(CONSTRAINT_VIOLATION), tagged.get(1).verdict());
        assertEquals(ValidationVerdict.repairable(INTRA_BATCH_DUPLICATE), tagged.get(2).verdict());
    }

    @Test
    @DisplayName("Should keep input order and never modify rows")
    void testValidate_OrderAndImmutability() {
        List<Row> rows = TestFixtures.scenarioRows();
        List<Row> snapshot = rows.stream().map(Row::copy).toList();

        List<TaggedRow> first = validator.validate(rows, schema);
        List<TaggedRow> second = validator.validate(rows, schema);

        assertEquals(snapshot, rows);
        for (int i = 0; i < rows.size(); i++) {
            assertSame(rows.get(i), first.get(i).row());
            assertEquals(first.get(i).verdict(), second.get(i).verdict());
        }
    }

    @Test
    @DisplayName("Should return an empty list for an empty batch")
    void testValidate_EmptyBatch() {
        assertTrue(validator.validate(List.of(), schema).isEmpty());
    }

    // ============================================================================
    // Rule 1: missing required
    // ============================================================================

    @Test
    @DisplayName("Should reject a row whose non-nullable column is absent")
    void testValidate_MissingCountry() {
        assertEquals(ValidationVerdict.rejected(MISSING_REQUIRED), verdictOf(TestFixtures.rowWithout(0, "country")));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   "})
    @DisplayName("Should treat blank values of required columns as missing")
    void testValidate_BlankRequired(String blank) {
        assertEquals(ValidationVerdict.rejected(MISSING_REQUIRED), verdictOf(TestFixtures.rowWith(0, "invoice", blank)));
    }

    @Test
    @DisplayName("Should reject missing required values before looking at types")
    void testValidate_MissingWinsOverTypeProblems() {
        Row row = TestFixtures.rowWith(0, "quantity", "lots");
        row.remove("country");
        assertEquals(ValidationVerdict.rejected(MISSING_REQUIRED), verdictOf(row));
    }

    @Test
    @DisplayName("Should accept missing nullable columns with defaults")
    void testValidate_MissingNullableWithDefault() {
        Row row = TestFixtures.rowWith(0, "customer_id", null);
        assertTrue(verdictOf(row).isValid());
    }

    // ============================================================================
    // Rule 2: type conformance
    // ============================================================================

    @ParameterizedTest
    @CsvSource({
        "quantity, 6.0",
        "quantity, ' 1,200 '",
        "price,    '2,50'",
        "price,    '1,234.50'"
    })
    @DisplayName("Should mark coercible values as type_mismatch")
    void testValidate_Coercible(String column, String value) {
        assertEquals(ValidationVerdict.repairable(TYPE_MISMATCH), verdictOf(TestFixtures.rowWith(0, column, value)));
    }

    @ParameterizedTest
    @CsvSource({
        "quantity,     five",
        "price,        '2.50 EUR'",
        "invoice_date, 'next tuesday'",
        "invoice_date, 2010-13-45"
    })
    @DisplayName("Should reject values no coercion rule can read")
    void testValidate_Uncoercible(String column, String value) {
        assertEquals(ValidationVerdict.rejected(UNCOERCIBLE), verdictOf(TestFixtures.rowWith(0, column, value)));
    }

    @ParameterizedTest
    @ValueSource(strings = {"2010-12-01 08:26:00", "12/1/2010 8:26", "2010-12-01T08:26:00", "2010-12-01"})
    @DisplayName("Should accept dates in any known pattern")
    void testValidate_KnownDatePatterns(String date) {
        assertTrue(verdictOf(TestFixtures.rowWith(0, "invoice_date", date)).isValid());
    }

    @Test
    @DisplayName("Should accept native Java values")
    void testValidate_NativeValues() {
        Row row = TestFixtures.rowWith(0, "quantity", 5L);
        row.put("price", new java.math.BigDecimal("2.50"));
        row.put("invoice_date", TestFixtures.T1);
        assertTrue(verdictOf(row).isValid());

        assertEquals(ValidationVerdict.rejected(UNCOERCIBLE), verdictOf(TestFixtures.rowWith(0, "price", Double.NaN)));
        assertEquals(ValidationVerdict.rejected(UNCOERCIBLE),
                verdictOf(TestFixtures.rowWith(0, "price", Double.POSITIVE_INFINITY)));
        assertEquals(ValidationVerdict.rejected(UNCOERCIBLE),
                verdictOf(TestFixtures.rowWith(0, "price", Float.NEGATIVE_INFINITY)));
        assertEquals(ValidationVerdict.rejected(UNCOERCIBLE), verdictOf(TestFixtures.rowWith(0, "quantity", Double.NaN)));
    }

    // ============================================================================
    // Rule 3: constraints
    // ============================================================================

    @Test
    @DisplayName("Should reject a constraint violation without a repair")
    void testValidate_ZeroQuantity() {
        assertEquals(ValidationVerdict.rejected(CONSTRAINT_VIOLATION), verdictOf(TestFixtures.rowWith(0, "quantity", "0")));
    }

    @Test
    @DisplayName("Should reject a negative quantity on a regular invoice")
    void testValidate_NegativeQuantityWithoutCancellation() {
        assertEquals(ValidationVerdict.rejected(CONSTRAINT_VIOLATION), verdictOf(TestFixtures.rowWith(0, "quantity", "-3")));
    }

    @Test
    @DisplayName("Should reject invoices that break the invoice pattern")
    void testValidate_AdjustmentInvoice() {
        assertEquals(ValidationVerdict.rejected(CONSTRAINT_VIOLATION), verdictOf(TestFixtures.rowWith(0, "invoice", "A563185")));
    }

    @Test
    @DisplayName("Should mark clampable and defaultable violations as repairable")
    void testValidate_RepairableConstraints() {
        assertEquals(ValidationVerdict.repairable(CONSTRAINT_VIOLATION), verdictOf(TestFixtures.rowWith(0, "price", "2500")));
        assertEquals(ValidationVerdict.repairable(CONSTRAINT_VIOLATION), verdictOf(TestFixtures.rowWith(0, "channel", "PHONE")));
    }

    @Test
    @DisplayName("Should honour a configured cancellation prefix")
    void testValidate_CustomCancellationPrefix() {
        Validator custom = new Validator(CleaningRules.builder().cancellationPrefixes(List.of("X")).build());
        Row row = TestFixtures.rowWith(0, "quantity", "-3");
        row.put("invoice", "C1002");

        assertEquals(ValidationVerdict.rejected(CONSTRAINT_VIOLATION),
                custom.validate(List.of(row), schema).get(0).verdict());
    }

    // ============================================================================
    // Rule 4: duplicates
    // ============================================================================

    @Test
    @DisplayName("Should compare natural keys on trimmed values")
    void testValidate_DuplicateAfterTrim() {
        Row first = TestFixtures.rowWith(0, "stock_code", "85123A");
        Row second = TestFixtures.rowWith(1, "stock_code", "85123A ");
        second.put("quantity", "7");

        List<TaggedRow> tagged = validator.validate(List.of(first, second), schema);

        assertTrue(tagged.get(0).verdict().isValid());
        assertEquals(ValidationVerdict.repairable(INTRA_BATCH_DUPLICATE), tagged.get(1).verdict());
    }

    @Test
    @DisplayName("Should treat lines without a line number as duplicates on invoice and stock code")
    void testValidate_DuplicateWithoutLineNumber() {
        Row first = TestFixtures.rowWith(0, "quantity", "5");
        Row second = TestFixtures.rowWith(1, "quantity", "7");
        second.put("price", "3.10");

        List<TaggedRow> tagged = validator.validate(List.of(first, second), schema);

        assertTrue(tagged.get(0).verdict().isValid());
        assertEquals(ValidationVerdict.repairable(INTRA_BATCH_DUPLICATE), tagged.get(1).verdict());
    }

    @Test
    @DisplayName("Should keep lines of the same item apart when their line numbers differ")
    void testValidate_LineNumberSeparatesKeys() {
        Row first = TestFixtures.rowWith(0, "line_no", "1");
        Row second = TestFixtures.rowWith(1, "line_no", "2");
        Row repeat = TestFixtures.rowWith(2, "line_no", "1");

        List<TaggedRow> tagged = validator.validate(List.of(first, second, repeat), schema);

        assertTrue(tagged.get(0).verdict().isValid());
        assertTrue(tagged.get(1).verdict().isValid());
        assertEquals(ValidationVerdict.repairable(INTRA_BATCH_DUPLICATE), tagged.get(2).verdict());
    }

    @Test
    @DisplayName("Should not let rejected rows claim a natural key")
    void testValidate_RejectedRowDoesNotClaimKey() {
        Row rejected = TestFixtures.rowWith(0, "quantity", "0");
        Row valid = TestFixtures.rowWith(1, "quantity", "5");

        List<TaggedRow> tagged = validator.validate(List.of(rejected, valid), schema);

        assertTrue(tagged.get(0).verdict().isRejected());
        assertTrue(tagged.get(1).verdict().isValid());
    }
}
