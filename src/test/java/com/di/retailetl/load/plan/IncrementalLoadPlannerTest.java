package com.di.retailetl.load.plan;

import com.di.retailetl.TestFixtures;
import com.di.retailetl.clean.CleanResult;
import com.di.retailetl.clean.Cleaner;
import com.di.retailetl.clean.CleaningRules;
import com.di.retailetl.model.Row;
import com.di.retailetl.schema.SchemaContract;
import com.di.retailetl.validation.Validator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("IncrementalLoadPlanner Tests")
class IncrementalLoadPlannerTest {

    private IncrementalLoadPlanner planner;
    private CleanResult scenario;

    @BeforeEach
    void setUp() {
        CleaningRules rules = CleaningRules.defaults();
        SchemaContract schema = TestFixtures.scenarioSchema();
        planner = new IncrementalLoadPlanner(rules);
        scenario = new Cleaner(schema, rules).clean(new Validator(rules).validate(TestFixtures.scenarioRows(), schema));
    }

    private static List<String> invoices(LoadPlan plan) {
        return plan.toInsert().stream().map(r -> (String) r.get("invoice")).collect(Collectors.toList());
    }

    private static Row cleanedRow(int rowId, String invoice, LocalDateTime timestamp) {
        return new Row(rowId, Map.of("invoice", invoice, "invoice_date", timestamp));
    }

    // ============================================================================
    // INCREMENTAL
    // ============================================================================

    @Test
    @DisplayName("Should insert every row after an older watermark")
    void testPlan_WatermarkBeforeBatch() {
        LoadPlan plan = planner.plan(scenario, Watermark.of("1000", TestFixtures.T0), LoadMode.INCREMENTAL);

        assertEquals(List.of("1001", "C1002"), invoices(plan));
        assertEquals(0, plan.skippedAsDuplicate());
        assertEquals(Watermark.of("C1002", TestFixtures.T2), plan.newWatermark());
    }

    @Test
    @DisplayName("Should skip rows at or before the watermark")
    void testPlan_WatermarkInsideBatch() {
        LoadPlan plan = planner.plan(scenario, Watermark.of("1001", TestFixtures.T1), LoadMode.INCREMENTAL);

        assertEquals(List.of("C1002"), invoices(plan));
        assertEquals(1, plan.skippedAsDuplicate());
        assertEquals(Watermark.of("C1002", TestFixtures.T2), plan.newWatermark());
    }

    @Test
    @DisplayName("Should keep the watermark when every row is already loaded")
    void testPlan_WatermarkAfterBatch() {
        Watermark current = Watermark.of("9999", TestFixtures.T2.plusDays(1));

        LoadPlan plan = planner.plan(scenario, current, LoadMode.INCREMENTAL);

        assertTrue(plan.isEmpty());
        assertEquals(2, plan.skippedAsDuplicate());
        assertEquals(current, plan.newWatermark());
    }

    @Test
    @DisplayName("Should treat a missing watermark as empty")
    void testPlan_NullWatermark() {
        LoadPlan plan = planner.plan(scenario, null, LoadMode.INCREMENTAL);

        assertEquals(2, plan.toInsert().size());
        assertEquals(Watermark.of("C1002", TestFixtures.T2), plan.newWatermark());
    }

    @Test
    @DisplayName("Should break timestamp ties on the invoice id")
    void testPlan_SameTimestampTie() {
        List<Row> rows = List.of(
                cleanedRow(0, "1001", TestFixtures.T1),
                cleanedRow(1, "1002", TestFixtures.T1),
                cleanedRow(2, "1000", TestFixtures.T1));

        LoadPlan plan = planner.plan(rows, Watermark.of("1001", TestFixtures.T1), LoadMode.INCREMENTAL);

        assertEquals(List.of("1002"), invoices(plan));
        assertEquals(2, plan.skippedAsDuplicate());
        assertEquals(Watermark.of("1002", TestFixtures.T1), plan.newWatermark());
    }

    @Test
    @DisplayName("Should keep input order of inserted rows")
    void testPlan_OrderPreserved() {
        List<Row> rows = List.of(
                cleanedRow(0, "1003", TestFixtures.T2),
                cleanedRow(1, "1001", TestFixtures.T1));

        LoadPlan plan = planner.plan(rows, Watermark.EMPTY, LoadMode.INCREMENTAL);

        assertEquals(List.of("1003", "1001"), invoices(plan));
        assertEquals(Watermark.of("1003", TestFixtures.T2), plan.newWatermark());
    }

    @Test
    @DisplayName("Should carry rejected rows through to the plan")
    void testPlan_RejectedCarried() {
        LoadPlan plan = planner.plan(scenario, Watermark.EMPTY, LoadMode.INCREMENTAL);

        assertEquals(scenario.rejected(), plan.rejected());
        assertEquals(LoadMode.INCREMENTAL, plan.mode());
    }

    // ============================================================================
    // FULL and edge cases
    // ============================================================================

    @Test
    @DisplayName("Should take every row in FULL mode and ignore the stored watermark")
    void testPlan_FullMode() {
        Watermark later = Watermark.of("9999", TestFixtures.T2.plusDays(1));

        LoadPlan plan = planner.plan(scenario, later, LoadMode.FULL);

        assertEquals(2, plan.toInsert().size());
        assertEquals(0, plan.skippedAsDuplicate());
        assertEquals(Watermark.of("C1002", TestFixtures.T2), plan.newWatermark());
    }

    @Test
    @DisplayName("Should return an empty plan for an empty batch")
    void testPlan_EmptyInput() {
        Watermark current = Watermark.of("1001", TestFixtures.T1);

        LoadPlan plan = planner.plan(List.of(), current, LoadMode.INCREMENTAL);

        assertTrue(plan.isEmpty());
        assertEquals(0, plan.skippedAsDuplicate());
        assertEquals(current, plan.newWatermark());
    }

    @Test
    @DisplayName("Should be deterministic for the same input")
    void testPlan_Deterministic() {
        Watermark current = Watermark.of("1001", TestFixtures.T1);

        assertEquals(planner.plan(scenario, current, LoadMode.INCREMENTAL),
                planner.plan(scenario, current, LoadMode.INCREMENTAL));
    }

    @Test
    @DisplayName("Should fail on a row without a readable timestamp")
    void testPlan_UnreadableTimestamp() {
        List<Row> rows = List.of(new Row(0, Map.of("invoice", "1001", "invoice_date", "not a date")));

        assertThrows(IllegalStateException.class,
                () -> planner.plan(rows, Watermark.EMPTY, LoadMode.INCREMENTAL));
    }
}
