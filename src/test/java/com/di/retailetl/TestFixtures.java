package com.di.retailetl;

import com.di.retailetl.model.Row;
import com.di.retailetl.schema.SchemaContract;
import com.di.retailetl.schema.SchemaRegistry;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Shared rows and schema for the core pipeline tests.
 */
public final class TestFixtures {

    public static final LocalDateTime T0 = LocalDateTime.of(2010, 12, 1, 8, 0, 0);
    public static final LocalDateTime T1 = LocalDateTime.of(2010, 12, 1, 8, 26, 0);
    public static final LocalDateTime T2 = LocalDateTime.of(2010, 12, 1, 9, 2, 0);

    private TestFixtures() {
    }

    public static SchemaContract scenarioSchema() {
        return new SchemaRegistry().load("classpath:schema/scenario_schema.yml");
    }

    /** A raw row as it arrives from the reader: every value a string. */
    public static Map<String, Object> rawValues(String invoice, String quantity, String price, String invoiceDate) {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("invoice", invoice);
        values.put("stock_code", "85123A");
        values.put("quantity", quantity);
        values.put("price", price);
        values.put("invoice_date", invoiceDate);
        values.put("country", "United Kingdom");
        return values;
    }

    /**
     * (1001, 5, 2.50, T1), (C1002, -3, 1.00, T2), (1001, 5, 2.50, T1).
     */
    public static List<Row> scenarioRows() {
        List<Row> rows = new ArrayList<>();
        rows.add(new Row(0, rawValues("1001", "5", "2.50", "2010-12-01 08:26:00")));
        rows.add(new Row(1, rawValues("C1002", "-3", "1.00", "2010-12-01 09:02:00")));
        rows.add(new Row(2, rawValues("1001", "5", "2.50", "2010-12-01 08:26:00")));
        return rows;
    }

    public static Row rowWith(int rowId, String column, Object value) {
        Map<String, Object> values = rawValues("1001", "5", "2.50", "2010-12-01 08:26:00");
        values.put(column, value);
        return new Row(rowId, values);
    }

    public static Row rowWithout(int rowId, String column) {
        Map<String, Object> values = rawValues("1001", "5", "2.50", "2010-12-01 08:26:00");
        values.remove(column);
        return new Row(rowId, values);
    }
}
