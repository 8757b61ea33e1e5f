package com.di.retailetl.schema;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ColumnNameNormalizer Tests")
class ColumnNameNormalizerTest {

    @ParameterizedTest
    @CsvSource({
        "InvoiceNo,      invoiceno",
        "Invoice No,     invoice_no",
        "invoice_no,     invoice_no",
        "'  Unit Price ', unit_price",
        "Customer-ID,    customer_id",
        "__country__,    country"
    })
    @DisplayName("Should normalise headers to lower snake case")
    void testNormalize(String header, String expected) {
        assertEquals(expected, ColumnNameNormalizer.normalize(header));
    }

    @Test
    @DisplayName("Should drop a byte order mark")
    void testNormalize_Bom() {
        assertEquals("invoice", ColumnNameNormalizer.normalize("\uFEFFInvoice"));
    }

    @Test
    @DisplayName("Should return an empty name for null or punctuation-only headers")
    void testNormalize_Empty() {
        assertEquals("", ColumnNameNormalizer.normalize(null));
        assertEquals("", ColumnNameNormalizer.normalize(" -- "));
    }
}
