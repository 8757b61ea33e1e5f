package com.di.retailetl.source;

import com.di.retailetl.model.Row;
import com.di.retailetl.schema.ColumnNameNormalizer;
import com.di.retailetl.schema.SchemaContract;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads a CSV export into raw rows.
 *
 * <p>Headers are standardised against the schema: {@code InvoiceNo}, {@code Invoice No} and
 * {@code invoice} all become {@code invoice}. Headers the schema does not know keep their
 * snake_case form and are dropped later by the cleaner. Values stay untyped strings.
 */
@Slf4j
public class CsvBatchReader implements RawBatchProvider {

    private final Path file;
    private final SchemaContract schema;
    private final char delimiter;

    public CsvBatchReader(Path file, SchemaContract schema, char delimiter) {
        this.file = file;
        this.schema = schema;
        this.delimiter = delimiter;
    }

    public CsvBatchReader(Path file, SchemaContract schema) {
        this(file, schema, ',');
    }

    @Override
    public List<Row> read() {
        if (!Files.isReadable(file)) {
            throw new BatchReadException("Input file not found or not readable: " + file);
        }
        log.info("[READ] Loading data from {}", file);
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return read(reader);
        } catch (IOException e) {
            throw new BatchReadException("Failed to read " + file + ": " + e.getMessage(), e);
        }
    }

    List<Row> read(Reader reader) throws IOException {
        CSVFormat format = CSVFormat.DEFAULT.builder()
                .setHeader()
                .setSkipHeaderRecord(true)
                .setDelimiter(delimiter)
                .setIgnoreEmptyLines(true)
                .setAllowMissingColumnNames(true)
                .build();

        try (CSVParser parser = format.parse(reader)) {
            List<String> headers = parser.getHeaderNames();
            if (headers.isEmpty()) {
                throw new BatchReadException("No header row in " + describe());
            }
            List<String> columns = standardizeHeaders(headers);

            List<Row> rows = new ArrayList<>();
            int rowId = 0;
            for (CSVRecord record : parser) {
                Map<String, Object> values = new LinkedHashMap<>();
                for (int i = 0; i < columns.size(); i++) {
                    values.put(columns.get(i), record.isSet(i) ? record.get(i) : null);
                }
                rows.add(new Row(rowId++, values));
            }
            log.info("[READ] Loaded {} records with {} columns", rows.size(), columns.size());
            return rows;
        }
    }

    /**
     * Maps raw headers to column names. A header that collides with an earlier one keeps its
     * normalised form with a numeric suffix so no value is silently overwritten.
     */
    List<String> standardizeHeaders(List<String> headers) {
        List<String> columns = new ArrayList<>(headers.size());
        Set<String> used = new HashSet<>();
        for (int i = 0; i < headers.size(); i++) {
            String raw = headers.get(i);
            String normalized = ColumnNameNormalizer.normalize(raw);
            String column = schema.resolveHeader(raw).orElse(normalized.isEmpty() ? "column_" + (i + 1) : normalized);
            if (!used.add(column)) {
                String base = normalized.isEmpty() ? "column_" + (i + 1) : normalized;
                String candidate = base;
                int suffix = 2;
                while (!used.add(candidate)) {
                    candidate = base + "_" + suffix++;
                }
                log.warn("[READ] Header '{}' collides with an earlier column '{}', kept as '{}'", raw, column, candidate);
                column = candidate;
            } else if (!column.equals(raw)) {
                log.debug("[READ] Header '{}' standardised to '{}'", raw, column);
            }
            columns.add(column);
        }
        return columns;
    }

    @Override
    public String describe() {
        return file.toString();
    }
}
