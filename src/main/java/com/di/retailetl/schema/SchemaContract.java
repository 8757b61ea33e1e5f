package com.di.retailetl.schema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Ordered, immutable set of column contracts with a version tag.
 * Column names are unique after case folding.
 */
public final class SchemaContract {

    public static final String DEFAULT_VERSION = "1.0";

    private final String version;
    private final Map<String, ColumnContract> columns;
    private final Map<String, String> headerIndex;

    public SchemaContract(String version, List<ColumnContract> columns) {
        this.version = version == null || version.isBlank() ? DEFAULT_VERSION : version.trim();
        Map<String, ColumnContract> byName = new LinkedHashMap<>();
        Map<String, String> folded = new HashMap<>();
        Map<String, String> index = new HashMap<>();
        for (ColumnContract column : columns) {
            String key = column.name().toLowerCase(Locale.ROOT);
            if (folded.putIfAbsent(key, column.name()) != null) {
                throw new SchemaError(column.name(), "duplicate_column",
                        "column name collides with '" + folded.get(key) + "'");
            }
            byName.put(column.name(), column);
            registerHeader(index, ColumnNameNormalizer.normalize(column.name()), column.name());
        }
        for (ColumnContract column : columns) {
            for (String alias : column.aliases()) {
                registerHeader(index, ColumnNameNormalizer.normalize(alias), column.name());
            }
        }
        this.columns = Collections.unmodifiableMap(byName);
        this.headerIndex = Collections.unmodifiableMap(index);
    }

    private static void registerHeader(Map<String, String> index, String header, String column) {
        String existing = index.putIfAbsent(header, column);
        if (existing != null && !existing.equals(column)) {
            throw new SchemaError(column, "duplicate_alias",
                    "header '" + header + "' already resolves to column '" + existing + "'");
        }
    }

    public String getVersion() {
        return version;
    }

    public List<ColumnContract> columns() {
        return new ArrayList<>(columns.values());
    }

    public Set<String> columnNames() {
        return columns.keySet();
    }

    public Optional<ColumnContract> column(String name) {
        return Optional.ofNullable(columns.get(name));
    }

    public boolean contains(String name) {
        return columns.containsKey(name);
    }

    public int size() {
        return columns.size();
    }

    /** Maps a raw header (any casing or separator style) to the column it names, if any. */
    public Optional<String> resolveHeader(String rawHeader) {
        return Optional.ofNullable(headerIndex.get(ColumnNameNormalizer.normalize(rawHeader)));
    }

    @Override
    public String toString() {
        return "SchemaContract{version=" + version + ", columns=" + columns.keySet() + "}";
    }
}
