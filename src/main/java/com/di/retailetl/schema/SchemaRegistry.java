package com.di.retailetl.schema;

import com.di.retailetl.clean.CleaningRules;
import com.di.retailetl.util.CoercionFailure;
import com.di.retailetl.util.TypeCoercion;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Loads column contracts from a YAML schema file.
 *
 * <p>Every structural problem is reported as a {@link SchemaError} naming the column and the
 * rule that failed, before any row is looked at. Loading has no side effects beyond reading
 * the source.
 */
@Slf4j
public class SchemaRegistry {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final ResourceLoader resourceLoader;

    public SchemaRegistry() {
        this(new DefaultResourceLoader());
    }

    public SchemaRegistry(ResourceLoader resourceLoader) {
        this.resourceLoader = resourceLoader;
    }

    /**
     * Loads a schema from a Spring resource location, e.g. {@code classpath:retail_schema.yml}
     * or {@code file:/etc/retail/schema.yml}.
     */
    public SchemaContract load(String location) {
        if (location == null || location.isBlank()) {
            throw new SchemaError(null, "source", "schema location is blank");
        }
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new SchemaError(null, "source", "schema resource not found: " + location);
        }
        try (Reader reader = new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8)) {
            SchemaContract contract = read(reader, location);
            log.info("[SCHEMA] Loaded schema version={} with {} column(s) from {}",
                    contract.getVersion(), contract.size(), location);
            return contract;
        } catch (IOException e) {
            throw new SchemaError(null, "source", "cannot read " + location + ": " + e.getMessage(), e);
        }
    }

    public SchemaContract load(Reader reader) {
        return read(reader, "<reader>");
    }

    private SchemaContract read(Reader reader, String origin) {
        SchemaDocument document;
        try {
            document = YAML_MAPPER.readValue(reader, SchemaDocument.class);
        } catch (IOException e) {
            throw new SchemaError(null, "yaml", "cannot parse " + origin + ": " + e.getMessage(), e);
        }
        if (document == null || document.getSchema() == null) {
            throw new SchemaError(null, "missing_field", "no 'schema' section in " + origin);
        }
        return toContract(document.getSchema());
    }

    SchemaContract toContract(SchemaDocument.Definition definition) {
        List<SchemaDocument.ColumnDefinition> definitions = definition.getColumns();
        if (definitions == null || definitions.isEmpty()) {
            throw new SchemaError(null, "missing_field", "'columns' must list at least one column");
        }
        List<ColumnContract> columns = new ArrayList<>(definitions.size());
        for (int i = 0; i < definitions.size(); i++) {
            columns.add(toColumn(definitions.get(i), i));
        }
        return new SchemaContract(definition.getVersion(), columns);
    }

    private ColumnContract toColumn(SchemaDocument.ColumnDefinition def, int position) {
        if (def == null || def.getName() == null || def.getName().isBlank()) {
            throw new SchemaError("#" + position, "missing_field", "'name' is required");
        }
        String name = def.getName().trim();
        if (CleaningRules.DERIVED_COLUMNS.contains(name.toLowerCase(Locale.ROOT))) {
            throw new SchemaError(name, "reserved_name", "column is derived during cleaning");
        }
        if (def.getType() == null || def.getType().isBlank()) {
            throw new SchemaError(name, "missing_field", "'type' is required");
        }
        SemanticType type = SemanticType.fromTag(def.getType())
                .orElseThrow(() -> new SchemaError(name, "unknown_type",
                        "unknown semantic type '" + def.getType() + "'"));
        if (def.getNullable() == null) {
            throw new SchemaError(name, "missing_field", "'nullable' is required");
        }

        String defaultValue = def.getDefaultValue();
        if (defaultValue != null) {
            checkDefault(name, type, defaultValue);
        }
        ColumnConstraint constraint = toConstraint(name, type, def.getConstraint(), defaultValue);
        if (defaultValue != null && constraintRejectsDefault(type, constraint, defaultValue)) {
            throw new SchemaError(name, "default_violates_constraint",
                    "default '" + defaultValue + "' does not satisfy the column constraint");
        }
        return new ColumnContract(name, type, def.getNullable(), constraint, defaultValue, def.getAliases());
    }

    private ColumnConstraint toConstraint(String name, SemanticType type,
                                          SchemaDocument.ConstraintDefinition def,
                                          String defaultValue) {
        if (def == null) {
            if (type == SemanticType.ENUM) {
                throw new SchemaError(name, "enum_without_values", "ENUM column needs 'constraint.allowed'");
            }
            return ColumnConstraint.NONE;
        }
        ConstraintRepair repair = ConstraintRepair.fromTag(def.getRepair())
                .orElseThrow(() -> new SchemaError(name, "unknown_repair",
                        "unknown repair '" + def.getRepair() + "'"));

        BigDecimal min = def.getMin();
        BigDecimal max = def.getMax();
        if ((min != null || max != null) && !type.isNumeric()) {
            throw new SchemaError(name, "range_on_non_numeric", "min/max only apply to integer or decimal columns");
        }
        if (min != null && max != null && min.compareTo(max) > 0) {
            throw new SchemaError(name, "min_greater_than_max", "min " + min + " > max " + max);
        }
        if (type == SemanticType.INTEGER && (!isIntegral(min) || !isIntegral(max))) {
            throw new SchemaError(name, "fractional_bound", "integer column bounds must be whole numbers");
        }

        Pattern pattern = null;
        if (def.getPattern() != null) {
            if (!type.isText()) {
                throw new SchemaError(name, "pattern_on_non_text", "pattern only applies to string or enum columns");
            }
            try {
                pattern = Pattern.compile(def.getPattern());
            } catch (PatternSyntaxException e) {
                throw new SchemaError(name, "invalid_pattern", e.getDescription() + " in '" + def.getPattern() + "'", e);
            }
        }

        Set<String> allowed = def.getAllowed() == null ? Set.of() : new LinkedHashSet<>(def.getAllowed());
        if (type == SemanticType.ENUM && allowed.isEmpty()) {
            throw new SchemaError(name, "enum_without_values", "ENUM column needs 'constraint.allowed'");
        }
        if (!allowed.isEmpty() && !type.isText()) {
            throw new SchemaError(name, "allowed_on_non_text", "allowed values only apply to string or enum columns");
        }

        if (repair == ConstraintRepair.CLAMP && (min == null && max == null)) {
            throw new SchemaError(name, "clamp_without_bound", "CLAMP repair needs a numeric min or max");
        }
        if (repair == ConstraintRepair.DEFAULT && defaultValue == null) {
            throw new SchemaError(name, "default_repair_without_default", "DEFAULT repair needs a 'default' value");
        }
        return new ColumnConstraint(min, max, pattern, allowed, repair);
    }

    private static void checkDefault(String name, SemanticType type, String defaultValue) {
        try {
            TypeCoercion.coerce(defaultValue, type, Locale.ROOT);
        } catch (CoercionFailure e) {
            throw new SchemaError(name, "invalid_default", e.getMessage(), e);
        }
    }

    private static boolean constraintRejectsDefault(SemanticType type, ColumnConstraint constraint, String defaultValue) {
        if (type.isText()) {
            return constraint.violatedBy(defaultValue);
        }
        if (type.isNumeric()) {
            try {
                return constraint.violatedBy(TypeCoercion.toDecimal(defaultValue, Locale.ROOT));
            } catch (CoercionFailure e) {
                return true;
            }
        }
        return false;
    }

    private static boolean isIntegral(BigDecimal bound) {
        return bound == null || bound.stripTrailingZeros().scale() <= 0;
    }
}
