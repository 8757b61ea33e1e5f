package com.di.retailetl.schema;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

/**
 * YAML shape of a schema file, bound by Jackson before it is checked and turned into a
 * {@link SchemaContract}.
 *
 * <pre>
 * schema:
 *   version: "1.0"
 *   columns:
 *     - name: quantity
 *       type: integer
 *       nullable: false
 *       constraint: { min: 1, repair: none }
 * </pre>
 */
@Data
@NoArgsConstructor
public class SchemaDocument {

    private Definition schema;

    @Data
    @NoArgsConstructor
    public static class Definition {
        private String version;
        private List<ColumnDefinition> columns;
    }

    @Data
    @NoArgsConstructor
    public static class ColumnDefinition {
        private String name;
        private String type;
        private Boolean nullable;
        @JsonProperty("default")
        private String defaultValue;
        private List<String> aliases;
        private ConstraintDefinition constraint;
    }

    @Data
    @NoArgsConstructor
    public static class ConstraintDefinition {
        private BigDecimal min;
        private BigDecimal max;
        private String pattern;
        private List<String> allowed;
        private String repair;
    }
}
