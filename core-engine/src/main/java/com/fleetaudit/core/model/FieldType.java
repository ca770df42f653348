package com.fleetaudit.core.model;

import java.util.Locale;

/**
 * Declared type of a schema field. Determines how resolved values are
 * coerced and which sentinel is shown when the field's source is broken.
 *
 * @since 1.0.0
 */
public enum FieldType {

    STR("str"),
    INT("int"),
    FLOAT("float"),
    BOOL("bool"),
    LIST("list"),
    DICT("dict");

    private final String schemaName;

    FieldType(String schemaName) {
        this.schemaName = schemaName;
    }

    /**
     * @return the name used for this type in schema YAML
     */
    public String schemaName() {
        return schemaName;
    }

    /**
     * Type-appropriate sentinel used when no explicit sentinel is declared.
     * The values are wrong-looking on purpose and stand out in a
     * rendered report.
     *
     * @param fallback the field's fallback, used for types without a sentinel
     * @return sentinel value
     */
    public Object defaultSentinel(Object fallback) {
        return switch (this) {
            case STR -> "ERROR";
            case INT -> -1L;
            case FLOAT -> -1.0;
            case BOOL, LIST, DICT -> fallback;
        };
    }

    /**
     * Parse a schema type name.
     *
     * @param name type name such as {@code "int"}; {@code null} means {@code str}
     * @return the field type
     * @throws IllegalArgumentException if the name is not a supported type
     */
    public static FieldType fromSchemaName(String name) {
        if (name == null) {
            return STR;
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (FieldType type : values()) {
            if (type.schemaName.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown field type: '" + name
                + "'. Supported: str, int, float, bool, list, dict");
    }
}
