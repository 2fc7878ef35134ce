package com.eainde.literature.schema;

import com.eainde.literature.exception.PipelineConfigurationException;

/**
 * JSON Schema field types supported in record schemas, with their storage column type.
 */
public enum FieldType {

    STRING("TEXT"),
    INTEGER("INTEGER"),
    NUMBER("REAL"),
    /** stored as 0/1 */
    BOOLEAN("INTEGER"),
    /** stored as serialized JSON */
    ARRAY("TEXT"),
    /** stored as serialized JSON */
    OBJECT("TEXT");

    private final String columnType;

    FieldType(String columnType) {
        this.columnType = columnType;
    }

    public String columnType() {
        return columnType;
    }

    public boolean isJson() {
        return this == ARRAY || this == OBJECT;
    }

    public static FieldType fromJsonType(String jsonType) {
        if (jsonType == null) {
            return STRING;
        }
        return switch (jsonType) {
            case "string" -> STRING;
            case "integer" -> INTEGER;
            case "number" -> NUMBER;
            case "boolean" -> BOOLEAN;
            case "array" -> ARRAY;
            case "object" -> OBJECT;
            default -> throw new PipelineConfigurationException("Unsupported field type in schema: " + jsonType);
        };
    }
}
