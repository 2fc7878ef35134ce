package com.eainde.literature.schema;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;

/**
 * One schema-declared record field.
 *
 * <p>Owns the conversions between the in-memory {@link JsonNode} value, the
 * storage column value and the text used for similarity comparison.</p>
 *
 * @param name        column / property name
 * @param type        declared type (first non-null type for nullable unions)
 * @param required    listed in the record schema's {@code required}
 * @param unique      listed in {@code x-unique-fields}
 * @param description property description, may be null
 */
public record SchemaField(
        String name,
        FieldType type,
        boolean required,
        boolean unique,
        String description
) {

    private static final ObjectMapper objectMapper = new ObjectMapper();
    private static final JsonNodeFactory nodes = JsonNodeFactory.instance;

    /** Edits to unique or required fields count as major. */
    public boolean isMajor() {
        return required || unique;
    }

    public static boolean isEmpty(JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) return true;
        if (value.isTextual()) return value.asText().isBlank();
        if (value.isContainerNode()) return value.isEmpty();
        return false;
    }

    // =========================================================================
    //  LLM output → in-memory value
    // =========================================================================

    /**
     * Coerces an LLM-provided value towards the declared type. Scalars given for
     * array fields are wrapped, JSON text for array/object fields is parsed.
     */
    public JsonNode normalize(JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return NullNode.getInstance();
        }
        if (type == FieldType.ARRAY && !value.isArray()) {
            JsonNode parsed = value.isTextual() ? tryParse(value.asText()) : null;
            if (parsed != null && parsed.isArray()) {
                return parsed;
            }
            ArrayNode wrapped = nodes.arrayNode();
            wrapped.add(value);
            return wrapped;
        }
        if (type == FieldType.OBJECT && value.isTextual()) {
            JsonNode parsed = tryParse(value.asText());
            return parsed != null && parsed.isObject() ? parsed : value;
        }
        return value;
    }

    // =========================================================================
    //  In-memory value ↔ column value
    // =========================================================================

    public Object toColumnValue(JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return null;
        }
        return switch (type) {
            case STRING -> value.isTextual() ? value.asText() : value.toString();
            case INTEGER -> toLong(value);
            case NUMBER -> toDouble(value);
            case BOOLEAN -> value.asBoolean() ? 1 : 0;
            case ARRAY, OBJECT -> normalize(value).toString();
        };
    }

    public JsonNode fromColumnValue(Object columnValue) {
        if (columnValue == null) {
            return NullNode.getInstance();
        }
        return switch (type) {
            case STRING -> nodes.textNode(columnValue.toString());
            case INTEGER -> columnValue instanceof Number n
                    ? nodes.numberNode(n.longValue())
                    : nodes.textNode(columnValue.toString());
            case NUMBER -> columnValue instanceof Number n
                    ? nodes.numberNode(n.doubleValue())
                    : nodes.textNode(columnValue.toString());
            case BOOLEAN -> columnValue instanceof Number n
                    ? nodes.booleanNode(n.intValue() != 0)
                    : nodes.booleanNode(Boolean.parseBoolean(columnValue.toString()));
            case ARRAY, OBJECT -> {
                JsonNode parsed = tryParse(columnValue.toString());
                yield parsed != null ? parsed : nodes.textNode(columnValue.toString());
            }
        };
    }

    /**
     * Text used by similarity strategies; null when the value is empty.
     */
    public static String comparableText(JsonNode value) {
        if (isEmpty(value)) return null;
        return value.isTextual() ? value.asText() : value.toString();
    }

    private static Long toLong(JsonNode value) {
        if (value.isNumber()) return value.asLong();
        if (value.isBoolean()) return value.asBoolean() ? 1L : 0L;
        String text = value.asText().trim();
        try {
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            try {
                return (long) Double.parseDouble(text);
            } catch (NumberFormatException notNumeric) {
                return null;
            }
        }
    }

    private static Double toDouble(JsonNode value) {
        if (value.isNumber()) return value.asDouble();
        try {
            return Double.parseDouble(value.asText().trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static JsonNode tryParse(String text) {
        try {
            JsonNode parsed = objectMapper.readTree(text);
            return parsed == null || parsed.isMissingNode() ? null : parsed;
        } catch (JsonProcessingException e) {
            return null;
        }
    }
}
