package com.eainde.literature.schema;

import com.eainde.literature.exception.PipelineConfigurationException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonBooleanSchema;
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonIntegerSchema;
import dev.langchain4j.model.chat.request.json.JsonNumberSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonSchema;
import dev.langchain4j.model.chat.request.json.JsonSchemaElement;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Converts the JSON Schema documents used by the pipeline (record schema,
 * metadata schema, dedup response schema) into langchain4j structured-output schemas.
 *
 * <p>Custom annotations such as {@code x-unique-fields} are ignored; nullable
 * unions ({@code ["integer", "null"]}) map to their non-null member.</p>
 */
public class JsonSchemaConverter {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private JsonSchemaConverter() {
    }

    public static JsonSchema toLangChainSchema(String name, String jsonSchemaString) {
        JsonNode rootNode;
        try {
            rootNode = objectMapper.readTree(jsonSchemaString);
        } catch (Exception e) {
            throw new PipelineConfigurationException("Failed to parse JSON Schema '" + name + "'", e);
        }
        return JsonSchema.builder()
                .name(name != null ? name : "Schema")
                .rootElement(parseElement(rootNode))
                .build();
    }

    private static JsonSchemaElement parseElement(JsonNode node) {
        String type = SchemaLoader.resolveType(node.get("type"));
        if (type == null) {
            if (node.has("properties")) return parseObject(node);
            if (node.has("items")) return parseArray(node);
            return parseString(node);
        }

        return switch (type) {
            case "object" -> parseObject(node);
            case "array" -> parseArray(node);
            case "integer" -> JsonIntegerSchema.builder().description(description(node)).build();
            case "number" -> JsonNumberSchema.builder().description(description(node)).build();
            case "boolean" -> JsonBooleanSchema.builder().description(description(node)).build();
            default -> parseString(node);
        };
    }

    private static JsonObjectSchema parseObject(JsonNode node) {
        JsonObjectSchema.Builder builder = JsonObjectSchema.builder().description(description(node));

        Iterator<Map.Entry<String, JsonNode>> fields = node.path("properties").fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            builder.addProperty(field.getKey(), parseElement(field.getValue()));
        }

        if (node.path("required").isArray()) {
            List<String> requiredFields = new ArrayList<>();
            node.get("required").forEach(n -> requiredFields.add(n.asText()));
            builder.required(requiredFields);
        }
        return builder.build();
    }

    private static JsonArraySchema parseArray(JsonNode node) {
        JsonArraySchema.Builder builder = JsonArraySchema.builder().description(description(node));
        builder.items(node.has("items") ? parseElement(node.get("items")) : JsonStringSchema.builder().build());
        return builder.build();
    }

    private static JsonSchemaElement parseString(JsonNode node) {
        if (node.path("enum").isArray()) {
            List<String> enumValues = new ArrayList<>();
            node.get("enum").forEach(n -> {
                if (!n.isNull()) enumValues.add(n.asText());
            });
            return JsonEnumSchema.builder()
                    .description(description(node))
                    .enumValues(enumValues)
                    .build();
        }
        return JsonStringSchema.builder().description(description(node)).build();
    }

    private static String description(JsonNode node) {
        return node.has("description") ? node.get("description").asText() : null;
    }
}
