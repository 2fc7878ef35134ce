package com.eainde.literature.schema;

import com.eainde.literature.config.ConfigFileResolver;
import com.eainde.literature.config.PipelineProperties;
import com.eainde.literature.exception.PipelineConfigurationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Loads and validates the record schema.
 *
 * <p>Expected shape: {@code properties.records} is an array whose {@code items}
 * object declares {@code properties}, optional {@code required}, and a mandatory
 * {@code x-unique-fields} list naming a subset of the properties.</p>
 */
@Log4j2
@Component
public class SchemaLoader {

    public static final String SCHEMA_FILE = "schema.json";

    private static final ObjectMapper objectMapper = new ObjectMapper();
    private static final Pattern COLUMN_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final ConfigFileResolver resolver;
    private final PipelineProperties properties;

    public SchemaLoader(ConfigFileResolver resolver, PipelineProperties properties) {
        this.resolver = resolver;
        this.properties = properties;
    }

    public RecordSchema load() {
        String json = resolver.read(properties.getSchemaFile(), SCHEMA_FILE, SCHEMA_FILE);
        RecordSchema schema = parse(json);
        log.info("Loaded record schema: {} fields, unique fields {}, required fields {}",
                schema.size(), schema.uniqueFields(), schema.requiredFields());
        return schema;
    }

    public static RecordSchema parse(String json) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new PipelineConfigurationException("Schema is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new PipelineConfigurationException("Schema must be a JSON object");
        }

        JsonNode records = root.path("properties").path("records");
        JsonNode items = records.path("items");
        if (!"array".equals(records.path("type").asText()) || !items.path("properties").isObject()) {
            throw new PipelineConfigurationException(
                    "Schema must define a top-level 'records' array whose items declare 'properties'");
        }

        JsonNode props = items.get("properties");
        Set<String> required = readNameList(items.path("required"));
        JsonNode uniqueNode = items.get("x-unique-fields");
        if (uniqueNode == null || !uniqueNode.isArray() || uniqueNode.isEmpty()) {
            throw new PipelineConfigurationException(
                    "Schema must define 'x-unique-fields' at properties > records > items level to specify "
                            + "which fields define record uniqueness. Add 'x-unique-fields': [\"field1\", ...] "
                            + "to the record schema items, as a sibling to 'required'.");
        }
        Set<String> unique = readNameList(uniqueNode);

        List<String> invalidUnique = missingFrom(unique, props);
        if (!invalidUnique.isEmpty()) {
            throw new PipelineConfigurationException("Invalid x-unique-fields in schema: "
                    + String.join(", ", invalidUnique) + ". These fields are not defined in the record properties.");
        }
        List<String> invalidRequired = missingFrom(required, props);
        if (!invalidRequired.isEmpty()) {
            throw new PipelineConfigurationException("Invalid required fields in schema: "
                    + String.join(", ", invalidRequired) + ". These fields are not defined in the record properties.");
        }

        Map<String, SchemaField> fields = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = props.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            String name = entry.getKey();
            if (!COLUMN_NAME.matcher(name).matches()) {
                throw new PipelineConfigurationException("Schema field name is not a valid column name: " + name);
            }
            if (RecordSchema.RESERVED_COLUMNS.contains(name)) {
                throw new PipelineConfigurationException("Schema field name is reserved by the record store: " + name);
            }
            JsonNode def = entry.getValue();
            fields.put(name, new SchemaField(
                    name,
                    FieldType.fromJsonType(resolveType(def.get("type"))),
                    required.contains(name),
                    unique.contains(name),
                    def.has("description") ? def.get("description").asText() : null));
        }
        return new RecordSchema(json, fields);
    }

    /**
     * {@code "string"} or a nullable union such as {@code ["string", "null"]};
     * unions resolve to their first non-null member.
     */
    static String resolveType(JsonNode typeNode) {
        if (typeNode == null || typeNode.isNull()) return null;
        if (typeNode.isTextual()) return typeNode.asText();
        if (typeNode.isArray()) {
            for (JsonNode t : typeNode) {
                if (!"null".equals(t.asText())) return t.asText();
            }
        }
        return null;
    }

    private static Set<String> readNameList(JsonNode node) {
        Set<String> names = new HashSet<>();
        if (node != null && node.isArray()) {
            node.forEach(n -> names.add(n.asText()));
        }
        return names;
    }

    private static List<String> missingFrom(Set<String> names, JsonNode props) {
        List<String> missing = new ArrayList<>();
        for (String name : names) {
            if (!props.has(name)) missing.add(name);
        }
        missing.sort(String::compareTo);
        return missing;
    }
}
