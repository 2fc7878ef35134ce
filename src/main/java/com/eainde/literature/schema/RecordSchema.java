package com.eainde.literature.schema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The active record schema: a typed field map derived once per run from the
 * user's JSON Schema and passed explicitly to every component that needs it.
 */
public final class RecordSchema {

    /** Columns owned by the store; a schema may not declare them. */
    public static final Set<String> RESERVED_COLUMNS = Set.of(
            "id", "document_id", "record_id", "extraction_timestamp", "llm_model",
            "prompt_hash", "added_by_user", "deleted_by_user", "human_edited");

    private final String json;
    private final Map<String, SchemaField> fields;

    RecordSchema(String json, Map<String, SchemaField> fields) {
        this.json = json;
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    /** The original schema document, as given to the LLM for structured output. */
    public String json() {
        return json;
    }

    public Map<String, SchemaField> fields() {
        return fields;
    }

    public List<String> fieldNames() {
        return List.copyOf(fields.keySet());
    }

    public SchemaField field(String name) {
        return fields.get(name);
    }

    public boolean hasField(String name) {
        return fields.containsKey(name);
    }

    public int size() {
        return fields.size();
    }

    public List<String> uniqueFields() {
        return fields.values().stream().filter(SchemaField::unique).map(SchemaField::name).toList();
    }

    public List<String> requiredFields() {
        return fields.values().stream().filter(SchemaField::required).map(SchemaField::name).toList();
    }
}
