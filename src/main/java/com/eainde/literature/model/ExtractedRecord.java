package com.eainde.literature.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import lombok.Builder;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A persisted record row.
 *
 * @param id                  surrogate key; the join key for review diffs
 * @param documentId          owning document
 * @param recordId            human-readable business key, {@code {Author}{Year}-o{N}}
 * @param fields              schema field values keyed by field name
 * @param addedByUser         inserted by a reviewer
 * @param deletedByUser       soft-deleted by a reviewer
 * @param humanEdited         at least one field changed by a reviewer
 * @param llmModel            model that produced the row
 * @param promptHash          MD5 of the extraction prompt
 * @param extractionTimestamp insert time
 */
@Builder(toBuilder = true)
public record ExtractedRecord(
        Long id,
        long documentId,
        String recordId,
        Map<String, JsonNode> fields,
        boolean addedByUser,
        boolean deletedByUser,
        boolean humanEdited,
        String llmModel,
        String promptHash,
        Instant extractionTimestamp
) {

    public ExtractedRecord {
        fields = fields != null ? Collections.unmodifiableMap(withoutNulls(fields)) : Map.of();
    }

    public JsonNode field(String name) {
        JsonNode value = fields.get(name);
        return value != null ? value : NullNode.getInstance();
    }

    /** Not removed by a reviewer. */
    public boolean isActive() {
        return !deletedByUser;
    }

    /** Protected from automated updates. */
    public boolean isProtected() {
        return humanEdited || deletedByUser;
    }

    private static Map<String, JsonNode> withoutNulls(Map<String, JsonNode> fields) {
        Map<String, JsonNode> copy = new LinkedHashMap<>();
        fields.forEach((k, v) -> {
            if (v != null && !v.isNull() && !v.isMissingNode()) copy.put(k, v);
        });
        return copy;
    }
}
