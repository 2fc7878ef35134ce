package com.eainde.literature.review;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One row as saved by a reviewer.
 *
 * @param id       surrogate id of the stored row; null for a row the reviewer added
 * @param recordId business key, possibly edited; null to keep the stored one or generate one
 * @param fields   schema field values; a missing or null value clears the field
 */
public record ReviewedRecord(Long id, String recordId, Map<String, JsonNode> fields) {

    public ReviewedRecord {
        fields = fields != null ? Collections.unmodifiableMap(new LinkedHashMap<>(fields)) : Map.of();
    }

    public boolean isNew() {
        return id == null;
    }
}
