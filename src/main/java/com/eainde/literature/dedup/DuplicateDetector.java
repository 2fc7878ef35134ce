package com.eainde.literature.dedup;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Map;

/**
 * Decides which new records are not duplicates of existing ones.
 */
public interface DuplicateDetector {

    /**
     * @param newRecords   candidate rows, field name → value
     * @param existing     rows already stored for the document (never empty)
     * @param uniqueFields fields that jointly identify a record
     * @param threshold    similarity each compared field must reach
     * @return indices into {@code newRecords} of the rows to keep, ascending
     */
    List<Integer> findUnique(List<Map<String, JsonNode>> newRecords,
                             List<Map<String, JsonNode>> existing,
                             List<String> uniqueFields,
                             double threshold);
}
