package com.eainde.literature.dedup;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Map;

/**
 * @param kept           new records to insert, in input order
 * @param duplicateCount new records discarded as duplicates
 */
public record DeduplicationResult(List<Map<String, JsonNode>> kept, int duplicateCount) {
}
