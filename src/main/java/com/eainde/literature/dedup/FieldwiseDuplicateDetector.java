package com.eainde.literature.dedup;

import com.eainde.literature.schema.SchemaField;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Pairwise comparison on unique fields with a per-field {@link FieldSimilarity}.
 *
 * <p>A pair is a duplicate when at least one unique field is populated on both
 * sides and every such field reaches the threshold. Fields empty on either side
 * are not compared.</p>
 */
public class FieldwiseDuplicateDetector implements DuplicateDetector {

    private final FieldSimilarity similarity;

    public FieldwiseDuplicateDetector(FieldSimilarity similarity) {
        this.similarity = similarity;
    }

    @Override
    public List<Integer> findUnique(List<Map<String, JsonNode>> newRecords,
                                    List<Map<String, JsonNode>> existing,
                                    List<String> uniqueFields,
                                    double threshold) {
        similarity.prepare(collectValues(newRecords, existing, uniqueFields));

        List<Integer> kept = new ArrayList<>();
        for (int i = 0; i < newRecords.size(); i++) {
            Map<String, JsonNode> candidate = newRecords.get(i);
            boolean duplicate = false;
            for (Map<String, JsonNode> stored : existing) {
                if (isDuplicate(candidate, stored, uniqueFields, threshold)) {
                    duplicate = true;
                    break;
                }
            }
            if (!duplicate) kept.add(i);
        }
        return kept;
    }

    boolean isDuplicate(Map<String, JsonNode> candidate, Map<String, JsonNode> stored,
                        List<String> uniqueFields, double threshold) {
        int compared = 0;
        for (String field : uniqueFields) {
            String a = SchemaField.comparableText(candidate.get(field));
            String b = SchemaField.comparableText(stored.get(field));
            if (a == null || b == null) continue;
            compared++;
            if (similarity.similarity(a, b) < threshold) {
                return false;
            }
        }
        return compared > 0;
    }

    private static Set<String> collectValues(List<Map<String, JsonNode>> newRecords,
                                             List<Map<String, JsonNode>> existing,
                                             List<String> uniqueFields) {
        Set<String> values = new LinkedHashSet<>();
        for (List<Map<String, JsonNode>> rows : List.of(newRecords, existing)) {
            for (Map<String, JsonNode> row : rows) {
                for (String field : uniqueFields) {
                    String text = SchemaField.comparableText(row.get(field));
                    if (text != null) values.add(text);
                }
            }
        }
        return values;
    }
}
