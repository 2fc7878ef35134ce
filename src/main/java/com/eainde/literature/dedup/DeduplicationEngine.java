package com.eainde.literature.dedup;

import com.eainde.literature.exception.PipelineConfigurationException;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.log4j.Log4j2;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Filters newly extracted records against the records already stored for a document.
 *
 * <p>The caller must pass every stored row, soft-deleted and human-edited ones
 * included, read immediately before the call. Rows removed from storage by other
 * means are then absent from the comparison and their re-extracted versions are
 * kept.</p>
 */
@Log4j2
public class DeduplicationEngine {

    private final Map<SimilarityMethod, DuplicateDetector> detectors;

    public DeduplicationEngine(Map<SimilarityMethod, DuplicateDetector> detectors) {
        this.detectors = detectors.isEmpty() ? Map.of() : new EnumMap<>(detectors);
    }

    public DeduplicationResult deduplicate(List<Map<String, JsonNode>> newRecords,
                                           List<Map<String, JsonNode>> existingRecords,
                                           List<String> uniqueFields,
                                           SimilarityMethod method,
                                           double threshold) {
        if (threshold < 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException("Similarity threshold must be within [0, 1], got " + threshold);
        }
        if (newRecords.isEmpty()) {
            return new DeduplicationResult(List.of(), 0);
        }
        if (existingRecords.isEmpty()) {
            log.info("No existing records, keeping all {} new records", newRecords.size());
            return new DeduplicationResult(List.copyOf(newRecords), 0);
        }

        DuplicateDetector detector = detectors.get(method);
        if (detector == null) {
            throw new PipelineConfigurationException("No duplicate detector configured for method " + method);
        }

        List<Integer> keptIndices = detector.findUnique(newRecords, existingRecords, uniqueFields, threshold);
        List<Map<String, JsonNode>> kept = new ArrayList<>(keptIndices.size());
        for (int index : keptIndices) {
            kept.add(newRecords.get(index));
        }
        int duplicates = newRecords.size() - kept.size();
        log.info("Deduplication ({}): {} new, {} existing, {} kept, {} duplicates removed",
                method, newRecords.size(), existingRecords.size(), kept.size(), duplicates);
        return new DeduplicationResult(kept, duplicates);
    }
}
