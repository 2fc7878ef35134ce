package com.eainde.literature.dedup;

import com.eainde.literature.llm.StructuredOutputClient;
import com.eainde.literature.llm.StructuredRequest;
import com.eainde.literature.llm.StructuredResponse;
import com.eainde.literature.prompt.PromptRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.log4j.Log4j2;

import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.stream.IntStream;

/**
 * Asks an LLM which new records are not duplicates, in one call per document.
 *
 * <p>Both batches are reduced to their unique fields. New rows are numbered from 1;
 * the model answers {@code {"unique_indices": [...]}}. A failed call, a missing,
 * empty or malformed answer, or one with no usable index keeps every new row.</p>
 */
@Log4j2
public class LlmSemanticDuplicateDetector implements DuplicateDetector {

    static final String RESPONSE_SCHEMA = """
            {
              "type": "object",
              "properties": {
                "unique_indices": {
                  "type": "array",
                  "description": "1-based indices of NEW records that duplicate no EXISTING record",
                  "items": { "type": "integer" }
                }
              },
              "required": ["unique_indices"]
            }
            """;

    private final StructuredOutputClient client;
    private final PromptRepository prompts;
    private final List<String> models;
    private final ObjectMapper objectMapper;

    public LlmSemanticDuplicateDetector(StructuredOutputClient client, PromptRepository prompts,
                                        List<String> models, ObjectMapper objectMapper) {
        this.client = client;
        this.prompts = prompts;
        this.models = List.copyOf(models);
        this.objectMapper = objectMapper;
    }

    @Override
    public List<Integer> findUnique(List<Map<String, JsonNode>> newRecords,
                                    List<Map<String, JsonNode>> existing,
                                    List<String> uniqueFields,
                                    double threshold) {
        List<Integer> keepAll = IntStream.range(0, newRecords.size()).boxed().toList();

        StructuredResponse response;
        try {
            response = client.call(new StructuredRequest(
                    "deduplication",
                    prompts.get(PromptRepository.DEDUPLICATION),
                    buildUserPrompt(newRecords, existing, uniqueFields),
                    RESPONSE_SCHEMA,
                    models));
        } catch (RuntimeException e) {
            log.warn("Semantic deduplication call failed, keeping all {} new records: {}",
                    newRecords.size(), e.getMessage());
            return keepAll;
        }

        JsonNode indices = response.data() != null ? response.data().path("unique_indices") : null;
        if (indices == null || !indices.isArray() || indices.isEmpty()) {
            log.warn("Semantic deduplication returned no indices, keeping all {} new records", newRecords.size());
            return keepAll;
        }

        TreeSet<Integer> kept = new TreeSet<>();
        for (JsonNode index : indices) {
            if (!index.canConvertToInt()) continue;
            int oneBased = index.asInt();
            if (oneBased >= 1 && oneBased <= newRecords.size()) {
                kept.add(oneBased - 1);
            }
        }
        if (kept.isEmpty()) {
            log.warn("Semantic deduplication indices {} are all out of range, keeping all {} new records",
                    indices, newRecords.size());
            return keepAll;
        }
        return List.copyOf(kept);
    }

    String buildUserPrompt(List<Map<String, JsonNode>> newRecords,
                           List<Map<String, JsonNode>> existing,
                           List<String> uniqueFields) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.set("existing_records", project(existing, uniqueFields, false));
        payload.set("new_records", project(newRecords, uniqueFields, true));
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialise deduplication payload", e);
        }
    }

    private ArrayNode project(List<Map<String, JsonNode>> rows, List<String> uniqueFields, boolean numbered) {
        ArrayNode array = objectMapper.createArrayNode();
        for (int i = 0; i < rows.size(); i++) {
            ObjectNode row = array.addObject();
            if (numbered) row.put("index", i + 1);
            for (String field : uniqueFields) {
                JsonNode value = rows.get(i).get(field);
                row.set(field, value != null ? value : objectMapper.nullNode());
            }
        }
        return array;
    }
}
