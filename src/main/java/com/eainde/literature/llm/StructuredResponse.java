package com.eainde.literature.llm;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.stream.Collectors;

/**
 * @param data           parsed response matching the requested schema
 * @param modelUsed      model that produced it
 * @param failedAttempts models tried before it, oldest first
 */
public record StructuredResponse(JsonNode data, String modelUsed, List<ModelAttempt> failedAttempts) {

    public StructuredResponse {
        failedAttempts = failedAttempts != null ? List.copyOf(failedAttempts) : List.of();
    }

    /**
     * Prior failures, one per line; null when the first model succeeded.
     */
    public String attemptLog() {
        return describe(failedAttempts);
    }

    static String describe(List<ModelAttempt> attempts) {
        if (attempts.isEmpty()) return null;
        return attempts.stream().map(ModelAttempt::describe).collect(Collectors.joining("\n"));
    }
}
