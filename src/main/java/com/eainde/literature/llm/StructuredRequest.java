package com.eainde.literature.llm;

import java.util.List;

/**
 * @param name         schema name, also used in logs
 * @param systemPrompt instructions
 * @param userPrompt   document content and context
 * @param schemaJson   JSON Schema the response must match
 * @param models       model ids in fallback order
 */
public record StructuredRequest(
        String name,
        String systemPrompt,
        String userPrompt,
        String schemaJson,
        List<String> models
) {
    public StructuredRequest {
        models = models != null ? List.copyOf(models) : List.of();
    }
}
