package com.eainde.literature.llm;

/**
 * External capability: given a prompt and a schema, return structured data or a typed failure.
 *
 * <p>Implementations try {@link StructuredRequest#models()} in order and return the
 * first success. When every model fails they throw {@link ModelRefusalException}
 * (all refused) or {@link StructuredOutputException}.</p>
 */
public interface StructuredOutputClient {

    StructuredResponse call(StructuredRequest request);
}
