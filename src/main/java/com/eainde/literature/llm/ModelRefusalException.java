package com.eainde.literature.llm;

import java.util.List;

/**
 * A provider declined to process the content. Thrown per model during fallback,
 * and by the client when every configured model refused.
 */
public class ModelRefusalException extends StructuredOutputException {

    public ModelRefusalException(String message) {
        super(message);
    }

    public ModelRefusalException(String message, List<ModelAttempt> attempts) {
        super(message, attempts);
    }
}
