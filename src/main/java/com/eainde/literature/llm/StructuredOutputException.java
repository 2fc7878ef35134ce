package com.eainde.literature.llm;

import java.util.List;

/**
 * Every configured model failed, or the response could not be used.
 */
public class StructuredOutputException extends RuntimeException {

    private final transient List<ModelAttempt> attempts;

    public StructuredOutputException(String message) {
        this(message, List.of());
    }

    public StructuredOutputException(String message, List<ModelAttempt> attempts) {
        super(message);
        this.attempts = List.copyOf(attempts);
    }

    public List<ModelAttempt> getAttempts() {
        return attempts;
    }

    public String attemptLog() {
        return StructuredResponse.describe(attempts);
    }
}
