package com.eainde.literature.llm;

import java.time.Instant;

/**
 * A failed call to one model during fallback.
 */
public record ModelAttempt(String model, Instant attemptedAt, String error, boolean refusal) {

    public String describe() {
        return attemptedAt + " " + model + (refusal ? " refused: " : " failed: ") + error;
    }
}
