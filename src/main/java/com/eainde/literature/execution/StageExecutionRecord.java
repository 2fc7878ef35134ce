package com.eainde.literature.execution;

import com.eainde.literature.model.Stage;

import java.time.Instant;

/**
 * One stage run for one document, kept for debugging and audit.
 */
public record StageExecutionRecord(
        String executionId,
        long documentId,
        Stage stage,
        String status,
        String modelUsed,
        String attemptLog,
        String errorMessage,
        Instant startedAt,
        Instant completedAt,
        long durationMs
) {
    public static final String RUNNING = "RUNNING";
    public static final String SUCCESS = "SUCCESS";
    public static final String FAILED = "FAILED";

    /**
     * Creates a new RUNNING record when a stage starts.
     */
    public static StageExecutionRecord running(String executionId, long documentId, Stage stage, Instant startedAt) {
        return new StageExecutionRecord(
                executionId,
                documentId,
                stage,
                RUNNING,
                null,
                null,
                null,
                startedAt,
                null,
                0
        );
    }
}
