package com.eainde.literature.orchestrator;

import java.util.List;

/**
 * Aggregated result of one pipeline run: one row per input document.
 */
public class PipelineResult {

    private final List<DocumentResult> documentResults;
    private final int successCount;
    private final int failureCount;

    private PipelineResult(List<DocumentResult> documentResults) {
        this.documentResults = List.copyOf(documentResults);
        this.successCount = (int) documentResults.stream().filter(DocumentResult::isSuccess).count();
        this.failureCount = documentResults.size() - this.successCount;
    }

    public static PipelineResult aggregate(List<DocumentResult> documentResults) {
        return new PipelineResult(documentResults);
    }

    public static PipelineResult empty() {
        return new PipelineResult(List.of());
    }

    public List<DocumentResult> getDocumentResults() {
        return documentResults;
    }

    public int getSuccessCount() {
        return successCount;
    }

    public int getFailureCount() {
        return failureCount;
    }

    public int getTotalCount() {
        return documentResults.size();
    }

    public List<DocumentResult> getFailures() {
        return documentResults.stream().filter(r -> !r.isSuccess()).toList();
    }
}
