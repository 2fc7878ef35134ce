package com.eainde.literature.orchestrator;

import com.eainde.literature.model.Stage;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Result row for one document: one status text per stage.
 *
 * <p>Anything other than {@code completed} or {@code skipped} is a failure for that document.</p>
 */
public class DocumentResult {

    private final Long documentId;
    private final String fileName;
    private final Map<Stage, String> statuses;

    private DocumentResult(Long documentId, String fileName, Map<Stage, String> statuses) {
        this.documentId = documentId;
        this.fileName = fileName;
        this.statuses = Collections.unmodifiableMap(statuses);
    }

    public static DocumentResult of(Long documentId, String fileName, StageOutcome outcome) {
        Map<Stage, String> statuses = new EnumMap<>(Stage.class);
        for (Stage stage : Stage.values()) {
            String result = outcome.result(stage);
            statuses.put(stage, result != null ? result : "not processed");
        }
        return new DocumentResult(documentId, fileName, statuses);
    }

    /**
     * A document that could not be registered or whose worker crashed.
     */
    public static DocumentResult failure(Long documentId, String fileName, String errorMessage) {
        Map<Stage, String> statuses = new EnumMap<>(Stage.class);
        for (Stage stage : Stage.values()) {
            statuses.put(stage, errorMessage);
        }
        return new DocumentResult(documentId, fileName, statuses);
    }

    public Long getDocumentId() {
        return documentId;
    }

    public String getFileName() {
        return fileName;
    }

    public String getStatus(Stage stage) {
        return statuses.get(stage);
    }

    public Map<Stage, String> getStatuses() {
        return statuses;
    }

    public boolean isSuccess() {
        return statuses.values().stream().allMatch(DocumentResult::isOk);
    }

    public static boolean isOk(String status) {
        return StageOutcome.COMPLETED.equals(status) || StageOutcome.SKIPPED.equals(status);
    }

    @Override
    public String toString() {
        return "DocumentResult{documentId=" + documentId + ", fileName=" + fileName + ", statuses=" + statuses + "}";
    }
}
