package com.eainde.literature.model;

import lombok.Builder;

import java.time.Instant;

/**
 * A source document, identified by the SHA-256 of its bytes.
 */
@Builder(toBuilder = true)
public record Document(
        Long id,
        String fileName,
        String filePath,
        String fileHash,
        Long fileSize,
        Instant uploadTimestamp,
        String documentContent,
        String ocrImages,
        String ocrProvider,
        String ocrAudit,
        PublicationMetadata metadata,
        StageStatus ocrStatus,
        StageStatus metadataStatus,
        StageStatus extractionStatus,
        StageStatus refinementStatus,
        String metadataLlmModel,
        String extractionLlmModel,
        String refinementLlmModel,
        Integer recordsExtracted,
        Instant reviewedAt
) {

    public StageStatus status(Stage stage) {
        StageStatus status = switch (stage) {
            case OCR -> ocrStatus;
            case METADATA -> metadataStatus;
            case EXTRACTION -> extractionStatus;
            case REFINEMENT -> refinementStatus;
        };
        return status != null ? status : StageStatus.unset();
    }

    public boolean hasContent() {
        return documentContent != null && !documentContent.isBlank();
    }

    public boolean hasOcrAudit() {
        return ocrAudit != null && !ocrAudit.isBlank();
    }

    public PublicationMetadata metadataOrEmpty() {
        return metadata != null ? metadata : PublicationMetadata.empty();
    }

    public boolean isReviewed() {
        return reviewedAt != null;
    }
}
