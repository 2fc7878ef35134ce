package com.eainde.literature.model;

import java.util.List;

/**
 * Pipeline stages in execution order.
 */
public enum Stage {

    OCR("OCR", "ocr_status"),
    METADATA("Metadata extraction", "metadata_status"),
    EXTRACTION("Extraction", "extraction_status"),
    REFINEMENT("Refinement", "refinement_status");

    private final String label;
    private final String statusColumn;

    Stage(String label, String statusColumn) {
        this.label = label;
        this.statusColumn = statusColumn;
    }

    public String label() {
        return label;
    }

    public String statusColumn() {
        return statusColumn;
    }

    /**
     * Stage whose failure in the same pass leaves this stage nothing to work on.
     * Metadata is not a prerequisite: extraction proceeds without it.
     */
    public Stage prerequisite() {
        return switch (this) {
            case OCR -> null;
            case METADATA, EXTRACTION -> OCR;
            case REFINEMENT -> EXTRACTION;
        };
    }

    /**
     * Stages whose status is reset when this stage re-runs. Refinement is opt-in
     * and never part of the cascade.
     */
    public List<Stage> invalidates() {
        return switch (this) {
            case OCR -> List.of(METADATA, EXTRACTION);
            case METADATA -> List.of(EXTRACTION);
            case EXTRACTION, REFINEMENT -> List.of();
        };
    }
}
