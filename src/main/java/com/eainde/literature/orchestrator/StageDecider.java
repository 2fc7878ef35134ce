package com.eainde.literature.orchestrator;

import com.eainde.literature.model.Document;
import com.eainde.literature.model.Stage;
import com.eainde.literature.model.StageStatus;

/**
 * Run/skip decision for the status-gated stages (OCR, Metadata, Extraction).
 * Pure: no I/O, never throws for those stages.
 */
public final class StageDecider {

    private StageDecider() {
    }

    /**
     * <ol>
     *   <li>forced for this document, or an upstream stage produced fresh output → RUN</li>
     *   <li>status not completed (unset, failed, desync) → RUN</li>
     *   <li>completed but payload absent → RUN, recording a desync status</li>
     *   <li>otherwise → SKIP</li>
     * </ol>
     */
    public static StageDecision decide(Stage stage,
                                       StageStatus status,
                                       DataCheck dataCheck,
                                       ForceDirective force,
                                       long documentId,
                                       boolean upstreamRan) {
        if (stage == Stage.REFINEMENT) {
            throw new IllegalArgumentException("Refinement is opt-in and not status-gated");
        }
        if (force.appliesTo(documentId)) {
            return StageDecision.run(StageDecision.Reason.FORCED);
        }
        if (upstreamRan) {
            return StageDecision.run(StageDecision.Reason.UPSTREAM_RAN);
        }
        if (status == null || !status.isCompleted()) {
            return StageDecision.run(StageDecision.Reason.NOT_COMPLETED);
        }
        if (dataCheck == DataCheck.ABSENT) {
            return new StageDecision(StageDecision.Action.RUN, StageDecision.Reason.DESYNC,
                    StageStatus.desync("status completed but " + payloadName(stage) + " missing"));
        }
        return StageDecision.skip();
    }

    /**
     * Evaluates the stage's data-existence predicate against the stored document.
     */
    public static DataCheck dataCheck(Stage stage, Document document) {
        return switch (stage) {
            case OCR -> document.hasContent() ? DataCheck.PRESENT : DataCheck.ABSENT;
            case METADATA -> document.metadataOrEmpty().hasCoreFields() ? DataCheck.PRESENT : DataCheck.ABSENT;
            case EXTRACTION, REFINEMENT -> DataCheck.NOT_CHECKED;
        };
    }

    static String payloadName(Stage stage) {
        return switch (stage) {
            case OCR -> "OCR text";
            case METADATA -> "title, first author and publication year";
            case EXTRACTION, REFINEMENT -> "records";
        };
    }
}
