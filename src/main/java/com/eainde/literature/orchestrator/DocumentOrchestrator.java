package com.eainde.literature.orchestrator;

import com.eainde.literature.config.PipelineProperties;
import com.eainde.literature.exception.PipelineConfigurationException;
import com.eainde.literature.model.Document;
import com.eainde.literature.model.Stage;
import com.eainde.literature.model.StageStatus;
import com.eainde.literature.stage.PipelineStage;
import com.eainde.literature.stage.StageExecutor;
import com.eainde.literature.store.DocumentRepository;
import com.eainde.literature.store.RecordRepository;
import lombok.extern.log4j.Log4j2;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Walks one document through OCR → Metadata → Extraction → Refinement.
 *
 * <h3>Per status-gated stage:</h3>
 * <pre>
 * re-read document → blocked by a prerequisite that failed in this pass?
 *   → decide(status, data check, force, upstreamRan)
 *   → SKIP, or RUN: record desync if any → reset downstream statuses → execute → persist status
 * </pre>
 *
 * <p>Refinement is opt-in: it runs only for selected documents that have at least one
 * active record. Stage failures end up in the status column and the returned outcome,
 * never as exceptions. Interruption leaves the in-flight stage's status unchanged and
 * reports it and every later stage as {@code cancelled}.</p>
 */
@Log4j2
@Component
public class DocumentOrchestrator {

    static final String MDC_DOCUMENT_ID = "documentId";
    private static final List<Stage> GATED_STAGES = List.of(Stage.OCR, Stage.METADATA, Stage.EXTRACTION);

    private final DocumentRepository documentRepository;
    private final RecordRepository recordRepository;
    private final StageExecutor stageExecutor;
    private final PipelineProperties properties;
    private final Map<Stage, PipelineStage> stages = new EnumMap<>(Stage.class);

    public DocumentOrchestrator(DocumentRepository documentRepository,
                                RecordRepository recordRepository,
                                StageExecutor stageExecutor,
                                PipelineProperties properties,
                                List<PipelineStage> pipelineStages) {
        this.documentRepository = documentRepository;
        this.recordRepository = recordRepository;
        this.stageExecutor = stageExecutor;
        this.properties = properties;
        for (PipelineStage stage : pipelineStages) {
            if (stages.put(stage.stage(), stage) != null) {
                throw new PipelineConfigurationException("More than one implementation for stage " + stage.stage());
            }
        }
        for (Stage stage : Stage.values()) {
            if (!stages.containsKey(stage)) {
                throw new PipelineConfigurationException("No implementation for stage " + stage);
            }
        }
    }

    // =========================================================================
    //  Public API
    // =========================================================================

    /**
     * Processes one registered document.
     *
     * @return per-stage results of this pass
     */
    public StageOutcome process(long documentId, ProcessingOptions options) {
        MDC.put(MDC_DOCUMENT_ID, String.valueOf(documentId));
        StageOutcome outcome = StageOutcome.start(documentId);
        Stage current = Stage.OCR;
        try {
            for (Stage stage : GATED_STAGES) {
                current = stage;
                outcome = runGatedStage(stage, outcome, options);
            }
            current = Stage.REFINEMENT;
            outcome = runRefinement(outcome, options);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Processing cancelled during {}", current.label());
            outcome = outcome.cancelled(current);
        } finally {
            MDC.remove(MDC_DOCUMENT_ID);
        }
        return outcome;
    }

    // =========================================================================
    //  Status-gated stages
    // =========================================================================

    private StageOutcome runGatedStage(Stage stage, StageOutcome outcome, ProcessingOptions options)
            throws InterruptedException {
        long documentId = outcome.documentId();
        Document document = load(documentId);

        Stage blocker = outcome.blockingPrerequisite(stage);
        if (blocker != null) {
            log.warn("{}: blocked, {} did not complete in this pass", stage.label(), blocker.label());
            return outcome.blocked(stage, blocker);
        }

        StageDecision decision = StageDecider.decide(
                stage,
                document.status(stage),
                StageDecider.dataCheck(stage, document),
                options.force(stage),
                documentId,
                outcome.upstreamRan());

        if (!decision.shouldRun()) {
            log.info("{}: SKIP ({})", stage.label(), decision.reason());
            return outcome.skipped(stage);
        }

        if (decision.statusToRecord() != null) {
            log.warn("{}: {}", stage.label(), decision.statusToRecord().toColumnValue());
            documentRepository.updateStatus(documentId, stage, decision.statusToRecord());
        }
        log.info("{}: RUN ({})", stage.label(), decision.reason());

        // ── Cascade: downstream statuses are cleared before they are evaluated ──
        if (!stage.invalidates().isEmpty()) {
            documentRepository.resetStatuses(documentId, stage.invalidates());
            log.debug("{}: reset {}", stage.label(), stage.invalidates());
        }

        return execute(stage, document, outcome);
    }

    // =========================================================================
    //  Refinement (opt-in)
    // =========================================================================

    private StageOutcome runRefinement(StageOutcome outcome, ProcessingOptions options) throws InterruptedException {
        long documentId = outcome.documentId();
        if (!options.refine().appliesTo(documentId)) {
            log.debug("Refinement: SKIP (not selected)");
            return outcome.skipped(Stage.REFINEMENT);
        }

        Stage blocker = outcome.blockingPrerequisite(Stage.REFINEMENT);
        if (blocker != null) {
            log.warn("Refinement: blocked, {} did not complete in this pass", blocker.label());
            return outcome.blocked(Stage.REFINEMENT, blocker);
        }

        if (recordRepository.countActive(documentId) == 0) {
            log.info("Refinement: SKIP (no records)");
            return outcome.skipped(Stage.REFINEMENT);
        }

        log.info("Refinement: RUN (selected)");
        return execute(Stage.REFINEMENT, load(documentId), outcome);
    }

    // =========================================================================
    //  Helpers
    // =========================================================================

    private StageOutcome execute(Stage stage, Document document, StageOutcome outcome) throws InterruptedException {
        StageStatus status = stageExecutor.execute(stages.get(stage), document, timeout(stage));
        documentRepository.updateStatus(document.id(), stage, status);
        return status.isCompleted()
                ? outcome.ran(stage)
                : outcome.failed(stage, status.toColumnValue());
    }

    private Document load(long documentId) {
        return documentRepository.findById(documentId)
                .orElseThrow(() -> new IllegalStateException("Document " + documentId + " not found"));
    }

    private Duration timeout(Stage stage) {
        PipelineProperties.Timeouts timeouts = properties.getTimeouts();
        return switch (stage) {
            case OCR -> timeouts.getOcr();
            case METADATA -> timeouts.getMetadata();
            case EXTRACTION -> timeouts.getExtraction();
            case REFINEMENT -> timeouts.getRefinement();
        };
    }
}
