package com.eainde.literature.orchestrator;

import com.eainde.literature.config.PipelineProperties;
import com.eainde.literature.model.Stage;

/**
 * Forcing directives for one pipeline run, plus the refinement selection.
 */
public record ProcessingOptions(ForceDirective forceOcr,
                                ForceDirective forceMetadata,
                                ForceDirective forceExtraction,
                                ForceDirective refine) {

    public ProcessingOptions {
        forceOcr = forceOcr != null ? forceOcr : ForceDirective.none();
        forceMetadata = forceMetadata != null ? forceMetadata : ForceDirective.none();
        forceExtraction = forceExtraction != null ? forceExtraction : ForceDirective.none();
        refine = refine != null ? refine : ForceDirective.none();
    }

    public static ProcessingOptions defaults() {
        return new ProcessingOptions(null, null, null, null);
    }

    /**
     * Parses the configured directive texts; throws on any unrecognised value.
     */
    public static ProcessingOptions fromProperties(PipelineProperties properties) {
        return new ProcessingOptions(
                ForceDirective.parse(properties.getForce().getOcr()),
                ForceDirective.parse(properties.getForce().getMetadata()),
                ForceDirective.parse(properties.getForce().getExtraction()),
                ForceDirective.parse(properties.getRefine()));
    }

    public ForceDirective force(Stage stage) {
        return switch (stage) {
            case OCR -> forceOcr;
            case METADATA -> forceMetadata;
            case EXTRACTION -> forceExtraction;
            case REFINEMENT -> ForceDirective.none();
        };
    }

    public ProcessingOptions withForce(Stage stage, ForceDirective directive) {
        return switch (stage) {
            case OCR -> new ProcessingOptions(directive, forceMetadata, forceExtraction, refine);
            case METADATA -> new ProcessingOptions(forceOcr, directive, forceExtraction, refine);
            case EXTRACTION -> new ProcessingOptions(forceOcr, forceMetadata, directive, refine);
            case REFINEMENT -> new ProcessingOptions(forceOcr, forceMetadata, forceExtraction, directive);
        };
    }
}
