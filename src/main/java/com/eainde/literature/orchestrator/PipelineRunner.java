package com.eainde.literature.orchestrator;

import com.eainde.literature.model.Stage;
import lombok.extern.log4j.Log4j2;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Processes {@code pipeline.input} once the application has started.
 */
@Log4j2
@Component
@ConditionalOnProperty(prefix = "pipeline", name = "run-on-startup", havingValue = "true")
public class PipelineRunner implements CommandLineRunner {

    private final PipelineService pipelineService;

    public PipelineRunner(PipelineService pipelineService) {
        this.pipelineService = pipelineService;
    }

    @Override
    public void run(String... args) {
        PipelineResult result = pipelineService.processFromProperties();
        for (DocumentResult row : result.getDocumentResults()) {
            log.info("{} [{}]: OCR={} | Metadata={} | Extraction={} | Refinement={}",
                    row.getFileName(), row.getDocumentId(),
                    row.getStatus(Stage.OCR), row.getStatus(Stage.METADATA),
                    row.getStatus(Stage.EXTRACTION), row.getStatus(Stage.REFINEMENT));
        }
        if (result.getFailureCount() > 0) {
            log.warn("{} of {} document(s) did not complete every stage",
                    result.getFailureCount(), result.getTotalCount());
        }
    }
}
