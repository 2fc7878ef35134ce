package com.eainde.literature.orchestrator;

import com.eainde.literature.config.PipelineProperties;
import com.eainde.literature.dedup.SimilarityMethod;
import com.eainde.literature.exception.PipelineConfigurationException;
import com.eainde.literature.model.Document;
import com.eainde.literature.store.DocumentRepository;
import com.eainde.literature.thread.MdcAwareExecutor;
import com.eainde.literature.util.ContentHasher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

/**
 * Pipeline entry point: registers input files and processes each document on a worker pool.
 *
 * Per run:
 *   1. Register every file on the calling thread: hash the bytes and reuse the stored
 *      document with the same hash, or insert a new one
 *   2. Run each distinct document through {@link DocumentOrchestrator} on one worker, end to end
 *   3. Collect one result row per file, in input order; files with identical content
 *      share their document's row
 *
 * Configuration errors are thrown before any document is touched; everything
 * document-specific ends up in the result rows.
 */
@Service
public class PipelineService {

    private static final Logger log = LoggerFactory.getLogger(PipelineService.class);

    private final DocumentRepository documentRepository;
    private final DocumentOrchestrator orchestrator;
    private final PipelineProperties properties;
    private final Clock clock;

    public PipelineService(DocumentRepository documentRepository,
                           DocumentOrchestrator orchestrator,
                           PipelineProperties properties,
                           Clock clock) {
        this.documentRepository = documentRepository;
        this.orchestrator = orchestrator;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Processes the configured input with the configured forcing directives.
     */
    public PipelineResult processFromProperties() {
        if (properties.getInput() == null || properties.getInput().isBlank()) {
            throw new PipelineConfigurationException("pipeline.input is not set");
        }
        return process(listInputFiles(Paths.get(properties.getInput())), ProcessingOptions.fromProperties(properties));
    }

    /**
     * Main entry point.
     *
     * @param files   source files, processed in parallel but reported in this order
     * @param options forcing directives and refinement selection
     * @return one row per file
     */
    public PipelineResult process(List<Path> files, ProcessingOptions options) {
        validate(options);
        if (files.isEmpty()) {
            log.warn("No input files to process");
            return PipelineResult.empty();
        }

        List<Registration> registrations = files.stream().map(this::tryRegister).toList();
        Set<Long> documentIds = new LinkedHashSet<>();
        registrations.stream().filter(Registration::registered).forEach(r -> documentIds.add(r.document().id()));
        if (documentIds.isEmpty()) {
            return PipelineResult.aggregate(registrations.stream().map(Registration::failureRow).toList());
        }

        int workers = Math.max(1, Math.min(properties.getWorkers(), documentIds.size()));
        log.info("Processing {} file(s), {} distinct document(s), with {} worker(s)",
                files.size(), documentIds.size(), workers);

        AtomicInteger counter = new AtomicInteger();
        ExecutorService pool = new MdcAwareExecutor(Executors.newFixedThreadPool(workers,
                r -> new Thread(r, "document-worker-" + counter.incrementAndGet())));

        Map<Long, Future<StageOutcome>> futures = new LinkedHashMap<>();
        try {
            for (long documentId : documentIds) {
                futures.put(documentId, pool.submit(() -> orchestrator.process(documentId, options)));
            }

            List<DocumentResult> results = new ArrayList<>(files.size());
            for (Registration registration : registrations) {
                results.add(registration.registered()
                        ? await(futures.get(registration.document().id()), registration)
                        : registration.failureRow());
            }

            PipelineResult result = PipelineResult.aggregate(results);
            log.info("Pipeline completed. Processed: {}, Succeeded: {}, Failed: {}",
                    result.getTotalCount(), result.getSuccessCount(), result.getFailureCount());
            return result;
        } finally {
            pool.shutdownNow();
        }
    }

    // =========================================================================
    //  Per-file work
    // =========================================================================

    private Registration tryRegister(Path file) {
        String fileName = file.getFileName().toString();
        try {
            return new Registration(fileName, register(file), null);
        } catch (RuntimeException e) {
            log.error("Failed to register file: {}", fileName, e);
            return new Registration(fileName, null, "Registration failed: " + e.getMessage());
        }
    }

    /**
     * Outcome of registering one input file: a document, or the failure text for its row.
     */
    private record Registration(String fileName, Document document, String failure) {

        boolean registered() {
            return document != null;
        }

        DocumentResult failureRow() {
            return DocumentResult.failure(null, fileName, failure);
        }
    }

    /**
     * Returns the stored document with the same content hash, or registers a new one.
     */
    Document register(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new IllegalArgumentException("File not found: " + file);
        }
        String hash = ContentHasher.sha256(file);
        return documentRepository.findByHash(hash)
                .map(existing -> {
                    log.info("File {} already registered as document {}", file.getFileName(), existing.id());
                    return existing;
                })
                .orElseGet(() -> {
                    Document document = Document.builder()
                            .fileName(file.getFileName().toString())
                            .filePath(file.toAbsolutePath().toString())
                            .fileHash(hash)
                            .fileSize(size(file))
                            .uploadTimestamp(clock.instant())
                            .build();
                    return document.toBuilder().id(documentRepository.insert(document)).build();
                });
    }

    private DocumentResult await(Future<StageOutcome> future, Registration registration) {
        long documentId = registration.document().id();
        String fileName = registration.fileName();
        try {
            return DocumentResult.of(documentId, fileName, future.get());
        } catch (ExecutionException e) {
            log.error("Worker crashed for file: {}", fileName, e.getCause());
            return DocumentResult.failure(documentId, fileName, "Worker failed: " + e.getCause().getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return DocumentResult.failure(documentId, fileName, StageOutcome.CANCELLED);
        }
    }

    // =========================================================================
    //  Validation and input
    // =========================================================================

    private void validate(ProcessingOptions options) {
        if (options == null) {
            throw new PipelineConfigurationException("Processing options must not be null");
        }
        PipelineProperties.Models models = properties.getModels();
        requireModels(models.getMetadata(), "pipeline.models.metadata");
        requireModels(models.getExtraction(), "pipeline.models.extraction");
        if (!(options.refine() instanceof ForceDirective.NoForce)) {
            requireModels(models.getRefinement(), "pipeline.models.refinement");
        }
        if (properties.getDeduplication().getMethod() == SimilarityMethod.LLM) {
            requireModels(models.getDeduplication(), "pipeline.models.deduplication");
        }
        double threshold = properties.getDeduplication().getThreshold();
        if (threshold < 0.0 || threshold > 1.0) {
            throw new PipelineConfigurationException(
                    "pipeline.deduplication.threshold must be within [0, 1], got " + threshold);
        }
        if (properties.getWorkers() < 1) {
            throw new PipelineConfigurationException("pipeline.workers must be at least 1");
        }
    }

    private static void requireModels(List<String> models, String property) {
        if (models == null || models.isEmpty()) {
            throw new PipelineConfigurationException(property + " must list at least one model");
        }
    }

    static List<Path> listInputFiles(Path input) {
        if (Files.isRegularFile(input)) {
            return List.of(input);
        }
        if (!Files.isDirectory(input)) {
            throw new PipelineConfigurationException("Input path does not exist: " + input);
        }
        try (Stream<Path> entries = Files.list(input)) {
            return entries.filter(Files::isRegularFile).sorted().toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list input directory " + input, e);
        }
    }

    private static Long size(Path file) {
        try {
            return Files.size(file);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read size of " + file, e);
        }
    }
}
