package com.eainde.literature.config;

import com.eainde.literature.dedup.SimilarityMethod;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Pipeline settings bound from {@code application.yml}.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "pipeline")
public class PipelineProperties {

    private Database database = new Database();

    /** Explicit record schema path; falls back to the config directory, then the bundled schema */
    private String schemaFile;

    /** Project-level override directory for schema and prompt files */
    private String configDirectory = "literature-config";

    /** Number of documents processed in parallel */
    private int workers = 1;

    private Timeouts timeouts = new Timeouts();

    private Models models = new Models();

    private Llm llm = new Llm();

    private Deduplication deduplication = new Deduplication();

    private Metadata metadata = new Metadata();

    /** Forcing directives per stage: none | all | comma-separated document ids */
    private Force force = new Force();

    /** Documents selected for refinement: none | all | comma-separated document ids */
    private String refine;

    /** Process {@link #input} when the application starts */
    private boolean runOnStartup = false;

    /** File or directory processed on startup */
    private String input;

    @Data
    public static class Database {
        private String path = "literature.db";
        private Duration busyTimeout = Duration.ofSeconds(30);
    }

    @Data
    public static class Timeouts {
        private Duration ocr = Duration.ofSeconds(300);
        private Duration metadata = Duration.ofSeconds(120);
        private Duration extraction = Duration.ofSeconds(300);
        private Duration refinement = Duration.ofSeconds(300);
    }

    @Data
    public static class Models {
        /** Empty disables the OCR quality audit */
        private List<String> ocrAudit = new ArrayList<>();
        private List<String> metadata = new ArrayList<>();
        private List<String> extraction = new ArrayList<>();
        private List<String> refinement = new ArrayList<>();
        private List<String> deduplication = new ArrayList<>();
    }

    @Data
    public static class Llm {
        private String baseUrl;
        private String apiKey;
        private Duration timeout = Duration.ofSeconds(120);
        private String embeddingModel = "text-embedding-3-small";
    }

    @Data
    public static class Deduplication {
        private SimilarityMethod method = SimilarityMethod.JACCARD;
        private double threshold = 0.9;
        private int ngramSize = 3;
    }

    @Data
    public static class Metadata {
        /** Pages of OCR text sent to the metadata call */
        private int maxPages = 3;

        private CrossRef crossref = new CrossRef();
    }

    @Data
    public static class CrossRef {
        /** Fill metadata gaps from CrossRef after the metadata call */
        private boolean enabled = false;
        private String baseUrl = "https://api.crossref.org";
        /** Contact address sent in the User-Agent, as CrossRef asks of polite clients */
        private String mailto;
        private Duration timeout = Duration.ofSeconds(10);
    }

    @Data
    public static class Force {
        private String ocr;
        private String metadata;
        private String extraction;
    }
}
