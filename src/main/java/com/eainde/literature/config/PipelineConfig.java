package com.eainde.literature.config;

import com.eainde.literature.crossref.CrossRefClient;
import com.eainde.literature.dedup.DeduplicationEngine;
import com.eainde.literature.dedup.DuplicateDetector;
import com.eainde.literature.dedup.EmbeddingCosineSimilarity;
import com.eainde.literature.dedup.FieldwiseDuplicateDetector;
import com.eainde.literature.dedup.LlmSemanticDuplicateDetector;
import com.eainde.literature.dedup.NgramJaccardSimilarity;
import com.eainde.literature.dedup.SimilarityMethod;
import com.eainde.literature.llm.LangChainStructuredOutputClient;
import com.eainde.literature.llm.StructuredOutputClient;
import com.eainde.literature.ocr.OcrClient;
import com.eainde.literature.ocr.TextFileOcrClient;
import com.eainde.literature.prompt.PromptRepository;
import com.eainde.literature.schema.RecordSchema;
import com.eainde.literature.schema.SchemaLoader;
import com.eainde.literature.store.SqliteDataSourceFactory;
import com.eainde.literature.util.RecordIdGenerator;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.model.chat.Capability;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import lombok.extern.log4j.Log4j2;
import okhttp3.OkHttpClient;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.time.Clock;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Infrastructure beans: store, schema, LLM clients and the deduplication strategy.
 */
@Log4j2
@Configuration
public class PipelineConfig {

    private static final int EMBEDDING_BATCH_SIZE = 100;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public ObjectMapper objectMapper() {
        return new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    // =========================================================================
    //  Store
    // =========================================================================

    @Bean
    public DataSource dataSource(PipelineProperties properties) {
        PipelineProperties.Database database = properties.getDatabase();
        log.info("Using SQLite database {}", database.getPath());
        return SqliteDataSourceFactory.create(database.getPath(), database.getBusyTimeout());
    }

    @Bean
    public JdbcTemplate jdbcTemplate(DataSource dataSource) {
        return new JdbcTemplate(dataSource);
    }

    @Bean
    public PlatformTransactionManager transactionManager(DataSource dataSource) {
        return new DataSourceTransactionManager(dataSource);
    }

    @Bean
    public TransactionTemplate transactionTemplate(PlatformTransactionManager transactionManager) {
        return new TransactionTemplate(transactionManager);
    }

    // =========================================================================
    //  Schema
    // =========================================================================

    /**
     * Loaded once; an invalid schema fails start-up before any document is touched.
     */
    @Bean
    public RecordSchema recordSchema(SchemaLoader schemaLoader) {
        return schemaLoader.load();
    }

    @Bean
    public RecordIdGenerator recordIdGenerator(Clock clock) {
        return new RecordIdGenerator(clock);
    }

    // =========================================================================
    //  Collaborators
    // =========================================================================

    /**
     * Chat models are built on first use, one per model id.
     */
    @Bean
    public StructuredOutputClient structuredOutputClient(PipelineProperties properties,
                                                         ObjectMapper objectMapper,
                                                         Clock clock) {
        PipelineProperties.Llm llm = properties.getLlm();
        Map<String, ChatModel> models = new ConcurrentHashMap<>();
        return new LangChainStructuredOutputClient(
                modelId -> models.computeIfAbsent(modelId, id -> OpenAiChatModel.builder()
                        .baseUrl(llm.getBaseUrl())
                        .apiKey(llm.getApiKey())
                        .modelName(id)
                        .timeout(llm.getTimeout())
                        .supportedCapabilities(Set.of(Capability.RESPONSE_FORMAT_JSON_SCHEMA))
                        .strictJsonSchema(false)
                        .build()),
                objectMapper,
                clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public OcrClient ocrClient() {
        return new TextFileOcrClient();
    }

    @Bean
    public CrossRefClient crossRefClient(PipelineProperties properties, ObjectMapper objectMapper) {
        PipelineProperties.CrossRef crossref = properties.getMetadata().getCrossref();
        OkHttpClient httpClient = new OkHttpClient.Builder()
                .callTimeout(crossref.getTimeout())
                .build();
        return new CrossRefClient(httpClient, crossref.getBaseUrl(), crossref.getMailto(), objectMapper);
    }

    @Bean
    public DeduplicationEngine deduplicationEngine(PipelineProperties properties,
                                                   StructuredOutputClient client,
                                                   PromptRepository prompts,
                                                   ObjectMapper objectMapper) {
        PipelineProperties.Deduplication config = properties.getDeduplication();
        Map<SimilarityMethod, DuplicateDetector> detectors = new EnumMap<>(SimilarityMethod.class);
        detectors.put(SimilarityMethod.JACCARD,
                new FieldwiseDuplicateDetector(new NgramJaccardSimilarity(config.getNgramSize())));
        detectors.put(SimilarityMethod.LLM,
                new LlmSemanticDuplicateDetector(client, prompts, properties.getModels().getDeduplication(), objectMapper));

        if (config.getMethod() == SimilarityMethod.EMBEDDING) {
            PipelineProperties.Llm llm = properties.getLlm();
            OpenAiEmbeddingModel embeddingModel = OpenAiEmbeddingModel.builder()
                    .baseUrl(llm.getBaseUrl())
                    .apiKey(llm.getApiKey())
                    .modelName(llm.getEmbeddingModel())
                    .timeout(llm.getTimeout())
                    .build();
            detectors.put(SimilarityMethod.EMBEDDING,
                    new FieldwiseDuplicateDetector(new EmbeddingCosineSimilarity(embeddingModel, EMBEDDING_BATCH_SIZE)));
        }
        log.info("Deduplication: method {}, threshold {}", config.getMethod(), config.getThreshold());
        return new DeduplicationEngine(detectors);
    }
}
