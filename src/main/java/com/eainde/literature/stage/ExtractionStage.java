package com.eainde.literature.stage;

import com.eainde.literature.config.PipelineProperties;
import com.eainde.literature.dedup.DeduplicationEngine;
import com.eainde.literature.dedup.DeduplicationResult;
import com.eainde.literature.llm.StructuredOutputClient;
import com.eainde.literature.llm.StructuredRequest;
import com.eainde.literature.llm.StructuredResponse;
import com.eainde.literature.model.Document;
import com.eainde.literature.model.ExtractedRecord;
import com.eainde.literature.model.PublicationMetadata;
import com.eainde.literature.model.Stage;
import com.eainde.literature.prompt.PromptRepository;
import com.eainde.literature.schema.RecordSchema;
import com.eainde.literature.schema.SchemaField;
import com.eainde.literature.store.DocumentRepository;
import com.eainde.literature.store.RecordRepository;
import com.eainde.literature.util.RecordIdGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Extracts schema records from the document text and inserts the ones not already stored.
 *
 * <p>Insert-only. Existing rows are never updated here; the deduplication baseline is
 * every stored row of the document, read fresh at the start of the run, so rows that
 * were removed from storage are re-admitted while reviewed and deleted rows are not
 * extracted again.</p>
 */
@Log4j2
@Component
public class ExtractionStage implements PipelineStage {

    private final StructuredOutputClient client;
    private final PromptRepository prompts;
    private final RecordSchema schema;
    private final RecordRepository recordRepository;
    private final DocumentRepository documentRepository;
    private final DeduplicationEngine deduplicationEngine;
    private final RecordIdGenerator recordIdGenerator;
    private final PipelineProperties properties;
    private final ObjectMapper objectMapper;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public ExtractionStage(StructuredOutputClient client,
                           PromptRepository prompts,
                           RecordSchema schema,
                           RecordRepository recordRepository,
                           DocumentRepository documentRepository,
                           DeduplicationEngine deduplicationEngine,
                           RecordIdGenerator recordIdGenerator,
                           PipelineProperties properties,
                           ObjectMapper objectMapper,
                           TransactionTemplate transactionTemplate,
                           Clock clock) {
        this.client = client;
        this.prompts = prompts;
        this.schema = schema;
        this.recordRepository = recordRepository;
        this.documentRepository = documentRepository;
        this.deduplicationEngine = deduplicationEngine;
        this.recordIdGenerator = recordIdGenerator;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.transactionTemplate = transactionTemplate;
        this.clock = clock;
    }

    @Override
    public Stage stage() {
        return Stage.EXTRACTION;
    }

    @Override
    public StageReport run(Document document, StageContext context) throws JsonProcessingException {
        if (!document.hasContent()) {
            throw new IllegalStateException("No document content found in database");
        }

        List<ExtractedRecord> stored = recordRepository.findByDocument(document.id());
        String systemPrompt = prompts.get(PromptRepository.EXTRACTION);
        String promptHash = PromptRepository.hash(systemPrompt);
        log.info("Extraction inputs: {} stored records, prompt hash {}", stored.size(), promptHash.substring(0, 8));

        StructuredResponse response = client.call(new StructuredRequest(
                "records",
                systemPrompt,
                buildUserPrompt(document, stored),
                schema.json(),
                properties.getModels().getExtraction()));

        List<Map<String, JsonNode>> candidates = parseRecords(response.data());
        DeduplicationResult dedup = deduplicationEngine.deduplicate(
                candidates,
                stored.stream().map(ExtractedRecord::fields).toList(),
                schema.uniqueFields(),
                properties.getDeduplication().getMethod(),
                properties.getDeduplication().getThreshold());

        Persisted persisted = context.commit(() -> {
            List<ExtractedRecord> inserted = insert(document, stored, dedup.kept(), response.modelUsed(), promptHash);
            int active = recordRepository.countActive(document.id());
            documentRepository.saveExtractionInfo(document.id(), active, response.modelUsed(), response.attemptLog());
            return new Persisted(inserted.size(), active);
        });

        return new StageReport(response.modelUsed(), response.attemptLog(),
                String.format("%d extracted, %d duplicates, %d inserted, %d active",
                        candidates.size(), dedup.duplicateCount(), persisted.inserted(), persisted.active()));
    }

    private record Persisted(int inserted, int active) {
    }

    private List<ExtractedRecord> insert(Document document,
                                         List<ExtractedRecord> stored,
                                         List<Map<String, JsonNode>> kept,
                                         String modelUsed,
                                         String promptHash) {
        if (kept.isEmpty()) {
            return List.of();
        }
        PublicationMetadata metadata = document.metadataOrEmpty();
        int sequence = RecordIdGenerator.maxSequence(stored.stream().map(ExtractedRecord::recordId).toList());
        Instant now = clock.instant();

        List<ExtractedRecord> rows = new ArrayList<>(kept.size());
        for (Map<String, JsonNode> fields : kept) {
            rows.add(ExtractedRecord.builder()
                    .documentId(document.id())
                    .recordId(recordIdGenerator.generate(
                            metadata.firstAuthorLastname(), metadata.publicationYear(), ++sequence))
                    .fields(fields)
                    .llmModel(modelUsed)
                    .promptHash(promptHash)
                    .extractionTimestamp(now)
                    .build());
        }
        return transactionTemplate.execute(status -> rows.stream().map(recordRepository::insert).toList());
    }

    /**
     * Reads the {@code records} array, keeping schema fields only and coercing
     * values to their declared types. Rows missing a required field are dropped.
     */
    List<Map<String, JsonNode>> parseRecords(JsonNode data) {
        JsonNode array = data != null ? data.get("records") : null;
        if (array == null || array.isNull()) {
            log.warn("Response carried no 'records' array, treating as zero records");
            return List.of();
        }
        if (!array.isArray()) {
            throw new IllegalStateException("'records' is not an array");
        }

        List<Map<String, JsonNode>> records = new ArrayList<>();
        int index = 0;
        for (JsonNode row : array) {
            index++;
            if (!row.isObject()) {
                log.warn("Discarding record {}: not an object", index);
                continue;
            }
            Map<String, JsonNode> fields = new LinkedHashMap<>();
            for (SchemaField field : schema.fields().values()) {
                JsonNode value = field.normalize(row.get(field.name()));
                if (!value.isNull()) fields.put(field.name(), value);
            }
            List<String> missing = schema.requiredFields().stream()
                    .filter(name -> SchemaField.isEmpty(fields.get(name)))
                    .toList();
            if (!missing.isEmpty()) {
                log.warn("Discarding record {}: missing required field(s) {}", index, missing);
                continue;
            }
            records.add(fields);
        }
        return records;
    }

    String buildUserPrompt(Document document, List<ExtractedRecord> stored) throws JsonProcessingException {
        PublicationMetadata metadata = document.metadataOrEmpty();
        ObjectNode publication = objectMapper.createObjectNode();
        publication.put("title", metadata.title());
        publication.put("first_author_lastname", metadata.firstAuthorLastname());
        if (metadata.publicationYear() != null) {
            publication.put("publication_year", metadata.publicationYear());
        } else {
            publication.putNull("publication_year");
        }
        publication.put("doi", metadata.doi());
        publication.put("journal", metadata.journal());

        ArrayNode existing = objectMapper.createArrayNode();
        for (ExtractedRecord record : stored) {
            if (!record.isActive()) continue;
            ObjectNode row = existing.addObject();
            row.put("record_id", record.recordId());
            for (String field : schema.uniqueFields()) {
                row.set(field, record.field(field));
            }
        }

        StringBuilder prompt = new StringBuilder();
        prompt.append("# Publication\n\n")
                .append(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(publication))
                .append("\n\n# Existing records\n\n");
        if (existing.isEmpty()) {
            prompt.append("None.");
        } else {
            prompt.append("Do not extract these again:\n")
                    .append(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(existing));
        }
        if (document.hasOcrAudit()) {
            prompt.append("\n\n# OCR quality audit\n\n").append(document.ocrAudit());
        }
        prompt.append("\n\n# Document\n\n").append(document.documentContent());
        return prompt.toString();
    }
}
