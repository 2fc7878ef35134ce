package com.eainde.literature.stage;

import com.eainde.literature.config.PipelineProperties;
import com.eainde.literature.llm.StructuredOutputClient;
import com.eainde.literature.llm.StructuredRequest;
import com.eainde.literature.llm.StructuredResponse;
import com.eainde.literature.model.Document;
import com.eainde.literature.model.ExtractedRecord;
import com.eainde.literature.model.Stage;
import com.eainde.literature.prompt.PromptRepository;
import com.eainde.literature.schema.RecordSchema;
import com.eainde.literature.schema.SchemaField;
import com.eainde.literature.store.DocumentRepository;
import com.eainde.literature.store.RecordRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Enriches existing records with details found on a second read of the document.
 *
 * <p>Update-only: each returned row is matched to a stored row by {@code record_id};
 * rows with an unknown or missing id are dropped. Only non-null values that differ
 * from the stored ones are written, and rows a reviewer edited or deleted are left
 * untouched.</p>
 */
@Log4j2
@Component
public class RefinementStage implements PipelineStage {

    static final String RECORD_ID = "record_id";

    private final StructuredOutputClient client;
    private final PromptRepository prompts;
    private final RecordSchema schema;
    private final RecordRepository recordRepository;
    private final DocumentRepository documentRepository;
    private final PipelineProperties properties;
    private final ObjectMapper objectMapper;
    private final TransactionTemplate transactionTemplate;

    public RefinementStage(StructuredOutputClient client,
                           PromptRepository prompts,
                           RecordSchema schema,
                           RecordRepository recordRepository,
                           DocumentRepository documentRepository,
                           PipelineProperties properties,
                           ObjectMapper objectMapper,
                           TransactionTemplate transactionTemplate) {
        this.client = client;
        this.prompts = prompts;
        this.schema = schema;
        this.recordRepository = recordRepository;
        this.documentRepository = documentRepository;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.transactionTemplate = transactionTemplate;
    }

    @Override
    public Stage stage() {
        return Stage.REFINEMENT;
    }

    @Override
    public StageReport run(Document document, StageContext context) throws JsonProcessingException {
        List<ExtractedRecord> active = recordRepository.findActiveByDocument(document.id());
        if (active.isEmpty()) {
            return StageReport.of("no records to refine");
        }

        StructuredResponse response = client.call(new StructuredRequest(
                "records",
                prompts.get(PromptRepository.REFINEMENT),
                buildUserPrompt(document, active),
                refinementSchema(),
                properties.getModels().getRefinement()));

        Map<String, ExtractedRecord> byRecordId = active.stream()
                .collect(Collectors.toMap(ExtractedRecord::recordId, Function.identity(), (a, b) -> a));
        Map<String, Map<String, JsonNode>> changes = collectChanges(response.data(), byRecordId);

        Integer updated = context.commit(() -> {
            Integer count = transactionTemplate.execute(status -> changes.entrySet().stream()
                    .mapToInt(e -> recordRepository.updateUnprotected(document.id(), e.getKey(), e.getValue()))
                    .sum());
            documentRepository.saveRefinementInfo(document.id(), response.modelUsed(), response.attemptLog());
            return count;
        });

        return new StageReport(response.modelUsed(), response.attemptLog(),
                String.format("%d of %d records updated", updated != null ? updated : 0, active.size()));
    }

    /**
     * Field changes per matched record id. Protected rows are skipped here as well as
     * in the update statement.
     */
    Map<String, Map<String, JsonNode>> collectChanges(JsonNode data, Map<String, ExtractedRecord> byRecordId) {
        JsonNode array = data != null ? data.get("records") : null;
        Map<String, Map<String, JsonNode>> changes = new LinkedHashMap<>();
        if (array == null || !array.isArray()) {
            log.warn("Refinement response carried no 'records' array, nothing to update");
            return changes;
        }

        for (JsonNode row : array) {
            String recordId = row.path(RECORD_ID).asText(null);
            ExtractedRecord current = recordId != null ? byRecordId.get(recordId) : null;
            if (current == null) {
                log.warn("Dropping refined row with unknown record_id '{}'", recordId);
                continue;
            }
            if (current.isProtected()) {
                log.debug("Skipping {}: edited or deleted by a reviewer", recordId);
                continue;
            }

            Map<String, JsonNode> fieldChanges = new LinkedHashMap<>();
            for (SchemaField field : schema.fields().values()) {
                JsonNode refined = field.normalize(row.get(field.name()));
                if (SchemaField.isEmpty(refined)) continue;
                if (!Objects.equals(field.toColumnValue(refined), field.toColumnValue(current.field(field.name())))) {
                    fieldChanges.put(field.name(), refined);
                }
            }
            if (!fieldChanges.isEmpty()) {
                changes.merge(recordId, fieldChanges, (a, b) -> {
                    a.putAll(b);
                    return a;
                });
            }
        }
        return changes;
    }

    /**
     * The record schema with a required {@code record_id} property added to each row.
     */
    String refinementSchema() throws JsonProcessingException {
        ObjectNode root = (ObjectNode) objectMapper.readTree(schema.json());
        ObjectNode items = (ObjectNode) root.path("properties").path("records").path("items");
        ObjectNode idProperty = objectMapper.createObjectNode();
        idProperty.put("type", "string");
        idProperty.put("description", "Identifier of the existing record being refined; copy it verbatim");
        ObjectNode properties = (ObjectNode) items.get("properties");
        ObjectNode reordered = objectMapper.createObjectNode();
        reordered.set(RECORD_ID, idProperty);
        reordered.setAll(properties);
        items.set("properties", reordered);

        ArrayNode required = items.has("required") && items.get("required").isArray()
                ? (ArrayNode) items.get("required")
                : items.putArray("required");
        boolean present = false;
        for (JsonNode name : required) {
            present |= RECORD_ID.equals(name.asText());
        }
        if (!present) required.insert(0, RECORD_ID);
        return objectMapper.writeValueAsString(root);
    }

    String buildUserPrompt(Document document, List<ExtractedRecord> active) throws JsonProcessingException {
        ArrayNode rows = objectMapper.createArrayNode();
        for (ExtractedRecord record : active) {
            ObjectNode row = rows.addObject();
            row.put(RECORD_ID, record.recordId());
            for (String name : schema.fieldNames()) {
                row.set(name, record.field(name));
            }
        }
        String audit = document.hasOcrAudit()
                ? "\n\n# OCR quality audit\n\n" + document.ocrAudit()
                : "\n\n# OCR quality audit\n\nNo OCR audit available.";
        return "# Records to refine\n\n"
                + objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(rows)
                + audit
                + "\n\n# Document\n\n"
                + document.documentContent();
    }
}
