package com.eainde.literature.stage;

import com.eainde.literature.config.ConfigFileResolver;
import com.eainde.literature.config.PipelineProperties;
import com.eainde.literature.llm.StructuredOutputClient;
import com.eainde.literature.llm.StructuredRequest;
import com.eainde.literature.llm.StructuredResponse;
import com.eainde.literature.model.Document;
import com.eainde.literature.model.ExtractedRecord;
import com.eainde.literature.prompt.PromptRepository;
import com.eainde.literature.support.TestDatabase;
import com.eainde.literature.support.TestProperties;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static com.eainde.literature.support.Json.fields;
import static com.eainde.literature.support.Json.parse;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RefinementStageTest {

    @TempDir
    Path tempDir;

    @Mock
    private StructuredOutputClient client;

    private TestDatabase db;
    private RefinementStage stage;
    private long documentId;

    @BeforeEach
    void setUp() {
        db = new TestDatabase(tempDir);
        PipelineProperties properties = TestProperties.create(tempDir);
        stage = new RefinementStage(client, new PromptRepository(new ConfigFileResolver(properties)), db.schema,
                db.records, db.documents, properties, db.objectMapper, db.transactionTemplate);

        documentId = db.insertDocument("a.md", "/a.md").id();
        db.documents.saveOcrResult(documentId, "Full text\n\n--- PAGE 1 ---\n", null, "text");
    }

    private ExtractedRecord insert(String recordId, Object... keyValues) {
        return db.records.insert(ExtractedRecord.builder()
                .documentId(documentId)
                .recordId(recordId)
                .fields(fields(keyValues))
                .extractionTimestamp(Instant.parse("2025-01-01T00:00:00Z"))
                .build());
    }

    private Document document() {
        return db.documents.findById(documentId).orElseThrow();
    }

    private ExtractedRecord reload(String recordId) {
        return db.records.findByDocument(documentId).stream()
                .filter(r -> r.recordId().equals(recordId))
                .findFirst().orElseThrow();
    }

    @Test
    void run_shouldUpdateChangedFieldsByRecordId() throws Exception {
        // Arrange
        insert("Smith1998-o1", "species", "Myotis lucifugus", "host", "Culicidae", "count", 3);
        when(client.call(any())).thenReturn(new StructuredResponse(parse("""
                {"records": [
                  {"record_id": "Smith1998-o1", "species": "Myotis lucifugus", "host": "Culicidae",
                   "location": "Ontario", "count": 3, "notes": null}
                ]}
                """), "refine-model", List.of()));

        // Act
        StageReport report = stage.run(document(), StageContext.open());

        // Assert
        ExtractedRecord refined = reload("Smith1998-o1");
        assertThat(refined.field("location").asText()).isEqualTo("Ontario");
        assertThat(refined.field("count").asLong()).isEqualTo(3L);
        assertThat(refined.humanEdited()).isFalse();
        assertThat(report.summary()).isEqualTo("1 of 1 records updated");
        assertThat(document().refinementLlmModel()).isEqualTo("refine-model");
    }

    @Test
    void run_shouldNeverInsertOrClear() throws Exception {
        // Arrange
        insert("A-o1", "species", "Myotis", "host", "Culicidae", "location", "Ontario");
        when(client.call(any())).thenReturn(new StructuredResponse(parse("""
                {"records": [
                  {"record_id": "A-o1", "species": "Myotis", "host": "Culicidae", "location": null},
                  {"record_id": "A-o9", "species": "Invented", "host": "Row"},
                  {"species": "No id", "host": "Row"}
                ]}
                """), "refine-model", List.of()));

        // Act
        stage.run(document(), StageContext.open());

        // Assert
        List<ExtractedRecord> stored = db.records.findByDocument(documentId);
        assertThat(stored).hasSize(1);
        assertThat(stored.get(0).field("location").asText()).isEqualTo("Ontario");
    }

    @Test
    void run_shouldLeaveReviewerEditedRowsUntouched() throws Exception {
        // Arrange
        ExtractedRecord edited = insert("A-o1", "species", "Myotis", "host", "Culicidae");
        insert("A-o2", "species", "Eptesicus", "host", "Moth");
        db.records.applyReviewChanges(edited.id(), null, fields("host", "Aedes"));
        when(client.call(any())).thenReturn(new StructuredResponse(parse("""
                {"records": [
                  {"record_id": "A-o1", "species": "Myotis", "host": "Culicidae", "location": "X"},
                  {"record_id": "A-o2", "species": "Eptesicus", "host": "Moth", "location": "Y"}
                ]}
                """), "refine-model", List.of()));

        // Act
        StageReport report = stage.run(document(), StageContext.open());

        // Assert
        assertThat(reload("A-o1").field("host").asText()).isEqualTo("Aedes");
        assertThat(reload("A-o1").fields()).doesNotContainKey("location");
        assertThat(reload("A-o2").field("location").asText()).isEqualTo("Y");
        assertThat(report.summary()).isEqualTo("1 of 2 records updated");
    }

    @Test
    void run_shouldSkipCall_whenNoActiveRecords() throws Exception {
        ExtractedRecord deleted = insert("A-o1", "species", "Myotis", "host", "Culicidae");
        db.records.softDelete(deleted.id());

        StageReport report = stage.run(document(), StageContext.open());

        assertThat(report.summary()).isEqualTo("no records to refine");
        verifyNoInteractions(client);
    }

    @Test
    void run_shouldSendActiveRecordsWithIdsAndRequireRecordIdInSchema() throws Exception {
        // Arrange
        insert("A-o1", "species", "Myotis", "host", "Culicidae");
        when(client.call(any())).thenReturn(new StructuredResponse(parse("{\"records\": []}"), "refine-model", List.of()));

        // Act
        stage.run(document(), StageContext.open());

        // Assert
        ArgumentCaptor<StructuredRequest> captor = ArgumentCaptor.forClass(StructuredRequest.class);
        verify(client).call(captor.capture());
        StructuredRequest request = captor.getValue();
        assertThat(request.userPrompt()).startsWith("# Records to refine").contains("\"record_id\" : \"A-o1\"")
                .contains("# Document\n\nFull text");
        JsonNode items = parse(request.schemaJson()).path("properties").path("records").path("items");
        assertThat(items.path("properties").fieldNames().next()).isEqualTo("record_id");
        assertThat(items.path("required").get(0).asText()).isEqualTo("record_id");
        assertThat(request.models()).containsExactly("refine-model");
    }

    @Test
    void buildUserPrompt_shouldIncludeStoredOcrAudit() throws Exception {
        // Arrange
        ExtractedRecord stored = insert("A-o1", "species", "Myotis", "host", "Culicidae");
        db.documents.saveOcrAudit(documentId, "{\"overall_quality\":\"poor\",\"issues\":[]}");

        // Act
        String prompt = stage.buildUserPrompt(document(), List.of(stored));

        // Assert
        assertThat(prompt).contains("# OCR quality audit\n\n{\"overall_quality\":\"poor\"")
                .doesNotContain("No OCR audit available");
        assertThat(prompt.indexOf("# OCR quality audit")).isLessThan(prompt.indexOf("# Document"));
    }

    @Test
    void buildUserPrompt_shouldSayWhenNoOcrAuditExists() throws Exception {
        ExtractedRecord stored = insert("A-o1", "species", "Myotis", "host", "Culicidae");

        assertThat(stage.buildUserPrompt(document(), List.of(stored)))
                .contains("# OCR quality audit\n\nNo OCR audit available.");
    }

    @Test
    void collectChanges_shouldIgnoreEqualValuesAcrossNumericRepresentations() {
        ExtractedRecord stored = insert("A-o1", "species", "Myotis", "host", "Culicidae", "count", 5);

        Map<String, Map<String, JsonNode>> changes = stage.collectChanges(
                parse("{\"records\": [{\"record_id\": \"A-o1\", \"count\": \"5\", \"species\": \"Myotis\"}]}"),
                Map.of("A-o1", reload(stored.recordId())));

        assertThat(changes).isEmpty();
    }
}
