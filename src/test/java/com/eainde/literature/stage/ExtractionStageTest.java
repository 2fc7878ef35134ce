package com.eainde.literature.stage;

import com.eainde.literature.config.ConfigFileResolver;
import com.eainde.literature.config.PipelineProperties;
import com.eainde.literature.dedup.DeduplicationEngine;
import com.eainde.literature.dedup.FieldwiseDuplicateDetector;
import com.eainde.literature.dedup.NgramJaccardSimilarity;
import com.eainde.literature.dedup.SimilarityMethod;
import com.eainde.literature.llm.StructuredOutputClient;
import com.eainde.literature.llm.StructuredRequest;
import com.eainde.literature.llm.StructuredResponse;
import com.eainde.literature.model.Document;
import com.eainde.literature.model.ExtractedRecord;
import com.eainde.literature.model.PublicationMetadata;
import com.eainde.literature.prompt.PromptRepository;
import com.eainde.literature.support.TestDatabase;
import com.eainde.literature.support.TestProperties;
import com.eainde.literature.util.RecordIdGenerator;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static com.eainde.literature.support.Json.parse;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ExtractionStageTest {

    private static final String TWO_RECORDS = """
            {"records": [
              {"species": "Myotis lucifugus", "host": "Culicidae", "location": "Ontario", "count": "12"},
              {"species": "Eptesicus fuscus", "host": "Coleoptera", "sentences": "Big brown bats ate beetles."}
            ]}
            """;

    @TempDir
    Path tempDir;

    @Mock
    private StructuredOutputClient client;

    private TestDatabase db;
    private ExtractionStage stage;
    private long documentId;

    @BeforeEach
    void setUp() {
        db = new TestDatabase(tempDir);
        PipelineProperties properties = TestProperties.create(tempDir);
        Clock clock = Clock.fixed(Instant.parse("2025-06-01T12:00:00Z"), ZoneOffset.UTC);
        DeduplicationEngine engine = new DeduplicationEngine(Map.of(
                SimilarityMethod.JACCARD, new FieldwiseDuplicateDetector(new NgramJaccardSimilarity())));
        stage = new ExtractionStage(client, new PromptRepository(new ConfigFileResolver(properties)), db.schema,
                db.records, db.documents, engine, new RecordIdGenerator(clock), properties,
                db.objectMapper, db.transactionTemplate, clock);

        documentId = db.insertDocument("smith1998.md", "/smith1998.md").id();
        db.documents.saveOcrResult(documentId, "Bats and their prey.\n\n--- PAGE 1 ---\n", null, "text");
        db.documents.saveMetadata(documentId, PublicationMetadata.builder()
                .firstAuthorLastname("Smith").publicationYear(1998).title("Bat diets").build(), "meta-model", null);
    }

    private Document document() {
        return db.documents.findById(documentId).orElseThrow();
    }

    private void respond(String json) {
        when(client.call(any())).thenReturn(new StructuredResponse(parse(json), "extract-model", List.of()));
    }

    // =========================================================================
    //  Insertion
    // =========================================================================

    @Nested
    @DisplayName("insertion")
    class Insertion {

        @Test
        void run_shouldInsertRecordsWithSequentialIds() throws Exception {
            // Arrange
            respond(TWO_RECORDS);

            // Act
            StageReport report = stage.run(document(), StageContext.open());

            // Assert
            List<ExtractedRecord> stored = db.records.findByDocument(documentId);
            assertThat(stored).extracting(ExtractedRecord::recordId).containsExactly("Smith1998-o1", "Smith1998-o2");
            assertThat(stored.get(0).field("count").asLong()).isEqualTo(12L);
            assertThat(stored.get(1).field("sentences").get(0).asText()).isEqualTo("Big brown bats ate beetles.");
            assertThat(stored.get(0).llmModel()).isEqualTo("extract-model");
            assertThat(stored.get(0).promptHash()).hasSize(32);
            assertThat(document().recordsExtracted()).isEqualTo(2);
            assertThat(document().extractionLlmModel()).isEqualTo("extract-model");
            assertThat(report.summary()).isEqualTo("2 extracted, 0 duplicates, 2 inserted, 2 active");
        }

        @Test
        void run_shouldDropRowsMissingRequiredFields() throws Exception {
            respond("""
                    {"records": [
                      {"species": "Myotis lucifugus", "host": "  "},
                      "not an object",
                      {"species": "Lasiurus borealis", "host": "Moth", "unknown": "dropped"}
                    ]}
                    """);

            stage.run(document(), StageContext.open());

            List<ExtractedRecord> stored = db.records.findByDocument(documentId);
            assertThat(stored).hasSize(1);
            assertThat(stored.get(0).fields()).containsOnlyKeys("species", "host");
        }

        @Test
        void run_shouldTreatMissingRecordsArrayAsZeroRecords() throws Exception {
            respond("{}");

            StageReport report = stage.run(document(), StageContext.open());

            assertThat(db.records.findByDocument(documentId)).isEmpty();
            assertThat(report.summary()).startsWith("0 extracted");
        }

        @Test
        void run_shouldFail_whenRecordsIsNotAnArray() {
            respond("{\"records\": \"none\"}");

            assertThatThrownBy(() -> stage.run(document(), StageContext.open())).isInstanceOf(IllegalStateException.class);
        }
    }

    // =========================================================================
    //  Re-runs
    // =========================================================================

    @Nested
    @DisplayName("re-runs")
    class Reruns {

        @Test
        void run_shouldNotInsertDuplicates_whenSameRecordsReturnedAgain() throws Exception {
            respond(TWO_RECORDS);
            stage.run(document(), StageContext.open());

            StageReport report = stage.run(document(), StageContext.open());

            assertThat(db.records.findByDocument(documentId)).hasSize(2);
            assertThat(report.summary()).isEqualTo("2 extracted, 2 duplicates, 0 inserted, 2 active");
        }

        @Test
        void run_shouldContinueSequenceAfterHighestStoredId() throws Exception {
            // Arrange
            respond(TWO_RECORDS);
            stage.run(document(), StageContext.open());
            when(client.call(any())).thenReturn(new StructuredResponse(parse("""
                    {"records": [{"species": "Lasiurus borealis", "host": "Lepidoptera"}]}
                    """), "extract-model", List.of()));

            // Act
            stage.run(document(), StageContext.open());

            // Assert
            assertThat(db.records.findByDocument(documentId)).extracting(ExtractedRecord::recordId)
                    .containsExactly("Smith1998-o1", "Smith1998-o2", "Smith1998-o3");
        }

        @Test
        void run_shouldNotReextractSoftDeletedRecords() throws Exception {
            respond(TWO_RECORDS);
            stage.run(document(), StageContext.open());
            db.records.softDelete(db.records.findByDocument(documentId).get(0).id());

            stage.run(document(), StageContext.open());

            assertThat(db.records.findByDocument(documentId)).hasSize(2);
            assertThat(db.records.countActive(documentId)).isEqualTo(1);
            assertThat(document().recordsExtracted()).isEqualTo(1);
        }

        @Test
        void run_shouldReadmitRecordsRemovedFromStorage() throws Exception {
            // Arrange
            respond(TWO_RECORDS);
            stage.run(document(), StageContext.open());
            db.jdbcTemplate.update("DELETE FROM records WHERE record_id = ?", "Smith1998-o1");

            // Act
            stage.run(document(), StageContext.open());

            // Assert
            List<ExtractedRecord> stored = db.records.findByDocument(documentId);
            assertThat(stored).hasSize(2);
            assertThat(stored).extracting(r -> r.field("species").asText())
                    .containsExactlyInAnyOrder("Myotis lucifugus", "Eptesicus fuscus");
            assertThat(stored).extracting(ExtractedRecord::recordId).contains("Smith1998-o3");
        }
    }

    // =========================================================================
    //  Prompt
    // =========================================================================

    @Test
    void run_shouldListActiveRecordsInPrompt() throws Exception {
        // Arrange
        respond(TWO_RECORDS);
        stage.run(document(), StageContext.open());
        db.records.softDelete(db.records.findByDocument(documentId).get(1).id());

        // Act
        stage.run(document(), StageContext.open());

        // Assert
        ArgumentCaptor<StructuredRequest> captor = ArgumentCaptor.forClass(StructuredRequest.class);
        verify(client, times(2)).call(captor.capture());
        String first = captor.getAllValues().get(0).userPrompt();
        String second = captor.getAllValues().get(1).userPrompt();
        assertThat(first).contains("# Publication").contains("\"first_author_lastname\" : \"Smith\"")
                .contains("# Existing records\n\nNone.").contains("# Document\n\nBats and their prey.");
        assertThat(second).contains("Smith1998-o1").doesNotContain("Smith1998-o2").doesNotContain("\"notes\"");
        assertThat(captor.getAllValues().get(0).schemaJson()).isEqualTo(db.schema.json());
    }

    @Test
    void buildUserPrompt_shouldPlaceOcrAuditBeforeDocument_whenPresent() throws Exception {
        assertThat(stage.buildUserPrompt(document(), List.of())).doesNotContain("# OCR quality audit");

        db.documents.saveOcrAudit(documentId, "{\"overall_quality\":\"fair\",\"issues\":[]}");
        String prompt = stage.buildUserPrompt(document(), List.of());

        assertThat(prompt).contains("# OCR quality audit\n\n{\"overall_quality\":\"fair\"");
        assertThat(prompt.indexOf("# OCR quality audit")).isLessThan(prompt.indexOf("# Document"));
    }

    @Test
    void parseRecords_shouldCoerceScalarToArrayForArrayFields() {
        List<Map<String, JsonNode>> rows = stage.parseRecords(parse(
                "{\"records\": [{\"species\": \"a\", \"host\": \"b\", \"sentences\": \"one\"}]}"));

        assertThat(rows.get(0).get("sentences").isArray()).isTrue();
    }
}
