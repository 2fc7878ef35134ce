package com.eainde.literature.review;

import com.eainde.literature.model.ExtractedRecord;
import com.eainde.literature.model.PublicationMetadata;
import com.eainde.literature.model.RecordEdit;
import com.eainde.literature.support.TestDatabase;
import com.eainde.literature.util.RecordIdGenerator;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.eainde.literature.support.Json.fields;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReviewServiceTest {

    private static final Instant NOW = Instant.parse("2025-05-05T10:00:00Z");

    @TempDir
    Path tempDir;

    private TestDatabase db;
    private ReviewService service;
    private long documentId;
    private ExtractedRecord first;
    private ExtractedRecord second;

    @BeforeEach
    void setUp() {
        db = new TestDatabase(tempDir);
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        service = new ReviewService(db.documents, db.records, db.edits, db.schema,
                new RecordIdGenerator(clock), db.transactionTemplate, clock);

        documentId = db.insertDocument("smith1998.md", "/smith1998.md").id();
        db.documents.saveMetadata(documentId, PublicationMetadata.builder()
                .firstAuthorLastname("Smith").publicationYear(1998).build(), "m", null);
        first = insert("Smith1998-o1", "species", "Myotis lucifugus", "host", "Culicidae", "count", 5);
        second = insert("Smith1998-o2", "species", "Eptesicus fuscus", "host", "Coleoptera");
    }

    private ExtractedRecord insert(String recordId, Object... keyValues) {
        return db.records.insert(ExtractedRecord.builder()
                .documentId(documentId)
                .recordId(recordId)
                .fields(fields(keyValues))
                .llmModel("extract-model")
                .extractionTimestamp(Instant.parse("2025-01-01T00:00:00Z"))
                .build());
    }

    private static ReviewedRecord unchanged(ExtractedRecord record) {
        return new ReviewedRecord(record.id(), record.recordId(), record.fields());
    }

    private static ReviewedRecord edited(ExtractedRecord record, String field, Object value) {
        Map<String, JsonNode> values = new LinkedHashMap<>(record.fields());
        values.putAll(fields(field, value));
        return new ReviewedRecord(record.id(), record.recordId(), values);
    }

    private ExtractedRecord reload(long id) {
        return db.records.findByDocument(documentId).stream().filter(r -> r.id() == id).findFirst().orElseThrow();
    }

    // =========================================================================
    //  Edits
    // =========================================================================

    @Nested
    @DisplayName("edits")
    class Edits {

        @Test
        void unchangedSave_shouldOnlyMarkDocumentReviewed() {
            // Act
            ReviewSummary summary = service.saveReview(documentId, List.of(unchanged(first), unchanged(second)));

            // Assert
            assertThat(summary).isEqualTo(new ReviewSummary(0, 0, 0, 0));
            assertThat(db.edits.findByDocument(documentId)).isEmpty();
            assertThat(db.documents.findById(documentId).orElseThrow().reviewedAt()).isEqualTo(NOW);
            assertThat(reload(first.id()).humanEdited()).isFalse();
        }

        @Test
        void changedColumn_shouldBeLoggedAndFlagRowAsHumanEdited() {
            // Act
            ReviewSummary summary = service.saveReview(documentId,
                    List.of(edited(first, "host", "Aedes vexans"), unchanged(second)));

            // Assert
            assertThat(summary).isEqualTo(new ReviewSummary(1, 1, 0, 0));
            List<RecordEdit> edits = db.edits.findByDocument(documentId);
            assertThat(edits).hasSize(1);
            RecordEdit edit = edits.get(0);
            assertThat(edit.recordId()).isEqualTo(first.id());
            assertThat(edit.columnName()).isEqualTo("host");
            assertThat(edit.originalValue()).isEqualTo("Culicidae");
            assertThat(edit.newValue()).isEqualTo("Aedes vexans");
            assertThat(edit.editedAt()).isEqualTo(NOW);

            ExtractedRecord stored = reload(first.id());
            assertThat(stored.field("host").asText()).isEqualTo("Aedes vexans");
            assertThat(stored.humanEdited()).isTrue();
        }

        @Test
        void sameValueInAnotherRepresentation_shouldNotCountAsEdit() {
            ReviewSummary summary = service.saveReview(documentId,
                    List.of(edited(first, "count", "5"), unchanged(second)));

            assertThat(summary.columnEdits()).isZero();
        }

        @Test
        void clearedField_shouldBeLoggedWithNullNewValue() {
            Map<String, JsonNode> values = new LinkedHashMap<>(first.fields());
            values.remove("count");

            service.saveReview(documentId, List.of(new ReviewedRecord(first.id(), null, values), unchanged(second)));

            RecordEdit edit = db.edits.findByDocument(documentId).get(0);
            assertThat(edit.columnName()).isEqualTo("count");
            assertThat(edit.originalValue()).isEqualTo("5");
            assertThat(edit.newValue()).isNull();
            assertThat(reload(first.id()).field("count").isNull()).isTrue();
        }

        @Test
        void renamedRecordId_shouldBeLoggedAsEdit() {
            service.saveReview(documentId,
                    List.of(new ReviewedRecord(first.id(), "Smith1998-o10", first.fields()), unchanged(second)));

            RecordEdit edit = db.edits.findByDocument(documentId).get(0);
            assertThat(edit.columnName()).isEqualTo("record_id");
            assertThat(edit.originalValue()).isEqualTo("Smith1998-o1");
            assertThat(reload(first.id()).recordId()).isEqualTo("Smith1998-o10");
        }
    }

    // =========================================================================
    //  Additions and deletions
    // =========================================================================

    @Nested
    @DisplayName("additions and deletions")
    class AddAndDelete {

        @Test
        void omittedRow_shouldBeSoftDeleted() {
            ReviewSummary summary = service.saveReview(documentId, List.of(unchanged(first)));

            assertThat(summary.deletedRecords()).isEqualTo(1);
            assertThat(reload(second.id()).deletedByUser()).isTrue();
            assertThat(db.records.countActive(documentId)).isEqualTo(1);
        }

        @Test
        void newRow_shouldBeInsertedAsReviewerAddedWithNextId() {
            // Arrange
            List<ReviewedRecord> rows = new ArrayList<>(List.of(unchanged(first), unchanged(second)));
            rows.add(new ReviewedRecord(null, null, fields("species", "Lasiurus borealis", "host", "Moth")));

            // Act
            ReviewSummary summary = service.saveReview(documentId, rows);

            // Assert
            assertThat(summary.addedRecords()).isEqualTo(1);
            ExtractedRecord added = db.records.findByDocument(documentId).get(2);
            assertThat(added.recordId()).isEqualTo("Smith1998-o3");
            assertThat(added.addedByUser()).isTrue();
            assertThat(added.llmModel()).isNull();
        }

        @Test
        void alreadyDeletedRow_shouldNotBeCountedAgain() {
            service.saveReview(documentId, List.of(unchanged(first)));

            ReviewSummary summary = service.saveReview(documentId, List.of(unchanged(first)));

            assertThat(summary.deletedRecords()).isZero();
        }
    }

    // =========================================================================
    //  Validation
    // =========================================================================

    @Test
    void saveReview_shouldRejectUnknownDocument() {
        assertThatThrownBy(() -> service.saveReview(999L, List.of()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("999");
    }

    @Test
    void saveReview_shouldRejectRowFromAnotherDocument_withoutWritingAnything() {
        long otherDocument = db.insertDocument("other.md", "/other.md").id();
        ExtractedRecord foreign = db.records.insert(ExtractedRecord.builder()
                .documentId(otherDocument).recordId("X-o1").fields(fields("species", "a", "host", "b")).build());

        assertThatThrownBy(() -> service.saveReview(documentId, List.of(unchanged(foreign))))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(db.records.countActive(documentId)).isEqualTo(2);
        assertThat(db.documents.findById(documentId).orElseThrow().isReviewed()).isFalse();
    }
}
