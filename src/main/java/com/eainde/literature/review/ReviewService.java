package com.eainde.literature.review;

import com.eainde.literature.model.Document;
import com.eainde.literature.model.ExtractedRecord;
import com.eainde.literature.model.PublicationMetadata;
import com.eainde.literature.model.RecordEdit;
import com.eainde.literature.schema.RecordSchema;
import com.eainde.literature.schema.SchemaField;
import com.eainde.literature.store.DocumentRepository;
import com.eainde.literature.store.RecordEditRepository;
import com.eainde.literature.store.RecordRepository;
import com.eainde.literature.util.RecordIdGenerator;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Saves a reviewer's version of a document's records.
 *
 * <p>Rows are matched by surrogate id. Changed columns are appended to the edit log
 * and flag the row as human-edited; stored rows missing from the saved set are
 * soft-deleted; rows without an id are inserted as reviewer-added. The document is
 * marked reviewed even when nothing changed. One transaction per save.</p>
 */
@Log4j2
@Service
public class ReviewService {

    static final String RECORD_ID_COLUMN = "record_id";

    private final DocumentRepository documentRepository;
    private final RecordRepository recordRepository;
    private final RecordEditRepository recordEditRepository;
    private final RecordSchema schema;
    private final RecordIdGenerator recordIdGenerator;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public ReviewService(DocumentRepository documentRepository,
                         RecordRepository recordRepository,
                         RecordEditRepository recordEditRepository,
                         RecordSchema schema,
                         RecordIdGenerator recordIdGenerator,
                         TransactionTemplate transactionTemplate,
                         Clock clock) {
        this.documentRepository = documentRepository;
        this.recordRepository = recordRepository;
        this.recordEditRepository = recordEditRepository;
        this.schema = schema;
        this.recordIdGenerator = recordIdGenerator;
        this.transactionTemplate = transactionTemplate;
        this.clock = clock;
    }

    public ReviewSummary saveReview(long documentId, List<ReviewedRecord> reviewed) {
        Document document = documentRepository.findById(documentId)
                .orElseThrow(() -> new IllegalArgumentException("Document " + documentId + " not found"));
        List<ExtractedRecord> storedRows = recordRepository.findByDocument(documentId);
        Map<Long, ExtractedRecord> stored = storedRows.stream()
                .collect(Collectors.toMap(ExtractedRecord::id, Function.identity()));

        for (ReviewedRecord row : reviewed) {
            if (!row.isNew() && !stored.containsKey(row.id())) {
                throw new IllegalArgumentException(
                        "Record " + row.id() + " does not belong to document " + documentId);
            }
        }

        ReviewSummary summary = transactionTemplate.execute(status -> apply(document, storedRows, stored, reviewed));
        log.info("Review saved for document {}: {}", documentId, summary);
        return summary;
    }

    private ReviewSummary apply(Document document,
                                List<ExtractedRecord> storedRows,
                                Map<Long, ExtractedRecord> stored,
                                List<ReviewedRecord> reviewed) {
        Instant now = clock.instant();
        int updated = 0;
        int edits = 0;
        int added = 0;
        int deleted = 0;
        int sequence = RecordIdGenerator.maxSequence(storedRows.stream().map(ExtractedRecord::recordId).toList());
        Set<Long> keptIds = new HashSet<>();

        for (ReviewedRecord row : reviewed) {
            if (row.isNew()) {
                String recordId = row.recordId();
                if (recordId == null || recordId.isBlank()) {
                    PublicationMetadata metadata = document.metadataOrEmpty();
                    recordId = recordIdGenerator.generate(
                            metadata.firstAuthorLastname(), metadata.publicationYear(), ++sequence);
                }
                recordRepository.insert(ExtractedRecord.builder()
                        .documentId(document.id())
                        .recordId(recordId)
                        .fields(row.fields())
                        .addedByUser(true)
                        .extractionTimestamp(now)
                        .build());
                added++;
                continue;
            }

            keptIds.add(row.id());
            ExtractedRecord current = stored.get(row.id());
            int changed = diffAndApply(current, row, now);
            if (changed > 0) {
                updated++;
                edits += changed;
            }
        }

        for (ExtractedRecord current : storedRows) {
            if (current.isActive() && !keptIds.contains(current.id())) {
                recordRepository.softDelete(current.id());
                deleted++;
            }
        }

        documentRepository.markReviewed(document.id(), now);
        return new ReviewSummary(updated, edits, added, deleted);
    }

    /**
     * @return number of changed columns
     */
    private int diffAndApply(ExtractedRecord current, ReviewedRecord row, Instant now) {
        Map<String, JsonNode> changedValues = new LinkedHashMap<>();
        int changes = 0;

        String newRecordId = null;
        if (row.recordId() != null && !row.recordId().isBlank() && !row.recordId().equals(current.recordId())) {
            newRecordId = row.recordId();
            recordEditRepository.append(RecordEdit.of(current.documentId(), current.id(),
                    RECORD_ID_COLUMN, current.recordId(), newRecordId, now));
            changes++;
        }

        for (SchemaField field : schema.fields().values()) {
            JsonNode newValue = row.fields().getOrDefault(field.name(), NullNode.getInstance());
            String before = columnText(field, current.field(field.name()));
            String after = columnText(field, newValue);
            if (!Objects.equals(before, after)) {
                changedValues.put(field.name(), newValue);
                recordEditRepository.append(RecordEdit.of(current.documentId(), current.id(),
                        field.name(), before, after, now));
                changes++;
            }
        }

        if (changes > 0) {
            recordRepository.applyReviewChanges(current.id(), newRecordId, changedValues);
        }
        return changes;
    }

    private static String columnText(SchemaField field, JsonNode value) {
        Object columnValue = field.toColumnValue(value);
        return columnValue != null ? columnValue.toString() : null;
    }
}
