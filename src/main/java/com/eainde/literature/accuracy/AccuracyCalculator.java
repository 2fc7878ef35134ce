package com.eainde.literature.accuracy;

import com.eainde.literature.model.Document;
import com.eainde.literature.model.ExtractedRecord;
import com.eainde.literature.model.RecordEdit;
import com.eainde.literature.schema.RecordSchema;
import com.eainde.literature.schema.SchemaField;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Derives detection and field-level accuracy from the review audit trail.
 *
 * <p>Only documents with a review timestamp count. A model row is one not added by
 * a reviewer. Edits are distinct (record, column) pairs on model rows that were
 * not deleted, restricted to schema columns; an edit to a unique or required field
 * is major.</p>
 */
public final class AccuracyCalculator {

    private AccuracyCalculator() {
    }

    public static AccuracyReport calculate(List<Document> documents,
                                           List<ExtractedRecord> records,
                                           List<RecordEdit> edits,
                                           RecordSchema schema) {
        Set<Long> reviewedIds = documents.stream()
                .filter(Document::isReviewed)
                .map(Document::id)
                .collect(Collectors.toSet());

        List<ExtractedRecord> reviewedRecords = records.stream()
                .filter(r -> reviewedIds.contains(r.documentId()))
                .toList();

        long modelExtracted = reviewedRecords.stream().filter(r -> !r.addedByUser()).count();
        long humanAdded = reviewedRecords.stream().filter(r -> r.addedByUser() && !r.deletedByUser()).count();
        long deleted = reviewedRecords.stream().filter(r -> !r.addedByUser() && r.deletedByUser()).count();

        // ── Edits: distinct (record, column) on surviving model rows ──
        Map<Long, ExtractedRecord> survivingModelRows = reviewedRecords.stream()
                .filter(r -> !r.addedByUser() && !r.deletedByUser())
                .collect(Collectors.toMap(ExtractedRecord::id, Function.identity()));
        Set<EditKey> editKeys = edits.stream()
                .filter(e -> reviewedIds.contains(e.documentId()))
                .filter(e -> survivingModelRows.containsKey(e.recordId()))
                .filter(e -> schema.hasField(e.columnName()))
                .map(e -> new EditKey(e.recordId(), e.columnName()))
                .collect(Collectors.toSet());

        long totalEdits = editKeys.size();
        long majorEdits = editKeys.stream().filter(k -> schema.field(k.column()).isMajor()).count();
        long recordsWithEdits = editKeys.stream().map(EditKey::recordId).distinct().count();

        Map<String, Long> editsByColumn = new LinkedHashMap<>();
        Map<String, OptionalDouble> columnAccuracy = new LinkedHashMap<>();
        for (SchemaField field : schema.fields().values()) {
            long columnEdits = editKeys.stream().filter(k -> k.column().equals(field.name())).count();
            editsByColumn.put(field.name(), columnEdits);
            OptionalDouble rate = ratio(columnEdits, modelExtracted);
            columnAccuracy.put(field.name(), rate.isPresent() ? OptionalDouble.of(1.0 - rate.getAsDouble()) : rate);
        }

        // ── Detection layer ──
        int numFields = schema.size();
        long recordsFound = modelExtracted - deleted;
        OptionalDouble detectionPrecision = ratio(recordsFound, modelExtracted);
        OptionalDouble detectionRecall = ratio(recordsFound, recordsFound + humanAdded);
        OptionalDouble perfectRecordRate = ratio(recordsFound - recordsWithEdits, recordsFound);

        // ── Field layer ──
        long totalFields = modelExtracted * numFields;
        long correctFields = totalFields - deleted * numFields - totalEdits;
        long trueFields = (recordsFound + humanAdded) * numFields;
        OptionalDouble fieldPrecision = ratio(correctFields, totalFields);
        OptionalDouble fieldRecall = ratio(correctFields, trueFields);

        return AccuracyReport.builder()
                .verifiedDocuments(reviewedIds.size())
                .numFields(numFields)
                .modelExtracted(modelExtracted)
                .humanAdded(humanAdded)
                .deleted(deleted)
                .recordsFound(recordsFound)
                .recordsMissed(humanAdded)
                .recordsHallucinated(deleted)
                .recordsWithEdits(recordsWithEdits)
                .detectionPrecision(detectionPrecision)
                .detectionRecall(detectionRecall)
                .perfectRecordRate(perfectRecordRate)
                .totalFields(totalFields)
                .correctFields(correctFields)
                .trueFields(trueFields)
                .fieldPrecision(fieldPrecision)
                .fieldRecall(fieldRecall)
                .fieldF1(harmonicMean(fieldPrecision, fieldRecall))
                .totalEdits(totalEdits)
                .majorEdits(majorEdits)
                .minorEdits(totalEdits - majorEdits)
                .majorEditRate(ratio(majorEdits, totalEdits))
                .avgEditsPerDocument(ratio(totalEdits, reviewedIds.size()))
                .editsByColumn(Collections.unmodifiableMap(editsByColumn))
                .columnAccuracy(Collections.unmodifiableMap(columnAccuracy))
                .build();
    }

    static OptionalDouble ratio(long numerator, long denominator) {
        return denominator == 0 ? OptionalDouble.empty() : OptionalDouble.of((double) numerator / denominator);
    }

    static OptionalDouble harmonicMean(OptionalDouble a, OptionalDouble b) {
        if (a.isEmpty() || b.isEmpty()) return OptionalDouble.empty();
        double sum = a.getAsDouble() + b.getAsDouble();
        return sum == 0.0 ? OptionalDouble.empty() : OptionalDouble.of(2 * a.getAsDouble() * b.getAsDouble() / sum);
    }

    private record EditKey(long recordId, String column) {
    }
}
