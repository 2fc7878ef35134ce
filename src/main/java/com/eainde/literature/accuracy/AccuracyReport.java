package com.eainde.literature.accuracy;

import lombok.Builder;

import java.util.Map;
import java.util.OptionalDouble;

/**
 * Extraction quality over human-reviewed documents.
 *
 * <p>Ratios are {@link OptionalDouble#empty()} when their denominator is zero.</p>
 */
@Builder
public record AccuracyReport(
        int verifiedDocuments,
        int numFields,

        // detection layer
        long modelExtracted,
        long humanAdded,
        long deleted,
        long recordsFound,
        long recordsMissed,
        long recordsHallucinated,
        long recordsWithEdits,
        OptionalDouble detectionPrecision,
        OptionalDouble detectionRecall,
        OptionalDouble perfectRecordRate,

        // field layer
        long totalFields,
        long correctFields,
        long trueFields,
        OptionalDouble fieldPrecision,
        OptionalDouble fieldRecall,
        OptionalDouble fieldF1,

        // edits
        long totalEdits,
        long majorEdits,
        long minorEdits,
        OptionalDouble majorEditRate,
        OptionalDouble avgEditsPerDocument,
        Map<String, Long> editsByColumn,
        Map<String, OptionalDouble> columnAccuracy
) {
}
