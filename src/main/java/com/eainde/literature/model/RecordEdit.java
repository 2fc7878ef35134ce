package com.eainde.literature.model;

import java.time.Instant;

/**
 * One column-level change made during human review. Append-only.
 */
public record RecordEdit(
        Long id,
        long documentId,
        long recordId,
        String columnName,
        String originalValue,
        String newValue,
        Instant editedAt
) {

    public static RecordEdit of(long documentId, long recordId, String columnName,
                                String originalValue, String newValue, Instant editedAt) {
        return new RecordEdit(null, documentId, recordId, columnName, originalValue, newValue, editedAt);
    }
}
