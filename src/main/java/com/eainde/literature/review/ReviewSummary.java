package com.eainde.literature.review;

/**
 * @param updatedRecords stored rows with at least one changed column
 * @param columnEdits    audit rows written
 * @param addedRecords   rows inserted by the reviewer
 * @param deletedRecords rows soft-deleted by this save
 */
public record ReviewSummary(int updatedRecords, int columnEdits, int addedRecords, int deletedRecords) {
}
