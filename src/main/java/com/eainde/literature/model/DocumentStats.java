package com.eainde.literature.model;

public record DocumentStats(long documents, long records, long reviewedDocuments) {
}
