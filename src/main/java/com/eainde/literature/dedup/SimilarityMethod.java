package com.eainde.literature.dedup;

public enum SimilarityMethod {
    /** character n-gram Jaccard; no external calls */
    JACCARD,
    /** cosine similarity of provider embeddings */
    EMBEDDING,
    /** one LLM judgement per document */
    LLM
}
