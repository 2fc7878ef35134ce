package com.eainde.literature.dedup;

import java.util.Collection;

/**
 * Similarity in [0, 1] between two field values.
 */
public interface FieldSimilarity {

    double similarity(String a, String b);

    /**
     * Called once per batch with every value about to be compared, so
     * implementations backed by an external service can batch their calls.
     */
    default void prepare(Collection<String> values) {
    }
}
