package com.eainde.literature.dedup;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Cosine similarity of embeddings of canonicalised text.
 *
 * <p>Vectors are cached per distinct canonical value; {@link #prepare} embeds all
 * uncached values of a batch in chunks of {@code batchSize}.</p>
 */
public class EmbeddingCosineSimilarity implements FieldSimilarity {

    private static final Logger log = LoggerFactory.getLogger(EmbeddingCosineSimilarity.class);

    private static final int MAX_CACHE_ENTRIES = 10_000;

    private final EmbeddingModel embeddingModel;
    private final int batchSize;
    private final Map<String, float[]> cache = new ConcurrentHashMap<>();

    public EmbeddingCosineSimilarity(EmbeddingModel embeddingModel, int batchSize) {
        this.embeddingModel = embeddingModel;
        this.batchSize = batchSize;
    }

    @Override
    public void prepare(Collection<String> values) {
        if (cache.size() > MAX_CACHE_ENTRIES) {
            cache.clear();
        }
        Set<String> missing = new LinkedHashSet<>();
        for (String value : values) {
            String canonical = TextCanonicalizer.canonicalize(value);
            if (canonical != null && !canonical.isEmpty() && !cache.containsKey(canonical)) {
                missing.add(canonical);
            }
        }
        if (missing.isEmpty()) return;

        List<String> pending = List.copyOf(missing);
        log.debug("Embedding {} distinct values in batches of {}", pending.size(), batchSize);
        for (int i = 0; i < pending.size(); i += batchSize) {
            List<String> batch = pending.subList(i, Math.min(i + batchSize, pending.size()));
            List<Embedding> embeddings = embeddingModel.embedAll(batch.stream().map(TextSegment::from).toList()).content();
            if (embeddings.size() != batch.size()) {
                throw new IllegalStateException("Embedding provider returned " + embeddings.size()
                        + " vectors for " + batch.size() + " inputs");
            }
            for (int j = 0; j < batch.size(); j++) {
                cache.put(batch.get(j), embeddings.get(j).vector());
            }
        }
    }

    @Override
    public double similarity(String a, String b) {
        if (a == null || b == null) return 0.0;

        String left = TextCanonicalizer.canonicalize(a);
        String right = TextCanonicalizer.canonicalize(b);
        if (left.isEmpty() && right.isEmpty()) return 1.0;
        if (left.isEmpty() || right.isEmpty()) return 0.0;
        if (left.equals(right)) return 1.0;

        return cosine(vectorFor(left), vectorFor(right));
    }

    private float[] vectorFor(String canonical) {
        return cache.computeIfAbsent(canonical,
                text -> Objects.requireNonNull(embeddingModel.embed(text).content(), "embedding").vector());
    }

    /**
     * @throws IllegalArgumentException when dimensions differ
     * @return cosine similarity, 0 when either vector has zero norm
     */
    public static double cosine(float[] a, float[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException("Vectors must have the same dimension: " + a.length + " vs " + b.length);
        }
        double dot = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        for (int i = 0; i < a.length; i++) {
            dot += (double) a[i] * b[i];
            normA += (double) a[i] * a[i];
            normB += (double) b[i] * b[i];
        }
        if (normA == 0.0 || normB == 0.0) return 0.0;
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }
}
