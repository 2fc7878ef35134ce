package com.eainde.literature.dedup;

import java.util.HashSet;
import java.util.Set;

/**
 * Jaccard similarity of character n-gram sets over canonicalised text.
 *
 * <p>Edge cases: null → 0; both empty → 1; one empty → 0; equal after
 * canonicalisation → 1; either shorter than n → 0.</p>
 */
public class NgramJaccardSimilarity implements FieldSimilarity {

    public static final int DEFAULT_N = 3;

    private final int n;

    public NgramJaccardSimilarity() {
        this(DEFAULT_N);
    }

    public NgramJaccardSimilarity(int n) {
        if (n < 1) {
            throw new IllegalArgumentException("n-gram size must be positive, got " + n);
        }
        this.n = n;
    }

    @Override
    public double similarity(String a, String b) {
        if (a == null || b == null) return 0.0;

        String left = TextCanonicalizer.canonicalize(a);
        String right = TextCanonicalizer.canonicalize(b);
        if (left.isEmpty() && right.isEmpty()) return 1.0;
        if (left.isEmpty() || right.isEmpty()) return 0.0;
        if (left.equals(right)) return 1.0;

        Set<String> leftGrams = ngrams(left);
        Set<String> rightGrams = ngrams(right);
        if (leftGrams.isEmpty() || rightGrams.isEmpty()) return 0.0;

        Set<String> union = new HashSet<>(leftGrams);
        union.addAll(rightGrams);
        leftGrams.retainAll(rightGrams);
        return (double) leftGrams.size() / union.size();
    }

    Set<String> ngrams(String text) {
        Set<String> grams = new HashSet<>();
        for (int i = 0; i + n <= text.length(); i++) {
            grams.add(text.substring(i, i + n));
        }
        return grams;
    }
}
