package com.record.linkage.similarity;

import java.util.Locale;

/**
 * Interface for string similarity algorithms.
 * All implementations return a score between 0 (no similarity) and 100 (identical),
 * are symmetric in their arguments, and return 0 when either string is null or empty.
 */
public interface SimilarityAlgorithm {

    /**
     * Computes the similarity between two strings.
     *
     * @param s1 first string
     * @param s2 second string
     * @return similarity score between 0 and 100
     */
    double compute(String s1, String s2);

    /**
     * Returns the configuration name of this algorithm.
     */
    String getName();

    /**
     * Looks up an algorithm by its configuration name: {@code ratio}, {@code token-sort}
     * or {@code levenshtein}.
     */
    static SimilarityAlgorithm forName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Similarity algorithm name is required");
        }
        switch (name.trim().toLowerCase(Locale.ROOT)) {
            case IndelRatio.NAME:
                return new IndelRatio();
            case TokenSortRatio.NAME:
                return new TokenSortRatio();
            case LevenshteinRatio.NAME:
                return new LevenshteinRatio();
            default:
                throw new IllegalArgumentException("Unknown similarity algorithm: " + name);
        }
    }
}
