package com.record.linkage.core.model;

import java.util.Locale;

/**
 * Result of comparing two records. All scores are in [0, 100].
 *
 * @param nameScore    fuzzy similarity of the standardized company names
 * @param addressScore fuzzy similarity of the standardized addresses
 * @param overallScore weighted combination of the two
 */
public record SimilarityPair(
        double nameScore,
        double addressScore,
        double overallScore
) {
    public SimilarityPair {
        validate(nameScore, "nameScore");
        validate(addressScore, "addressScore");
        validate(overallScore, "overallScore");
    }

    public static SimilarityPair none() {
        return new SimilarityPair(0.0, 0.0, 0.0);
    }

    public boolean meets(double threshold) {
        return overallScore >= threshold;
    }

    private static void validate(double score, String name) {
        if (Double.isNaN(score) || score < 0.0 || score > 100.0) {
            throw new IllegalArgumentException(name + " must be between 0 and 100, got " + score);
        }
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "SimilarityPair{name=%.2f, address=%.2f, overall=%.2f}",
                nameScore, addressScore, overallScore);
    }
}
