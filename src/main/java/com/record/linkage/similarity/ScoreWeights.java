package com.record.linkage.similarity;

/**
 * Weights combining the name and address scores into the overall score:
 * {@code (nameWeight * name + addressWeight * address) / (nameWeight + addressWeight)}.
 */
public record ScoreWeights(
        double nameWeight,
        double addressWeight
) {
    public ScoreWeights {
        if (!Double.isFinite(nameWeight) || !Double.isFinite(addressWeight)) {
            throw new IllegalArgumentException("Weights must be finite");
        }
        if (nameWeight < 0 || addressWeight < 0) {
            throw new IllegalArgumentException("Weights must be non-negative");
        }
        if (nameWeight + addressWeight <= 0) {
            throw new IllegalArgumentException("At least one weight must be positive");
        }
    }

    /**
     * Name counts 1.4 times as much as the address.
     */
    public static ScoreWeights defaultWeights() {
        return new ScoreWeights(1.4, 1.0);
    }

    public static ScoreWeights equalWeights() {
        return new ScoreWeights(1.0, 1.0);
    }

    public double combine(double nameScore, double addressScore) {
        double combined = (nameWeight * nameScore + addressWeight * addressScore)
                / (nameWeight + addressWeight);
        // Floating point can land a hair outside [0, 100]
        return Math.max(0.0, Math.min(100.0, combined));
    }
}
