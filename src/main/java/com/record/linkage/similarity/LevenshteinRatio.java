package com.record.linkage.similarity;

/**
 * Classic Levenshtein ratio: {@code 100 * (1 - distance / max(|s1|, |s2|))}.
 */
public class LevenshteinRatio extends EditRatio {

    static final String NAME = "levenshtein";

    @Override
    protected double ratio(String s1, String s2) {
        int distance = editDistance(s1, s2, LEVENSHTEIN_SUBSTITUTION);
        return 100.0 * (1.0 - (double) distance / Math.max(s1.length(), s2.length()));
    }

    @Override
    public String getName() {
        return NAME;
    }
}
