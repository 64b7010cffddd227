package com.record.linkage.similarity;

/**
 * Fuzzy ratio based on the InDel distance (insertions and deletions only):
 * {@code 100 * (1 - indel / (|s1| + |s2|))}.
 */
public class IndelRatio extends EditRatio {

    static final String NAME = "ratio";

    @Override
    protected double ratio(String s1, String s2) {
        int indel = editDistance(s1, s2, INDEL_SUBSTITUTION);
        return 100.0 * (1.0 - (double) indel / (s1.length() + s2.length()));
    }

    @Override
    public String getName() {
        return NAME;
    }
}
