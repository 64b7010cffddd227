package com.record.linkage.similarity;

/**
 * Base for ratios derived from an edit distance between two strings.
 *
 * <p>Empty or missing input on either side scores 0 and identical input scores 100;
 * everything else is left to {@link #ratio(String, String)}.</p>
 */
abstract class EditRatio implements SimilarityAlgorithm {

    /**
     * Substitution cost that makes {@link #editDistance} the InDel distance,
     * a substitution being one deletion plus one insertion.
     */
    static final int INDEL_SUBSTITUTION = 2;
    static final int LEVENSHTEIN_SUBSTITUTION = 1;

    @Override
    public final double compute(String s1, String s2) {
        if (s1 == null || s2 == null || s1.isEmpty() || s2.isEmpty()) {
            return 0.0;
        }
        if (s1.equals(s2)) {
            return 100.0;
        }
        return Math.max(0.0, Math.min(100.0, ratio(s1, s2)));
    }

    /**
     * Scores two distinct, non-empty strings.
     */
    protected abstract double ratio(String s1, String s2);

    /**
     * Edit distance with unit insertions and deletions and the given substitution cost,
     * keeping two rows of the table sized to the shorter string.
     */
    static int editDistance(String s1, String s2, int substitutionCost) {
        String shorter = s1.length() <= s2.length() ? s1 : s2;
        String longer = shorter == s1 ? s2 : s1;

        int[] previous = new int[shorter.length() + 1];
        int[] current = new int[shorter.length() + 1];
        for (int i = 0; i < previous.length; i++) {
            previous[i] = i;
        }

        for (int j = 1; j <= longer.length(); j++) {
            char c = longer.charAt(j - 1);
            current[0] = j;
            for (int i = 1; i <= shorter.length(); i++) {
                int substitute = previous[i - 1] + (shorter.charAt(i - 1) == c ? 0 : substitutionCost);
                current[i] = Math.min(substitute, Math.min(current[i - 1], previous[i]) + 1);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[shorter.length()];
    }
}
