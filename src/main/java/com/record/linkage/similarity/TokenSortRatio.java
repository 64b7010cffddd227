package com.record.linkage.similarity;

import java.util.Arrays;
import java.util.regex.Pattern;

/**
 * {@link IndelRatio} over whitespace tokens sorted alphabetically, so word order does not matter:
 * "MAIN ST 123" and "123 MAIN ST" score 100.
 */
public class TokenSortRatio extends EditRatio {

    static final String NAME = "token-sort";

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final IndelRatio indel = new IndelRatio();

    @Override
    protected double ratio(String s1, String s2) {
        return indel.compute(sortTokens(s1), sortTokens(s2));
    }

    @Override
    public String getName() {
        return NAME;
    }

    private static String sortTokens(String s) {
        String trimmed = s.trim();
        if (trimmed.isEmpty()) {
            return "";
        }
        String[] tokens = WHITESPACE.split(trimmed);
        Arrays.sort(tokens);
        return String.join(" ", tokens);
    }
}
