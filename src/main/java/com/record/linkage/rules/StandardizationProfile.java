package com.record.linkage.rules;

/**
 * Rule sets available to the {@link TextStandardizer}.
 */
public enum StandardizationProfile {
    /** Uppercase, punctuation and dash trimming, whitespace collapse. */
    BASIC,
    /** BASIC plus legal-form removal for names and street-type canonicalization for addresses. */
    EXTENDED;

    public static StandardizationProfile fromString(String value) {
        for (StandardizationProfile profile : values()) {
            if (profile.name().equalsIgnoreCase(value.trim())) {
                return profile;
            }
        }
        throw new IllegalArgumentException("Unknown standardization profile: " + value);
    }
}
