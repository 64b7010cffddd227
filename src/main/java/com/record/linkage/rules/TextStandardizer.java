package com.record.linkage.rules;

import com.record.linkage.core.model.CompanyRecord;
import com.record.linkage.core.model.RecordField;
import com.record.linkage.core.model.StandardizedRecord;

import java.util.Objects;

/**
 * Turns raw names and addresses into their canonical comparable form.
 *
 * <p>Pure and total: never throws, and {@code null} or blank input yields {@code ""}.
 * Standardizing already standardized text returns it unchanged.</p>
 */
public class TextStandardizer {

    private final NormalizationEngine engine;
    private final StandardizationProfile profile;

    public TextStandardizer() {
        this(StandardizationProfile.BASIC);
    }

    public TextStandardizer(StandardizationProfile profile) {
        this.profile = Objects.requireNonNull(profile, "profile is required");
        this.engine = DefaultNormalizationRules.createEngine(profile);
    }

    /**
     * Standardizes text with the rules shared by every field.
     */
    public String standardize(String raw) {
        return engine.normalize(raw);
    }

    public String standardize(String raw, RecordField field) {
        return engine.normalize(raw, field);
    }

    public StandardizedRecord standardize(CompanyRecord record) {
        return new StandardizedRecord(record,
                standardize(record.companyName(), RecordField.NAME),
                standardize(record.addressRaw(), RecordField.ADDRESS));
    }

    public StandardizationProfile getProfile() {
        return profile;
    }
}
