package com.record.linkage.rules;

import com.record.linkage.core.model.RecordField;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import static com.record.linkage.rules.NormalizationRule.everyField;
import static com.record.linkage.rules.NormalizationRule.forField;

/**
 * Built-in normalization rules for company names and addresses.
 *
 * <p>Token-removing rules run before the dash rules so that a removal can never leave behind
 * a dash the dash rules would still strip. This keeps every profile idempotent.</p>
 */
public final class DefaultNormalizationRules {

    private DefaultNormalizationRules() {
        // Utility class
    }

    public static NormalizationEngine createEngine(StandardizationProfile profile) {
        return new NormalizationEngine(rulesFor(profile));
    }

    /**
     * Engine that rewrites a standardized address into a geocoder query.
     */
    public static NormalizationEngine createGeocodingQueryEngine() {
        return new NormalizationEngine(getGeocodingQueryRules());
    }

    public static List<NormalizationRule> rulesFor(StandardizationProfile profile) {
        List<NormalizationRule> rules = new ArrayList<>(getBasicRules());
        if (profile == StandardizationProfile.EXTENDED) {
            rules.addAll(getCompanyNameRules());
            rules.addAll(getAddressRules());
        }
        return rules;
    }

    /**
     * Rules applied to every field.
     */
    public static List<NormalizationRule> getBasicRules() {
        return List.of(
                everyField("basic-punctuation", 10, "[,.;:!?\"()]", ""),
                // "--" and longer become a separator
                everyField("basic-dash-runs", 20, "-{2,}", " "),
                // A dash standing alone between spaces carries nothing
                everyField("basic-standalone-dash", 30, "(^|\\s)-(?=\\s|$)", "$1")
        );
    }

    /**
     * Legal-form tokens stripped from company names.
     */
    public static List<NormalizationRule> getCompanyNameRules() {
        return List.of(
                forField(RecordField.NAME, "name-legal-form", 15,
                        "\\b(LTD|LIMITED|INTL|CO|COMPANY|LLC|INC|INCORPORATED|CORP|CORPORATION|PLC|GMBH)\\b", "")
        );
    }

    /**
     * Address clean-up: phone noise removal and street-type canonicalization.
     */
    public static List<NormalizationRule> getAddressRules() {
        return List.of(
                forField(RecordField.ADDRESS, "address-phone-labels", 15, "\\b(TEL/FAX|PHONE|FAX|TEL)\\b", ""),
                // Seven or more digits is a phone number, not a street or postal code
                forField(RecordField.ADDRESS, "address-phone-digits", 15, "\\b\\d{7,}\\b", ""),
                forField(RecordField.ADDRESS, "address-po-box", 40, "\\bP\\s?O\\s+BOX\\b", "POBOX"),
                streetType("STREET", "ST"),
                streetType("AVENUE", "AVE"),
                streetType("ROAD", "RD"),
                streetType("BOULEVARD", "BLVD"),
                streetType("DRIVE", "DR")
        );
    }

    /**
     * Rewrites that help a geocoder find an address. Not meant for matching.
     */
    public static List<NormalizationRule> getGeocodingQueryRules() {
        return List.of(
                everyField("query-room", 10, "\\b(ROOM|RM)\\b", ""),
                everyField("query-building", 20, "\\bBLDG\\b", "BUILDING"),
                everyField("query-road", 20, "\\bRD\\b", "ROAD"),
                everyField("query-street", 20, "\\bST\\b", "STREET")
        );
    }

    private static NormalizationRule streetType(String longForm, String abbreviation) {
        return forField(RecordField.ADDRESS, "address-" + longForm.toLowerCase(Locale.ROOT), 40,
                "\\b" + longForm + "\\b", abbreviation);
    }
}
