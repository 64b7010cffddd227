package com.record.linkage.core.model;

import java.util.Objects;

/**
 * A {@link CompanyRecord} with its name and address in standardized form.
 *
 * @param source          the raw record
 * @param companyNameNorm standardized company name
 * @param addressNorm     standardized address
 */
public record StandardizedRecord(
        CompanyRecord source,
        String companyNameNorm,
        String addressNorm
) {
    public StandardizedRecord {
        Objects.requireNonNull(source, "source is required");
        companyNameNorm = companyNameNorm != null ? companyNameNorm : "";
        addressNorm = addressNorm != null ? addressNorm : "";
    }

    public int index() {
        return source.index();
    }

    /**
     * A record with an empty name or address is never merged with anything.
     */
    public boolean isMatchable() {
        return !companyNameNorm.isEmpty() && !addressNorm.isEmpty();
    }
}
