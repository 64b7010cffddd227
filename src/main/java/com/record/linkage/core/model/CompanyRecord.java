package com.record.linkage.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One input row of a business directory.
 *
 * <p>{@code index} is the 0-based position of the row in the input and serves as its stable
 * identity for the whole pipeline. {@code columns} holds every original column in header order
 * so the row can be written back unchanged.</p>
 *
 * @param index       position of the row in the input
 * @param companyName raw company name, never null ("" when missing)
 * @param addressRaw  raw address text, never null ("" when missing)
 * @param columns     all original columns of the row
 */
public record CompanyRecord(
        int index,
        String companyName,
        String addressRaw,
        Map<String, String> columns
) {
    public CompanyRecord {
        if (index < 0) {
            throw new IllegalArgumentException("index must be >= 0");
        }
        companyName = companyName != null ? companyName : "";
        addressRaw = addressRaw != null ? addressRaw : "";
        columns = columns != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(columns))
                : Map.of();
    }

    /**
     * Creates a record carrying only the two matching fields.
     */
    public static CompanyRecord of(int index, String companyName, String addressRaw) {
        return new CompanyRecord(index, companyName, addressRaw, Map.of());
    }
}
