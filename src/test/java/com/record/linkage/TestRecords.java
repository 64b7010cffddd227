package com.record.linkage;

import com.record.linkage.core.model.CompanyRecord;
import com.record.linkage.core.model.GeocodedRecord;
import com.record.linkage.core.model.StandardizedRecord;
import com.record.linkage.geo.Coordinates;
import com.record.linkage.rules.TextStandardizer;

/**
 * Builders for records used across tests.
 */
public final class TestRecords {

    private static final TextStandardizer STANDARDIZER = new TextStandardizer();

    private TestRecords() {
    }

    public static StandardizedRecord standardized(int index, String name, String address) {
        return STANDARDIZER.standardize(CompanyRecord.of(index, name, address));
    }

    public static GeocodedRecord at(int index, String name, String address, double lat, double lon) {
        return GeocodedRecord.resolved(standardized(index, name, address), new Coordinates(lat, lon));
    }

    public static GeocodedRecord unresolved(int index, String name, String address) {
        return GeocodedRecord.unresolved(standardized(index, name, address));
    }
}
