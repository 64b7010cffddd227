package com.record.linkage.io;

import com.record.linkage.core.model.CompanyRecord;

import java.util.List;

/**
 * A parsed input CSV: the trimmed header and one record per data row.
 *
 * @param header  column names in file order
 * @param records rows in file order, indexed from 0
 */
public record InputTable(List<String> header, List<CompanyRecord> records) {

    public InputTable {
        header = List.copyOf(header);
        records = List.copyOf(records);
    }

    public int size() {
        return records.size();
    }
}
