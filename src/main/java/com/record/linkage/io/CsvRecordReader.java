package com.record.linkage.io;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.record.linkage.core.model.CompanyRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads a company directory CSV.
 *
 * <p>The first row is the header; header names are trimmed. The name and address columns are
 * required, every other column is carried along unchanged. Short rows are padded with empty
 * values.</p>
 */
public class CsvRecordReader {
    private static final Logger log = LoggerFactory.getLogger(CsvRecordReader.class);

    private final String nameColumn;
    private final String addressColumn;
    private final CsvMapper mapper;

    public CsvRecordReader(String nameColumn, String addressColumn) {
        this.nameColumn = nameColumn;
        this.addressColumn = addressColumn;
        this.mapper = new CsvMapper();
        this.mapper.enable(CsvParser.Feature.WRAP_AS_ARRAY);
        this.mapper.enable(CsvParser.Feature.SKIP_EMPTY_LINES);
    }

    public InputTable read(Path path) {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(reader);
        } catch (IOException e) {
            throw new LinkageIOException("Failed to read " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * @throws LinkageIOException if the input is empty, lacks a required column or cannot be parsed
     */
    public InputTable read(Reader reader) {
        try (MappingIterator<String[]> rows = mapper.readerFor(String[].class).readValues(reader)) {
            if (!rows.hasNext()) {
                throw new LinkageIOException("Input has no header row");
            }
            List<String> header = parseHeader(rows.next());
            requireColumn(header, nameColumn);
            requireColumn(header, addressColumn);

            List<CompanyRecord> records = new ArrayList<>();
            while (rows.hasNext()) {
                String[] row = rows.next();
                int index = records.size();
                if (row.length > header.size()) {
                    log.warn("csv.extra_cells row={} expected={} actual={}", index, header.size(), row.length);
                }
                Map<String, String> columns = new LinkedHashMap<>();
                for (int i = 0; i < header.size(); i++) {
                    columns.put(header.get(i), i < row.length && row[i] != null ? row[i] : "");
                }
                records.add(new CompanyRecord(index, columns.get(nameColumn), columns.get(addressColumn), columns));
            }

            log.info("csv.read rows={} columns={}", records.size(), header.size());
            return new InputTable(header, records);
        } catch (IOException | RuntimeException e) {
            if (e instanceof LinkageIOException linkageError) {
                throw linkageError;
            }
            throw new LinkageIOException("Failed to parse CSV input: " + e.getMessage(), e);
        }
    }

    /**
     * Trims header names and strips a leading BOM. Rows are keyed by header name, so a name
     * that appears twice would silently drop a column and is rejected.
     */
    private static List<String> parseHeader(String[] raw) {
        List<String> header = new ArrayList<>(raw.length);
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < raw.length; i++) {
            String name = raw[i] != null ? raw[i] : "";
            if (i == 0 && name.startsWith("﻿")) {
                name = name.substring(1);
            }
            name = name.trim();
            if (!seen.add(name)) {
                throw new LinkageIOException("Duplicate column '" + name + "' at position " + (i + 1)
                        + " in header " + Arrays.asList(raw));
            }
            header.add(name);
        }
        return header;
    }

    private static void requireColumn(List<String> header, String column) {
        if (!header.contains(column)) {
            throw new LinkageIOException("Missing required column '" + column + "' in header " + header);
        }
    }
}
