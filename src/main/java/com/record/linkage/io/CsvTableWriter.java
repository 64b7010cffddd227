package com.record.linkage.io;

import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvGenerator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.record.linkage.core.model.LinkedRecord;
import com.record.linkage.core.model.SimilarityPair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Writes linked records as CSV: the original columns followed by {@code Latitude},
 * {@code Longitude} and {@code Location Index}, optionally with the best match's scores.
 * Unresolved coordinates are written as empty cells.
 */
public class CsvTableWriter {
    private static final Logger log = LoggerFactory.getLogger(CsvTableWriter.class);

    public static final String LATITUDE = "Latitude";
    public static final String LONGITUDE = "Longitude";
    public static final String LOCATION_INDEX = "Location Index";
    public static final String NAME_CONFIDENCE = "Name Confidence";
    public static final String ADDRESS_CONFIDENCE = "Address Confidence";
    public static final String OVERALL_SIMILARITY = "Overall Similarity";

    private final boolean includeScores;
    private final CsvMapper mapper;

    public CsvTableWriter(boolean includeScores) {
        this.includeScores = includeScores;
        this.mapper = new CsvMapper();
        this.mapper.enable(CsvGenerator.Feature.STRICT_CHECK_FOR_QUOTING);
    }

    public void write(Path path, List<String> inputHeader, List<LinkedRecord> rows) {
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            write(writer, inputHeader, rows);
        } catch (IOException e) {
            throw new LinkageIOException("Failed to write " + path + ": " + e.getMessage(), e);
        }
        log.info("csv.written file={} rows={}", path, rows.size());
    }

    public void write(Writer writer, List<String> inputHeader, List<LinkedRecord> rows) {
        List<String> header = outputHeader(inputHeader);
        CsvSchema.Builder schema = CsvSchema.builder();
        header.forEach(schema::addColumn);

        // header written as a row of its own so that an empty partition still gets one
        try (SequenceWriter out = mapper.writer(schema.build().withoutHeader()).writeValues(writer)) {
            out.write(headerRow(header));
            for (LinkedRecord row : rows) {
                out.write(toRow(row, header));
            }
        } catch (IOException e) {
            throw new LinkageIOException("Failed to write CSV output: " + e.getMessage(), e);
        }
    }

    /**
     * Input columns, de-duplicated, followed by the columns this writer appends.
     */
    public List<String> outputHeader(List<String> inputHeader) {
        Set<String> columns = new LinkedHashSet<>(inputHeader);
        columns.add(LATITUDE);
        columns.add(LONGITUDE);
        columns.add(LOCATION_INDEX);
        if (includeScores) {
            columns.add(NAME_CONFIDENCE);
            columns.add(ADDRESS_CONFIDENCE);
            columns.add(OVERALL_SIMILARITY);
        }
        return new ArrayList<>(columns);
    }

    private Map<String, String> toRow(LinkedRecord linked, List<String> header) {
        Map<String, String> row = new LinkedHashMap<>();
        for (String column : header) {
            row.put(column, linked.record().source().columns().getOrDefault(column, ""));
        }
        row.put(LATITUDE, linked.record().coordinates().map(c -> Double.toString(c.latitude())).orElse(""));
        row.put(LONGITUDE, linked.record().coordinates().map(c -> Double.toString(c.longitude())).orElse(""));
        row.put(LOCATION_INDEX, Integer.toString(linked.groupId()));
        if (includeScores) {
            SimilarityPair best = linked.bestMatch() != null ? linked.bestMatch() : SimilarityPair.none();
            row.put(NAME_CONFIDENCE, format(best.nameScore()));
            row.put(ADDRESS_CONFIDENCE, format(best.addressScore()));
            row.put(OVERALL_SIMILARITY, format(best.overallScore()));
        }
        return row;
    }

    private static Map<String, String> headerRow(List<String> header) {
        Map<String, String> row = new LinkedHashMap<>();
        header.forEach(column -> row.put(column, column));
        return row;
    }

    private static String format(double score) {
        return String.format(Locale.ROOT, "%.2f", score);
    }
}
