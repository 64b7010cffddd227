package com.record.linkage.cli;

import com.record.linkage.geo.Coordinates;
import com.record.linkage.geo.Geocoder;
import com.record.linkage.io.CsvRecordReader;
import com.record.linkage.io.InputTable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class LinkageCliTest {

    private static final Map<String, Coordinates> GAZETTEER = Map.of(
            "123 MAIN ST BOSTON MA", new Coordinates(42.3601, -71.0589),
            "123 MAIN STREET BOSTON MA", new Coordinates(42.3601, -71.0589),
            "789 BROADWAY NEW YORK NY", new Coordinates(40.7128, -74.0060));

    private static final Geocoder FIXTURE = address -> Optional.ofNullable(GAZETTEER.get(address));

    @TempDir
    Path tempDir;

    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;
    private LinkageCli cli;

    @BeforeEach
    void setUp() {
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
        cli = new LinkageCli(new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8), config -> FIXTURE);
    }

    private Path writeInput(String content) throws IOException {
        Path input = tempDir.resolve("companies.csv");
        Files.writeString(input, content);
        return input;
    }

    private static final String SAMPLE = "Company Name,first3_addresses,Phone\n"
            + "Example Co.,\"123 Main St, Boston, MA\",1\n"
            + "Example Co,\"123 Main Street, Boston, MA\",2\n"
            + "Another LLC,\"789 Broadway, New York, NY\",3\n";

    @Test
    @DisplayName("Should link the input and write both tables")
    void testRun() throws IOException {
        Path input = writeInput(SAMPLE);
        Path processed = tempDir.resolve("processed.csv");
        Path lowSimilarity = tempDir.resolve("low.csv");

        int code = cli.run(new String[]{input.toString(), processed.toString(), lowSimilarity.toString(),
                "--set", "linkage.geocoding.strategy=sequential", "--set", "linkage.output.include-scores=true"});

        assertEquals(LinkageCli.EXIT_OK, code, err.toString(StandardCharsets.UTF_8));
        CsvRecordReader reader = new CsvRecordReader("Company Name", "first3_addresses");
        InputTable processedTable = reader.read(processed);
        InputTable lowTable = reader.read(lowSimilarity);

        assertEquals(2, processedTable.size());
        assertEquals(1, lowTable.size());
        assertEquals("Another LLC", lowTable.records().get(0).companyName());
        assertEquals("1", processedTable.records().get(0).columns().get("Location Index"));
        assertEquals("1", processedTable.records().get(1).columns().get("Location Index"));
        assertEquals("2", lowTable.records().get(0).columns().get("Location Index"));
        assertTrue(processedTable.header().contains("Overall Similarity"));
        String printed = out.toString(StandardCharsets.UTF_8);
        assertTrue(printed.contains("records=3 groups=2"));
        assertTrue(printed.contains("metrics geocode.resolved=3 geocode.unresolved=0"), printed);
        assertTrue(printed.contains("assignment.NEW_GROUP=2"), printed);
        assertTrue(printed.contains("assignment.SPATIAL_MATCH=1"), printed);
        assertTrue(printed.contains("low_similarity=1"), printed);
    }

    @Test
    @DisplayName("Should read settings from a config file")
    void testConfigFile() throws IOException {
        Path input = writeInput(SAMPLE);
        Path config = tempDir.resolve("linkage.properties");
        Files.writeString(config, "linkage.low_similarity_report_threshold=0\nlinkage.geocoding.strategy=sequential\n");

        int code = cli.run(new String[]{input.toString(), tempDir.resolve("p.csv").toString(),
                tempDir.resolve("l.csv").toString(), "--config", config.toString()});

        assertEquals(LinkageCli.EXIT_OK, code);
        assertEquals(3, new CsvRecordReader("Company Name", "first3_addresses")
                .read(tempDir.resolve("p.csv")).size());
    }

    @Test
    @DisplayName("Usage errors should exit with 2")
    void testUsageErrors() {
        assertEquals(LinkageCli.EXIT_USAGE, cli.run(new String[]{}));
        assertEquals(LinkageCli.EXIT_USAGE, cli.run(new String[]{"a.csv", "b.csv"}));
        assertEquals(LinkageCli.EXIT_USAGE, cli.run(new String[]{"a.csv", "b.csv", "c.csv", "--set", "novalue"}));
        assertEquals(LinkageCli.EXIT_USAGE, cli.run(new String[]{"a.csv", "b.csv", "c.csv", "--verbose"}));
        assertEquals(LinkageCli.EXIT_USAGE, cli.run(new String[]{"a.csv", "b.csv", "c.csv", "--config"}));
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("Usage:"));
    }

    @Test
    @DisplayName("Invalid configuration should exit with 2")
    void testInvalidConfig() {
        int code = cli.run(new String[]{"a.csv", "b.csv", "c.csv",
                "--set", "linkage.distance_threshold_miles=-1"});

        assertEquals(LinkageCli.EXIT_USAGE, code);
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("Configuration error"));
    }

    @Test
    @DisplayName("Input problems should exit with 1")
    void testInputFailures() throws IOException {
        Path missing = tempDir.resolve("absent.csv");
        assertEquals(LinkageCli.EXIT_FAILURE, cli.run(new String[]{missing.toString(),
                tempDir.resolve("p.csv").toString(), tempDir.resolve("l.csv").toString()}));

        Path badHeader = writeInput("Name,Address\nAcme,1 Main St\n");
        assertEquals(LinkageCli.EXIT_FAILURE, cli.run(new String[]{badHeader.toString(),
                tempDir.resolve("p.csv").toString(), tempDir.resolve("l.csv").toString()}));
    }

    @Test
    @DisplayName("Help should print usage and exit with 0")
    void testHelp() {
        assertEquals(LinkageCli.EXIT_OK, cli.run(new String[]{"--help"}));
        assertTrue(out.toString(StandardCharsets.UTF_8).startsWith("Usage:"));
    }
}
