package com.record.linkage.cli;

import com.record.linkage.api.LinkageOrchestrator;
import com.record.linkage.api.LinkageResult;
import com.record.linkage.config.LinkageConfig;
import com.record.linkage.config.LinkageConfigurationException;
import com.record.linkage.geo.Geocoder;
import com.record.linkage.geo.GeocodingStrategy;
import com.record.linkage.geo.ProgressCallback;
import com.record.linkage.io.CsvRecordReader;
import com.record.linkage.io.CsvTableWriter;
import com.record.linkage.io.InputTable;
import com.record.linkage.io.LinkageIOException;
import com.record.linkage.metrics.MicrometerLinkageMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Command-line entry point: reads a company directory CSV, links it and writes the processed
 * and low-similarity tables.
 *
 * <pre>
 *   java -cp app.jar com.record.linkage.cli.LinkageCli companies.csv processed.csv low_similarity.csv
 *   java -cp app.jar com.record.linkage.cli.LinkageCli in.csv out.csv review.csv \
 *       --set linkage.distance_threshold_miles=25 --config linkage.properties
 * </pre>
 *
 * <p>Exit codes: 0 on success, 2 on a usage or configuration error, 1 on any other failure.</p>
 */
public final class LinkageCli {
    private static final Logger log = LoggerFactory.getLogger(LinkageCli.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private static final String USAGE =
            "Usage: LinkageCli <input.csv> <processed.csv> <low_similarity.csv> "
                    + "[--set key=value]... [--config file.properties]";
    private static final int PROGRESS_INTERVAL = 100;

    private final PrintStream out;
    private final PrintStream err;
    private final Function<LinkageConfig, Geocoder> geocoderFactory;

    LinkageCli(PrintStream out, PrintStream err, Function<LinkageConfig, Geocoder> geocoderFactory) {
        this.out = out;
        this.err = err;
        this.geocoderFactory = geocoderFactory;
    }

    public static void main(String[] args) {
        int code = new LinkageCli(System.out, System.err, LinkageConfig::createGeocoder).run(args);
        System.exit(code);
    }

    int run(String[] args) {
        List<String> positional = new ArrayList<>();
        Map<String, String> overrides = new LinkedHashMap<>();
        Path configFile = null;

        for (int i = 0; i < (args == null ? 0 : args.length); i++) {
            String arg = args[i];
            if ("--help".equals(arg) || "-h".equals(arg)) {
                out.println(USAGE);
                return EXIT_OK;
            }
            if ("--set".equals(arg) || "--config".equals(arg)) {
                if (i + 1 >= args.length) {
                    return usage("Missing value for " + arg);
                }
                String value = args[++i];
                if ("--config".equals(arg)) {
                    configFile = Paths.get(value);
                    continue;
                }
                int eq = value.indexOf('=');
                if (eq <= 0) {
                    return usage("Expected key=value after --set, got '" + value + "'");
                }
                overrides.put(value.substring(0, eq).trim(), value.substring(eq + 1));
                continue;
            }
            if (arg.startsWith("--")) {
                return usage("Unknown option " + arg);
            }
            positional.add(arg);
        }
        if (positional.size() != 3) {
            return usage("Expected 3 file arguments, got " + positional.size());
        }

        LinkageConfig config;
        try {
            config = LinkageConfig.load(overrides, configFile);
        } catch (LinkageConfigurationException e) {
            err.println("Configuration error: " + e.getMessage());
            return EXIT_USAGE;
        }

        try {
            return link(config, Paths.get(positional.get(0)), Paths.get(positional.get(1)),
                    Paths.get(positional.get(2)));
        } catch (LinkageIOException e) {
            log.error("linkage.io_failed error={}", e.getMessage());
            err.println("I/O error: " + e.getMessage());
            return EXIT_FAILURE;
        } catch (RuntimeException e) {
            log.error("linkage.failed", e);
            err.println("Linkage failed: " + e);
            return EXIT_FAILURE;
        }
    }

    private int link(LinkageConfig config, Path input, Path processedFile, Path lowSimilarityFile) {
        InputTable table = new CsvRecordReader(config.getNameColumn(), config.getAddressColumn()).read(input);
        GeocodingStrategy strategy = config.createGeocodingStrategy();
        MicrometerLinkageMetrics metrics = new MicrometerLinkageMetrics(new SimpleMeterRegistry());
        try {
            LinkageOrchestrator orchestrator = LinkageOrchestrator.builder()
                    .options(config.toOptions())
                    .standardizer(config.createStandardizer())
                    .scorer(config.createScorer())
                    .geocoder(geocoderFactory.apply(config))
                    .geocodingStrategy(strategy)
                    .metrics(metrics)
                    .progressCallback(progressLogger())
                    .build();

            LinkageResult result = orchestrator.link(table.records());

            CsvTableWriter writer = new CsvTableWriter(config.isIncludeScores());
            writer.write(processedFile, table.header(), result.processed());
            writer.write(lowSimilarityFile, table.header(), result.lowSimilarity());

            out.println(result.summary().describe());
            String report = metrics.report();
            log.info("linkage.metrics runId={} {}", result.runId(), report);
            out.println("metrics " + report);
            return EXIT_OK;
        } finally {
            closeQuietly(strategy);
        }
    }

    private static ProgressCallback progressLogger() {
        return (processed, total, message) -> {
            if (processed % PROGRESS_INTERVAL == 0 || processed == total) {
                log.info("geocode.progress processed={} total={} message={}", processed, total, message);
            }
        };
    }

    private int usage(String problem) {
        err.println(problem);
        err.println(USAGE);
        return EXIT_USAGE;
    }

    private static void closeQuietly(GeocodingStrategy strategy) {
        if (strategy instanceof AutoCloseable closeable) {
            try {
                closeable.close();
            } catch (Exception e) {
                log.warn("strategy.close_failed strategy={} error={}", strategy.getName(), e.getMessage());
            }
        }
    }
}
