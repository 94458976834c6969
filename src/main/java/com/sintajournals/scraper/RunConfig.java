package com.sintajournals.scraper;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;

/**
 * Process-scoped configuration of one run, passed explicitly to every component.
 * <p>
 * Each key is resolved in order from the command line ({@code --key=value}), the environment
 * variable {@code SINTA_KEY} (upper snake case), the JVM system property of the same name, and
 * finally the default.
 *
 * @author SINTA Journals Scraper Team
 * @since 1.0
 */
public record RunConfig(
    RunMode mode,
    String portalUrl,
    Path inputFolder,
    Path outputFolder,
    OutputFormat outputFormat,
    boolean hdfsEnabled,
    String hdfsUrl,
    String hdfsPath,
    String hdfsUser,
    int maxPages,
    Duration waitTimeout,
    Duration graceDelay,
    Duration settleDelay,
    boolean headless,
    Path diagnosticsFolder
) {
    public static final String DEFAULT_PORTAL_URL = "https://sinta.kemdiktisaintek.go.id/journals/index/";

    /** What a run does. */
    public enum RunMode {
        /** Crawl the portal, then transform and load the captures. */
        CRAWL,
        /** Crawl the portal and archive the captures only. */
        SCRAPE,
        /** Transform and load previously archived captures. */
        ETL
    }

    /** Which local artifacts are written. */
    public enum OutputFormat {
        CSV, JSON, BOTH;

        public boolean includesCsv() {
            return this == CSV || this == BOTH;
        }

        public boolean includesJson() {
            return this == JSON || this == BOTH;
        }
    }

    public RunConfig {
        if (maxPages < 1) {
            throw new IllegalArgumentException("max-pages must be at least 1: " + maxPages);
        }
        hdfsUser = hdfsUser == null ? "" : hdfsUser;
    }

    /**
     * @return configuration with every key at its default
     */
    public static RunConfig defaults() {
        return fromMap(Map.of());
    }

    /**
     * Builds a configuration from command-line arguments, falling back to environment
     * variables, system properties and defaults.
     */
    public static RunConfig fromArgs(String[] args) {
        return fromMap(parseArgs(args), RunConfig::envOrProp);
    }

    /**
     * Builds a configuration from explicit values only.
     */
    public static RunConfig fromMap(Map<String, String> values) {
        return fromMap(values, key -> null);
    }

    static RunConfig fromMap(Map<String, String> values, Function<String, String> fallback) {
        Function<String, String> lookup = key -> {
            String v = values.get(key);
            if (v == null) v = fallback.apply(envName(key));
            return v == null || v.isBlank() ? null : v.trim();
        };
        return new RunConfig(
            parseEnum(RunMode.class, "mode", or(lookup.apply("mode"), "crawl")),
            or(lookup.apply("portal-url"), DEFAULT_PORTAL_URL),
            Paths.get(or(lookup.apply("input-folder"), "output_journals")),
            Paths.get(or(lookup.apply("output-folder"), "output_data")),
            parseEnum(OutputFormat.class, "output-format", or(lookup.apply("output-format"), "both")),
            Boolean.parseBoolean(or(lookup.apply("hdfs-enabled"), "false")),
            or(lookup.apply("hdfs-url"), "http://localhost:9870"),
            or(lookup.apply("hdfs-path"), "/user/sinta/journals"),
            or(lookup.apply("hdfs-user"), ""),
            parseInt("max-pages", or(lookup.apply("max-pages"), "23")),
            Duration.ofSeconds(parseInt("wait-timeout-seconds", or(lookup.apply("wait-timeout-seconds"), "70"))),
            Duration.ofSeconds(parseInt("grace-delay-seconds", or(lookup.apply("grace-delay-seconds"), "10"))),
            Duration.ofSeconds(parseInt("settle-delay-seconds", or(lookup.apply("settle-delay-seconds"), "10"))),
            Boolean.parseBoolean(or(lookup.apply("headless"), "true")),
            Paths.get(or(lookup.apply("diagnostics-folder"), "logs"))
        );
    }

    /**
     * Parses {@code --key=value} and bare {@code --flag} arguments. A first argument without
     * dashes is taken as the mode.
     */
    static Map<String, String> parseArgs(String[] args) {
        Map<String, String> values = new LinkedHashMap<>();
        if (args == null) return values;
        for (int i = 0; i < args.length; i++) {
            String arg = args[i].trim();
            if (arg.startsWith("--")) {
                String body = arg.substring(2);
                int eq = body.indexOf('=');
                if (eq >= 0) {
                    values.put(body.substring(0, eq), body.substring(eq + 1));
                } else {
                    values.put(body, "true");
                }
            } else if (i == 0 && !arg.isEmpty()) {
                values.put("mode", arg);
            } else {
                throw new IllegalArgumentException("Unrecognized argument: " + arg);
            }
        }
        return values;
    }

    private static String envName(String key) {
        return "SINTA_" + key.toUpperCase(Locale.ROOT).replace('-', '_');
    }

    private static String envOrProp(String key) {
        String ev = System.getenv(key);
        if (ev != null) return ev;
        return System.getProperty(key);
    }

    private static String or(String value, String defaultValue) {
        return value == null ? defaultValue : value;
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + key + ": " + value, e);
        }
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String key, String value) {
        try {
            return Enum.valueOf(type, value.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid value for " + key + ": " + value, e);
        }
    }
}
