package org.recall.indexing.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Properties;

/**
 * Typed configuration for the keyword index.
 *
 * <p>Loads {@code application.properties}, then overlays environment variables. If {@code INDEX_FILE_PATH}
 * is set, it overrides {@code index.file.path}. Missing, malformed or out-of-range keys fail
 * fast with {@link IllegalStateException}.</p>
 */
public record IndexingConfig(
    Path indexFile,
    Flush flush,
    Bm25 bm25,
    Search search,
    Tokenizer tokenizer
) {
    /** When pending mutations are written to disk; {@code 0} disables a bound. */
    public record Flush(int everyMutations, Duration maxAge) {}

    /** BM25 tuning constants. */
    public record Bm25(double k1, double b) {}

    /** Defaults applied when a caller does not pass search options. */
    public record Search(int defaultLimit, double defaultThreshold) {}

    /** Term normalization policy shared by documents and queries. */
    public record Tokenizer(String stopWords, int minTermLength) {}

    /**
     * Loads configuration from classpath properties plus environment variables.
     *
     * @return a fully-initialized {@link IndexingConfig}
     */
    public static IndexingConfig load() {
        Properties properties = loadProperties("application.properties");
        overlayEnvironment(properties);
        normalizeIndexPath(properties);
        return from(properties);
    }

    public static IndexingConfig from(Properties p) {
        return new IndexingConfig(
            Path.of(requireString(p, "index.file.path")),
            readFlush(p),
            readBm25(p),
            readSearch(p),
            readTokenizer(p)
        );
    }

    private static Flush readFlush(Properties p) {
        int everyMutations = requireInt(p, "index.flush.every.mutations");
        requireRange("index.flush.every.mutations", everyMutations, 0, Integer.MAX_VALUE);
        int maxAgeSeconds = requireInt(p, "index.flush.max.age.seconds");
        requireRange("index.flush.max.age.seconds", maxAgeSeconds, 0, Integer.MAX_VALUE);
        return new Flush(everyMutations, Duration.ofSeconds(maxAgeSeconds));
    }

    private static Bm25 readBm25(Properties p) {
        double k1 = requireDouble(p, "bm25.k1");
        requireRange("bm25.k1", k1, 0, Double.MAX_VALUE);
        double b = requireDouble(p, "bm25.b");
        requireRange("bm25.b", b, 0, 1);
        return new Bm25(k1, b);
    }

    private static Search readSearch(Properties p) {
        int limit = requireInt(p, "search.default.limit");
        requireRange("search.default.limit", limit, 1, Integer.MAX_VALUE);
        double threshold = requireDouble(p, "search.default.threshold");
        requireRange("search.default.threshold", threshold, 0, Double.MAX_VALUE);
        return new Search(limit, threshold);
    }

    private static Tokenizer readTokenizer(Properties p) {
        String stopWords = p.getProperty("tokenizer.stop.words", "");
        String minLength = trimToNull(p.getProperty("tokenizer.min.term.length"));
        int minTermLength = minLength == null ? 1 : requireInt(p, "tokenizer.min.term.length");
        requireRange("tokenizer.min.term.length", minTermLength, 1, Integer.MAX_VALUE);
        return new Tokenizer(stopWords, minTermLength);
    }

    private static void requireRange(String key, double value, double min, double max) {
        if (!Double.isFinite(value) || value < min || value > max) {
            throw new IllegalStateException("Configuration '" + key + "' out of range: " + value);
        }
    }

    private static Properties loadProperties(String resourceName) {
        Properties properties = new Properties();
        try (InputStream in = IndexingConfig.class.getClassLoader().getResourceAsStream(resourceName)) {
            if (in != null) {
                properties.load(in);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load " + resourceName, e);
        }
        return properties;
    }

    private static void overlayEnvironment(Properties properties) {
        properties.putAll(System.getenv());
    }

    private static void normalizeIndexPath(Properties properties) {
        String path = trimToNull(properties.getProperty("INDEX_FILE_PATH"));
        if (path != null) {
            properties.setProperty("index.file.path", path);
        }
    }

    private static String requireString(Properties properties, String key) {
        String value = trimToNull(properties.getProperty(key));
        if (value == null) {
            throw new IllegalStateException("Missing required configuration: " + key);
        }
        return value;
    }

    private static int requireInt(Properties properties, String key) {
        String value = requireString(properties, key);
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Invalid integer for configuration '" + key + "': '" + value + "'", e);
        }
    }

    private static double requireDouble(Properties properties, String key) {
        String value = requireString(properties, key);
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Invalid number for configuration '" + key + "': '" + value + "'", e);
        }
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
