package de.mirkosertic.archiveindexer.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Settings of the archive indexer.
 * <p>
 * Sources, later ones winning:
 * <ol>
 *     <li>{@code application.yaml} on the classpath</li>
 *     <li>{@code ~/.archiveindexer/config.yaml}</li>
 *     <li>environment variables {@code ARCHIVE_INDEXER_STORE_PATH} and {@code ARCHIVE_INDEXER_RETRY_INTERVAL_MS}</li>
 *     <li>system property {@code archiveindexer.store.path}</li>
 * </ol>
 * All settings live below the {@code indexer:} key. String values may contain
 * {@code ${NAME:fallback}} placeholders, resolved against the environment and system properties.
 */
public class IndexerConfig {

    private static final Logger logger = LoggerFactory.getLogger(IndexerConfig.class);

    private static final String ENV_STORE_PATH = "ARCHIVE_INDEXER_STORE_PATH";
    private static final String ENV_RETRY_INTERVAL_MS = "ARCHIVE_INDEXER_RETRY_INTERVAL_MS";
    private static final String PROP_STORE_PATH = "archiveindexer.store.path";
    private static final String CONFIG_DIR = ".archiveindexer";
    private static final String USER_CONFIG_FILE = "config.yaml";
    private static final String BUNDLED_CONFIG_FILE = "application.yaml";
    private static final String SECTION = "indexer";

    private static final Pattern PLACEHOLDER = Pattern.compile("\\$\\{([^}:]+)(?::([^}]*))?\\}");

    public static final long DEFAULT_RETRY_INTERVAL_MS = 30_000;
    public static final long DEFAULT_DOWNLOAD_DEBOUNCE_MS = 1_000;

    private String storePath;
    private int threadPoolSize = 4;
    private int archivePoolSize = 4;
    private long retryIntervalMs = DEFAULT_RETRY_INTERVAL_MS;
    private long downloadDebounceMs = DEFAULT_DOWNLOAD_DEBOUNCE_MS;

    protected IndexerConfig() {
    }

    public static IndexerConfig load() {
        final IndexerConfig config = new IndexerConfig();

        try (final InputStream bundled = IndexerConfig.class.getClassLoader().getResourceAsStream(BUNDLED_CONFIG_FILE)) {
            if (bundled != null) {
                config.applyYaml(bundled, "classpath:" + BUNDLED_CONFIG_FILE);
            }
        } catch (final IOException e) {
            logger.warn("Could not read bundled {}", BUNDLED_CONFIG_FILE, e);
        }

        final Path userConfig = getUserConfigPath();
        if (Files.isRegularFile(userConfig)) {
            try (final InputStream in = Files.newInputStream(userConfig)) {
                config.applyYaml(in, userConfig.toString());
            } catch (final IOException e) {
                logger.warn("Could not read {}", userConfig, e);
            }
        }

        config.applyEnvironment();

        logger.info("Indexer configuration: storePath={}, threadPoolSize={}, archivePoolSize={}, retryIntervalMs={}",
                config.storePath, config.threadPoolSize, config.archivePoolSize, config.retryIntervalMs);
        return config;
    }

    /**
     * Built-in defaults only, without consulting files or the environment.
     */
    public static IndexerConfig defaults() {
        final IndexerConfig config = new IndexerConfig();
        config.storePath = defaultStorePath();
        return config;
    }

    @SuppressWarnings("unchecked")
    void applyYaml(final InputStream in, final String source) {
        final Object yaml = new Yaml().load(in);
        if (yaml == null) {
            return;
        }
        if (!(yaml instanceof Map)) {
            logger.warn("Ignoring {}: expected a mapping at the top level", source);
            return;
        }
        applyYamlConfig((Map<String, Object>) yaml);
        logger.debug("Applied configuration from {}", source);
    }

    @SuppressWarnings("unchecked")
    void applyYamlConfig(final Map<String, Object> yaml) {
        final Object section = yaml.get(SECTION);
        if (!(section instanceof Map)) {
            return;
        }
        final Map<String, Object> values = (Map<String, Object>) section;

        final Object path = values.get("store-path");
        if (path != null) {
            storePath = resolveVariables(path.toString());
        }
        threadPoolSize = intValue(values, "thread-pool-size", threadPoolSize);
        archivePoolSize = intValue(values, "archive-pool-size", archivePoolSize);
        retryIntervalMs = longValue(values, "retry-interval-ms", retryIntervalMs);
        downloadDebounceMs = longValue(values, "download-debounce-ms", downloadDebounceMs);
    }

    private void applyEnvironment() {
        final String envStorePath = System.getenv(ENV_STORE_PATH);
        if (envStorePath != null && !envStorePath.isBlank()) {
            storePath = envStorePath.trim();
            logger.info("Store path taken from {}: {}", ENV_STORE_PATH, storePath);
        }

        final String envRetryInterval = System.getenv(ENV_RETRY_INTERVAL_MS);
        if (envRetryInterval != null && !envRetryInterval.isBlank()) {
            try {
                retryIntervalMs = Long.parseLong(envRetryInterval.trim());
            } catch (final NumberFormatException e) {
                logger.warn("Ignoring invalid {}: {}", ENV_RETRY_INTERVAL_MS, envRetryInterval);
            }
        }

        final String propStorePath = System.getProperty(PROP_STORE_PATH);
        if (propStorePath != null && !propStorePath.isBlank()) {
            storePath = propStorePath;
        }

        if (storePath == null || storePath.isBlank()) {
            storePath = defaultStorePath();
        }
    }

    /**
     * Replace {@code ${NAME}} and {@code ${NAME:fallback}} placeholders. Environment variables take
     * precedence over system properties; unresolvable placeholders without fallback become empty.
     */
    static String resolveVariables(final String value) {
        if (value == null || !value.contains("${")) {
            return value;
        }
        final Matcher matcher = PLACEHOLDER.matcher(value);
        final StringBuilder resolved = new StringBuilder();
        while (matcher.find()) {
            final String name = matcher.group(1);
            final String fallback = matcher.group(2) != null ? matcher.group(2) : "";
            String replacement = System.getenv(name);
            if (replacement == null || replacement.isEmpty()) {
                replacement = System.getProperty(name, fallback);
            }
            matcher.appendReplacement(resolved, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(resolved);
        return resolved.toString();
    }

    private static int intValue(final Map<String, Object> values, final String key, final int current) {
        final Object value = values.get(key);
        return value instanceof Number ? ((Number) value).intValue() : current;
    }

    private static long longValue(final Map<String, Object> values, final String key, final long current) {
        final Object value = values.get(key);
        return value instanceof Number ? ((Number) value).longValue() : current;
    }

    private static String defaultStorePath() {
        return getConfigDirectory().resolve("data").toString();
    }

    public static Path getUserConfigPath() {
        return getConfigDirectory().resolve(USER_CONFIG_FILE);
    }

    public static Path getConfigDirectory() {
        return Paths.get(System.getProperty("user.home"), CONFIG_DIR);
    }

    public String getStorePath() {
        return storePath;
    }

    public int getThreadPoolSize() {
        return threadPoolSize;
    }

    public int getArchivePoolSize() {
        return archivePoolSize;
    }

    public long getRetryIntervalMs() {
        return retryIntervalMs;
    }

    public long getDownloadDebounceMs() {
        return downloadDebounceMs;
    }
}
