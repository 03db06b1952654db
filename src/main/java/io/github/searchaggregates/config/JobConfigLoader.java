package io.github.searchaggregates.config;

import io.github.searchaggregates.exception.ConfigurationException;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;
import java.util.Properties;

/**
 * Builds {@link JobConfig.Builder} defaults from a classpath properties file and the environment.
 * Command line options are applied on top by the caller.
 */
public class JobConfigLoader {

    public static final String DEFAULT_CONFIG_FILE = "search-aggregates.properties";

    // Property keys
    static final String INPUT_BUCKET = "search.aggregates.input.bucket";
    static final String INPUT_PREFIX = "search.aggregates.input.prefix";
    static final String INPUT_FORMAT = "search.aggregates.input.format";
    static final String SAVE_MODE = "search.aggregates.save.mode";
    static final String OUTPUT_FORMAT = "search.aggregates.output.format";
    static final String OUTPUT_PARTITIONS = "search.aggregates.output.partitions";
    static final String OUTPUT_VERSION = "search.aggregates.output.version";
    static final String STORAGE_SCHEME = "search.aggregates.storage.scheme";
    static final String APP_NAME = "search.aggregates.app.name";

    // Environment variables
    static final String ENV_INPUT_BUCKET = "SEARCH_AGGREGATES_INPUT_BUCKET";
    static final String ENV_INPUT_PREFIX = "SEARCH_AGGREGATES_INPUT_PREFIX";
    static final String ENV_SAVE_MODE = "SEARCH_AGGREGATES_SAVE_MODE";
    static final String ENV_STORAGE_SCHEME = "SEARCH_AGGREGATES_STORAGE_SCHEME";
    static final String ENV_OUTPUT_PARTITIONS = "SEARCH_AGGREGATES_OUTPUT_PARTITIONS";

    /**
     * Defaults from {@value #DEFAULT_CONFIG_FILE} when present, overridden by the process environment.
     */
    public static JobConfig.Builder load() {
        JobConfig.Builder builder = JobConfig.builder();
        Properties props = loadProperties(DEFAULT_CONFIG_FILE, false);
        applyProperties(builder, props);
        applyEnvironment(builder, System.getenv());
        return builder;
    }

    /**
     * Create builder from a properties file on the classpath
     */
    public static JobConfig.Builder fromProperties(String propertiesFile) {
        JobConfig.Builder builder = JobConfig.builder();
        applyProperties(builder, loadProperties(propertiesFile, true));
        return builder;
    }

    static Properties loadProperties(String filename, boolean required) {
        Properties props = new Properties();

        try (InputStream is = JobConfigLoader.class.getClassLoader().getResourceAsStream(filename)) {
            if (is != null) {
                props.load(is);
            } else if (required) {
                throw new ConfigurationException("Properties file not found: " + filename);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Unable to read properties file: " + filename, e);
        }

        return props;
    }

    static void applyProperties(JobConfig.Builder builder, Properties props) {
        String value;
        if ((value = nonEmpty(props.getProperty(INPUT_BUCKET))) != null) builder.inputBucket(value);
        if ((value = nonEmpty(props.getProperty(INPUT_PREFIX))) != null) builder.inputPrefix(value);
        if ((value = nonEmpty(props.getProperty(INPUT_FORMAT))) != null) builder.inputFormat(value);
        if ((value = nonEmpty(props.getProperty(SAVE_MODE))) != null) builder.saveMode(value);
        if ((value = nonEmpty(props.getProperty(OUTPUT_FORMAT))) != null) builder.outputFormat(value);
        if ((value = nonEmpty(props.getProperty(STORAGE_SCHEME))) != null) builder.storageScheme(value);
        if ((value = nonEmpty(props.getProperty(APP_NAME))) != null) builder.appName(value);
        if ((value = nonEmpty(props.getProperty(OUTPUT_PARTITIONS))) != null) {
            builder.outputPartitions(parseInt(OUTPUT_PARTITIONS, value));
        }
        if ((value = nonEmpty(props.getProperty(OUTPUT_VERSION))) != null) {
            builder.outputVersion(parseInt(OUTPUT_VERSION, value));
        }
    }

    static void applyEnvironment(JobConfig.Builder builder, Map<String, String> env) {
        String value;
        if ((value = nonEmpty(env.get(ENV_INPUT_BUCKET))) != null) builder.inputBucket(value);
        if ((value = nonEmpty(env.get(ENV_INPUT_PREFIX))) != null) builder.inputPrefix(value);
        if ((value = nonEmpty(env.get(ENV_SAVE_MODE))) != null) builder.saveMode(value);
        if ((value = nonEmpty(env.get(ENV_STORAGE_SCHEME))) != null) builder.storageScheme(value);
        if ((value = nonEmpty(env.get(ENV_OUTPUT_PARTITIONS))) != null) {
            builder.outputPartitions(parseInt(ENV_OUTPUT_PARTITIONS, value));
        }
    }

    private static String nonEmpty(String value) {
        if (value == null || value.trim().isEmpty()) {
            return null;
        }
        return value.trim();
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Expected an integer for " + key + " but got: " + value, e);
        }
    }
}
