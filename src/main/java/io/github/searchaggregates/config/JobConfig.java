package io.github.searchaggregates.config;

import io.github.searchaggregates.exception.ConfigurationException;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * Settings for one run of the search dashboard job.
 *
 * <p>This class uses the builder pattern for configuration and is immutable
 * once constructed.</p>
 */
public final class JobConfig {

    public static final String DEFAULT_INPUT_BUCKET = "telemetry-parquet";
    public static final String DEFAULT_INPUT_PREFIX = "main_summary/v4";
    public static final String DEFAULT_SAVE_MODE = "error";
    public static final String DEFAULT_STORAGE_SCHEME = "s3";
    public static final String DEFAULT_FORMAT = "parquet";
    public static final String DEFAULT_APP_NAME = "search_dashboard_etl";
    public static final int DEFAULT_OUTPUT_PARTITIONS = 10;
    public static final int DEFAULT_OUTPUT_VERSION = 3;

    private static final DateTimeFormatter SUBMISSION_DATE_FORMAT = DateTimeFormatter.BASIC_ISO_DATE;

    // Run
    private final String submissionDate;
    private final String appName;

    // Input
    private final String inputBucket;
    private final String inputPrefix;
    private final String inputFormat;

    // Output
    private final String bucket;
    private final String prefix;
    private final String saveMode;
    private final String outputFormat;
    private final int outputPartitions;
    private final int outputVersion;

    private final String storageScheme;

    private JobConfig(Builder builder) {
        this.submissionDate = builder.submissionDate;
        this.appName = builder.appName;
        this.inputBucket = builder.inputBucket;
        this.inputPrefix = builder.inputPrefix;
        this.inputFormat = builder.inputFormat;
        this.bucket = builder.bucket;
        this.prefix = builder.prefix;
        this.saveMode = builder.saveMode;
        this.outputFormat = builder.outputFormat;
        this.outputPartitions = builder.outputPartitions;
        this.outputVersion = builder.outputVersion;
        this.storageScheme = builder.storageScheme;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getSubmissionDate() {
        return submissionDate;
    }

    public String getAppName() {
        return appName;
    }

    public String getInputBucket() {
        return inputBucket;
    }

    public String getInputPrefix() {
        return inputPrefix;
    }

    public String getInputFormat() {
        return inputFormat;
    }

    public String getBucket() {
        return bucket;
    }

    public String getPrefix() {
        return prefix;
    }

    public String getSaveMode() {
        return saveMode;
    }

    public String getOutputFormat() {
        return outputFormat;
    }

    public int getOutputPartitions() {
        return outputPartitions;
    }

    public int getOutputVersion() {
        return outputVersion;
    }

    public String getStorageScheme() {
        return storageScheme;
    }

    /**
     * Location of the {@code main_summary} snapshot for the submission date.
     */
    public String getSourcePath() {
        return String.format("%s://%s/%s/submission_date_s3=%s",
                storageScheme, inputBucket, inputPrefix, submissionDate);
    }

    /**
     * Location the rollup for the submission date is written to.
     */
    public String getOutputPath() {
        return String.format("%s://%s/%s/v%d/submission_date_s3=%s",
                storageScheme, bucket, prefix, outputVersion, submissionDate);
    }

    public Builder toBuilder() {
        return new Builder()
                .submissionDate(submissionDate)
                .appName(appName)
                .inputBucket(inputBucket)
                .inputPrefix(inputPrefix)
                .inputFormat(inputFormat)
                .bucket(bucket)
                .prefix(prefix)
                .saveMode(saveMode)
                .outputFormat(outputFormat)
                .outputPartitions(outputPartitions)
                .outputVersion(outputVersion)
                .storageScheme(storageScheme);
    }

    @Override
    public String toString() {
        return "JobConfig{" +
                "submissionDate='" + submissionDate + '\'' +
                ", source='" + getSourcePath() + '\'' +
                ", output='" + getOutputPath() + '\'' +
                ", saveMode='" + saveMode + '\'' +
                ", outputPartitions=" + outputPartitions +
                '}';
    }

    /**
     * Builder for JobConfig.
     */
    public static final class Builder {
        private String submissionDate;
        private String appName = DEFAULT_APP_NAME;
        private String inputBucket = DEFAULT_INPUT_BUCKET;
        private String inputPrefix = DEFAULT_INPUT_PREFIX;
        private String inputFormat = DEFAULT_FORMAT;
        private String bucket;
        private String prefix;
        private String saveMode = DEFAULT_SAVE_MODE;
        private String outputFormat = DEFAULT_FORMAT;
        private int outputPartitions = DEFAULT_OUTPUT_PARTITIONS;
        private int outputVersion = DEFAULT_OUTPUT_VERSION;
        private String storageScheme = DEFAULT_STORAGE_SCHEME;

        private Builder() {
        }

        /**
         * Submission date as {@code yyyyMMdd}, e.g. {@code 20170801}.
         */
        public Builder submissionDate(String submissionDate) {
            this.submissionDate = submissionDate;
            return this;
        }

        public Builder appName(String appName) {
            this.appName = appName;
            return this;
        }

        public Builder inputBucket(String inputBucket) {
            this.inputBucket = inputBucket;
            return this;
        }

        public Builder inputPrefix(String inputPrefix) {
            this.inputPrefix = inputPrefix;
            return this;
        }

        public Builder inputFormat(String inputFormat) {
            this.inputFormat = inputFormat;
            return this;
        }

        public Builder bucket(String bucket) {
            this.bucket = bucket;
            return this;
        }

        public Builder prefix(String prefix) {
            this.prefix = prefix;
            return this;
        }

        public Builder saveMode(String saveMode) {
            this.saveMode = saveMode;
            return this;
        }

        public Builder outputFormat(String outputFormat) {
            this.outputFormat = outputFormat;
            return this;
        }

        public Builder outputPartitions(int outputPartitions) {
            this.outputPartitions = outputPartitions;
            return this;
        }

        public Builder outputVersion(int outputVersion) {
            this.outputVersion = outputVersion;
            return this;
        }

        /**
         * File system scheme for both paths, e.g. {@code s3}, {@code hdfs} or {@code file}.
         */
        public Builder storageScheme(String storageScheme) {
            this.storageScheme = storageScheme;
            return this;
        }

        public JobConfig build() {
            requireValue("submission_date", submissionDate);
            requireValue("bucket", bucket);
            requireValue("prefix", prefix);
            requireValue("input_bucket", inputBucket);
            requireValue("input_prefix", inputPrefix);
            requireValue("save_mode", saveMode);
            requireValue("storage_scheme", storageScheme);
            requireValue("app_name", appName);

            try {
                LocalDate.parse(submissionDate, SUBMISSION_DATE_FORMAT);
            } catch (DateTimeParseException e) {
                throw new ConfigurationException("Submission date must be formatted as yyyyMMdd: " + submissionDate, e);
            }
            if (outputPartitions < 1) {
                throw new ConfigurationException("Output partitions must be at least 1");
            }
            if (outputVersion < 1) {
                throw new ConfigurationException("Output version must be at least 1");
            }
            return new JobConfig(this);
        }

        private static void requireValue(String option, String value) {
            if (value == null || value.trim().isEmpty()) {
                throw new ConfigurationException("Missing required option: " + option);
            }
        }
    }
}
