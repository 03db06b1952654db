package io.github.searchaggregates.config;

import io.github.searchaggregates.exception.ConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.HashMap;
import java.util.Map;
import java.util.Properties;

import static org.assertj.core.api.Assertions.*;

class JobConfigTest {

    private static JobConfig.Builder minimal() {
        return JobConfig.builder()
                .submissionDate("20170801")
                .bucket("net-mozaws-prod-us-west-2-pipeline-analysis")
                .prefix("search_dashboard");
    }

    @Nested
    @DisplayName("Builder")
    class BuilderTests {

        @Test
        void appliesDefaults() {
            JobConfig config = minimal().build();

            assertThat(config.getInputBucket()).isEqualTo("telemetry-parquet");
            assertThat(config.getInputPrefix()).isEqualTo("main_summary/v4");
            assertThat(config.getSaveMode()).isEqualTo("error");
            assertThat(config.getOutputPartitions()).isEqualTo(10);
            assertThat(config.getOutputVersion()).isEqualTo(3);
            assertThat(config.getStorageScheme()).isEqualTo("s3");
            assertThat(config.getAppName()).isEqualTo("search_dashboard_etl");
            assertThat(config.getInputFormat()).isEqualTo("parquet");
            assertThat(config.getOutputFormat()).isEqualTo("parquet");
        }

        @Test
        void interpolatesPaths() {
            JobConfig config = minimal().build();

            assertThat(config.getSourcePath())
                    .isEqualTo("s3://telemetry-parquet/main_summary/v4/submission_date_s3=20170801");
            assertThat(config.getOutputPath())
                    .isEqualTo("s3://net-mozaws-prod-us-west-2-pipeline-analysis/search_dashboard/v3/submission_date_s3=20170801");
        }

        @Test
        void honoursInputOverridesAndScheme() {
            JobConfig config = minimal()
                    .inputBucket("other-bucket")
                    .inputPrefix("main_summary/v5")
                    .storageScheme("hdfs")
                    .build();

            assertThat(config.getSourcePath()).isEqualTo("hdfs://other-bucket/main_summary/v5/submission_date_s3=20170801");
            assertThat(config.getOutputPath()).startsWith("hdfs://");
        }

        @Test
        void toBuilderCopiesEverything() {
            JobConfig config = minimal().saveMode("overwrite").outputPartitions(4).build();

            JobConfig copy = config.toBuilder().build();

            assertThat(copy.getOutputPath()).isEqualTo(config.getOutputPath());
            assertThat(copy.getSaveMode()).isEqualTo("overwrite");
            assertThat(copy.getOutputPartitions()).isEqualTo(4);
        }

        @Test
        void requiresSubmissionDateBucketAndPrefix() {
            assertThatThrownBy(() -> JobConfig.builder().bucket("b").prefix("p").build())
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("submission_date");
            assertThatThrownBy(() -> JobConfig.builder().submissionDate("20170801").prefix("p").build())
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("bucket");
            assertThatThrownBy(() -> JobConfig.builder().submissionDate("20170801").bucket("b").prefix(" ").build())
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("prefix");
        }

        @ParameterizedTest
        @ValueSource(strings = {"2017-08-01", "20171301", "201708", "yesterday"})
        void rejectsMalformedSubmissionDates(String date) {
            assertThatThrownBy(() -> minimal().submissionDate(date).build())
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("yyyyMMdd");
        }

        @Test
        void rejectsNonPositivePartitionsAndVersion() {
            assertThatThrownBy(() -> minimal().outputPartitions(0).build()).isInstanceOf(ConfigurationException.class);
            assertThatThrownBy(() -> minimal().outputVersion(0).build()).isInstanceOf(ConfigurationException.class);
        }
    }

    @Nested
    @DisplayName("Loader")
    class LoaderTests {

        @Test
        void loadsPropertiesFromClasspath() {
            JobConfig config = JobConfigLoader.fromProperties("search-aggregates-test.properties")
                    .submissionDate("20170801")
                    .bucket("out")
                    .prefix("rollups")
                    .build();

            assertThat(config.getInputBucket()).isEqualTo("test-input");
            assertThat(config.getSaveMode()).isEqualTo("overwrite");
            assertThat(config.getOutputPartitions()).isEqualTo(2);
            assertThat(config.getStorageScheme()).isEqualTo("file");
        }

        @Test
        void bundledDefaultsMatchBuilderDefaults() {
            JobConfig fromFile = JobConfigLoader.fromProperties(JobConfigLoader.DEFAULT_CONFIG_FILE)
                    .submissionDate("20170801").bucket("b").prefix("p").build();
            JobConfig fromBuilder = minimal().bucket("b").prefix("p").build();

            assertThat(fromFile.getSourcePath()).isEqualTo(fromBuilder.getSourcePath());
            assertThat(fromFile.getOutputPath()).isEqualTo(fromBuilder.getOutputPath());
            assertThat(fromFile.getSaveMode()).isEqualTo(fromBuilder.getSaveMode());
            assertThat(fromFile.getOutputPartitions()).isEqualTo(fromBuilder.getOutputPartitions());
        }

        @Test
        void missingPropertiesFileFails() {
            assertThatThrownBy(() -> JobConfigLoader.fromProperties("does-not-exist.properties"))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("does-not-exist.properties");
        }

        @Test
        void nonNumericPartitionsFail() {
            assertThatThrownBy(() -> JobConfigLoader.fromProperties("search-aggregates-bad-partitions.properties"))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("ten");
        }

        @Test
        void environmentOverridesProperties() {
            JobConfig.Builder builder = JobConfig.builder();
            Properties props = new Properties();
            props.setProperty(JobConfigLoader.INPUT_BUCKET, "from-file");
            props.setProperty(JobConfigLoader.SAVE_MODE, "append");
            JobConfigLoader.applyProperties(builder, props);

            Map<String, String> env = new HashMap<>();
            env.put(JobConfigLoader.ENV_INPUT_BUCKET, "from-env");
            env.put(JobConfigLoader.ENV_OUTPUT_PARTITIONS, "5");
            env.put(JobConfigLoader.ENV_SAVE_MODE, " ");
            JobConfigLoader.applyEnvironment(builder, env);

            JobConfig config = builder.submissionDate("20170801").bucket("b").prefix("p").build();
            assertThat(config.getInputBucket()).isEqualTo("from-env");
            assertThat(config.getSaveMode()).isEqualTo("append");
            assertThat(config.getOutputPartitions()).isEqualTo(5);
        }
    }
}
