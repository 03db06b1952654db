package io.github.searchaggregates.spark;

import io.github.searchaggregates.config.JobConfig;
import io.github.searchaggregates.files.MainSummaryReader;
import io.github.searchaggregates.files.RollupWriter;
import org.apache.spark.sql.Dataset;
import org.apache.spark.sql.Row;
import org.apache.spark.sql.SparkSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * SearchDashboardJob - reads a day of {@code main_summary}, builds the search dashboard rollup
 * and saves it.
 *
 * Example usage:
 * <pre>
 * JobConfig config = JobConfig.builder()
 *     .submissionDate("20170801")
 *     .bucket("telemetry-parquet")
 *     .prefix("search_dashboard")
 *     .build();
 *
 * // creates and stops its own session
 * SearchDashboardJob.generateDashboard(config);
 *
 * // or inside an existing session
 * SearchDashboardJob.run(spark, config);
 * </pre>
 */
public class SearchDashboardJob {

    private static final Logger LOG = LoggerFactory.getLogger(SearchDashboardJob.class);

    public static void generateDashboard(JobConfig config) {
        long start = System.currentTimeMillis();
        SparkSession spark = SparkSession.builder()
                .appName(config.getAppName())
                .getOrCreate();

        try {
            run(spark, config);
        } finally {
            spark.stop();
        }
        LOG.info("... done (took: {})", Duration.ofMillis(System.currentTimeMillis() - start));
    }

    /**
     * Reader, pipeline and writer against an existing session. Either the whole rollup is
     * written or the call fails without writing.
     */
    public static SearchAggregatesPipeline.ProcessingResult run(SparkSession spark, JobConfig config) {
        LOG.info("Running search dashboard job with {}", config);

        MainSummaryReader reader = new MainSummaryReader(spark, config.getInputFormat());
        RollupWriter writer = new RollupWriter(
                spark.sparkContext().hadoopConfiguration(),
                config.getOutputFormat(),
                config.getOutputPartitions()
        );
        // fail on a bad save mode before reading anything
        RollupWriter.parseSaveMode(config.getSaveMode());

        Dataset<Row> mainSummary = reader.read(config.getSourcePath());

        LOG.info("Running the search dashboard ETL job...");
        SearchAggregatesPipeline.ProcessingResult result = SearchAggregatesPipeline.forBatch(spark)
                .process(mainSummary);

        writer.write(result.getDataset(), config.getOutputPath(), config.getSaveMode());
        return result;
    }
}
