package io.github.searchaggregates.files;

import org.apache.spark.sql.Dataset;
import org.apache.spark.sql.Row;
import org.apache.spark.sql.SparkSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads a {@code main_summary} snapshot.
 */
public class MainSummaryReader {

    private static final Logger LOG = LoggerFactory.getLogger(MainSummaryReader.class);

    private final SparkSession spark;
    private final String format;

    public MainSummaryReader(SparkSession spark, String format) {
        this.spark = spark;
        this.format = format;
    }

    public Dataset<Row> read(String sourcePath) {
        LOG.info("Loading main_summary from {} ({})", sourcePath, format);
        return spark.read()
                .format(format)
                .load(sourcePath);
    }
}
