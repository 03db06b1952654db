package io.github.searchaggregates.files;

import io.github.searchaggregates.exception.ConfigurationException;
import io.github.searchaggregates.exception.DestinationConflictException;
import io.github.searchaggregates.exception.SearchAggregationException;
import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.fs.FileSystem;
import org.apache.hadoop.fs.Path;
import org.apache.spark.sql.Dataset;
import org.apache.spark.sql.Row;
import org.apache.spark.sql.SaveMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Locale;

/**
 * Persists a rollup dataset. The partition count only controls how many files are written.
 */
public class RollupWriter {

    private static final Logger LOG = LoggerFactory.getLogger(RollupWriter.class);

    private final Configuration hadoopConf;
    private final String format;
    private final int partitions;

    public RollupWriter(Configuration hadoopConf, String format, int partitions) {
        if (partitions < 1) {
            throw new ConfigurationException("Output partitions must be at least 1");
        }
        this.hadoopConf = hadoopConf;
        this.format = format;
        this.partitions = partitions;
    }

    /**
     * Writes {@code rollup} to {@code destination}. With save mode {@code error} an existing
     * destination fails the write before any file is produced.
     */
    public void write(Dataset<Row> rollup, String destination, String saveMode) {
        SaveMode mode = parseSaveMode(saveMode);
        if (mode == SaveMode.ErrorIfExists && exists(destination)) {
            throw new DestinationConflictException(destination);
        }

        LOG.info("Saving rollups to: {} (mode={}, partitions={})", destination, mode, partitions);
        rollup.repartition(partitions)
                .write()
                .mode(mode)
                .format(format)
                .save(destination);
    }

    /**
     * Accepts the same names as {@code DataFrameWriter.mode(String)}.
     */
    public static SaveMode parseSaveMode(String saveMode) {
        if (saveMode == null) {
            throw new ConfigurationException("Save mode cannot be null");
        }
        switch (saveMode.toLowerCase(Locale.ROOT)) {
            case "error":
            case "errorifexists":
            case "default":
                return SaveMode.ErrorIfExists;
            case "overwrite":
                return SaveMode.Overwrite;
            case "append":
                return SaveMode.Append;
            case "ignore":
                return SaveMode.Ignore;
            default:
                throw new ConfigurationException("Unknown save mode: " + saveMode
                        + ". Accepted save modes are 'overwrite', 'append', 'ignore', 'error', 'errorifexists', 'default'.");
        }
    }

    private boolean exists(String destination) {
        Path path = new Path(destination);
        try {
            FileSystem fs = path.getFileSystem(hadoopConf);
            return fs.exists(path);
        } catch (IOException e) {
            throw new SearchAggregationException("Unable to inspect destination " + destination, e);
        }
    }
}
