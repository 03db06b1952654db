package io.github.searchaggregates.spark;

import io.github.searchaggregates.exception.ConfigurationException;
import io.github.searchaggregates.exception.DataShapeException;
import io.github.searchaggregates.model.SearchType;
import org.apache.spark.sql.Column;
import org.apache.spark.sql.Dataset;
import org.apache.spark.sql.Row;
import org.apache.spark.sql.SparkSession;
import org.apache.spark.sql.functions;
import org.apache.spark.sql.types.DataTypes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

import static io.github.searchaggregates.model.SearchColumns.*;
import static org.apache.spark.sql.functions.col;
import static org.apache.spark.sql.functions.first;
import static org.apache.spark.sql.functions.lit;
import static org.apache.spark.sql.functions.sum;
import static org.apache.spark.sql.functions.when;

/**
 * Explodes, classifies and pivots {@code main_summary} search counts into the search
 * dashboard rollup.
 *
 * <pre>
 * // default dashboard dimensions
 * Dataset&lt;Row&gt; rollup = SearchAggregatesPipeline.searchAggregates(mainSummary);
 *
 * // custom dimensions with an extra aggregate
 * ProcessingResult result = SearchAggregatesPipeline.forBatch(spark)
 *     .groupBy("submission_date", "country", "engine")
 *     .withAuxiliaryAggregates(AuxiliaryAggregate.of("clients", countDistinct("client_id")))
 *     .withErrorHandling(ErrorHandling.SKIP_MALFORMED)
 *     .process(mainSummary);
 * </pre>
 *
 * The three stages are also exposed on their own as {@link #explode}, {@link #classify} and
 * {@link #aggregate}.
 */
public class SearchAggregatesPipeline {

    private static final Logger LOG = LoggerFactory.getLogger(SearchAggregatesPipeline.class);

    /**
     * Search count entries at or above this value are treated as bogus client data and dropped.
     */
    public static final int MAX_CLIENT_SEARCH_COUNT = 10000;

    private static final String EXPLODED_ENTRY = "single_search_count";
    private static final String ENTRY_STATUS = "_entry_status";

    private static final String RETAINED = "retained";
    private static final String OVER_CEILING = "over_ceiling";
    private static final String MALFORMED = "malformed";

    private final SparkSession spark;
    private final PipelineConfig config;

    /**
     * What to do with search count entries missing engine, source or count.
     */
    public enum ErrorHandling {
        FAIL_FAST,
        SKIP_MALFORMED
    }

    /**
     * Pipeline configuration
     */
    public static class PipelineConfig {
        private final List<String> groupingColumns = new ArrayList<>(DEFAULT_GROUPING_COLUMNS);
        private final List<AuxiliaryAggregate> auxiliaryAggregates = new ArrayList<>();
        private ErrorHandling errorHandling = ErrorHandling.FAIL_FAST;
        private int maxClientSearchCount = MAX_CLIENT_SEARCH_COUNT;
        private boolean enableMetrics = true;

        public List<String> getGroupingColumns() {
            return Collections.unmodifiableList(groupingColumns);
        }

        public List<AuxiliaryAggregate> getAuxiliaryAggregates() {
            return Collections.unmodifiableList(auxiliaryAggregates);
        }

        public ErrorHandling getErrorHandling() {
            return errorHandling;
        }

        public int getMaxClientSearchCount() {
            return maxClientSearchCount;
        }
    }

    /**
     * Processing result with metrics
     */
    public static class ProcessingResult {
        private final Dataset<Row> dataset;
        private final ProcessingMetrics metrics;

        ProcessingResult(Dataset<Row> dataset, ProcessingMetrics metrics) {
            this.dataset = dataset;
            this.metrics = metrics;
        }

        public Dataset<Row> getDataset() { return dataset; }
        public ProcessingMetrics getMetrics() { return metrics; }
    }

    /**
     * Processing metrics. Entry counts stay at zero when metrics are disabled and
     * malformed entries are skipped, since no pass over the data is made then.
     */
    public static class ProcessingMetrics {
        private long inputRecords;
        private long searchCountEntries;
        private long retainedEntries;
        private long entriesOverCeiling;
        private long malformedEntries;
        private long processingTimeMs;

        public long getInputRecords() { return inputRecords; }
        public long getSearchCountEntries() { return searchCountEntries; }
        public long getRetainedEntries() { return retainedEntries; }
        public long getEntriesOverCeiling() { return entriesOverCeiling; }
        public long getMalformedEntries() { return malformedEntries; }
        public long getProcessingTimeMs() { return processingTimeMs; }

        public double getRetentionRate() {
            return searchCountEntries > 0 ? (double) retainedEntries / searchCountEntries : 0.0;
        }

        @Override
        public String toString() {
            return String.format(
                    "ProcessingMetrics[records=%d, entries=%d, retained=%d (%.2f%%), overCeiling=%d, malformed=%d, time=%dms]",
                    inputRecords, searchCountEntries, retainedEntries, getRetentionRate() * 100,
                    entriesOverCeiling, malformedEntries, processingTimeMs
            );
        }
    }


    private SearchAggregatesPipeline(SparkSession spark) {
        this.spark = spark;
        this.config = new PipelineConfig();
    }

    public static SearchAggregatesPipeline forBatch(SparkSession spark) {
        return new SearchAggregatesPipeline(spark);
    }

    /**
     * The search dashboard rollup: default dimensions, no auxiliary aggregates.
     */
    public static Dataset<Row> searchAggregates(Dataset<Row> mainSummary) {
        return forBatch(mainSummary.sparkSession())
                .process(mainSummary)
                .getDataset();
    }


    /**
     * Replaces the grouping dimensions. An empty list rolls everything up into one row.
     */
    public SearchAggregatesPipeline groupBy(String... columns) {
        return groupBy(Arrays.asList(columns));
    }

    public SearchAggregatesPipeline groupBy(List<String> columns) {
        if (columns == null) {
            throw new ConfigurationException("Grouping columns cannot be null");
        }
        this.config.groupingColumns.clear();
        this.config.groupingColumns.addAll(columns);
        return this;
    }

    public SearchAggregatesPipeline withAuxiliaryAggregates(AuxiliaryAggregate... aggregates) {
        this.config.auxiliaryAggregates.addAll(Arrays.asList(aggregates));
        return this;
    }

    public SearchAggregatesPipeline withErrorHandling(ErrorHandling strategy) {
        this.config.errorHandling = strategy;
        return this;
    }

    public SearchAggregatesPipeline withMaxClientSearchCount(int maxClientSearchCount) {
        this.config.maxClientSearchCount = maxClientSearchCount;
        return this;
    }

    public SearchAggregatesPipeline disableMetrics() {
        this.config.enableMetrics = false;
        return this;
    }


    /**
     * Runs explode, classify and aggregate. Configuration problems are reported before
     * any Spark job is started.
     */
    public ProcessingResult process(Dataset<Row> mainSummary) {
        long startTime = System.currentTimeMillis();
        validateConfiguration();
        requireSearchCounts(mainSummary);
        validateGrouping(expectedClassifiedColumns(mainSummary));

        ProcessingMetrics metrics = new ProcessingMetrics();
        Dataset<Row> exploded;
        // labels the counting passes in the Spark UI
        spark.sparkContext().setJobDescription("search aggregates: counting search count entries");
        try {
            if (config.enableMetrics) {
                metrics.inputRecords = mainSummary.count();
            }
            exploded = explode(mainSummary, metrics);
        } finally {
            spark.sparkContext().setJobDescription(null);
        }
        Dataset<Row> classified = classify(exploded);
        Dataset<Row> aggregated = aggregate(classified);

        metrics.processingTimeMs = System.currentTimeMillis() - startTime;
        LOG.info("Search aggregation prepared: {}", metrics);
        return new ProcessingResult(aggregated, metrics);
    }


    /**
     * One row per {@code search_counts} entry, with {@code engine}, {@code source} and
     * {@code count} as top-level columns and {@code search_counts} dropped. Entries whose count
     * reaches the ceiling are removed; malformed entries fail the call or are skipped according
     * to the configured {@link ErrorHandling}.
     */
    public Dataset<Row> explode(Dataset<Row> mainSummary) {
        validateConfiguration();
        requireSearchCounts(mainSummary);
        return explode(mainSummary, new ProcessingMetrics());
    }

    private Dataset<Row> explode(Dataset<Row> mainSummary, ProcessingMetrics metrics) {
        Dataset<Row> flattened = mainSummary
                .withColumn(EXPLODED_ENTRY, functions.explode(col(SEARCH_COUNTS)))
                .select(
                        col("*"),
                        col(EXPLODED_ENTRY + "." + ENGINE).as(ENGINE),
                        col(EXPLODED_ENTRY + "." + SOURCE).as(SOURCE),
                        col(EXPLODED_ENTRY + "." + COUNT).as(COUNT)
                )
                .drop(EXPLODED_ENTRY)
                .drop(SEARCH_COUNTS)
                .withColumn(ENTRY_STATUS, entryStatus());

        if (config.errorHandling == ErrorHandling.FAIL_FAST || config.enableMetrics) {
            collectEntryMetrics(flattened, metrics);
            if (metrics.malformedEntries > 0) {
                if (config.errorHandling == ErrorHandling.FAIL_FAST) {
                    throw new DataShapeException(SEARCH_COUNTS, metrics.malformedEntries, String.format(
                            "%d search count entries are missing engine, source or count, or have a negative count",
                            metrics.malformedEntries));
                }
                LOG.warn("Skipping {} malformed search count entries", metrics.malformedEntries);
            }
        }

        return flattened
                .filter(col(ENTRY_STATUS).equalTo(RETAINED))
                .drop(ENTRY_STATUS);
    }

    private Column entryStatus() {
        Column malformed = col(ENGINE).isNull()
                .or(col(SOURCE).isNull())
                .or(col(COUNT).isNull())
                .or(col(COUNT).lt(0));
        return when(malformed, lit(MALFORMED))
                .when(col(COUNT).geq(config.maxClientSearchCount), lit(OVER_CEILING))
                .otherwise(lit(RETAINED));
    }

    /**
     * Counts entries per status in a single pass.
     */
    private void collectEntryMetrics(Dataset<Row> flattened, ProcessingMetrics metrics) {
        Map<String, Long> statusCounts = new HashMap<>();
        for (Row r : flattened.groupBy(ENTRY_STATUS).count().collectAsList()) {
            statusCounts.put(r.getString(0), r.getLong(1));
        }

        metrics.retainedEntries = statusCounts.getOrDefault(RETAINED, 0L);
        metrics.entriesOverCeiling = statusCounts.getOrDefault(OVER_CEILING, 0L);
        metrics.malformedEntries = statusCounts.getOrDefault(MALFORMED, 0L);
        metrics.searchCountEntries = metrics.retainedEntries + metrics.entriesOverCeiling + metrics.malformedEntries;

        LOG.debug("Search count entries by status: {}", statusCounts);
    }


    /**
     * Adds {@code type} and {@code addon_version}. Inputs without an {@code active_addons}
     * column get a null {@code addon_version}.
     */
    public Dataset<Row> classify(Dataset<Row> exploded) {
        if (!hasColumn(exploded, SOURCE)) {
            throw new DataShapeException(SOURCE, "Dataset has not been exploded into search count entries");
        }
        Column addonVersion = hasColumn(exploded, ACTIVE_ADDONS)
                ? SearchAggregatesFunctions.addonVersion(col(ACTIVE_ADDONS))
                : lit(null).cast(DataTypes.StringType);

        return exploded
                .withColumn(TYPE, SearchAggregatesFunctions.searchType(col(SOURCE)))
                .withColumn(ADDON_VERSION, addonVersion);
    }


    /**
     * Sums {@code count} per grouping dimensions and search type, then expands the type into one
     * column per {@link SearchType}. A type with no events in a group is null in that row.
     */
    public Dataset<Row> aggregate(Dataset<Row> classified) {
        validateConfiguration();
        validateGrouping(new LinkedHashSet<>(Arrays.asList(classified.columns())));

        Column[] keys = config.groupingColumns.stream().map(functions::col).toArray(Column[]::new);
        Column[] keysWithType = Arrays.copyOf(keys, keys.length + 1);
        keysWithType[keys.length] = col(TYPE);

        List<Column> byTypeAggregates = new ArrayList<>();
        byTypeAggregates.add(sum(col(COUNT)).as(COUNT));
        for (AuxiliaryAggregate aggregate : config.auxiliaryAggregates) {
            byTypeAggregates.add(aggregate.named());
        }

        Dataset<Row> byType = classified
                .groupBy(keysWithType)
                .agg(byTypeAggregates.get(0), tail(byTypeAggregates));

        List<Column> pivoted = new ArrayList<>();
        for (SearchType type : SearchType.values()) {
            pivoted.add(sum(when(isType(type), col(COUNT))).as(type.getLabel()));
        }
        for (AuxiliaryAggregate aggregate : config.auxiliaryAggregates) {
            for (SearchType type : SearchType.values()) {
                // (dimensions, type) is unique in byType, so at most one value is non-null
                pivoted.add(first(when(isType(type), col(aggregate.getName())), true)
                        .as(aggregate.pivotedName(type.getLabel())));
            }
        }

        LOG.debug("Pivoting search counts over {} by {}", SearchType.labels(), config.groupingColumns);
        return byType
                .groupBy(keys)
                .agg(pivoted.get(0), tail(pivoted));
    }

    private static Column isType(SearchType type) {
        return col(TYPE).equalTo(type.getLabel());
    }

    private static Column[] tail(List<Column> columns) {
        return columns.subList(1, columns.size()).toArray(new Column[0]);
    }


    /**
     * Columns {@link #classify} will produce for the given input.
     */
    static Set<String> expectedClassifiedColumns(Dataset<Row> mainSummary) {
        Set<String> columns = new LinkedHashSet<>(Arrays.asList(mainSummary.columns()));
        columns.remove(SEARCH_COUNTS);
        columns.addAll(Arrays.asList(ENGINE, SOURCE, COUNT, TYPE, ADDON_VERSION));
        return columns;
    }

    private void validateGrouping(Set<String> availableColumns) {
        Set<String> seen = new HashSet<>();
        for (String column : config.groupingColumns) {
            if (column == null || column.trim().isEmpty()) {
                throw new ConfigurationException("Grouping column names cannot be null or empty");
            }
            if (TYPE.equals(column) || COUNT.equals(column) || SearchType.labels().contains(column)) {
                throw new ConfigurationException(column, "Cannot group by a column the pivot produces or sums");
            }
            if (!seen.add(column)) {
                throw new ConfigurationException(column, "Grouping column is listed more than once");
            }
            if (!availableColumns.contains(column)) {
                throw new ConfigurationException(column,
                        "Grouping column does not exist. Available columns: " + availableColumns);
            }
        }

        Set<String> names = new HashSet<>();
        for (AuxiliaryAggregate aggregate : config.auxiliaryAggregates) {
            String name = aggregate.getName();
            if (TYPE.equals(name) || COUNT.equals(name) || seen.contains(name)) {
                throw new ConfigurationException(name, "Auxiliary aggregate name collides with a grouping column");
            }
            if (!names.add(name)) {
                throw new ConfigurationException(name, "Auxiliary aggregate name is used more than once");
            }
            for (SearchType type : SearchType.values()) {
                String pivoted = aggregate.pivotedName(type.getLabel());
                if (seen.contains(pivoted)) {
                    throw new ConfigurationException(pivoted,
                            "Pivoted auxiliary aggregate collides with a grouping column");
                }
            }
        }
    }

    private static void requireSearchCounts(Dataset<Row> mainSummary) {
        if (!hasColumn(mainSummary, SEARCH_COUNTS)) {
            throw new DataShapeException(SEARCH_COUNTS, "Input dataset has no search counts to explode");
        }
        for (String column : Arrays.asList(ENGINE, SOURCE, COUNT)) {
            if (hasColumn(mainSummary, column)) {
                throw new DataShapeException(column,
                        "Input dataset already has a top-level column produced by exploding search counts");
            }
        }
    }

    private static boolean hasColumn(Dataset<Row> dataset, String column) {
        return Arrays.asList(dataset.columns()).contains(column);
    }

    public void validateConfiguration() {
        if (config.errorHandling == null) {
            throw new ConfigurationException("Error handling strategy cannot be null");
        }
        if (config.maxClientSearchCount < 1) {
            throw new ConfigurationException("Max client search count must be at least 1");
        }
    }

    public PipelineConfig getConfig() {
        return config;
    }
}
