package io.github.searchaggregates.exception;

/**
 * Thrown when the input telemetry does not have the fields the aggregation reads,
 * or carries search count entries with missing or invalid values.
 */
public class DataShapeException extends SearchAggregationException {

    private final long offendingRows;

    public DataShapeException(String column, String message) {
        super(column, message);
        this.offendingRows = 0L;
    }

    public DataShapeException(String column, long offendingRows, String message) {
        super(column, message);
        this.offendingRows = offendingRows;
    }

    /**
     * Returns the number of rows that failed validation, or 0 when the whole dataset is unusable.
     */
    public long getOffendingRows() {
        return offendingRows;
    }
}
