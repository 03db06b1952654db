package io.github.searchaggregates.exception;

/**
 * Base exception for all search aggregation failures.
 */
public class SearchAggregationException extends RuntimeException {

    private final String column;

    public SearchAggregationException(String message) {
        super(message);
        this.column = null;
    }

    public SearchAggregationException(String message, Throwable cause) {
        super(message, cause);
        this.column = null;
    }

    public SearchAggregationException(String column, String message) {
        super(message);
        this.column = column;
    }

    public SearchAggregationException(String column, String message, Throwable cause) {
        super(message, cause);
        this.column = column;
    }

    /**
     * Returns the column the error refers to, or null if it is not tied to one.
     */
    public String getColumn() {
        return column;
    }

    @Override
    public String getMessage() {
        if (column != null && !column.isEmpty()) {
            return "Column '" + column + "': " + super.getMessage();
        }
        return super.getMessage();
    }
}
