package io.github.searchaggregates.exception;

/**
 * Thrown when the job or pipeline is configured with values it cannot run with,
 * such as an unknown grouping column or save mode.
 */
public class ConfigurationException extends SearchAggregationException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }

    public ConfigurationException(String column, String message) {
        super(column, message);
    }
}
