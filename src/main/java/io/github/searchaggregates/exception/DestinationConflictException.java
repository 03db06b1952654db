package io.github.searchaggregates.exception;

/**
 * Thrown when the save mode forbids writing into an existing destination and the destination
 * already holds data. Nothing is written when this is raised.
 */
public class DestinationConflictException extends SearchAggregationException {

    private final String destination;

    public DestinationConflictException(String destination) {
        super("Destination already exists and save mode is 'error': " + destination);
        this.destination = destination;
    }

    public String getDestination() {
        return destination;
    }
}
