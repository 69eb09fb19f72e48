package com.netmeasure.aggregation;

/**
 * Thrown when a round produced no usable data from any worker.
 */
public class AggregationException extends RuntimeException {
    /**
     * Create a new exception.
     *
     * @param message error message
     */
    public AggregationException(String message) {
        super(message);
    }

    public AggregationException(String message, Throwable cause) {
        super(message, cause);
    }
}
