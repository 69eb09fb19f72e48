package com.netmeasure.transform;

/**
 * Thrown when a transformer fails on series data.
 */
public class TransformException extends RuntimeException {
    /**
     * Create a new exception.
     *
     * @param message error message
     */
    public TransformException(String message) {
        super(message);
    }

    public TransformException(String message, Throwable cause) {
        super(message, cause);
    }
}
