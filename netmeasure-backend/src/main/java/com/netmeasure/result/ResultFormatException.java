package com.netmeasure.result;

/**
 * Thrown when a persisted result document is corrupt, unreadable or of an unsupported version.
 */
public class ResultFormatException extends RuntimeException {
    /**
     * Create a new exception.
     *
     * @param message error message
     */
    public ResultFormatException(String message) {
        super(message);
    }

    public ResultFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
