package com.netmeasure.supervisor;

/**
 * Thrown when a hard interrupt abandons a collect round.
 */
public class RunAbortedException extends RuntimeException {
    /**
     * Create a new exception.
     *
     * @param message error message
     */
    public RunAbortedException(String message) {
        super(message);
    }

    public RunAbortedException(String message, Throwable cause) {
        super(message, cause);
    }
}
