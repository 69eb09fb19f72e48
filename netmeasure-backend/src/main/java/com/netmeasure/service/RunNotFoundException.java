package com.netmeasure.service;

/**
 * Thrown when a run id does not refer to a known run.
 */
public class RunNotFoundException extends RuntimeException {
    public RunNotFoundException(String message) {
        super(message);
    }
}
