package com.netmeasure.service;

/**
 * Thrown when no test definition with the requested name is loaded.
 */
public class TestNotFoundException extends RuntimeException {
    public TestNotFoundException(String message) {
        super(message);
    }
}
