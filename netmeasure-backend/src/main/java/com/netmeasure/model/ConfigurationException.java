package com.netmeasure.model;

/**
 * Thrown when a run or test definition cannot be executed as configured.
 */
public class ConfigurationException extends RuntimeException {
    /**
     * Create a new exception.
     *
     * @param message error message
     */
    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
