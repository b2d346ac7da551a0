package com.marker.exception;

/**
 * Exception thrown when an environment or marker configuration is invalid.
 * Results in fail-fast at startup.
 */
public class ConfigurationException extends MarkerException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
