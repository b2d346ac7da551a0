package com.marker.exception;

/**
 * Base exception for the marker engine.
 */
public class MarkerException extends RuntimeException {

    public MarkerException(String message) {
        super(message);
    }

    public MarkerException(String message, Throwable cause) {
        super(message, cause);
    }
}
