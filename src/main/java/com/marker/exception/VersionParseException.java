package com.marker.exception;

/**
 * Exception thrown when a string is not a valid PEP 440 version, pattern or specifier.
 */
public class VersionParseException extends MarkerException {

    public VersionParseException(String message) {
        super(message);
    }
}
