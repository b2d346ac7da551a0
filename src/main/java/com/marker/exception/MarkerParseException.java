package com.marker.exception;

/**
 * Exception thrown when marker text cannot be parsed.
 * Carries the offending position so callers can point at it.
 */
public class MarkerParseException extends MarkerException {

    private final int position;
    private final String input;

    public MarkerParseException(String message, int position, String input) {
        super("Invalid marker at position " + position + ": " + message + " in '" + input + "'");
        this.position = position;
        this.input = input;
    }

    public int getPosition() {
        return position;
    }

    public String getInput() {
        return input;
    }
}
