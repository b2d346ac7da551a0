package com.marker.report;

/**
 * A warning captured by a {@link CollectingReporter}.
 *
 * @param kind    Warning kind
 * @param message Human readable message
 */
public record MarkerWarning(MarkerWarningKind kind, String message) {

    @Override
    public String toString() {
        return kind + ": " + message;
    }
}
