package com.marker.report;

/**
 * Sink for marker warnings.
 * <p>
 * Passed explicitly into parsing and evaluation so that neither depends on global
 * logging state. Warnings never change a boolean result.
 */
@FunctionalInterface
public interface Reporter {

    /**
     * Report a warning.
     *
     * @param kind    Warning kind
     * @param message Human readable message
     */
    void report(MarkerWarningKind kind, String message);
}
