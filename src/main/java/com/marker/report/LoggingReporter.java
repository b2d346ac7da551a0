package com.marker.report;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reporter that forwards every warning to the log.
 */
public final class LoggingReporter implements Reporter {

    public static final LoggingReporter INSTANCE = new LoggingReporter();

    private static final Logger log = LoggerFactory.getLogger(LoggingReporter.class);

    private LoggingReporter() {
    }

    @Override
    public void report(MarkerWarningKind kind, String message) {
        log.warn("{} ({})", message, kind);
    }
}
