package com.marker;

import com.marker.environment.TestEnvironments;
import com.marker.evaluator.MarkerEvaluator;
import com.marker.report.CollectingReporter;
import com.marker.report.MarkerWarningKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.CommandLineRunner;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the command-line runner.
 */
class MarkerApplicationTest {

    private CollectingReporter reporter;
    private CommandLineRunner runner;

    @BeforeEach
    void setUp() {
        reporter = new CollectingReporter();
        runner = new MarkerApplication().evaluateMarkers(new MarkerEvaluator(TestEnvironments.linux(), reporter));
    }

    @Test
    @DisplayName("Should evaluate the sample markers when no arguments are given")
    void shouldEvaluateSamples() {
        assertDoesNotThrow(() -> runner.run());
        assertTrue(reporter.getWarnings().isEmpty());
    }

    @Test
    @DisplayName("Should evaluate each argument and keep going after a malformed one")
    void shouldEvaluateArguments() {
        assertDoesNotThrow(() -> runner.run("os.name == 'posix'", "python_version >=", "'a' == 'b'"));

        assertEquals(1, reporter.count(MarkerWarningKind.DEPRECATED_MARKER_NAME));
        assertEquals(2, reporter.count(MarkerWarningKind.STRING_STRING_COMPARISON));
    }
}
