package com.marker.config;

import com.marker.environment.MarkerEnvironment;
import com.marker.expression.ExtraName;
import com.marker.pep440.Version;

import java.util.List;

/**
 * Loaded marker configuration.
 *
 * @param environment    Target environment, or null to evaluate extras only
 * @param extras         Extras requested by default
 * @param pythonVersions Candidate Python versions for {@code requires-python} style checks
 */
public record MarkerConfig(
        MarkerEnvironment environment,
        List<ExtraName> extras,
        List<Version> pythonVersions
) {

    public MarkerConfig {
        extras = extras == null ? List.of() : List.copyOf(extras);
        pythonVersions = pythonVersions == null ? List.of() : List.copyOf(pythonVersions);
    }

    public boolean hasEnvironment() {
        return environment != null;
    }
}
