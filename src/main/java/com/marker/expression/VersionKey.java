package com.marker.expression;

import java.util.Arrays;
import java.util.Optional;

/**
 * Environment markers whose value is a PEP 440 version, such as {@code python_version}.
 */
public enum VersionKey {
    IMPLEMENTATION_VERSION("implementation_version"),
    PYTHON_FULL_VERSION("python_full_version"),
    PYTHON_VERSION("python_version");

    private final String markerName;

    VersionKey(String markerName) {
        this.markerName = markerName;
    }

    public String markerName() {
        return markerName;
    }

    public static Optional<VersionKey> fromMarkerName(String name) {
        return Arrays.stream(values())
                .filter(key -> key.markerName.equals(name))
                .findFirst();
    }

    @Override
    public String toString() {
        return markerName;
    }
}
