package com.marker.environment;

import com.marker.expression.StringKey;
import com.marker.expression.VersionKey;
import com.marker.pep440.Version;

/**
 * The concrete runtime values a marker is evaluated against.
 * Immutable after creation.
 */
public interface MarkerEnvironment {

    /**
     * Get the version-valued marker, e.g. {@code python_version}.
     *
     * @param key Version key
     * @return Parsed version, never null
     */
    Version getVersion(VersionKey key);

    /**
     * Get the string-valued marker, e.g. {@code sys_platform}.
     * Deprecated aliases resolve to their canonical key.
     *
     * @param key String key
     * @return Value, never null
     */
    String getString(StringKey key);

    /**
     * Create a new builder.
     */
    static Builder builder() {
        return new DefaultMarkerEnvironment.Builder();
    }

    /**
     * Builder for MarkerEnvironment.
     */
    interface Builder {
        Builder implementationName(String value);
        Builder implementationVersion(String value);
        Builder osName(String value);
        Builder platformMachine(String value);
        Builder platformPythonImplementation(String value);
        Builder platformRelease(String value);
        Builder platformSystem(String value);
        Builder platformVersion(String value);
        Builder pythonFullVersion(String value);
        Builder pythonVersion(String value);
        Builder sysPlatform(String value);
        MarkerEnvironment build();
    }
}
