package com.marker.environment;

import com.marker.exception.ConfigurationException;
import com.marker.exception.VersionParseException;
import com.marker.expression.StringKey;
import com.marker.expression.VersionKey;
import com.marker.pep440.Version;

import java.util.EnumMap;
import java.util.Map;

/**
 * Default implementation of MarkerEnvironment.
 * Version values keep their original text next to the parsed version.
 */
public class DefaultMarkerEnvironment implements MarkerEnvironment {

    private final Map<VersionKey, String> versionStrings;
    private final Map<VersionKey, Version> versions;
    private final Map<StringKey, String> strings;

    private DefaultMarkerEnvironment(Builder builder) {
        this.versionStrings = new EnumMap<>(builder.versionStrings);
        this.versions = new EnumMap<>(VersionKey.class);
        for (Map.Entry<VersionKey, String> entry : versionStrings.entrySet()) {
            try {
                versions.put(entry.getKey(), Version.parse(entry.getValue()));
            } catch (VersionParseException e) {
                throw new ConfigurationException("Invalid " + entry.getKey() + " '" + entry.getValue() + "'", e);
            }
        }
        this.strings = new EnumMap<>(builder.strings);
    }

    @Override
    public Version getVersion(VersionKey key) {
        return versions.get(key);
    }

    @Override
    public String getString(StringKey key) {
        return strings.get(key.canonical());
    }

    /**
     * The version text exactly as supplied, e.g. "3.12.0rc1".
     */
    public String getVersionString(VersionKey key) {
        return versionStrings.get(key);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DefaultMarkerEnvironment that)) {
            return false;
        }
        return versionStrings.equals(that.versionStrings) && strings.equals(that.strings);
    }

    @Override
    public int hashCode() {
        return 31 * versionStrings.hashCode() + strings.hashCode();
    }

    @Override
    public String toString() {
        return "MarkerEnvironment{" + versionStrings + ", " + strings + "}";
    }

    /**
     * Builder for DefaultMarkerEnvironment. Every marker must be set.
     */
    public static class Builder implements MarkerEnvironment.Builder {
        private final Map<VersionKey, String> versionStrings = new EnumMap<>(VersionKey.class);
        private final Map<StringKey, String> strings = new EnumMap<>(StringKey.class);

        @Override
        public Builder implementationName(String value) {
            strings.put(StringKey.IMPLEMENTATION_NAME, value);
            return this;
        }

        @Override
        public Builder implementationVersion(String value) {
            versionStrings.put(VersionKey.IMPLEMENTATION_VERSION, value);
            return this;
        }

        @Override
        public Builder osName(String value) {
            strings.put(StringKey.OS_NAME, value);
            return this;
        }

        @Override
        public Builder platformMachine(String value) {
            strings.put(StringKey.PLATFORM_MACHINE, value);
            return this;
        }

        @Override
        public Builder platformPythonImplementation(String value) {
            strings.put(StringKey.PLATFORM_PYTHON_IMPLEMENTATION, value);
            return this;
        }

        @Override
        public Builder platformRelease(String value) {
            strings.put(StringKey.PLATFORM_RELEASE, value);
            return this;
        }

        @Override
        public Builder platformSystem(String value) {
            strings.put(StringKey.PLATFORM_SYSTEM, value);
            return this;
        }

        @Override
        public Builder platformVersion(String value) {
            strings.put(StringKey.PLATFORM_VERSION, value);
            return this;
        }

        @Override
        public Builder pythonFullVersion(String value) {
            versionStrings.put(VersionKey.PYTHON_FULL_VERSION, value);
            return this;
        }

        @Override
        public Builder pythonVersion(String value) {
            versionStrings.put(VersionKey.PYTHON_VERSION, value);
            return this;
        }

        @Override
        public Builder sysPlatform(String value) {
            strings.put(StringKey.SYS_PLATFORM, value);
            return this;
        }

        @Override
        public MarkerEnvironment build() {
            for (VersionKey key : VersionKey.values()) {
                if (versionStrings.get(key) == null) {
                    throw new ConfigurationException("Marker environment is missing " + key);
                }
            }
            for (StringKey key : StringKey.values()) {
                if (!key.isDeprecated() && strings.get(key) == null) {
                    throw new ConfigurationException("Marker environment is missing " + key);
                }
            }
            return new DefaultMarkerEnvironment(this);
        }
    }
}
