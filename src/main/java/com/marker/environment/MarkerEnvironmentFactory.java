package com.marker.environment;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.marker.exception.ConfigurationException;
import com.marker.expression.StringKey;
import com.marker.expression.VersionKey;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Factory for reading and writing a MarkerEnvironment in its JSON form.
 * Field names are the PEP 508 marker names (e.g. "python_version", "sys_platform").
 */
public class MarkerEnvironmentFactory {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private MarkerEnvironmentFactory() {
    }

    /**
     * Create a MarkerEnvironment from a JSON object.
     *
     * @param json JSON object with one string field per marker
     * @return Environment
     */
    public static MarkerEnvironment fromJson(String json) {
        if (json == null || json.isBlank()) {
            throw new ConfigurationException("Marker environment JSON cannot be empty");
        }
        return fromMap(parseJson(json));
    }

    /**
     * Create a MarkerEnvironment from a map keyed by marker name.
     * Values are converted with {@code toString()}, so YAML numbers such as 3.12 are accepted.
     */
    public static MarkerEnvironment fromMap(Map<String, ?> values) {
        if (values == null) {
            throw new ConfigurationException("Marker environment cannot be null");
        }
        return MarkerEnvironment.builder()
                .implementationName(get(values, StringKey.IMPLEMENTATION_NAME.markerName()))
                .implementationVersion(get(values, VersionKey.IMPLEMENTATION_VERSION.markerName()))
                .osName(get(values, StringKey.OS_NAME.markerName()))
                .platformMachine(get(values, StringKey.PLATFORM_MACHINE.markerName()))
                .platformPythonImplementation(get(values, StringKey.PLATFORM_PYTHON_IMPLEMENTATION.markerName()))
                .platformRelease(get(values, StringKey.PLATFORM_RELEASE.markerName()))
                .platformSystem(get(values, StringKey.PLATFORM_SYSTEM.markerName()))
                .platformVersion(get(values, StringKey.PLATFORM_VERSION.markerName()))
                .pythonFullVersion(get(values, VersionKey.PYTHON_FULL_VERSION.markerName()))
                .pythonVersion(get(values, VersionKey.PYTHON_VERSION.markerName()))
                .sysPlatform(get(values, StringKey.SYS_PLATFORM.markerName()))
                .build();
    }

    /**
     * Write an environment as a JSON object.
     */
    public static String toJson(MarkerEnvironment environment) {
        try {
            return objectMapper.writeValueAsString(toMap(environment));
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Failed to serialize marker environment", e);
        }
    }

    /**
     * Flatten an environment into a map keyed by marker name.
     */
    public static Map<String, String> toMap(MarkerEnvironment environment) {
        Map<String, String> result = new LinkedHashMap<>();
        for (VersionKey key : VersionKey.values()) {
            String text = environment instanceof DefaultMarkerEnvironment defaults
                    ? defaults.getVersionString(key)
                    : environment.getVersion(key).toString();
            result.put(key.markerName(), text);
        }
        for (StringKey key : StringKey.values()) {
            if (!key.isDeprecated()) {
                result.put(key.markerName(), environment.getString(key));
            }
        }
        return result;
    }

    private static String get(Map<String, ?> values, String name) {
        Object value = values.get(name);
        if (value == null) {
            throw new ConfigurationException("Marker environment is missing " + name);
        }
        return value.toString();
    }

    private static Map<String, Object> parseJson(String json) {
        try {
            return objectMapper.readValue(json, new TypeReference<Map<String, Object>>() {});
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Failed to parse marker environment JSON: " + e.getMessage(), e);
        }
    }
}
