package com.marker.config;

import com.marker.environment.MarkerEnvironment;
import com.marker.environment.MarkerEnvironmentFactory;
import com.marker.exception.ConfigurationException;
import com.marker.exception.MarkerException;
import com.marker.expression.ExtraName;
import com.marker.pep440.Version;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Loads marker configuration from YAML files.
 * <p>
 * Expected layout, either at the root or under a {@code marker} key:
 * <pre>
 * environment:
 *   python_version: "3.12"
 *   sys_platform: linux
 *   ...
 * extras: [dev, docs]
 * python-versions: ["3.10", "3.11", "3.12"]
 * </pre>
 * Quote versions such as {@code "3.10"}; YAML would otherwise read them as numbers.
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private ConfigLoader() {
    }

    /**
     * Load configuration from a path.
     * Supports classpath: prefix for classpath resources.
     *
     * @param path Path to the configuration file
     * @return Loaded configuration
     * @throws ConfigurationException if the file is missing or invalid
     */
    public static MarkerConfig load(String path) {
        log.info("Loading marker configuration from: {}", path);

        Resource resource = getResource(path);
        if (!resource.exists()) {
            throw new ConfigurationException("Configuration file not found: " + path);
        }
        try (InputStream inputStream = resource.getInputStream()) {
            return parseYaml(inputStream);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    private static Resource getResource(String path) {
        if (path.startsWith("classpath:")) {
            String resourcePath = path.substring("classpath:".length());
            return new ClassPathResource(resourcePath);
        }
        return new FileSystemResource(path);
    }

    @SuppressWarnings("unchecked")
    private static MarkerConfig parseYaml(InputStream inputStream) {
        Yaml yaml = new Yaml();
        Map<String, Object> root = yaml.load(inputStream);

        if (root == null) {
            throw new ConfigurationException("Configuration file is empty");
        }

        // The marker section can be at the root or under 'marker'
        Map<String, Object> markerConfig = root.containsKey("marker")
                ? (Map<String, Object>) root.get("marker")
                : root;

        MarkerEnvironment environment = parseEnvironment((Map<String, Object>) markerConfig.get("environment"));
        List<ExtraName> extras = parseExtras(getList(markerConfig, "extras"));
        List<Version> pythonVersions = parsePythonVersions(getList(markerConfig, "python-versions"));

        MarkerConfig config = new MarkerConfig(environment, extras, pythonVersions);

        log.info("Loaded marker configuration: environment={}, {} extras, {} python versions",
                environment != null ? "present" : "none", extras.size(), pythonVersions.size());

        return config;
    }

    private static MarkerEnvironment parseEnvironment(Map<String, Object> map) {
        if (map == null) {
            log.warn("No environment configured, markers will be evaluated against extras only");
            return null;
        }
        MarkerEnvironment environment = MarkerEnvironmentFactory.fromMap(map);
        log.debug("Parsed marker environment: {}", environment);
        return environment;
    }

    private static List<ExtraName> parseExtras(List<Object> list) {
        List<ExtraName> extras = new ArrayList<>();
        for (Object item : list) {
            try {
                extras.add(ExtraName.of(item.toString()));
            } catch (MarkerException e) {
                throw new ConfigurationException("Invalid extra in configuration: '" + item + "'", e);
            }
        }
        return extras;
    }

    private static List<Version> parsePythonVersions(List<Object> list) {
        List<Version> versions = new ArrayList<>();
        for (Object item : list) {
            try {
                versions.add(Version.parse(item.toString()));
            } catch (MarkerException e) {
                throw new ConfigurationException("Invalid python version in configuration: '" + item + "'", e);
            }
        }
        return versions;
    }

    // Helper methods

    @SuppressWarnings("unchecked")
    private static List<Object> getList(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value == null) return List.of();
        if (value instanceof List) return (List<Object>) value;
        throw new ConfigurationException("Expected a list for '" + key + "', found: " + value);
    }
}
