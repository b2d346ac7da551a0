package com.marker.config;

import com.marker.exception.ConfigurationException;
import com.marker.expression.ExtraName;
import com.marker.expression.StringKey;
import com.marker.pep440.Version;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ConfigLoader.
 */
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Should load environment, extras and python versions from the root")
    void shouldLoadRootLayout() {
        MarkerConfig config = ConfigLoader.load("classpath:marker-test.yaml");

        assertTrue(config.hasEnvironment());
        assertEquals("aarch64", config.environment().getString(StringKey.PLATFORM_MACHINE));
        assertEquals(List.of(ExtraName.of("dev-tools"), ExtraName.of("docs")), config.extras());
        assertEquals(List.of(Version.parse("3.9"), Version.parse("3.10"), Version.parse("3.11")),
                config.pythonVersions());
    }

    @Test
    @DisplayName("Should load the marker section without an environment")
    void shouldLoadWithoutEnvironment() {
        MarkerConfig config = ConfigLoader.load("classpath:marker-extras-only.yaml");

        assertFalse(config.hasEnvironment());
        assertNull(config.environment());
        assertEquals(List.of(ExtraName.of("test")), config.extras());
        assertTrue(config.pythonVersions().isEmpty());
    }

    @Test
    @DisplayName("Should load the bundled default configuration")
    void shouldLoadBundledConfiguration() {
        MarkerConfig config = ConfigLoader.load("classpath:marker-environment.yaml");

        assertTrue(config.hasEnvironment());
        assertEquals(3, config.pythonVersions().size());
    }

    @Test
    @DisplayName("Should load from the file system")
    void shouldLoadFromFile() throws IOException {
        Path file = tempDir.resolve("markers.yaml");
        Files.writeString(file, "extras: [gpu]\npython-versions: ['3.12']\n");

        MarkerConfig config = ConfigLoader.load(file.toString());

        assertEquals(List.of(ExtraName.of("gpu")), config.extras());
        assertEquals(List.of(Version.of(3, 12)), config.pythonVersions());
    }

    @Test
    @DisplayName("Should fail on an invalid python version")
    void shouldFailOnInvalidVersion() {
        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> ConfigLoader.load("classpath:marker-bad-version.yaml"));

        assertTrue(e.getMessage().contains("three"));
    }

    @Test
    @DisplayName("Should fail on a missing file")
    void shouldFailOnMissingFile() {
        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> ConfigLoader.load("classpath:does-not-exist.yaml"));

        assertTrue(e.getMessage().startsWith("Configuration file not found: "));
    }

    @Test
    @DisplayName("Should fail on an empty file")
    void shouldFailOnEmptyFile() throws IOException {
        Path file = tempDir.resolve("empty.yaml");
        Files.writeString(file, "");

        assertThrows(ConfigurationException.class, () -> ConfigLoader.load(file.toString()));
    }

    @Test
    @DisplayName("Should fail when extras is not a list")
    void shouldFailOnNonListExtras() throws IOException {
        Path file = tempDir.resolve("scalar.yaml");
        Files.writeString(file, "marker:\n  extras: dev\n");

        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> ConfigLoader.load(file.toString()));
        assertTrue(e.getMessage().contains("extras"));
    }

    @Test
    @DisplayName("Should fail on an invalid extra")
    void shouldFailOnInvalidExtra() throws IOException {
        Path file = tempDir.resolve("bad-extra.yaml");
        Files.writeString(file, "extras: ['-dev']\n");

        assertThrows(ConfigurationException.class, () -> ConfigLoader.load(file.toString()));
    }

    @Test
    @DisplayName("Should fail on an incomplete environment")
    void shouldFailOnIncompleteEnvironment() throws IOException {
        Path file = tempDir.resolve("partial.yaml");
        Files.writeString(file, "environment:\n  python_version: '3.12'\n");

        assertThrows(ConfigurationException.class, () -> ConfigLoader.load(file.toString()));
    }
}
