package com.marker.expression;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for marker keys and operands.
 */
class StringKeyTest {

    @Test
    @DisplayName("Should resolve deprecated spellings to their canonical key")
    void shouldResolveDeprecatedSpellings() {
        StringKey key = StringKey.fromMarkerName("os.name").orElseThrow();

        assertTrue(key.isDeprecated());
        assertEquals(StringKey.OS_NAME, key.canonical());
        assertEquals("os_name", key.toString());
        assertEquals("os.name is deprecated in favor of os_name", key.deprecationMessage());
    }

    @Test
    @DisplayName("Should map python_implementation to platform_python_implementation")
    void shouldMapPythonImplementation() {
        StringKey key = StringKey.fromMarkerName("python_implementation").orElseThrow();

        assertEquals(StringKey.PLATFORM_PYTHON_IMPLEMENTATION, key.canonical());
    }

    @Test
    @DisplayName("Should resolve marker names to operands")
    void shouldResolveMarkerNames() {
        assertEquals(Optional.of(new MarkerValue.EnvVersion(VersionKey.PYTHON_VERSION)),
                MarkerValue.fromMarkerName("python_version"));
        assertEquals(Optional.of(new MarkerValue.EnvString(StringKey.SYS_PLATFORM)),
                MarkerValue.fromMarkerName("sys_platform"));
        assertEquals(Optional.of(new MarkerValue.Extra()), MarkerValue.fromMarkerName("extra"));
        assertTrue(MarkerValue.fromMarkerName("python_versions").isEmpty());
    }

    @Test
    @DisplayName("Should quote literals with single quotes unless they contain one")
    void shouldQuoteLiterals() {
        assertEquals("'linux'", MarkerValue.quote("linux"));
        assertEquals("\"it's\"", MarkerValue.quote("it's"));
        assertEquals("'win32'", new MarkerValue.Literal("win32").toString());
    }
}
