package com.marker.tree.json;

import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.marker.exception.MarkerParseException;
import com.marker.tree.MarkerTree;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for MarkerTreeModule.
 */
class MarkerTreeModuleTest {

    record Requirement(String name, MarkerTree marker) {
    }

    private ObjectMapper mapper;

    @BeforeEach
    void setUp() {
        mapper = new ObjectMapper().registerModule(new MarkerTreeModule());
    }

    @Test
    @DisplayName("Should write a marker as its display string")
    void shouldSerializeAsString() throws Exception {
        MarkerTree marker = MarkerTree.parse("'3.6' < python_version and extra == 'Dev_Tools'");

        assertEquals("\"python_version > '3.6' and extra == 'dev-tools'\"", mapper.writeValueAsString(marker));
    }

    @Test
    @DisplayName("Should read a marker field by parsing it")
    void shouldDeserializeField() throws Exception {
        Requirement requirement = mapper.readValue(
                "{\"name\":\"pywin32\",\"marker\":\"sys_platform == 'win32'\"}", Requirement.class);

        assertEquals("pywin32", requirement.name());
        assertEquals(MarkerTree.parse("sys_platform == 'win32'"), requirement.marker());
    }

    @Test
    @DisplayName("Should round-trip a marker through JSON")
    void shouldRoundTrip() throws Exception {
        Requirement requirement = new Requirement("colorama",
                MarkerTree.parse("os_name == 'nt' or (python_version < '3.8' and platform_machine != 'arm64')"));

        String json = mapper.writeValueAsString(requirement);

        assertEquals(requirement, mapper.readValue(json, Requirement.class));
    }

    @Test
    @DisplayName("Should read an empty string as the universal marker")
    void shouldReadEmptyAsUniversal() throws Exception {
        assertTrue(mapper.readValue("\"\"", MarkerTree.class).isUniversal());
        assertEquals("\"\"", mapper.writeValueAsString(MarkerTree.universal()));
    }

    @Test
    @DisplayName("Should fail on malformed marker text")
    void shouldFailOnMalformedMarker() {
        JsonMappingException e = assertThrows(JsonMappingException.class,
                () -> mapper.readValue("\"python_version >= 3.8\"", MarkerTree.class));

        assertInstanceOf(MarkerParseException.class, e.getCause());
        assertTrue(e.getOriginalMessage().contains("position 18"));
    }

    @Test
    @DisplayName("Should fail on a non-string token")
    void shouldFailOnNonString() {
        assertThrows(JsonMappingException.class, () -> mapper.readValue("{\"name\":\"x\",\"marker\":42}", Requirement.class));
    }
}
