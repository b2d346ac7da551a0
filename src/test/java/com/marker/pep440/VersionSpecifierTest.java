package com.marker.pep440;

import com.marker.exception.VersionParseException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for VersionSpecifier construction and containment.
 */
class VersionSpecifierTest {

    @ParameterizedTest
    @DisplayName("Should test containment")
    @CsvSource({
            "==, 3.8, false, 3.8.0, true",
            "==, 3.8, false, 3.8.1, false",
            "==, 3.8, false, 3.8+local, true",
            "==, 3.8, true, 3.8.12, true",
            "==, 3.8, true, 3.9, false",
            "!=, 3.8, true, 3.9, true",
            "!=, 3.8, true, 3.8.1, false",
            "!=, 3.8, false, 3.8.1, true",
            "~=, 3.6, false, 3.7, true",
            "~=, 3.6, false, 3.6, true",
            "~=, 3.6, false, 4.0, false",
            "~=, 3.6.2, false, 3.6.9, true",
            "~=, 3.6.2, false, 3.7.0, false",
            "<, 3.11, false, 3.10, true",
            "<, 3.11, false, 3.11, false",
            "<, 3.11, false, 3.11rc1, false",
            "<, 3.11rc2, false, 3.10, true",
            "<=, 3.11, false, 3.11, true",
            ">, 3.6, false, 3.7, true",
            ">, 3.6, false, 3.6.post1, false",
            ">, 3.6.post1, false, 3.6.post2, true",
            ">, 3.6, false, 3.6+local, false",
            ">=, 3.6, false, 3.6, true",
            ">=, 3.6, false, 3.6rc1, false"
    })
    void shouldTestContainment(String operator, String version, boolean wildcard,
                               String candidate, boolean expected) {
        VersionSpecifier specifier = VersionSpecifier.fromPattern(
                operatorFor(operator), new VersionPattern(Version.parse(version), wildcard));

        assertEquals(expected, specifier.contains(Version.parse(candidate)),
                () -> specifier + " contains " + candidate);
    }

    @Test
    @DisplayName("Should switch to wildcard operators for star patterns")
    void shouldSwitchToWildcardOperators() {
        VersionSpecifier equal = VersionSpecifier.fromPattern(VersionOperator.EQUAL, VersionPattern.parse("3.*"));
        VersionSpecifier notEqual = VersionSpecifier.fromPattern(VersionOperator.NOT_EQUAL, VersionPattern.parse("3.*"));

        assertEquals(VersionOperator.EQUAL_STAR, equal.operator());
        assertEquals(VersionOperator.NOT_EQUAL_STAR, notEqual.operator());
        assertEquals("==3.*", equal.toString());
        assertEquals("!=3.*", notEqual.toString());
    }

    @Test
    @DisplayName("Should reject star with ordering operators")
    void shouldRejectStarWithOrdering() {
        assertThrows(VersionParseException.class,
                () -> VersionSpecifier.fromPattern(VersionOperator.GREATER_THAN, VersionPattern.parse("3.*")));
    }

    @Test
    @DisplayName("Should reject local versions with ordering operators")
    void shouldRejectLocalWithOrdering() {
        assertThrows(VersionParseException.class,
                () -> VersionSpecifier.of(VersionOperator.LESS_THAN, Version.parse("3.8+local")));
        assertDoesNotThrow(() -> VersionSpecifier.of(VersionOperator.EQUAL, Version.parse("3.8+local")));
    }

    @Test
    @DisplayName("Should require two release segments for ~=")
    void shouldRequireTwoSegmentsForTildeEqual() {
        assertThrows(VersionParseException.class,
                () -> VersionSpecifier.of(VersionOperator.TILDE_EQUAL, Version.parse("3")));
    }

    @Test
    @DisplayName("Should reject local versions with wildcards")
    void shouldRejectLocalWildcard() {
        assertThrows(VersionParseException.class, () -> VersionPattern.parse("3.8+local.*"));
    }

    @Test
    @DisplayName("Should compare specifiers by value")
    void shouldCompareByValue() {
        VersionSpecifier a = VersionSpecifier.of(VersionOperator.LESS_THAN, Version.parse("3.6"));
        VersionSpecifier b = VersionSpecifier.lessThan(Version.parse("3.6.0"));

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
    }

    private static VersionOperator operatorFor(String symbol) {
        return switch (symbol) {
            case "==" -> VersionOperator.EQUAL;
            case "!=" -> VersionOperator.NOT_EQUAL;
            case "~=" -> VersionOperator.TILDE_EQUAL;
            case "<" -> VersionOperator.LESS_THAN;
            case "<=" -> VersionOperator.LESS_THAN_EQUAL;
            case ">" -> VersionOperator.GREATER_THAN;
            case ">=" -> VersionOperator.GREATER_THAN_EQUAL;
            default -> throw new IllegalArgumentException(symbol);
        };
    }
}
