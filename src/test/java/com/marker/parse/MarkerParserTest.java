package com.marker.parse;

import com.marker.environment.TestEnvironments;
import com.marker.exception.MarkerParseException;
import com.marker.expression.ExtraName;
import com.marker.expression.ExtraOperator;
import com.marker.expression.MarkerOperator;
import com.marker.expression.StringKey;
import com.marker.expression.VersionKey;
import com.marker.expression.impl.ArbitraryExpression;
import com.marker.expression.impl.ExtraExpression;
import com.marker.expression.impl.StringExpression;
import com.marker.expression.impl.VersionExpression;
import com.marker.pep440.Version;
import com.marker.pep440.VersionOperator;
import com.marker.pep440.VersionSpecifier;
import com.marker.report.CollectingReporter;
import com.marker.report.MarkerWarningKind;
import com.marker.tree.MarkerTree;
import com.marker.tree.impl.AndTree;
import com.marker.tree.impl.OrTree;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for MarkerParser.
 */
class MarkerParserTest {

    private CollectingReporter reporter;

    @BeforeEach
    void setUp() {
        reporter = new CollectingReporter();
    }

    private MarkerTree parse(String markers) {
        return MarkerTree.parse(markers, reporter);
    }

    // =====================================================================
    // Structure
    // =====================================================================

    @Test
    @DisplayName("Should parse a version comparison")
    void shouldParseVersionComparison() {
        MarkerTree tree = parse("python_version >= \"3.8\"");

        VersionExpression expected = new VersionExpression(VersionKey.PYTHON_VERSION,
                VersionSpecifier.of(VersionOperator.GREATER_THAN_EQUAL, Version.parse("3.8")));
        assertEquals(expected, tree);
        assertTrue(reporter.getWarnings().isEmpty());
    }

    @Test
    @DisplayName("Should bind 'and' tighter than 'or'")
    void shouldBindAndTighterThanOr() {
        MarkerTree tree = parse("os_name == 'nt' or python_version == '3.7' and sys_platform == 'win32'");

        OrTree or = assertInstanceOf(OrTree.class, tree);
        assertEquals(2, or.children().size());
        assertInstanceOf(StringExpression.class, or.children().get(0));
        AndTree and = assertInstanceOf(AndTree.class, or.children().get(1));
        assertEquals(2, and.children().size());
    }

    @Test
    @DisplayName("Should parse parenthesized groups")
    void shouldParseGroups() {
        MarkerTree tree = parse("( \"linux\" in sys_platform) and extra == 'all'");

        AndTree and = assertInstanceOf(AndTree.class, tree);
        assertEquals(new StringExpression(StringKey.SYS_PLATFORM, MarkerOperator.CONTAINS, "linux"),
                and.children().get(0));
        assertEquals(new ExtraExpression(ExtraOperator.EQUAL, ExtraName.of("all")), and.children().get(1));
        assertEquals("'linux' in sys_platform and extra == 'all'", tree.toString());
    }

    @Test
    @DisplayName("Should keep redundant nesting from the text")
    void shouldKeepNesting() {
        MarkerTree tree = parse("os_name == 'nt' and (python_version >= '3.8' and extra == 'dev')");

        AndTree and = assertInstanceOf(AndTree.class, tree);
        assertEquals(2, and.children().size());
        assertInstanceOf(AndTree.class, and.children().get(1));
    }

    @Test
    @DisplayName("Should accept deprecated dotted names")
    void shouldAcceptDeprecatedNames() {
        MarkerTree tree = parse("os.name == 'posix' and platform.python_implementation == 'CPython'");

        assertTrue(reporter.getWarnings().isEmpty());
        assertTrue(tree.evaluateReporter(TestEnvironments.linux(), Set.of(), reporter));
        assertEquals(2, reporter.count(MarkerWarningKind.DEPRECATED_MARKER_NAME));
    }

    @ParameterizedTest
    @DisplayName("Should print markers that parse back to the same tree")
    @CsvSource(delimiter = '|', quoteCharacter = '"', value = {
            "python_version >= '3.8'",
            "python_full_version == '3.9.*'",
            "implementation_version != '3.11.0rc1'",
            "'nt' not in os_name",
            "sys_platform in 'linux darwin'",
            "platform_release ~= '5.15'",
            "extra == 'dev-tools'",
            "os_name == 'nt' and (python_version < '3.8' or extra != 'gpu')",
            "(os_name == 'nt' or os_name == 'posix') and platform_machine == 'x86_64'"
    })
    void shouldRoundTripDisplay(String marker) {
        MarkerTree tree = parse(marker);

        assertEquals(marker, tree.toString());
        assertEquals(tree, parse(tree.toString()));
    }

    @Test
    @DisplayName("Should print values containing a single quote in double quotes")
    void shouldQuoteValuesWithSingleQuote() {
        MarkerTree tree = parse("platform_version == \"it's\"");

        assertEquals("platform_version == \"it's\"", tree.toString());
        assertEquals(tree, parse(tree.toString()));
    }

    // =====================================================================
    // Normalization
    // =====================================================================

    @Test
    @DisplayName("Should move the key to the left of a version comparison")
    void shouldNormalizeInvertedVersion() {
        MarkerTree tree = parse("'3.6' < python_version");

        assertEquals("python_version > '3.6'", tree.toString());
        assertEquals("python_version <= '3.6'", tree.negate().toString());
    }

    @Test
    @DisplayName("Should move the key to the left of a string comparison")
    void shouldNormalizeInvertedString() {
        MarkerTree contains = parse("'nux' in sys_platform");
        MarkerTree greater = parse("'5' > platform_release");

        assertEquals(new StringExpression(StringKey.SYS_PLATFORM, MarkerOperator.CONTAINS, "nux"), contains);
        assertEquals(new StringExpression(StringKey.PLATFORM_RELEASE, MarkerOperator.LESS_THAN, "5"), greater);
        assertTrue(contains.evaluate(TestEnvironments.linux(), Set.of()));
    }

    @Test
    @DisplayName("Should normalize extra names on either side")
    void shouldNormalizeExtraNames() {
        MarkerTree left = parse("extra == 'Dev_Tools'");
        MarkerTree right = parse("'dev.tools' == extra");

        assertEquals(left, right);
        assertEquals("extra == 'dev-tools'", left.toString());
    }

    @Test
    @DisplayName("Should use a wildcard comparison for star versions")
    void shouldParseStarVersion() {
        MarkerTree tree = parse("python_version != '3.*'");

        VersionExpression expression = assertInstanceOf(VersionExpression.class, tree);
        assertEquals(VersionOperator.NOT_EQUAL_STAR, expression.specifier().operator());
    }

    // =====================================================================
    // Comparisons that never apply
    // =====================================================================

    @Test
    @DisplayName("Should warn when comparing two quoted strings")
    void shouldWarnOnStringStringComparison() {
        MarkerTree tree = parse("\"3.9\" > \"3.10\"");

        assertInstanceOf(ArbitraryExpression.class, tree);
        assertEquals(1, reporter.count(MarkerWarningKind.STRING_STRING_COMPARISON));
        assertEquals("Comparing two quoted strings with each other doesn't make sense: '3.9' > '3.10',"
                + " will evaluate to false", reporter.getWarnings().get(0).message());
        assertFalse(tree.evaluate(TestEnvironments.linux(), Set.of()));
    }

    @Test
    @DisplayName("Should warn when comparing two markers")
    void shouldWarnOnMarkerMarkerComparison() {
        MarkerTree tree = parse("os_name == sys_platform");

        assertEquals("os_name == sys_platform", tree.toString());
        assertEquals(1, reporter.count(MarkerWarningKind.MARKER_MARKER_COMPARISON));
        assertFalse(tree.evaluate(TestEnvironments.linux(), Set.of()));
    }

    @Test
    @DisplayName("Should warn when comparing a version key with something else")
    void shouldWarnOnVersionKeyComparedWithKey() {
        MarkerTree tree = parse("python_version == python_full_version");

        assertInstanceOf(ArbitraryExpression.class, tree);
        assertEquals(1, reporter.count(MarkerWarningKind.PEP440_ERROR));
    }

    @ParameterizedTest
    @DisplayName("Should report version errors and never apply")
    @CsvSource(delimiter = '|', quoteCharacter = '"', value = {
            "python_version == 'three'",
            "python_version >= '3.*'",
            "'3.*' == python_version",
            "python_version in '2.7 3.2 3.3'",
            "'3.8' not in python_version",
            "python_version ~= '3'",
            "python_version >= '3.8+local'"
    })
    void shouldReportVersionErrors(String marker) {
        MarkerTree tree = parse(marker);

        assertInstanceOf(ArbitraryExpression.class, tree);
        assertEquals(1, reporter.count(MarkerWarningKind.PEP440_ERROR));
        assertFalse(tree.evaluate(TestEnvironments.linux(), Set.of()));
    }

    @ParameterizedTest
    @DisplayName("Should report invalid extra comparisons and never apply")
    @CsvSource(delimiter = '|', quoteCharacter = '"', value = {
            "extra == os_name",
            "extra == '-dev'",
            "extra >= 'dev'",
            "'dev' in extra"
    })
    void shouldReportInvalidExtraComparisons(String marker) {
        MarkerTree tree = parse(marker);

        assertInstanceOf(ArbitraryExpression.class, tree);
        assertEquals(1, reporter.count(MarkerWarningKind.EXTRA_INVALID_COMPARISON));
        assertFalse(tree.evaluate(TestEnvironments.linux(), Set.of(ExtraName.of("dev"))));
    }

    @Test
    @DisplayName("Should keep the rest of the marker when one clause never applies")
    void shouldKeepRestOfMarker() {
        MarkerTree tree = parse("python_version == 'three' or os_name == 'posix'");

        assertTrue(tree.evaluate(TestEnvironments.linux(), Set.of()));
        assertEquals(1, reporter.getWarnings().size());
    }

    // =====================================================================
    // Errors
    // =====================================================================

    @ParameterizedTest
    @DisplayName("Should reject malformed markers at the offending position")
    @CsvSource(delimiter = '|', quoteCharacter = '"', value = {
            "python_version >= 3.8 | 18 | Expected a quoted string or a valid marker name, found '3.8'",
            "foo == 'bar' | 0 | Expected a quoted string or a valid marker name, found 'foo'",
            "os_name == | 10 | Expected marker value, found end of input",
            "python_version == '3.8' and | 27 | Expected marker value, found end of input",
            "os_name not 'nt' | 12 | Expected 'in' after 'not'",
            "os_name 'nt' | 8 | Expected a valid marker operator",
            "(os_name == 'nt' | 16 | Expected ')'",
            "os_name == 'nt' extra | 16 | Unexpected 'extra', expected 'and', 'or' or end of input",
            "os_name == 'nt') | 15 | Unexpected ')'",
            "() | 1 | Expected a quoted string or a valid marker name, found ')'"
    })
    void shouldRejectMalformedMarkers(String marker, int position, String message) {
        MarkerParseException e = assertThrows(MarkerParseException.class, () -> parse(marker));

        assertEquals(position, e.getPosition());
        assertTrue(e.getMessage().contains(message), e::getMessage);
        assertTrue(e.getMessage().endsWith(" in '" + marker + "'"));
    }

    @Test
    @DisplayName("Should treat blank text as the universal marker")
    void shouldParseBlankAsUniversal() {
        assertTrue(parse("").isUniversal());
        assertTrue(parse(null).isUniversal());
        assertTrue(parse("\t ").evaluate(TestEnvironments.linux(), Set.of()));
    }
}
