package com.marker.parse;

import com.marker.exception.MarkerException;
import com.marker.exception.MarkerParseException;
import com.marker.exception.VersionParseException;
import com.marker.expression.ExtraName;
import com.marker.expression.ExtraOperator;
import com.marker.expression.MarkerExpression;
import com.marker.expression.MarkerOperator;
import com.marker.expression.MarkerValue;
import com.marker.expression.VersionKey;
import com.marker.expression.impl.ArbitraryExpression;
import com.marker.expression.impl.ExtraExpression;
import com.marker.expression.impl.StringExpression;
import com.marker.expression.impl.VersionExpression;
import com.marker.pep440.Version;
import com.marker.pep440.VersionOperator;
import com.marker.pep440.VersionPattern;
import com.marker.pep440.VersionSpecifier;
import com.marker.report.MarkerWarningKind;
import com.marker.report.Reporter;
import com.marker.tree.MarkerTree;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Parser for PEP 508 environment markers.
 * Converts tokens into a MarkerTree using recursive descent parsing.
 * <p>
 * Grammar (precedence: AND > OR):
 * <pre>
 * marker := or
 * or     := and ('or' and)*
 * and    := expr ('and' expr)*
 * expr   := '(' or ')' | value op value
 * value  := quoted string | marker name
 * op     := '==' | '!=' | '>' | '>=' | '<' | '<=' | '~=' | 'in' | 'not' 'in'
 * </pre>
 * Comparisons are normalized so the key is on the left. Comparisons that make no sense
 * (two literals, two keys, bad versions, bad extras) are reported and kept as
 * {@link ArbitraryExpression}, which never applies.
 */
public final class MarkerParser {

    private final String input;
    private final List<Token> tokens;
    private final Reporter reporter;
    private int index;

    public MarkerParser(String input, List<Token> tokens, Reporter reporter) {
        this.input = input;
        this.tokens = tokens;
        this.reporter = reporter;
        this.index = 0;
    }

    /**
     * Parse the token stream into a MarkerTree.
     *
     * @return Root marker
     * @throws MarkerParseException if the tokens do not form a marker
     */
    public MarkerTree parse() {
        MarkerTree result = parseOr();
        if (!isAtEnd()) {
            throw error("Unexpected '" + peek().text() + "', expected 'and', 'or' or end of input");
        }
        return result;
    }

    private MarkerTree parseOr() {
        MarkerTree left = parseAnd();
        List<MarkerTree> markers = new ArrayList<>();
        markers.add(left);

        while (match(TokenType.OR)) {
            markers.add(parseAnd());
        }

        return markers.size() == 1 ? left : MarkerTree.anyOf(markers);
    }

    private MarkerTree parseAnd() {
        MarkerTree left = parseExpression();
        List<MarkerTree> markers = new ArrayList<>();
        markers.add(left);

        while (match(TokenType.AND)) {
            markers.add(parseExpression());
        }

        return markers.size() == 1 ? left : MarkerTree.allOf(markers);
    }

    private MarkerTree parseExpression() {
        if (match(TokenType.LPAREN)) {
            MarkerTree inner = parseOr();
            expect(TokenType.RPAREN, "Expected ')'");
            return inner;
        }
        MarkerValue left = parseValue();
        MarkerOperator operator = parseOperator();
        MarkerValue right = parseValue();
        return normalize(left, operator, right);
    }

    private MarkerValue parseValue() {
        if (match(TokenType.STRING)) {
            return new MarkerValue.Literal(previous().text());
        }
        if (check(TokenType.IDENT)) {
            Token token = peek();
            Optional<MarkerValue> value = MarkerValue.fromMarkerName(token.text());
            if (value.isEmpty()) {
                throw error("Expected a quoted string or a valid marker name, found '" + token.text() + "'");
            }
            advance();
            return value.get();
        }
        if (isAtEnd()) {
            throw error("Expected marker value, found end of input");
        }
        throw error("Expected a quoted string or a valid marker name, found '" + peek().text() + "'");
    }

    private MarkerOperator parseOperator() {
        if (match(TokenType.NOT)) {
            expect(TokenType.IN, "Expected 'in' after 'not'");
            return MarkerOperator.NOT_IN;
        }
        if (match(TokenType.EQ, TokenType.NE, TokenType.GT, TokenType.GTE,
                TokenType.LT, TokenType.LTE, TokenType.TILDE_EQ, TokenType.IN)) {
            String symbol = previous().text();
            return MarkerOperator.fromSymbol(symbol)
                    .orElseThrow(() -> new IllegalStateException("No marker operator for " + symbol));
        }
        throw error("Expected a valid marker operator (such as '>=' or 'not in'), found '" + peek().text() + "'");
    }

    // ------------------------------------------------------------------
    // Normalization
    // ------------------------------------------------------------------

    private MarkerExpression normalize(MarkerValue left, MarkerOperator operator, MarkerValue right) {
        if (left instanceof MarkerValue.EnvVersion version) {
            if (!(right instanceof MarkerValue.Literal literal)) {
                reporter.report(MarkerWarningKind.PEP440_ERROR, "Expected quoted PEP 440 version to compare with "
                        + version.key() + ", found " + right + ", will evaluate to false");
                return new ArbitraryExpression(left, operator, right);
            }
            return versionExpression(version.key(), operator, literal.value())
                    .orElseGet(() -> new ArbitraryExpression(left, operator, right));
        }

        if (left instanceof MarkerValue.EnvString string) {
            if (!(right instanceof MarkerValue.Literal literal)) {
                reporter.report(MarkerWarningKind.MARKER_MARKER_COMPARISON,
                        "Comparing two markers with each other doesn't make any sense, will evaluate to false");
                return new ArbitraryExpression(left, operator, right);
            }
            return new StringExpression(string.key(), operator, literal.value());
        }

        if (left instanceof MarkerValue.Extra) {
            if (!(right instanceof MarkerValue.Literal literal)) {
                reporter.report(MarkerWarningKind.EXTRA_INVALID_COMPARISON,
                        "Comparing extra with something other than a quoted string is wrong, will evaluate to false");
                return new ArbitraryExpression(left, operator, right);
            }
            return extraExpression(operator, literal.value())
                    .orElseGet(() -> new ArbitraryExpression(left, operator, right));
        }

        // Quoted string on the left
        String value = ((MarkerValue.Literal) left).value();
        if (right instanceof MarkerValue.EnvVersion version) {
            return invertedVersionExpression(value, operator, version.key())
                    .orElseGet(() -> new ArbitraryExpression(left, operator, right));
        }
        if (right instanceof MarkerValue.EnvString string) {
            return new StringExpression(string.key(), operator.invert(), value);
        }
        if (right instanceof MarkerValue.Extra) {
            return extraExpression(operator, value)
                    .orElseGet(() -> new ArbitraryExpression(left, operator, right));
        }

        ArbitraryExpression expression = new ArbitraryExpression(left, operator, right);
        reporter.report(MarkerWarningKind.STRING_STRING_COMPARISON,
                "Comparing two quoted strings with each other doesn't make sense: " + expression
                        + ", will evaluate to false");
        return expression;
    }

    private Optional<MarkerExpression> versionExpression(VersionKey key, MarkerOperator operator, String value) {
        VersionPattern pattern;
        try {
            pattern = VersionPattern.parse(value);
        } catch (VersionParseException e) {
            reporter.report(MarkerWarningKind.PEP440_ERROR, "Expected PEP 440 version to compare with " + key
                    + ", found " + value + ", will evaluate to false: " + e.getMessage());
            return Optional.empty();
        }

        Optional<VersionOperator> versionOperator = operator.toVersionOperator();
        if (versionOperator.isEmpty()) {
            reporter.report(MarkerWarningKind.PEP440_ERROR, "Expected PEP 440 version operator to compare " + key
                    + " with '" + pattern.version() + "', found '" + operator + "', will evaluate to false");
            return Optional.empty();
        }

        try {
            return Optional.of(new VersionExpression(key, VersionSpecifier.fromPattern(versionOperator.get(), pattern)));
        } catch (VersionParseException e) {
            reporter.report(MarkerWarningKind.PEP440_ERROR, "Invalid operator/version combination: " + e.getMessage());
            return Optional.empty();
        }
    }

    // '3.8' < python_version; a wildcard is not valid on this side
    private Optional<MarkerExpression> invertedVersionExpression(String value, MarkerOperator operator, VersionKey key) {
        MarkerOperator inverted = operator.invert();

        Version version;
        try {
            version = Version.parse(value);
        } catch (VersionParseException e) {
            reporter.report(MarkerWarningKind.PEP440_ERROR, "Expected PEP 440 version to compare with " + key
                    + ", found " + value + ", will evaluate to false: " + e.getMessage());
            return Optional.empty();
        }

        Optional<VersionOperator> versionOperator = inverted.toVersionOperator();
        if (versionOperator.isEmpty()) {
            reporter.report(MarkerWarningKind.PEP440_ERROR, "Expected PEP 440 version operator to compare " + key
                    + " with '" + version + "', found '" + inverted + "', will evaluate to false");
            return Optional.empty();
        }

        try {
            return Optional.of(new VersionExpression(key, VersionSpecifier.of(versionOperator.get(), version)));
        } catch (VersionParseException e) {
            reporter.report(MarkerWarningKind.PEP440_ERROR, "Invalid operator/version combination: " + e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<MarkerExpression> extraExpression(MarkerOperator operator, String value) {
        ExtraName name;
        try {
            name = ExtraName.of(value);
        } catch (MarkerException e) {
            reporter.report(MarkerWarningKind.EXTRA_INVALID_COMPARISON,
                    "Expected extra name, found '" + value + "', will evaluate to false: " + e.getMessage());
            return Optional.empty();
        }

        Optional<ExtraOperator> extraOperator = ExtraOperator.fromMarkerOperator(operator);
        if (extraOperator.isEmpty()) {
            reporter.report(MarkerWarningKind.EXTRA_INVALID_COMPARISON,
                    "Comparing extra with '" + operator + "' is wrong, only '==' and '!=' are allowed,"
                            + " will evaluate to false");
            return Optional.empty();
        }
        return Optional.of(new ExtraExpression(extraOperator.get(), name));
    }

    // ------------------------------------------------------------------
    // Token helpers
    // ------------------------------------------------------------------

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private void expect(TokenType type, String message) {
        if (!check(type)) {
            throw error(message);
        }
        advance();
    }

    private boolean check(TokenType type) {
        return peek().type() == type;
    }

    private Token advance() {
        if (!isAtEnd()) {
            index++;
        }
        return previous();
    }

    private boolean isAtEnd() {
        return peek().type() == TokenType.EOF;
    }

    private Token peek() {
        return tokens.get(index);
    }

    private Token previous() {
        return tokens.get(index - 1);
    }

    private MarkerParseException error(String message) {
        return new MarkerParseException(message, peek().position(), input);
    }
}
