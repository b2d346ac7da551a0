package com.marker.expression.impl;

import com.marker.environment.MarkerEnvironment;
import com.marker.expression.ExtraName;
import com.marker.expression.MarkerExpression;
import com.marker.expression.MarkerOperator;
import com.marker.expression.MarkerValue;
import com.marker.expression.StringKey;
import com.marker.pep440.Version;
import com.marker.report.MarkerWarningKind;
import com.marker.report.Reporter;
import com.marker.tree.MarkerTree;

import java.util.List;
import java.util.Set;

/**
 * String comparison, e.g. {@code sys_platform == 'linux'} or {@code 'arm' in platform_machine}.
 * <p>
 * The key is always on the left. {@code 'x' in key} is stored with {@link MarkerOperator#CONTAINS}.
 *
 * @param key      String-valued key
 * @param operator Comparison operator
 * @param value    Literal to compare against; may not contain both quote characters
 */
public record StringExpression(StringKey key, MarkerOperator operator, String value) implements MarkerExpression {

    public StringExpression {
        value = MarkerValue.requireQuotable(value);
    }

    @Override
    public boolean evaluateNode(MarkerEnvironment environment, Set<ExtraName> extras, Reporter reporter) {
        if (environment == null) {
            return true;
        }
        return compareStrings(environment.getString(key), operator, value, reporter);
    }

    @Override
    public boolean evaluateExtrasAndPythonVersion(Set<ExtraName> extras, List<Version> pythonVersions) {
        return true;
    }

    @Override
    public void reportDeprecatedOptions(Reporter reporter) {
        if (key.isDeprecated()) {
            reporter.report(MarkerWarningKind.DEPRECATED_MARKER_NAME, key.deprecationMessage());
        }
    }

    /**
     * {@code ~=} has no string meaning and stays as it is.
     */
    @Override
    public MarkerTree negate() {
        return operator.negate()
                .<MarkerTree>map(negated -> new StringExpression(key, negated, value))
                .orElse(this);
    }

    /**
     * Compare an environment value with a literal.
     *
     * @param left     Environment value
     * @param operator Operator
     * @param right    Literal
     * @param reporter Receives a warning for ordering comparisons
     */
    public static boolean compareStrings(String left, MarkerOperator operator, String right, Reporter reporter) {
        return switch (operator) {
            case EQUAL -> left.equals(right);
            case NOT_EQUAL -> !left.equals(right);
            case GREATER_THAN -> lexicographic(left, right, reporter) > 0;
            case GREATER_EQUAL -> lexicographic(left, right, reporter) >= 0;
            case LESS_THAN -> lexicographic(left, right, reporter) < 0;
            case LESS_EQUAL -> lexicographic(left, right, reporter) <= 0;
            case TILDE_EQUAL -> {
                reporter.report(MarkerWarningKind.LEXICOGRAPHIC_COMPARISON,
                        "Can't compare " + left + " and " + right + " with `~=`");
                yield false;
            }
            case IN -> right.contains(left);
            case NOT_IN -> !right.contains(left);
            case CONTAINS -> left.contains(right);
            case NOT_CONTAINS -> !left.contains(right);
        };
    }

    private static int lexicographic(String left, String right, Reporter reporter) {
        reporter.report(MarkerWarningKind.LEXICOGRAPHIC_COMPARISON,
                "Comparing " + left + " and " + right + " lexicographically");
        return left.compareTo(right);
    }

    @Override
    public String toString() {
        if (operator == MarkerOperator.CONTAINS || operator == MarkerOperator.NOT_CONTAINS) {
            return MarkerValue.quote(value) + " " + operator + " " + key;
        }
        return key + " " + operator + " " + MarkerValue.quote(value);
    }
}
