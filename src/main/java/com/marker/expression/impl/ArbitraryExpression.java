package com.marker.expression.impl;

import com.marker.environment.MarkerEnvironment;
import com.marker.expression.ExtraName;
import com.marker.expression.MarkerExpression;
import com.marker.expression.MarkerOperator;
import com.marker.expression.MarkerValue;
import com.marker.pep440.Version;
import com.marker.report.MarkerWarningKind;
import com.marker.report.Reporter;
import com.marker.tree.MarkerTree;

import java.util.List;
import java.util.Set;

/**
 * A comparison with no defined meaning, such as {@code '3.9' > '3.10'} or
 * {@code os_name == sys_platform}. Kept for display; never applies, even when negated.
 */
public record ArbitraryExpression(MarkerValue left, MarkerOperator operator, MarkerValue right)
        implements MarkerExpression {

    @Override
    public boolean evaluateNode(MarkerEnvironment environment, Set<ExtraName> extras, Reporter reporter) {
        return false;
    }

    @Override
    public boolean evaluateExtrasAndPythonVersion(Set<ExtraName> extras, List<Version> pythonVersions) {
        return true;
    }

    @Override
    public void reportDeprecatedOptions(Reporter reporter) {
        reportDeprecated(left, reporter);
        reportDeprecated(right, reporter);
    }

    private static void reportDeprecated(MarkerValue value, Reporter reporter) {
        if (value instanceof MarkerValue.EnvString env && env.key().isDeprecated()) {
            reporter.report(MarkerWarningKind.DEPRECATED_MARKER_NAME, env.key().deprecationMessage());
        }
    }

    @Override
    public MarkerTree negate() {
        return operator.negate()
                .<MarkerTree>map(negated -> new ArbitraryExpression(left, negated, right))
                .orElse(this);
    }

    @Override
    public String toString() {
        return left + " " + operator + " " + right;
    }
}
