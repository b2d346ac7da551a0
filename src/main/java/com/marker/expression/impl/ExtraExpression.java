package com.marker.expression.impl;

import com.marker.environment.MarkerEnvironment;
import com.marker.expression.ExtraName;
import com.marker.expression.ExtraOperator;
import com.marker.expression.MarkerExpression;
import com.marker.expression.MarkerValue;
import com.marker.pep440.Version;
import com.marker.report.Reporter;
import com.marker.tree.MarkerTree;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * {@code extra == 'name'} or {@code extra != 'name'}.
 * Decided by the requested extras, never by the environment.
 */
public record ExtraExpression(ExtraOperator operator, ExtraName name) implements MarkerExpression {

    @Override
    public boolean evaluateNode(MarkerEnvironment environment, Set<ExtraName> extras, Reporter reporter) {
        return matches(extras.contains(name));
    }

    @Override
    public boolean evaluateExtrasAndPythonVersion(Set<ExtraName> extras, List<Version> pythonVersions) {
        return matches(extras.contains(name));
    }

    private boolean matches(boolean requested) {
        return operator == ExtraOperator.EQUAL ? requested : !requested;
    }

    @Override
    public MarkerTree negate() {
        return new ExtraExpression(operator.negate(), name);
    }

    @Override
    public Optional<MarkerTree> simplifyExtrasWith(Predicate<ExtraName> isExtra) {
        if (matches(isExtra.test(name))) {
            return Optional.empty();
        }
        return Optional.of(this);
    }

    @Override
    public String toString() {
        return "extra " + operator + " " + MarkerValue.quote(name.value());
    }
}
