package com.marker.tree.impl;

import com.marker.environment.MarkerEnvironment;
import com.marker.expression.ExtraName;
import com.marker.expression.MarkerExpression;
import com.marker.pep440.Version;
import com.marker.report.Reporter;
import com.marker.tree.MarkerTree;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * AND marker: applies if all children apply. The empty AND always applies.
 */
public record AndTree(List<MarkerTree> children) implements MarkerTree {

    public static final AndTree EMPTY = new AndTree(List.of());

    public AndTree {
        children = List.copyOf(children);
    }

    @Override
    public boolean evaluateNode(MarkerEnvironment environment, Set<ExtraName> extras, Reporter reporter) {
        for (MarkerTree child : children) {
            if (!child.evaluateNode(environment, extras, reporter)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean evaluateExtrasAndPythonVersion(Set<ExtraName> extras, List<Version> pythonVersions) {
        return children.stream().allMatch(child -> child.evaluateExtrasAndPythonVersion(extras, pythonVersions));
    }

    @Override
    public void reportDeprecatedOptions(Reporter reporter) {
        children.forEach(child -> child.reportDeprecatedOptions(reporter));
    }

    @Override
    public MarkerTree negate() {
        MarkerTree negated = OrTree.EMPTY;
        for (MarkerTree child : children) {
            negated = negated.or(child.negate());
        }
        return negated;
    }

    @Override
    public Optional<MarkerTree> simplifyExtrasWith(Predicate<ExtraName> isExtra) {
        List<MarkerTree> kept = new ArrayList<>();
        for (MarkerTree child : children) {
            child.simplifyExtrasWith(isExtra).ifPresent(kept::add);
        }
        if (kept.isEmpty()) {
            return Optional.empty();
        }
        if (kept.size() == 1) {
            return Optional.of(kept.get(0));
        }
        return Optional.of(new AndTree(kept));
    }

    @Override
    public String toString() {
        return children.stream()
                .map(AndTree::display)
                .collect(Collectors.joining(" and "));
    }

    static String display(MarkerTree child) {
        return child instanceof MarkerExpression ? child.toString() : "(" + child + ")";
    }
}
