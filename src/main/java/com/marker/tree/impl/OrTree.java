package com.marker.tree.impl;

import com.marker.environment.MarkerEnvironment;
import com.marker.expression.ExtraName;
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
 * OR marker: applies if any child applies. The empty OR never applies.
 */
public record OrTree(List<MarkerTree> children) implements MarkerTree {

    public static final OrTree EMPTY = new OrTree(List.of());

    public OrTree {
        children = List.copyOf(children);
    }

    @Override
    public boolean evaluateNode(MarkerEnvironment environment, Set<ExtraName> extras, Reporter reporter) {
        for (MarkerTree child : children) {
            if (child.evaluateNode(environment, extras, reporter)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean evaluateExtrasAndPythonVersion(Set<ExtraName> extras, List<Version> pythonVersions) {
        return children.stream().anyMatch(child -> child.evaluateExtrasAndPythonVersion(extras, pythonVersions));
    }

    @Override
    public void reportDeprecatedOptions(Reporter reporter) {
        children.forEach(child -> child.reportDeprecatedOptions(reporter));
    }

    @Override
    public MarkerTree negate() {
        MarkerTree negated = AndTree.EMPTY;
        for (MarkerTree child : children) {
            negated = negated.and(child.negate());
        }
        return negated;
    }

    /**
     * If any child always applies, so does the whole OR.
     */
    @Override
    public Optional<MarkerTree> simplifyExtrasWith(Predicate<ExtraName> isExtra) {
        List<MarkerTree> kept = new ArrayList<>();
        for (MarkerTree child : children) {
            Optional<MarkerTree> simplified = child.simplifyExtrasWith(isExtra);
            if (simplified.isEmpty()) {
                return Optional.empty();
            }
            kept.add(simplified.get());
        }
        if (kept.size() == 1) {
            return Optional.of(kept.get(0));
        }
        return Optional.of(new OrTree(kept));
    }

    @Override
    public String toString() {
        return children.stream()
                .map(AndTree::display)
                .collect(Collectors.joining(" or "));
    }
}
