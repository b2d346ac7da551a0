package com.marker.tree;

import com.marker.environment.MarkerEnvironment;
import com.marker.exception.MarkerException;
import com.marker.expression.ExtraName;
import com.marker.expression.ExtraOperator;
import com.marker.expression.MarkerExpression;
import com.marker.expression.impl.ExtraExpression;
import com.marker.parse.MarkerParser;
import com.marker.parse.MarkerTokenizer;
import com.marker.pep440.Version;
import com.marker.report.CollectingReporter;
import com.marker.report.LoggingReporter;
import com.marker.report.Reporter;
import com.marker.tree.impl.AndTree;
import com.marker.tree.impl.OrTree;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * A marker: a single {@link MarkerExpression}, or an AND / OR over nested markers.
 * <p>
 * Trees are immutable values with structural equality. The combinators {@link #and(MarkerTree)}
 * and {@link #or(MarkerTree)} return new trees and keep them flat: no AND directly inside an AND,
 * no OR directly inside an OR, and no combinator with a single child. Trees built by hand or by
 * the parser are not required to be flat.
 * <p>
 * {@code toString()} renders marker text that parses back to an equal tree.
 */
public interface MarkerTree {

    // ------------------------------------------------------------------
    // Evaluation
    // ------------------------------------------------------------------

    /**
     * Does this marker apply in the given environment? Warnings are logged.
     *
     * @param environment Environment to evaluate against
     * @param extras      Requested extras
     * @return true if the marker applies
     */
    default boolean evaluate(MarkerEnvironment environment, Set<ExtraName> extras) {
        Objects.requireNonNull(environment, "environment");
        return evaluateReporter(environment, extras, LoggingReporter.INSTANCE);
    }

    /**
     * Like {@link #evaluate}, but without an environment every environment-dependent clause
     * is vacuously true. Only {@code extra} clauses and arbitrary comparisons still decide.
     *
     * @param environment Environment, or null to evaluate extras only
     * @param extras      Requested extras
     */
    default boolean evaluateOptionalEnvironment(MarkerEnvironment environment, Set<ExtraName> extras) {
        return evaluateReporter(environment, extras, LoggingReporter.INSTANCE);
    }

    /**
     * Evaluate, sending warnings to the given reporter instead of the log.
     * Deprecated marker names are reported for every clause, including those that
     * short-circuiting never reaches.
     *
     * @param environment Environment, or null for environment-free evaluation
     * @param extras      Requested extras
     * @param reporter    Warning sink
     */
    default boolean evaluateReporter(MarkerEnvironment environment, Set<ExtraName> extras, Reporter reporter) {
        reportDeprecatedOptions(reporter);
        return evaluateNode(environment, extras, reporter);
    }

    /**
     * Evaluate and return the warnings alongside the result.
     */
    default EvaluationResult evaluateCollectWarnings(MarkerEnvironment environment, Set<ExtraName> extras) {
        CollectingReporter reporter = new CollectingReporter();
        boolean result = evaluateReporter(environment, extras, reporter);
        return new EvaluationResult(result, reporter.getWarnings());
    }

    /**
     * Evaluate this node without the deprecated-name pass.
     *
     * @param environment Environment, or null for environment-free evaluation
     * @param extras      Requested extras
     * @param reporter    Warning sink
     */
    boolean evaluateNode(MarkerEnvironment environment, Set<ExtraName> extras, Reporter reporter);

    /**
     * Could some interpreter in {@code pythonVersions} satisfy this marker with these extras?
     * <p>
     * Only {@code extra} clauses and {@code python_version} comparisons are considered; every
     * other clause counts as true. A {@code python_version} clause holds if any candidate
     * matches. No warnings are reported.
     *
     * @param extras         Requested extras
     * @param pythonVersions Candidate Python versions, e.g. from {@code requires-python}
     */
    boolean evaluateExtrasAndPythonVersion(Set<ExtraName> extras, List<Version> pythonVersions);

    /**
     * Report one {@code DEPRECATED_MARKER_NAME} warning per deprecated key occurrence.
     */
    void reportDeprecatedOptions(Reporter reporter);

    // ------------------------------------------------------------------
    // Algebra
    // ------------------------------------------------------------------

    /**
     * The logical negation of this marker.
     * <p>
     * Total: every clause has a negation. Negating twice is evaluation-equivalent to the
     * original but not necessarily structurally equal.
     */
    MarkerTree negate();

    /**
     * Conjunction of this marker and {@code other}.
     * Returns this tree unchanged if {@code other} is equal to it.
     */
    default MarkerTree and(MarkerTree other) {
        if (this.equals(other)) {
            return this;
        }
        List<MarkerTree> children = new ArrayList<>();
        if (this instanceof AndTree self) {
            children.addAll(self.children());
        } else {
            children.add(this);
        }
        if (other instanceof AndTree that) {
            children.addAll(that.children());
        } else {
            children.add(other);
        }
        return children.size() == 1 ? children.get(0) : new AndTree(children);
    }

    /**
     * Disjunction of this marker and {@code other}.
     * Returns this tree unchanged if {@code other} is equal to it.
     */
    default MarkerTree or(MarkerTree other) {
        if (this.equals(other)) {
            return this;
        }
        List<MarkerTree> children = new ArrayList<>();
        if (this instanceof OrTree self) {
            children.addAll(self.children());
        } else {
            children.add(this);
        }
        if (other instanceof OrTree that) {
            children.addAll(that.children());
        } else {
            children.add(other);
        }
        return children.size() == 1 ? children.get(0) : new OrTree(children);
    }

    /**
     * Remove the {@code extra} clauses that are true given these extras.
     *
     * @return The simplified marker, or empty if it always applies given these extras.
     *         Empty never means "never applies".
     */
    default Optional<MarkerTree> simplifyExtras(Collection<ExtraName> extras) {
        return simplifyExtrasWith(extras::contains);
    }

    /**
     * Remove the {@code extra} clauses that are provably true under {@code isExtra}.
     * Clauses that are provably false are kept.
     *
     * @param isExtra Whether an extra is requested
     * @return The simplified marker, or empty if it always applies
     */
    Optional<MarkerTree> simplifyExtrasWith(Predicate<ExtraName> isExtra);

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    /**
     * Whether this is the empty conjunction, the marker that always applies.
     */
    default boolean isUniversal() {
        return this instanceof AndTree and && and.children().isEmpty();
    }

    /**
     * Find the {@code extra == '...'} clause that gates the whole marker: either the marker
     * itself, or a direct child of a top-level AND. OR-rooted markers have none.
     *
     * @return The clause, or empty if there is none
     * @throws MarkerException if the top-level AND has more than one distinct such clause
     */
    default Optional<MarkerExpression> topLevelExtra() {
        if (isExtraEquals(this)) {
            return Optional.of((MarkerExpression) this);
        }
        if (!(this instanceof AndTree and)) {
            return Optional.empty();
        }
        MarkerExpression found = null;
        for (MarkerTree child : and.children()) {
            if (!isExtraEquals(child)) {
                continue;
            }
            if (found != null && !found.equals(child)) {
                throw new MarkerException("Marker has more than one top-level extra: '"
                        + found + "' and '" + child + "' in '" + this + "'");
            }
            found = (MarkerExpression) child;
        }
        return Optional.ofNullable(found);
    }

    private static boolean isExtraEquals(MarkerTree tree) {
        return tree instanceof ExtraExpression extra && extra.operator() == ExtraOperator.EQUAL;
    }

    // ------------------------------------------------------------------
    // Factories
    // ------------------------------------------------------------------

    /**
     * The marker that always applies: the empty conjunction.
     */
    static MarkerTree universal() {
        return AndTree.EMPTY;
    }

    /**
     * Conjunction over the given children, exactly as given.
     */
    static MarkerTree allOf(List<MarkerTree> children) {
        return new AndTree(children);
    }

    /**
     * Disjunction over the given children, exactly as given.
     */
    static MarkerTree anyOf(List<MarkerTree> children) {
        return new OrTree(children);
    }

    /**
     * Parse marker text, logging parse warnings. A blank string is the universal marker.
     *
     * @throws com.marker.exception.MarkerParseException if the text is malformed
     */
    static MarkerTree parse(String markers) {
        return parse(markers, LoggingReporter.INSTANCE);
    }

    /**
     * Parse marker text, sending parse warnings to the given reporter.
     *
     * @throws com.marker.exception.MarkerParseException if the text is malformed
     */
    static MarkerTree parse(String markers, Reporter reporter) {
        if (markers == null || markers.isBlank()) {
            return universal();
        }
        return new MarkerParser(markers, new MarkerTokenizer(markers).tokenize(), reporter).parse();
    }
}
