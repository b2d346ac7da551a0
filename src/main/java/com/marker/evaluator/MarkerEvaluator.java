package com.marker.evaluator;

import com.marker.config.MarkerConfig;
import com.marker.environment.MarkerEnvironment;
import com.marker.expression.ExtraName;
import com.marker.pep440.Version;
import com.marker.report.LoggingReporter;
import com.marker.report.Reporter;
import com.marker.tree.MarkerTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Evaluates marker strings against one configured environment.
 * <p>
 * Without an environment only {@code extra} clauses decide; every other clause is
 * vacuously true. Parse failures propagate as {@link com.marker.exception.MarkerParseException}.
 * Thread-safe if the reporter is.
 */
public class MarkerEvaluator {

    private static final Logger log = LoggerFactory.getLogger(MarkerEvaluator.class);

    private final MarkerEnvironment environment;
    private final Set<ExtraName> defaultExtras;
    private final List<Version> pythonVersions;
    private final Reporter reporter;

    public MarkerEvaluator(MarkerEnvironment environment, Reporter reporter) {
        this(environment, List.of(), List.of(), reporter);
    }

    public MarkerEvaluator(MarkerConfig config) {
        this(config.environment(), config.extras(), config.pythonVersions(), LoggingReporter.INSTANCE);
    }

    public MarkerEvaluator(MarkerEnvironment environment, Collection<ExtraName> defaultExtras,
                           List<Version> pythonVersions, Reporter reporter) {
        this.environment = environment;
        this.defaultExtras = Set.copyOf(defaultExtras);
        this.pythonVersions = List.copyOf(pythonVersions);
        this.reporter = reporter;
    }

    /**
     * Evaluate a marker with the configured extras.
     */
    public boolean evaluate(String marker) {
        return evaluate(MarkerTree.parse(marker, reporter), defaultExtras);
    }

    /**
     * Evaluate a marker with the given extras. A blank marker always applies.
     *
     * @param marker Marker text
     * @param extras Requested extras, normalized before matching
     */
    public boolean evaluate(String marker, Collection<String> extras) {
        return evaluate(MarkerTree.parse(marker, reporter), toExtraNames(extras));
    }

    public boolean evaluate(MarkerTree marker, Set<ExtraName> extras) {
        boolean result = marker.evaluateReporter(environment, extras, reporter);
        log.debug("Marker '{}' with extras {} evaluated to {}", marker, extras, result);
        return result;
    }

    /**
     * Whether the marker could apply for the configured Python versions.
     */
    public boolean applies(String marker) {
        return applies(marker, namesOf(defaultExtras), pythonVersions);
    }

    /**
     * Whether some Python version in {@code pythonVersions} could satisfy the marker with these
     * extras. Clauses other than {@code extra} and {@code python_version} are ignored.
     */
    public boolean applies(String marker, Collection<String> extras, List<Version> pythonVersions) {
        MarkerTree tree = MarkerTree.parse(marker, reporter);
        boolean result = tree.evaluateExtrasAndPythonVersion(toExtraNames(extras), pythonVersions);
        log.debug("Marker '{}' applies for python versions {}: {}", tree, pythonVersions, result);
        return result;
    }

    /**
     * Drop the {@code extra} clauses that hold for the given extras.
     *
     * @return Simplified marker text, or empty if the marker always applies
     */
    public Optional<String> simplify(String marker, Collection<String> extras) {
        return MarkerTree.parse(marker, reporter)
                .simplifyExtras(toExtraNames(extras))
                .map(MarkerTree::toString);
    }

    public Optional<MarkerEnvironment> getEnvironment() {
        return Optional.ofNullable(environment);
    }

    public Set<ExtraName> getDefaultExtras() {
        return defaultExtras;
    }

    private static Set<ExtraName> toExtraNames(Collection<String> extras) {
        Set<ExtraName> names = new LinkedHashSet<>();
        for (String extra : extras) {
            names.add(ExtraName.of(extra));
        }
        return names;
    }

    private static List<String> namesOf(Set<ExtraName> extras) {
        return extras.stream().map(ExtraName::value).toList();
    }
}
