package com.marker.expression.impl;

import com.marker.environment.MarkerEnvironment;
import com.marker.exception.VersionParseException;
import com.marker.expression.ExtraName;
import com.marker.expression.MarkerExpression;
import com.marker.expression.MarkerValue;
import com.marker.expression.VersionKey;
import com.marker.pep440.Version;
import com.marker.pep440.VersionOperator;
import com.marker.pep440.VersionPattern;
import com.marker.pep440.VersionSpecifier;
import com.marker.report.Reporter;
import com.marker.tree.MarkerTree;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Version comparison, e.g. {@code python_version >= '3.8'}.
 *
 * @param key       Version-valued key, always on the left
 * @param specifier Constraint the key's value must satisfy
 */
public record VersionExpression(VersionKey key, VersionSpecifier specifier) implements MarkerExpression {

    @Override
    public boolean evaluateNode(MarkerEnvironment environment, Set<ExtraName> extras, Reporter reporter) {
        if (environment == null) {
            return true;
        }
        return specifier.contains(environment.getVersion(key));
    }

    @Override
    public boolean evaluateExtrasAndPythonVersion(Set<ExtraName> extras, List<Version> pythonVersions) {
        if (key != VersionKey.PYTHON_VERSION) {
            return true;
        }
        return pythonVersions.stream().anyMatch(specifier::contains);
    }

    @Override
    public MarkerTree negate() {
        Version version = specifier.version().withoutLocal();
        try {
            Optional<VersionOperator> negated = specifier.operator().negate();
            if (negated.isPresent()) {
                // == and != keep their local segment, ordering operators never have one
                Version target = negated.get().isLocalCompatible() ? specifier.version() : version;
                return new VersionExpression(key, VersionSpecifier.of(negated.get(), target));
            }
            // ~= V.N is >= V.N and == V.*
            List<Long> release = version.release();
            Version prefix = version.withRelease(release.subList(0, release.size() - 1));
            MarkerTree below = new VersionExpression(key, VersionSpecifier.lessThan(version));
            MarkerTree outside = new VersionExpression(key,
                    VersionSpecifier.fromPattern(VersionOperator.NOT_EQUAL, VersionPattern.wildcard(prefix)));
            return below.or(outside);
        } catch (VersionParseException e) {
            throw new IllegalStateException("Negating '" + this + "' produced an invalid specifier", e);
        }
    }

    @Override
    public String toString() {
        String version = specifier.version().toString();
        if (specifier.operator().isStar()) {
            version += ".*";
        }
        return key + " " + specifier.operator() + " " + MarkerValue.quote(version);
    }
}
