package com.marker.pep440;

import com.marker.exception.VersionParseException;

import java.util.List;
import java.util.Objects;

/**
 * A single PEP 440 version constraint such as {@code >= 3.8} or {@code == 3.*}.
 */
public final class VersionSpecifier {

    private final VersionOperator operator;
    private final Version version;

    private VersionSpecifier(VersionOperator operator, Version version) {
        this.operator = operator;
        this.version = version;
    }

    /**
     * Create a specifier from an operator and a version.
     *
     * @throws VersionParseException if a local version is used with an operator that forbids it,
     *                               or {@code ~=} is used with a single release segment
     */
    public static VersionSpecifier of(VersionOperator operator, Version version) {
        if (version.isLocal() && !operator.isLocalCompatible()) {
            throw new VersionParseException("You can't mix a " + operator
                    + " operator with a local version (`+" + String.join(".", version.local()) + "`)");
        }
        if (operator == VersionOperator.TILDE_EQUAL && version.release().size() < 2) {
            throw new VersionParseException("The ~= operator requires at least two parts in the release version");
        }
        return new VersionSpecifier(operator, version);
    }

    /**
     * Create a specifier from an operator and a pattern, switching {@code ==}/{@code !=}
     * to their wildcard forms when the pattern ends in {@code .*}.
     */
    public static VersionSpecifier fromPattern(VersionOperator operator, VersionPattern pattern) {
        VersionOperator effective = operator;
        if (pattern.wildcard()) {
            effective = switch (operator) {
                case EQUAL, EQUAL_STAR -> VersionOperator.EQUAL_STAR;
                case NOT_EQUAL, NOT_EQUAL_STAR -> VersionOperator.NOT_EQUAL_STAR;
                default -> throw new VersionParseException(
                        "Operator " + operator + " must not be used in version ending with a star");
            };
        }
        return of(effective, pattern.version());
    }

    public static VersionSpecifier lessThan(Version version) {
        return of(VersionOperator.LESS_THAN, version);
    }

    public VersionOperator operator() {
        return operator;
    }

    public Version version() {
        return version;
    }

    public boolean anyPrerelease() {
        return version.anyPrerelease();
    }

    /**
     * Whether the given version satisfies this constraint.
     * Local segments are ignored unless this specifier has one itself.
     */
    public boolean contains(Version candidate) {
        Version self = version.isLocal() ? version : version.withoutLocal();
        Version other = version.isLocal() ? candidate : candidate.withoutLocal();

        return switch (operator) {
            case EQUAL -> other.equals(self);
            case EQUAL_STAR -> self.epoch() == other.epoch() && releasePrefixMatches(self.release(), other.release());
            case EXACT_EQUAL -> version.toString().equals(candidate.toString());
            case NOT_EQUAL -> !other.equals(self);
            case NOT_EQUAL_STAR -> self.epoch() != other.epoch() || !releasePrefixMatches(self.release(), other.release());
            case TILDE_EQUAL -> {
                if (self.epoch() != other.epoch()) {
                    yield false;
                }
                List<Long> release = self.release();
                if (!releasePrefixMatches(release.subList(0, release.size() - 1), other.release())) {
                    yield false;
                }
                yield other.compareTo(self) >= 0;
            }
            case GREATER_THAN -> greaterThan(self, other);
            case GREATER_THAN_EQUAL -> greaterThan(self, other) || other.compareTo(self) >= 0;
            case LESS_THAN -> lessThan(self, other)
                    && !(Version.compareRelease(self, other) == 0 && other.anyPrerelease());
            case LESS_THAN_EQUAL -> lessThan(self, other) || other.compareTo(self) <= 0;
        };
    }

    // Zip semantics: compares the shared prefix only
    private static boolean releasePrefixMatches(List<Long> prefix, List<Long> release) {
        int length = Math.min(prefix.size(), release.size());
        for (int i = 0; i < length; i++) {
            if (!prefix.get(i).equals(release.get(i))) {
                return false;
            }
        }
        return true;
    }

    private static boolean lessThan(Version self, Version other) {
        if (other.epoch() < self.epoch()) {
            return true;
        }
        // <3.1 must not match 3.1.dev0 unless the specifier is itself a pre-release
        if (!self.anyPrerelease() && other.isPre() && Version.compareRelease(self, other) == 0) {
            return false;
        }
        return other.compareTo(self) < 0;
    }

    private static boolean greaterThan(Version self, Version other) {
        if (other.epoch() > self.epoch()) {
            return true;
        }
        if (Version.compareRelease(self, other) == 0) {
            // >3.1 must not match 3.1.post0 unless the specifier is itself a post-release
            if (!self.isPost() && other.isPost()) {
                return false;
            }
            if (other.isLocal()) {
                return false;
            }
        }
        return other.compareTo(self) > 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof VersionSpecifier that)) {
            return false;
        }
        return operator == that.operator && version.equals(that.version);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operator, version);
    }

    @Override
    public String toString() {
        if (operator.isStar()) {
            return operator + version.toString() + ".*";
        }
        return operator + version.toString();
    }
}
