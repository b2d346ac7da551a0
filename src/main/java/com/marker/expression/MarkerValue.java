package com.marker.expression;

import com.marker.exception.MarkerException;

import java.util.Optional;

/**
 * One operand of a marker comparison: an environment key, {@code extra}, or a quoted literal.
 */
public interface MarkerValue {

    /**
     * A key whose value is a PEP 440 version.
     */
    record EnvVersion(VersionKey key) implements MarkerValue {
        @Override
        public String toString() {
            return key.toString();
        }
    }

    /**
     * A key whose value is a string.
     */
    record EnvString(StringKey key) implements MarkerValue {
        @Override
        public String toString() {
            return key.toString();
        }
    }

    /**
     * The {@code extra} pseudo-key, which is matched against the requested extras rather than
     * the environment.
     */
    record Extra() implements MarkerValue {
        @Override
        public String toString() {
            return "extra";
        }
    }

    /**
     * A user given quoted string, such as {@code '3.8'} or {@code "win32"}.
     */
    record Literal(String value) implements MarkerValue {
        public Literal {
            value = requireQuotable(value);
        }

        @Override
        public String toString() {
            return quote(value);
        }
    }

    /**
     * Resolve a bare marker name such as {@code python_version} or {@code os.name}.
     */
    static Optional<MarkerValue> fromMarkerName(String name) {
        if ("extra".equals(name)) {
            return Optional.of(new Extra());
        }
        Optional<VersionKey> versionKey = VersionKey.fromMarkerName(name);
        if (versionKey.isPresent()) {
            return Optional.of(new EnvVersion(versionKey.get()));
        }
        return StringKey.fromMarkerName(name).map(EnvString::new);
    }

    /**
     * Check that a value can be written back as marker text. Marker strings have no escapes,
     * so a value may contain single quotes or double quotes but not both.
     *
     * @throws MarkerException if the value contains both quote characters
     */
    static String requireQuotable(String value) {
        if (value.indexOf('\'') >= 0 && value.indexOf('"') >= 0) {
            throw new MarkerException("Marker value can't contain both ' and \": " + value);
        }
        return value;
    }

    /**
     * Quote a literal for display. Single quotes unless the value itself contains one.
     */
    static String quote(String value) {
        if (value.indexOf('\'') >= 0) {
            return "\"" + value + "\"";
        }
        return "'" + value + "'";
    }
}
