package com.marker.expression;

import com.marker.exception.MarkerException;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * A validated, normalized extra name.
 * <p>
 * Normalization lowercases the name and collapses runs of {@code -}, {@code _} and
 * {@code .} into a single {@code -}, so {@code Dev_Tools} and {@code dev-tools} are equal.
 */
public final class ExtraName implements Comparable<ExtraName> {

    private static final Pattern VALID = Pattern.compile("^[a-z0-9]([-_.a-z0-9]*[a-z0-9])?$", Pattern.CASE_INSENSITIVE);
    private static final Pattern SEPARATORS = Pattern.compile("[-_.]+");

    private final String name;

    private ExtraName(String name) {
        this.name = name;
    }

    /**
     * Validate and normalize an extra name.
     *
     * @throws MarkerException if the name is not a valid extra name
     */
    public static ExtraName of(String name) {
        if (name == null || !VALID.matcher(name).matches()) {
            throw new MarkerException("Not a valid extra name: '" + name + "'");
        }
        return new ExtraName(SEPARATORS.matcher(name.toLowerCase(Locale.ROOT)).replaceAll("-"));
    }

    public String value() {
        return name;
    }

    @Override
    public int compareTo(ExtraName other) {
        return name.compareTo(other.name);
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof ExtraName other && name.equals(other.name));
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return name;
    }
}
