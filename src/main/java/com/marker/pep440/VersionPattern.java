package com.marker.pep440;

import com.marker.exception.VersionParseException;

/**
 * A version that may end in a {@code .*} wildcard, as allowed on the right-hand
 * side of {@code ==} and {@code !=}.
 *
 * @param version  The version without the wildcard
 * @param wildcard Whether the text ended in {@code .*}
 */
public record VersionPattern(Version version, boolean wildcard) {

    public static VersionPattern verbatim(Version version) {
        return new VersionPattern(version, false);
    }

    public static VersionPattern wildcard(Version version) {
        return new VersionPattern(version, true);
    }

    /**
     * Parse a version pattern such as "3.8" or "3.*".
     */
    public static VersionPattern parse(String text) {
        if (text == null) {
            throw new VersionParseException("Version pattern cannot be null");
        }
        String trimmed = text.trim();
        if (trimmed.endsWith(".*")) {
            Version version = Version.parse(trimmed.substring(0, trimmed.length() - 2));
            if (version.isLocal()) {
                throw new VersionParseException("Local versions can't be used with a wildcard: `" + text + "`");
            }
            return wildcard(version);
        }
        return verbatim(Version.parse(trimmed));
    }

    @Override
    public String toString() {
        return wildcard ? version + ".*" : version.toString();
    }
}
