package com.marker.report;

/**
 * Kinds of advisory warnings raised while parsing or evaluating markers.
 */
public enum MarkerWarningKind {
    /**
     * Using an old PEP 345 name such as {@code os.name} instead of {@code os_name}.
     */
    DEPRECATED_MARKER_NAME,
    /**
     * Comparing {@code extra} with an operator other than {@code ==}/{@code !=}, or with
     * something other than a quoted extra name.
     */
    EXTRA_INVALID_COMPARISON,
    /**
     * Comparing a string-valued marker lexicographically, such as {@code platform_release > "3.10"}.
     */
    LEXICOGRAPHIC_COMPARISON,
    /**
     * Comparing two markers, such as {@code os_name != sys_platform}.
     */
    MARKER_MARKER_COMPARISON,
    /**
     * A PEP 440 version or version operator failed to parse.
     */
    PEP440_ERROR,
    /**
     * Comparing two quoted strings, such as {@code "3.9" > "3.10"}.
     */
    STRING_STRING_COMPARISON
}
