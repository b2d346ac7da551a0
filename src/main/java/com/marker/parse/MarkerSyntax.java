package com.marker.parse;

import java.util.Map;

/**
 * Keywords and operator characters of the marker language.
 */
public final class MarkerSyntax {

    private MarkerSyntax() {
    }

    /**
     * Keywords mapped to token types. Keywords are case-sensitive.
     */
    public static final Map<String, TokenType> KEYWORDS = Map.of(
            "and", TokenType.AND,
            "or", TokenType.OR,
            "not", TokenType.NOT,
            "in", TokenType.IN
    );

    /**
     * Operator symbols.
     */
    public static final class Operators {
        public static final char LEFT_PAREN = '(';
        public static final char RIGHT_PAREN = ')';
        public static final char EQUALS = '=';
        public static final char BANG = '!';
        public static final char TILDE = '~';
        public static final char GREATER = '>';
        public static final char LESS = '<';
        public static final char QUOTE_DOUBLE = '"';
        public static final char QUOTE_SINGLE = '\'';
        public static final char DOT = '.';
        public static final char UNDERSCORE = '_';

        private Operators() {
        }
    }
}
