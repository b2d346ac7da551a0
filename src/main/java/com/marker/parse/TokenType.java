package com.marker.parse;

/**
 * Token types for marker parsing.
 */
public enum TokenType {
    // Operands
    IDENT,
    STRING,

    // Delimiters
    LPAREN,
    RPAREN,

    // Logical operators
    AND,
    OR,

    // Comparison operators
    EQ,
    NE,
    GT,
    GTE,
    LT,
    LTE,
    TILDE_EQ,

    // Membership, "not" only appears as part of "not in"
    IN,
    NOT,

    // Special
    EOF
}
