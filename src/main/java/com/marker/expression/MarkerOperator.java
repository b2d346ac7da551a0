package com.marker.expression;

import com.marker.pep440.VersionOperator;

import java.util.Optional;

/**
 * How a marker compares its operands, such as {@code >=} or {@code not in}.
 * <p>
 * {@link #CONTAINS} and {@link #NOT_CONTAINS} never come out of marker text directly.
 * They are what {@code 'x' in key} and {@code 'x' not in key} become once the
 * operands are swapped into key-first order.
 */
public enum MarkerOperator {
    EQUAL("=="),
    NOT_EQUAL("!="),
    GREATER_THAN(">"),
    GREATER_EQUAL(">="),
    LESS_THAN("<"),
    LESS_EQUAL("<="),
    TILDE_EQUAL("~="),
    IN("in"),
    NOT_IN("not in"),
    CONTAINS("in"),
    NOT_CONTAINS("not in");

    private final String symbol;

    MarkerOperator(String symbol) {
        this.symbol = symbol;
    }

    /**
     * Parse an operator as written in marker text. Never yields CONTAINS or NOT_CONTAINS.
     */
    public static Optional<MarkerOperator> fromSymbol(String symbol) {
        return switch (symbol) {
            case "==" -> Optional.of(EQUAL);
            case "!=" -> Optional.of(NOT_EQUAL);
            case ">" -> Optional.of(GREATER_THAN);
            case ">=" -> Optional.of(GREATER_EQUAL);
            case "<" -> Optional.of(LESS_THAN);
            case "<=" -> Optional.of(LESS_EQUAL);
            case "~=" -> Optional.of(TILDE_EQUAL);
            case "in" -> Optional.of(IN);
            case "not in" -> Optional.of(NOT_IN);
            default -> Optional.empty();
        };
    }

    /**
     * The PEP 440 operator for version comparisons; empty for the membership operators.
     */
    public Optional<VersionOperator> toVersionOperator() {
        return switch (this) {
            case EQUAL -> Optional.of(VersionOperator.EQUAL);
            case NOT_EQUAL -> Optional.of(VersionOperator.NOT_EQUAL);
            case GREATER_THAN -> Optional.of(VersionOperator.GREATER_THAN);
            case GREATER_EQUAL -> Optional.of(VersionOperator.GREATER_THAN_EQUAL);
            case LESS_THAN -> Optional.of(VersionOperator.LESS_THAN);
            case LESS_EQUAL -> Optional.of(VersionOperator.LESS_THAN_EQUAL);
            case TILDE_EQUAL -> Optional.of(VersionOperator.TILDE_EQUAL);
            default -> Optional.empty();
        };
    }

    /**
     * The operator to use once the operands are swapped, so {@code a < b} becomes {@code b > a}.
     */
    public MarkerOperator invert() {
        return switch (this) {
            case LESS_THAN -> GREATER_THAN;
            case LESS_EQUAL -> GREATER_EQUAL;
            case GREATER_THAN -> LESS_THAN;
            case GREATER_EQUAL -> LESS_EQUAL;
            case EQUAL, NOT_EQUAL, TILDE_EQUAL -> this;
            case IN -> CONTAINS;
            case NOT_IN -> NOT_CONTAINS;
            case CONTAINS -> IN;
            case NOT_CONTAINS -> NOT_IN;
        };
    }

    /**
     * The operator with the opposite meaning; empty for {@code ~=}, which has none.
     */
    public Optional<MarkerOperator> negate() {
        return switch (this) {
            case EQUAL -> Optional.of(NOT_EQUAL);
            case NOT_EQUAL -> Optional.of(EQUAL);
            case TILDE_EQUAL -> Optional.empty();
            case LESS_THAN -> Optional.of(GREATER_EQUAL);
            case LESS_EQUAL -> Optional.of(GREATER_THAN);
            case GREATER_THAN -> Optional.of(LESS_EQUAL);
            case GREATER_EQUAL -> Optional.of(LESS_THAN);
            case IN -> Optional.of(NOT_IN);
            case NOT_IN -> Optional.of(IN);
            case CONTAINS -> Optional.of(NOT_CONTAINS);
            case NOT_CONTAINS -> Optional.of(CONTAINS);
        };
    }

    @Override
    public String toString() {
        return symbol;
    }
}
