package com.marker.pep440;

import java.util.Optional;

/**
 * PEP 440 version comparison operators.
 */
public enum VersionOperator {
    EQUAL("=="),
    EQUAL_STAR("=="),
    /**
     * Arbitrary equality ({@code ===}), discouraged by PEP 440.
     */
    EXACT_EQUAL("==="),
    NOT_EQUAL("!="),
    NOT_EQUAL_STAR("!="),
    TILDE_EQUAL("~="),
    LESS_THAN("<"),
    LESS_THAN_EQUAL("<="),
    GREATER_THAN(">"),
    GREATER_THAN_EQUAL(">=");

    private final String symbol;

    VersionOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    /**
     * The operator with the opposite meaning.
     * <p>
     * Empty for {@code ~=}, whose negation is a disjunction of two clauses.
     * Not reversible for {@code ===}, which negates to {@code !=}.
     */
    public Optional<VersionOperator> negate() {
        return switch (this) {
            case EQUAL -> Optional.of(NOT_EQUAL);
            case EQUAL_STAR -> Optional.of(NOT_EQUAL_STAR);
            case EXACT_EQUAL -> Optional.of(NOT_EQUAL);
            case NOT_EQUAL -> Optional.of(EQUAL);
            case NOT_EQUAL_STAR -> Optional.of(EQUAL_STAR);
            case TILDE_EQUAL -> Optional.empty();
            case LESS_THAN -> Optional.of(GREATER_THAN_EQUAL);
            case LESS_THAN_EQUAL -> Optional.of(GREATER_THAN);
            case GREATER_THAN -> Optional.of(LESS_THAN_EQUAL);
            case GREATER_THAN_EQUAL -> Optional.of(LESS_THAN);
        };
    }

    /**
     * Whether this operator may be combined with a version that has a local segment.
     */
    public boolean isLocalCompatible() {
        return switch (this) {
            case GREATER_THAN, GREATER_THAN_EQUAL, LESS_THAN, LESS_THAN_EQUAL,
                    TILDE_EQUAL, EQUAL_STAR, NOT_EQUAL_STAR -> false;
            default -> true;
        };
    }

    public boolean isStar() {
        return this == EQUAL_STAR || this == NOT_EQUAL_STAR;
    }

    @Override
    public String toString() {
        return symbol;
    }
}
