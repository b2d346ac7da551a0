package com.marker.expression;

import java.util.Optional;

/**
 * The only operators allowed with {@code extra}.
 */
public enum ExtraOperator {
    EQUAL("=="),
    NOT_EQUAL("!=");

    private final String symbol;

    ExtraOperator(String symbol) {
        this.symbol = symbol;
    }

    public static Optional<ExtraOperator> fromMarkerOperator(MarkerOperator operator) {
        return switch (operator) {
            case EQUAL -> Optional.of(EQUAL);
            case NOT_EQUAL -> Optional.of(NOT_EQUAL);
            default -> Optional.empty();
        };
    }

    public ExtraOperator negate() {
        return this == EQUAL ? NOT_EQUAL : EQUAL;
    }

    @Override
    public String toString() {
        return symbol;
    }
}
