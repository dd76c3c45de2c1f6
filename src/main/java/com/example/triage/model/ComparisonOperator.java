package com.example.triage.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ComparisonOperator {
    GREATER_OR_EQUAL(">="),
    GREATER(">"),
    EQUAL("="),
    LESS_OR_EQUAL("<="),
    LESS("<"),
    INCLUDES("includes"),
    EXCLUDES("excludes");

    private final String symbol;

    ComparisonOperator(String symbol) {
        this.symbol = symbol;
    }

    @JsonValue
    public String getSymbol() {
        return symbol;
    }

    @JsonCreator
    public static ComparisonOperator fromSymbol(String symbol) {
        for (ComparisonOperator operator : values()) {
            if (operator.symbol.equals(symbol)) {
                return operator;
            }
        }
        throw new IllegalArgumentException("Operador desconhecido: " + symbol);
    }
}
