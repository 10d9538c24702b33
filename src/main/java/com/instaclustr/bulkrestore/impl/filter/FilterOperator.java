package com.instaclustr.bulkrestore.impl.filter;

import com.fasterxml.jackson.annotation.JsonValue;

public enum FilterOperator {
    EQ("$eq"),
    IN("$in"),
    CONTAINS("$contains"),
    ALL("$all"),
    GT("$gt"),
    LTE("$lte");

    private final String symbol;

    FilterOperator(final String symbol) {
        this.symbol = symbol;
    }

    @JsonValue
    public String getSymbol() {
        return symbol;
    }

    @Override
    public String toString() {
        return symbol;
    }
}
