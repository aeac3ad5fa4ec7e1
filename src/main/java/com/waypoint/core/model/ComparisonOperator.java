package com.waypoint.core.model;

import java.util.Arrays;

/**
 * Comparators allowed in a {@link PlanNode.CheckValue} condition.
 * <p>
 * Each constant carries the attribute code used in plan XML and the Promela symbol
 * it compiles to.
 */
public enum ComparisonOperator {
    LT("lt", "<"),
    LTE("lte", "<="),
    GT("gt", ">"),
    GTE("gte", ">="),
    EQ("eq", "=="),
    NEQ("neq", "!=");

    private final String code;
    private final String symbol;

    ComparisonOperator(String code, String symbol) {
        this.code = code;
        this.symbol = symbol;
    }

    public String code() {
        return code;
    }

    public String symbol() {
        return symbol;
    }

    /**
     * The comparator that holds exactly when this one does not.
     */
    public ComparisonOperator negate() {
        return switch (this) {
            case LT -> GTE;
            case LTE -> GT;
            case GT -> LTE;
            case GTE -> LT;
            case EQ -> NEQ;
            case NEQ -> EQ;
        };
    }

    /**
     * Looks up a comparator by its plan XML code ({@code lt}, {@code gte}, ...).
     *
     * @throws IllegalArgumentException if the code is not recognised
     */
    public static ComparisonOperator fromCode(String code) {
        return Arrays.stream(values())
                .filter(op -> op.code.equalsIgnoreCase(code))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown comparator: " + code));
    }
}
