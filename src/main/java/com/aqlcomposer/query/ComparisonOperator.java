package com.aqlcomposer.query;

/**
 * Comparison operators supported in FILTER and PRUNE clauses.
 * Unary operators carry a fixed right-hand side and take no operand.
 */
public enum ComparisonOperator {

    EQUALS("==", null),
    NOT_EQUALS("!=", null),
    GREATER_THAN(">", null),
    GREATER_OR_EQUAL(">=", null),
    LESSER_THAN("<", null),
    LESSER_OR_EQUAL("<=", null),
    LIKE("LIKE", null),
    NOT_LIKE("NOT LIKE", null),
    MATCHES("=~", null),
    DOES_NOT_MATCH("!~", null),
    IN("IN", null),
    NOT_IN("NOT IN", null),
    IS_NULL("==", "null"),
    IS_NOT_NULL("!=", "null"),
    IS_TRUE("==", "true"),
    IS_FALSE("==", "false");

    private final String aql;
    private final String fixedOperand;

    ComparisonOperator(String aql, String fixedOperand) {
        this.aql = aql;
        this.fixedOperand = fixedOperand;
    }

    public String getAql() {
        return aql;
    }

    /**
     * Right-hand literal of a unary operator, or null for binary operators
     */
    public String getFixedOperand() {
        return fixedOperand;
    }

    public boolean isUnary() {
        return fixedOperand != null;
    }
}
