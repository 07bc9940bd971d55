package com.aqlcomposer.query;

/**
 * Boolean combinator between two filter terms
 */
public enum LogicalOperator {
    AND("&&"),
    OR("||");

    private final String aql;

    LogicalOperator(String aql) {
        this.aql = aql;
    }

    public String getAql() {
        return aql;
    }
}
