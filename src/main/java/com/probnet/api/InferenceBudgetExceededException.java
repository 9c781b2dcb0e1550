package com.probnet.api;

/**
 * Thrown when a query performs more probability lookups than the engine's
 * configured evaluation budget allows.
 */
public class InferenceBudgetExceededException extends IllegalStateException {
    private final String queryVariable;
    private final long budget;

    public InferenceBudgetExceededException(String queryVariable, long budget) {
        super("Query for '" + queryVariable + "' exceeded the evaluation budget of " + budget);
        this.queryVariable = queryVariable;
        this.budget = budget;
    }

    public String queryVariable() {
        return queryVariable;
    }

    public long budget() {
        return budget;
    }
}
