package com.probnet.api;

/**
 * Thrown when a state index lies outside {@code [0, cardinality)} of the
 * variable it refers to.
 */
public class InvalidStateException extends IllegalArgumentException {
    private final String variableName;
    private final int state;
    private final int cardinality;

    public InvalidStateException(String variableName, int state, int cardinality) {
        super("Variable '" + variableName + "': state " + state + " out of range [0, " + cardinality + ")");
        this.variableName = variableName;
        this.state = state;
        this.cardinality = cardinality;
    }

    public String variableName() {
        return variableName;
    }

    public int state() {
        return state;
    }

    public int cardinality() {
        return cardinality;
    }
}
