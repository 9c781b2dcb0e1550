package com.probnet.api;

/**
 * Thrown when an operation references a variable that is not registered in
 * the network.
 */
public class UnknownVariableException extends IllegalArgumentException {
    private final String variableName;

    public UnknownVariableException(String variableName) {
        super("Unknown variable: " + variableName);
        this.variableName = variableName;
    }

    public String variableName() {
        return variableName;
    }
}
