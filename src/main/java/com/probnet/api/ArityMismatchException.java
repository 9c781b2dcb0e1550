package com.probnet.api;

/**
 * Thrown when a variable's parent names and parent cardinalities disagree.
 */
public class ArityMismatchException extends IllegalArgumentException {
    private final String variableName;

    public ArityMismatchException(String variableName, String message) {
        super("Variable '" + variableName + "': " + message);
        this.variableName = variableName;
    }

    public String variableName() {
        return variableName;
    }
}
