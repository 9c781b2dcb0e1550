package com.probnet.api;

/**
 * Thrown when a conditional probability table does not have the shape implied
 * by its variable's cardinality and its parents' cardinalities.
 */
public class ShapeMismatchException extends IllegalArgumentException {
    private final String variableName;

    public ShapeMismatchException(String variableName, String message) {
        super("Variable '" + variableName + "': " + message);
        this.variableName = variableName;
    }

    public String variableName() {
        return variableName;
    }
}
