package com.probnet.api;

public class DuplicateVariableException extends IllegalArgumentException {
    private final String variableName;

    public DuplicateVariableException(String variableName) {
        super("Duplicate variable name: " + variableName);
        this.variableName = variableName;
    }

    public String variableName() {
        return variableName;
    }
}
