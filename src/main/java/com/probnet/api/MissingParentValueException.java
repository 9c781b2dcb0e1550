package com.probnet.api;

/**
 * Thrown by a probability lookup when the parent assignment has no value for
 * one of the variable's declared parents.
 *
 * During inference this indicates a network whose edges and declared parents
 * disagree; {@code BayesianNetwork.checkConsistency()} reports such networks
 * up front.
 */
public class MissingParentValueException extends IllegalArgumentException {
    private final String variableName;
    private final String parentName;

    public MissingParentValueException(String variableName, String parentName) {
        super("Variable '" + variableName + "': no value for parent '" + parentName + "'");
        this.variableName = variableName;
        this.parentName = parentName;
    }

    public String variableName() {
        return variableName;
    }

    public String parentName() {
        return parentName;
    }
}
