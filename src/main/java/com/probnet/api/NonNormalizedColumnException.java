package com.probnet.api;

/**
 * Thrown when a column of a conditional probability table is not a valid
 * distribution: its entries do not sum to 1 within tolerance, or one of them
 * is negative or not finite.
 */
public class NonNormalizedColumnException extends IllegalArgumentException {
    private final String variableName;
    private final int column;
    private final double sum;

    public NonNormalizedColumnException(String variableName, int column, double sum) {
        super("Variable '" + variableName + "': column " + column + " sums to " + sum + ", expected 1.0");
        this.variableName = variableName;
        this.column = column;
        this.sum = sum;
    }

    public NonNormalizedColumnException(String variableName, int column, String message) {
        super("Variable '" + variableName + "': column " + column + " " + message);
        this.variableName = variableName;
        this.column = column;
        this.sum = Double.NaN;
    }

    public String variableName() {
        return variableName;
    }

    public int column() {
        return column;
    }

    /** The offending column sum, or NaN when the column failed for another reason. */
    public double sum() {
        return sum;
    }
}
