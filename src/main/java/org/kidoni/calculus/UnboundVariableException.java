package org.kidoni.calculus;

public class UnboundVariableException extends ExpressionException {
    private final String variable;

    public UnboundVariableException(final String variable) {
        super("variable '" + variable + "' is not bound");
        this.variable = variable;
    }

    public String getVariable() {
        return variable;
    }
}
