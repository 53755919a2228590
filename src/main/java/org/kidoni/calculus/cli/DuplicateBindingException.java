package org.kidoni.calculus.cli;

import org.kidoni.calculus.ExpressionException;

public class DuplicateBindingException extends ExpressionException {
    private final String variable;

    public DuplicateBindingException(final String variable) {
        super("variable '" + variable + "' is assigned more than once");
        this.variable = variable;
    }

    public String getVariable() {
        return variable;
    }
}
