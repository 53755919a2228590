package org.kidoni.calculus;

/**
 * Base class of every failure raised while parsing, evaluating or differentiating an expression.
 */
public class ExpressionException extends RuntimeException {
    public ExpressionException(final String message) {
        super(message);
    }

    public ExpressionException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
