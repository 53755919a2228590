package org.kidoni.calculus;

/**
 * A scalar operation that is undefined in its numeric domain, such as division by zero or the
 * logarithm of a non-positive real.
 */
public class DomainException extends ExpressionException {
    public DomainException(final String message) {
        super(message);
    }
}
