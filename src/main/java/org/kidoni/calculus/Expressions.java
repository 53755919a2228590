package org.kidoni.calculus;

import org.kidoni.calculus.domain.ComplexDomain;
import org.kidoni.calculus.domain.NumericDomain;
import org.kidoni.calculus.domain.RealDomain;

/**
 * Parsing entry points.
 */
public final class Expressions {
    private Expressions() {
    }

    public static <T> Expression<T> parse(final String text, final NumericDomain<T> domain) {
        return new ExpressionParser<>(domain).parse(text);
    }

    /**
     * Parses in the complex domain when {@code text} contains an imaginary literal, in the real
     * domain otherwise.
     */
    public static Expression<?> parse(final String text) {
        return parse(text, domainFor(text));
    }

    public static NumericDomain<?> domainFor(final String text) {
        return ExpressionParser.containsImaginaryLiteral(text) ? ComplexDomain.INSTANCE : RealDomain.INSTANCE;
    }
}
