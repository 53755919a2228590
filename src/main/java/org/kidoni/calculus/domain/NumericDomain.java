package org.kidoni.calculus.domain;

/**
 * The scalar arithmetic an expression tree computes over.
 * <p>
 * Operations that are undefined for their arguments throw
 * {@link org.kidoni.calculus.DomainException}; nothing is pre-validated by the tree.
 *
 * @param <T> the scalar type
 */
public interface NumericDomain<T> {
    /**
     * @return short lower-case name of the domain, e.g. {@code real}
     */
    String name();

    T zero();

    T one();

    T valueOf(double real);

    /**
     * @return whether literals such as {@code 2i} are representable
     */
    boolean isComplex();

    /**
     * @throws org.kidoni.calculus.DomainException if the domain is not {@linkplain #isComplex() complex}
     */
    T imaginary(double value);

    T add(T left, T right);

    T subtract(T left, T right);

    T multiply(T left, T right);

    T divide(T left, T right);

    T power(T base, T exponent);

    T sin(T value);

    T cos(T value);

    T exp(T value);

    T ln(T value);

    /**
     * @return whether {@code value} has no infinite or NaN part
     */
    boolean isFinite(T value);

    boolean isZero(T value);

    boolean isOne(T value);

    /**
     * Renders a value in a form the expression parser reads back as the same value.
     */
    String format(T value);
}
