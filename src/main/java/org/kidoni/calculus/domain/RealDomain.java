package org.kidoni.calculus.domain;

import java.math.BigDecimal;

import org.kidoni.calculus.DomainException;

public final class RealDomain implements NumericDomain<Double> {
    public static final RealDomain INSTANCE = new RealDomain();

    private RealDomain() {
    }

    @Override
    public String name() {
        return "real";
    }

    @Override
    public Double zero() {
        return 0.0;
    }

    @Override
    public Double one() {
        return 1.0;
    }

    @Override
    public Double valueOf(final double real) {
        return real;
    }

    @Override
    public boolean isComplex() {
        return false;
    }

    @Override
    public Double imaginary(final double value) {
        throw new DomainException("imaginary values are not representable in the real domain");
    }

    @Override
    public Double add(final Double left, final Double right) {
        return defined(left + right, left, right, "+");
    }

    @Override
    public Double subtract(final Double left, final Double right) {
        return defined(left - right, left, right, "-");
    }

    @Override
    public Double multiply(final Double left, final Double right) {
        return defined(left * right, left, right, "*");
    }

    @Override
    public Double divide(final Double left, final Double right) {
        if (right == 0.0) {
            throw new DomainException("division by zero: " + format(left) + " / " + format(right));
        }
        return defined(left / right, left, right, "/");
    }

    @Override
    public Double power(final Double base, final Double exponent) {
        if (base == 0.0 && exponent < 0.0) {
            throw new DomainException("zero raised to a negative power: " + format(base) + " ^ " + format(exponent));
        }

        return defined(Math.pow(base, exponent), base, exponent, "^");
    }

    @Override
    public Double sin(final Double value) {
        return defined(Math.sin(value), value, "sin");
    }

    @Override
    public Double cos(final Double value) {
        return defined(Math.cos(value), value, "cos");
    }

    @Override
    public Double exp(final Double value) {
        return defined(Math.exp(value), value, "exp");
    }

    @Override
    public Double ln(final Double value) {
        if (value <= 0.0) {
            throw new DomainException("logarithm of non-positive value " + format(value));
        }
        return Math.log(value);
    }

    @Override
    public boolean isFinite(final Double value) {
        return Double.isFinite(value);
    }

    @Override
    public boolean isZero(final Double value) {
        return value == 0.0;
    }

    @Override
    public boolean isOne(final Double value) {
        return value == 1.0;
    }

    /**
     * A NaN result from operands that are not NaN means the operation has no real value.
     */
    private Double defined(final double result, final double left, final double right, final String op) {
        if (Double.isNaN(result) && !Double.isNaN(left) && !Double.isNaN(right)) {
            throw new DomainException("no real value for " + format(left) + " " + op + " " + format(right));
        }
        return result;
    }

    private Double defined(final double result, final double argument, final String function) {
        if (Double.isNaN(result) && !Double.isNaN(argument)) {
            throw new DomainException("no real value for " + function + "(" + format(argument) + ")");
        }
        return result;
    }

    @Override
    public String format(final Double value) {
        return formatDouble(value);
    }

    /**
     * Plain decimal notation without exponent or trailing zeros, e.g. {@code 5}, {@code 0.25},
     * {@code -0.0000001}. Non-finite values use {@link Double#toString(double)}.
     */
    static String formatDouble(final double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return Double.toString(value);
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    @Override
    public String toString() {
        return name();
    }
}
