package org.kidoni.calculus.domain;

import org.apache.commons.math3.complex.Complex;
import org.kidoni.calculus.DomainException;

/**
 * Complex arithmetic backed by Commons Math {@link Complex}. Logarithms use the principal branch.
 */
public final class ComplexDomain implements NumericDomain<Complex> {
    public static final ComplexDomain INSTANCE = new ComplexDomain();

    // integral exponents up to this magnitude are computed by repeated multiplication
    private static final int MAX_EXACT_EXPONENT = 64;

    private ComplexDomain() {
    }

    @Override
    public String name() {
        return "complex";
    }

    @Override
    public Complex zero() {
        return Complex.ZERO;
    }

    @Override
    public Complex one() {
        return Complex.ONE;
    }

    @Override
    public Complex valueOf(final double real) {
        return new Complex(real, 0.0);
    }

    @Override
    public boolean isComplex() {
        return true;
    }

    @Override
    public Complex imaginary(final double value) {
        return new Complex(0.0, value);
    }

    @Override
    public Complex add(final Complex left, final Complex right) {
        return left.add(right);
    }

    @Override
    public Complex subtract(final Complex left, final Complex right) {
        return left.subtract(right);
    }

    @Override
    public Complex multiply(final Complex left, final Complex right) {
        return left.multiply(right);
    }

    @Override
    public Complex divide(final Complex left, final Complex right) {
        if (isZero(right)) {
            throw new DomainException("division by zero: " + format(left) + " / " + format(right));
        }
        return left.divide(right);
    }

    @Override
    public Complex power(final Complex base, final Complex exponent) {
        if (isIntegral(exponent)) {
            return integralPower(base, (int) exponent.getReal());
        }

        if (isZero(base)) {
            if (exponent.getImaginary() == 0.0 && exponent.getReal() > 0.0) {
                return Complex.ZERO;
            }
            throw new DomainException("zero raised to " + format(exponent));
        }
        return base.pow(exponent);
    }

    @Override
    public Complex sin(final Complex value) {
        return value.sin();
    }

    @Override
    public Complex cos(final Complex value) {
        return value.cos();
    }

    @Override
    public Complex exp(final Complex value) {
        return value.exp();
    }

    @Override
    public Complex ln(final Complex value) {
        if (isZero(value)) {
            throw new DomainException("logarithm of zero");
        }
        return value.log();
    }

    @Override
    public boolean isFinite(final Complex value) {
        return Double.isFinite(value.getReal()) && Double.isFinite(value.getImaginary());
    }

    @Override
    public boolean isZero(final Complex value) {
        return value.getReal() == 0.0 && value.getImaginary() == 0.0;
    }

    @Override
    public boolean isOne(final Complex value) {
        return value.getReal() == 1.0 && value.getImaginary() == 0.0;
    }

    @Override
    public String format(final Complex value) {
        final double re = value.getReal();
        final double im = value.getImaginary();

        if (im == 0.0) {
            return RealDomain.formatDouble(re);
        }
        if (re == 0.0) {
            return RealDomain.formatDouble(im) + "i";
        }
        return "(" + RealDomain.formatDouble(re) + (im < 0.0 ? "-" : "+") + RealDomain.formatDouble(Math.abs(im)) + "i)";
    }

    private static boolean isIntegral(final Complex exponent) {
        final double re = exponent.getReal();
        return exponent.getImaginary() == 0.0 && re == Math.rint(re) && Math.abs(re) <= MAX_EXACT_EXPONENT;
    }

    private Complex integralPower(final Complex base, final int exponent) {
        Complex result = Complex.ONE;
        Complex square = base;
        int remaining = Math.abs(exponent);
        while (remaining > 0) {
            if ((remaining & 1) == 1) {
                result = result.multiply(square);
            }
            square = square.multiply(square);
            remaining >>= 1;
        }

        if (exponent < 0) {
            if (isZero(base)) {
                throw new DomainException("zero raised to a negative power: " + exponent);
            }
            return Complex.ONE.divide(result);
        }
        return result;
    }

    @Override
    public String toString() {
        return name();
    }
}
