package org.kidoni.calculus;

import java.util.Map;

import org.apache.commons.math3.complex.Complex;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;
import org.kidoni.calculus.domain.ComplexDomain;
import org.kidoni.calculus.domain.RealDomain;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ExpressionsTest {
    private static final RealDomain REAL = RealDomain.INSTANCE;
    private static final double DELTA = 1e-12;

    @ParameterizedTest
    @CsvSource({
            "3, +, 4",
            "3, -, 4",
            "3, *, 4",
            "3, /, 4",
            "3, ^, 4",
            "1.5, /, 0.5",
            "2.5, ^, 2",
            "0.1, +, 0.2",
            "7, -, 7.25",
    })
    void constantArithmeticMatchesDirectComputation(final double a, final char op, final double b) {
        final double expected = switch (op) {
            case '+' -> a + b;
            case '-' -> a - b;
            case '*' -> a * b;
            case '/' -> a / b;
            case '^' -> Math.pow(a, b);
            default -> throw new IllegalArgumentException(String.valueOf(op));
        };

        var text = REAL.format(a) + " " + op + " " + REAL.format(b);
        assertEquals(expected, Expressions.parse(text, REAL).eval(Map.of()), 0.0);
    }

    @Test
    void evaluation() {
        assertEquals(5.0, Expressions.parse("x+3", REAL).eval(Map.of("x", 2.0)), 0.0);
        assertEquals(4.0, Expressions.parse("2*x/4", REAL).eval(Map.of("x", 8.0)), 0.0);
        assertEquals(9.0, Expressions.parse("x^2", REAL).eval(Map.of("x", 3.0)), 0.0);
        assertEquals(0.0, Expressions.parse("sin(x)", REAL).eval(Map.of("x", 0.0)), 0.0);
        assertEquals(5.0, Expressions.parse("2 + 3", REAL).eval(Map.of()), 0.0);
    }

    @Test
    void differentiation() {
        assertEquals(4.0, Expressions.parse("x^2", REAL).differentiate("x").eval(Map.of("x", 2.0)), 0.0);
        assertEquals(1.0, Expressions.parse("sin(x)", REAL).differentiate("x").eval(Map.of("x", 0.0)), 0.0);
        assertEquals(1.0, Expressions.parse("ln(x)", REAL).differentiate("x").eval(Map.of("x", 1.0)), 0.0);
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "sin(0.5)*3-ln(2)/exp(1)",
            "-2.5*cos(1)",
            "0.0001^0.5 + 1/3",
            "exp(-1)^sin(2)",
            "sin(1)-cos(1)-exp(0.1)",
            "10^400",
            "2*10^400+1",
    })
    void variableFreeExpressionsRoundTrip(final String text) {
        var e = Expressions.parse(text, REAL);
        var reparsed = Expressions.parse(e.serialize(), REAL);

        assertEquals(e, reparsed);
        assertEquals(e.eval(Map.of()), reparsed.eval(Map.of()), DELTA);
    }

    @Test
    void undefinedConstantExpressionRoundTrips() {
        var e = Expressions.parse("10^400-10^400", REAL);
        var reparsed = Expressions.parse(e.serialize(), REAL);

        assertEquals("((10^400)-(10^400))", e.serialize());
        assertEquals(e, reparsed);
        assertThrows(DomainException.class, () -> e.eval(Map.of()));
        assertThrows(DomainException.class, () -> reparsed.eval(Map.of()));
    }

    @Test
    void undefinedFunctionValue() {
        var e = Expressions.parse("sin(x)", REAL);
        assertThrows(DomainException.class, () -> e.eval(Map.of("x", Double.POSITIVE_INFINITY)));
    }

    @Test
    void complexRoundTrip() {
        var e = Expressions.parse("(3-2i)*sin(1i) + 2i/(1+1i)", ComplexDomain.INSTANCE);
        var reparsed = Expressions.parse(e.serialize(), ComplexDomain.INSTANCE);

        Complex expected = e.eval(Map.of());
        Complex actual = reparsed.eval(Map.of());
        assertEquals(expected.getReal(), actual.getReal(), DELTA);
        assertEquals(expected.getImaginary(), actual.getImaginary(), DELTA);
    }

    @Test
    void domainFollowsLiterals() {
        assertSame(REAL, Expressions.parse("x+1").domain());

        var complex = Expressions.parse("x+1+2i");
        assertSame(ComplexDomain.INSTANCE, complex.domain());
        assertEquals("((x+1)+2i)", complex.serialize());
    }

    @Test
    void errors() {
        assertThrows(ParseException.class, () -> Expressions.parse("sin x", REAL));
        assertThrows(ParseException.class, () -> Expressions.parse("+*3", REAL));

        var e = assertThrows(UnboundVariableException.class, () -> Expressions.parse("x+3", REAL).eval(Map.of()));
        assertEquals("x", e.getVariable());

        assertThrows(DomainException.class, () -> Expressions.parse("1/x", REAL).eval(Map.of("x", 0.0)));
        assertThrows(DomainException.class, () -> Expressions.parse("ln(x)", REAL).eval(Map.of("x", -1.0)));
    }
}
