package org.kidoni.calculus;

import java.util.Map;

import org.junit.jupiter.api.Test;
import org.kidoni.calculus.domain.RealDomain;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ExpressionTest {
    private static final RealDomain REAL = RealDomain.INSTANCE;

    private final Expression<Double> x = Expression.variable(REAL, "x");
    private final Expression<Double> five = Expression.constant(REAL, 5.0);

    @Test
    void combinators() {
        var c = x.pow(Expression.constant(REAL, 2.0)).add(five).sin();

        assertEquals("5", five.serialize());
        assertEquals("x", x.serialize());
        assertEquals("sin(((x^2)+5))", c.serialize());
        assertEquals(Math.sin(30.0), c.eval(Map.of("x", 5.0)), 0.0);
    }

    @Test
    void everyOperator() {
        var y = Expression.variable(REAL, "y");
        var bindings = Map.of("x", 6.0, "y", 3.0);

        assertEquals(9.0, x.add(y).eval(bindings), 0.0);
        assertEquals(3.0, x.subtract(y).eval(bindings), 0.0);
        assertEquals(18.0, x.multiply(y).eval(bindings), 0.0);
        assertEquals(2.0, x.divide(y).eval(bindings), 0.0);
        assertEquals(216.0, x.pow(y).eval(bindings), 0.0);
        assertEquals(Math.cos(6.0), x.cos().eval(bindings), 0.0);
        assertEquals(Math.exp(3.0), y.exp().eval(bindings), 0.0);
        assertEquals(Math.log(3.0), y.ln().eval(bindings), 0.0);
    }

    @Test
    void combinatorsSimplify() {
        var one = Expression.constant(REAL, 1.0);
        var zero = Expression.constant(REAL, 0.0);

        assertEquals(x, x.multiply(one));
        assertEquals(x, x.add(zero));
        assertEquals(zero, x.multiply(zero));
        assertEquals(one, x.pow(zero));
        assertEquals("10", five.add(five).serialize());
    }

    @Test
    void operandsAreNotModified() {
        var sum = x.add(Expression.constant(REAL, 1.0));
        var square = sum.multiply(sum);

        assertEquals("(x+1)", sum.serialize());
        assertEquals("((x+1)*(x+1))", square.serialize());
        assertEquals(16.0, square.eval(Map.of("x", 3.0)), 0.0);
    }

    @Test
    void copyIsEqualButIndependent() {
        var e = x.multiply(five).sin();
        var copy = e.copy();

        assertEquals(e, copy);
        assertEquals(e.hashCode(), copy.hashCode());
        assertNotSame(e.root(), copy.root());
        assertSame(e.domain(), copy.domain());
    }

    @Test
    void differentiate() {
        var d = x.pow(Expression.constant(REAL, 2.0)).differentiate("x");

        assertEquals("((x^2)*(2/x))", d.serialize());
        assertEquals(4.0, d.eval(Map.of("x", 2.0)), 0.0);
        assertThrows(NullPointerException.class, () -> x.differentiate(null));
    }

    @Test
    void toStringSerializes() {
        var e = x.divide(five);
        assertEquals(e.serialize(), e.toString());
    }

    @Test
    void evalWithoutBinding() {
        var e = assertThrows(UnboundVariableException.class, () -> x.add(five).eval(Map.of()));
        assertEquals("x", e.getVariable());
    }
}
