package org.kidoni.calculus;

import java.util.Objects;

import org.kidoni.calculus.Expr.BinaryExpr;
import org.kidoni.calculus.Expr.ConstExpr;
import org.kidoni.calculus.Expr.FunctionExpr;
import org.kidoni.calculus.domain.NumericDomain;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Smart constructors for operator and function nodes. Every node built by {@link Expression} or by
 * differentiation goes through here, so constant folding and identity elimination (x*0, x*1, x^0,
 * x^1, x+0, x-0, x/1) happen bottom-up as the tree is built.
 * <p>
 * Zero and one are recognized syntactically: only a constant equal to the domain identity counts,
 * never a subtree that merely evaluates to it. A fold that the domain rejects, such as a literal
 * division by zero, is left as an unfolded node so the error surfaces on evaluation. So is a fold
 * whose result is infinite or NaN, since such a constant has no literal form.
 */
public final class SimplificationRules<T> {
    private static final Logger logger = LoggerFactory.getLogger(SimplificationRules.class);

    private final NumericDomain<T> domain;

    public SimplificationRules(final NumericDomain<T> domain) {
        this.domain = Objects.requireNonNull(domain, "domain");
    }

    public NumericDomain<T> domain() {
        return domain;
    }

    public Expr<T> constant(final T value) {
        return new ConstExpr<>(value);
    }

    public Expr<T> constant(final double value) {
        return new ConstExpr<>(domain.valueOf(value));
    }

    public Expr<T> zero() {
        return constant(domain.zero());
    }

    public Expr<T> one() {
        return constant(domain.one());
    }

    public boolean isZero(final Expr<T> expr) {
        return expr instanceof ConstExpr<T> c && domain.isZero(c.value());
    }

    public boolean isOne(final Expr<T> expr) {
        return expr instanceof ConstExpr<T> c && domain.isOne(c.value());
    }

    /**
     * @param kind {@link Op#ADD} or {@link Op#SUBTRACT}
     */
    public Expr<T> makeAdditive(final Op kind, final Expr<T> left, final Expr<T> right) {
        if (kind != Op.ADD && kind != Op.SUBTRACT) {
            throw new IllegalArgumentException("not an additive operator: " + kind);
        }

        if (isZero(left)) {
            return kind == Op.SUBTRACT ? makeMultiply(constant(-1), right) : right;
        }
        if (isZero(right)) {
            return left;
        }
        if (left instanceof ConstExpr<T> l && right instanceof ConstExpr<T> r) {
            return fold(kind, l, r);
        }
        return new BinaryExpr<>(kind, left, right);
    }

    public Expr<T> makeMultiply(final Expr<T> left, final Expr<T> right) {
        if (isZero(left) || isZero(right)) {
            return zero();
        }
        if (isOne(left)) {
            return right;
        }
        if (isOne(right)) {
            return left;
        }
        if (left instanceof ConstExpr<T> l && right instanceof ConstExpr<T> r) {
            return fold(Op.MULTIPLY, l, r);
        }
        return new BinaryExpr<>(Op.MULTIPLY, left, right);
    }

    public Expr<T> makeDivide(final Expr<T> left, final Expr<T> right) {
        if (isOne(right)) {
            return left;
        }
        if (isZero(left)) {
            return zero();
        }
        if (left instanceof ConstExpr<T> l && right instanceof ConstExpr<T> r) {
            return fold(Op.DIVIDE, l, r);
        }
        return new BinaryExpr<>(Op.DIVIDE, left, right);
    }

    public Expr<T> makePower(final Expr<T> base, final Expr<T> exponent) {
        if (isOne(exponent)) {
            return base;
        }
        if (isZero(exponent)) {
            return one();
        }
        if (base instanceof ConstExpr<T> l && exponent instanceof ConstExpr<T> r) {
            return fold(Op.POWER, l, r);
        }
        return new BinaryExpr<>(Op.POWER, base, exponent);
    }

    /**
     * Function applications are never folded, so {@code sin(0)} stays symbolic.
     */
    public Expr<T> makeFunction(final Func function, final Expr<T> argument) {
        return new FunctionExpr<>(function, argument);
    }

    public Expr<T> make(final Op op, final Expr<T> left, final Expr<T> right) {
        return switch (op) {
            case ADD, SUBTRACT -> makeAdditive(op, left, right);
            case MULTIPLY -> makeMultiply(left, right);
            case DIVIDE -> makeDivide(left, right);
            case POWER -> makePower(left, right);
        };
    }

    private Expr<T> fold(final Op op, final ConstExpr<T> left, final ConstExpr<T> right) {
        try {
            final T value = op.apply(domain, left.value(), right.value());
            if (!domain.isFinite(value)) {
                logger.debug("not folding {}{}{}, result {} has no literal form",
                        domain.format(left.value()), op.symbol(), domain.format(right.value()), domain.format(value));
                return new BinaryExpr<>(op, left, right);
            }
            return constant(value);
        }
        catch (DomainException e) {
            logger.debug("not folding {}{}{}, deferred to evaluation: {}",
                    domain.format(left.value()), op.symbol(), domain.format(right.value()), e.getMessage());
            return new BinaryExpr<>(op, left, right);
        }
    }
}
