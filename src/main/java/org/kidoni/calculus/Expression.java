package org.kidoni.calculus;

import java.util.Map;
import java.util.Objects;

import org.kidoni.calculus.Expr.ConstExpr;
import org.kidoni.calculus.Expr.VarExpr;
import org.kidoni.calculus.domain.NumericDomain;

/**
 * An expression tree together with the numeric domain it computes over.
 * <p>
 * Expressions are values: combinators return new expressions and never modify their operands,
 * so the same expression may be used as both operands of a combination. {@link #copy()} gives a
 * structurally independent tree where one is wanted.
 *
 * @param <T> the scalar type
 */
public final class Expression<T> {
    private final SimplificationRules<T> rules;
    private final Expr<T> root;

    private Expression(final SimplificationRules<T> rules, final Expr<T> root) {
        this.rules = rules;
        this.root = Objects.requireNonNull(root, "root");
    }

    public static <T> Expression<T> constant(final NumericDomain<T> domain, final T value) {
        return new Expression<>(new SimplificationRules<>(domain), new ConstExpr<>(value));
    }

    public static <T> Expression<T> variable(final NumericDomain<T> domain, final String name) {
        return new Expression<>(new SimplificationRules<>(domain), new VarExpr<>(name));
    }

    public Expr<T> root() {
        return root;
    }

    public NumericDomain<T> domain() {
        return rules.domain();
    }

    public Expression<T> add(final Expression<T> other) {
        return combine(Op.ADD, other);
    }

    public Expression<T> subtract(final Expression<T> other) {
        return combine(Op.SUBTRACT, other);
    }

    public Expression<T> multiply(final Expression<T> other) {
        return combine(Op.MULTIPLY, other);
    }

    public Expression<T> divide(final Expression<T> other) {
        return combine(Op.DIVIDE, other);
    }

    public Expression<T> pow(final Expression<T> other) {
        return combine(Op.POWER, other);
    }

    public Expression<T> combine(final Op op, final Expression<T> other) {
        return new Expression<>(rules, rules.make(op, root, other.root));
    }

    public Expression<T> sin() {
        return apply(Func.SIN);
    }

    public Expression<T> cos() {
        return apply(Func.COS);
    }

    public Expression<T> exp() {
        return apply(Func.EXP);
    }

    public Expression<T> ln() {
        return apply(Func.LN);
    }

    public Expression<T> apply(final Func function) {
        return new Expression<>(rules, rules.makeFunction(function, root));
    }

    /**
     * @param bindings variable values, consulted read-only
     * @throws UnboundVariableException if a variable is missing from {@code bindings}
     * @throws DomainException if an operation is undefined for the values it receives
     */
    public T eval(final Map<String, ? extends T> bindings) {
        return root.eval(bindings, rules.domain());
    }

    public String serialize() {
        return root.serialize(rules.domain());
    }

    public Expression<T> differentiate(final String variable) {
        Objects.requireNonNull(variable, "variable");
        return new Expression<>(rules, root.differentiate(variable, rules));
    }

    public Expression<T> copy() {
        return new Expression<>(rules, root.copy());
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Expression<?> other)) {
            return false;
        }
        return rules.domain().equals(other.rules.domain()) && root.equals(other.root);
    }

    @Override
    public int hashCode() {
        return Objects.hash(rules.domain(), root);
    }

    @Override
    public String toString() {
        return serialize();
    }
}
