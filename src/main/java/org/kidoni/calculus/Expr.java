package org.kidoni.calculus;

import java.util.Map;
import java.util.Objects;

import org.kidoni.calculus.domain.NumericDomain;

/**
 * Node of an expression tree. The four variants are the only implementations; nodes are
 * immutable once constructed and never hold a null child.
 *
 * @param <T> scalar type of the {@link NumericDomain} the tree computes over
 */
public sealed interface Expr<T> {
    /**
     * @throws UnboundVariableException if a variable of the tree is missing from {@code bindings}
     * @throws DomainException if an operation is undefined for the values it receives
     */
    T eval(Map<String, ? extends T> bindings, NumericDomain<T> domain);

    /**
     * Fully parenthesized text that the parser reads back into an equal tree.
     */
    String serialize(NumericDomain<T> domain);

    /**
     * @return a structurally independent deep copy
     */
    Expr<T> copy();

    /**
     * Derivative with respect to {@code variable}, built only through {@code rules} so the
     * result is already simplified.
     */
    Expr<T> differentiate(String variable, SimplificationRules<T> rules);

    record ConstExpr<T>(T value) implements Expr<T> {
        public ConstExpr {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public T eval(final Map<String, ? extends T> bindings, final NumericDomain<T> domain) {
            return value;
        }

        @Override
        public String serialize(final NumericDomain<T> domain) {
            return domain.format(value);
        }

        @Override
        public Expr<T> copy() {
            return new ConstExpr<>(value);
        }

        @Override
        public Expr<T> differentiate(final String variable, final SimplificationRules<T> rules) {
            return rules.zero();
        }
    }

    record VarExpr<T>(String name) implements Expr<T> {
        public VarExpr {
            Objects.requireNonNull(name, "name");
        }

        @Override
        public T eval(final Map<String, ? extends T> bindings, final NumericDomain<T> domain) {
            final T value = bindings.get(name);
            if (value == null) {
                throw new UnboundVariableException(name);
            }
            return value;
        }

        @Override
        public String serialize(final NumericDomain<T> domain) {
            return name;
        }

        @Override
        public Expr<T> copy() {
            return new VarExpr<>(name);
        }

        @Override
        public Expr<T> differentiate(final String variable, final SimplificationRules<T> rules) {
            return name.equals(variable) ? rules.one() : rules.zero();
        }
    }

    record BinaryExpr<T>(Op op, Expr<T> left, Expr<T> right) implements Expr<T> {
        public BinaryExpr {
            Objects.requireNonNull(op, "op");
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }

        @Override
        public T eval(final Map<String, ? extends T> bindings, final NumericDomain<T> domain) {
            final T l = left.eval(bindings, domain);
            final T r = right.eval(bindings, domain);
            return op.apply(domain, l, r);
        }

        @Override
        public String serialize(final NumericDomain<T> domain) {
            return "(" + left.serialize(domain) + op.symbol() + right.serialize(domain) + ")";
        }

        @Override
        public Expr<T> copy() {
            return new BinaryExpr<>(op, left.copy(), right.copy());
        }

        @Override
        public Expr<T> differentiate(final String variable, final SimplificationRules<T> rules) {
            final Expr<T> dl = left.differentiate(variable, rules);
            final Expr<T> dr = right.differentiate(variable, rules);

            return switch (op) {
                case ADD, SUBTRACT -> rules.makeAdditive(op, dl, dr);
                case MULTIPLY -> rules.makeAdditive(Op.ADD,
                        rules.makeMultiply(dl, right),
                        rules.makeMultiply(left, dr));
                case DIVIDE -> rules.makeDivide(
                        rules.makeAdditive(Op.SUBTRACT, rules.makeMultiply(dl, right), rules.makeMultiply(left, dr)),
                        rules.makePower(right, rules.constant(2)));
                // l^r * (l' * r/l + r' * ln(l)), covering variable base and variable exponent alike
                case POWER -> rules.makeMultiply(
                        rules.makePower(left, right),
                        rules.makeAdditive(Op.ADD,
                                rules.makeMultiply(dl, rules.makeDivide(right, left)),
                                rules.makeMultiply(dr, rules.makeFunction(Func.LN, left))));
            };
        }
    }

    record FunctionExpr<T>(Func function, Expr<T> argument) implements Expr<T> {
        public FunctionExpr {
            Objects.requireNonNull(function, "function");
            Objects.requireNonNull(argument, "argument");
        }

        @Override
        public T eval(final Map<String, ? extends T> bindings, final NumericDomain<T> domain) {
            return function.apply(domain, argument.eval(bindings, domain));
        }

        @Override
        public String serialize(final NumericDomain<T> domain) {
            return function.functionName() + "(" + argument.serialize(domain) + ")";
        }

        @Override
        public Expr<T> copy() {
            return new FunctionExpr<>(function, argument.copy());
        }

        @Override
        public Expr<T> differentiate(final String variable, final SimplificationRules<T> rules) {
            final Expr<T> outer = switch (function) {
                case SIN -> rules.makeFunction(Func.COS, argument);
                case COS -> rules.makeMultiply(rules.constant(-1), rules.makeFunction(Func.SIN, argument));
                case EXP -> rules.makeFunction(Func.EXP, argument);
                case LN -> rules.makeDivide(rules.one(), argument);
            };
            return rules.makeMultiply(outer, argument.differentiate(variable, rules));
        }
    }
}
