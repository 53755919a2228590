package org.kidoni.calculus;

import org.kidoni.calculus.domain.NumericDomain;

/**
 * Binary operators, with the priority the parser uses to order them. All operators, including
 * {@link #POWER}, associate left to right.
 */
public enum Op {
    ADD('+', 1),
    SUBTRACT('-', 1),
    MULTIPLY('*', 2),
    DIVIDE('/', 2),
    POWER('^', 3);

    private final char symbol;
    private final int priority;

    Op(final char symbol, final int priority) {
        this.symbol = symbol;
        this.priority = priority;
    }

    public char symbol() {
        return symbol;
    }

    public int priority() {
        return priority;
    }

    public <T> T apply(final NumericDomain<T> domain, final T left, final T right) {
        return switch (this) {
            case ADD -> domain.add(left, right);
            case SUBTRACT -> domain.subtract(left, right);
            case MULTIPLY -> domain.multiply(left, right);
            case DIVIDE -> domain.divide(left, right);
            case POWER -> domain.power(left, right);
        };
    }

    public static boolean isOperator(final char symbol) {
        for (Op op : values()) {
            if (op.symbol == symbol) {
                return true;
            }
        }
        return false;
    }

    public static Op of(final char symbol) {
        return switch (symbol) {
            case '+' -> ADD;
            case '-' -> SUBTRACT;
            case '*' -> MULTIPLY;
            case '/' -> DIVIDE;
            case '^' -> POWER;
            default -> throw new IllegalArgumentException("unknown operator: " + symbol);
        };
    }
}
