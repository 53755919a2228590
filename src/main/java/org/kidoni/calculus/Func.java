package org.kidoni.calculus;

import java.util.Optional;

import org.kidoni.calculus.domain.NumericDomain;

public enum Func {
    SIN("sin"),
    COS("cos"),
    EXP("exp"),
    LN("ln");

    private final String functionName;

    Func(final String functionName) {
        this.functionName = functionName;
    }

    public String functionName() {
        return functionName;
    }

    public <T> T apply(final NumericDomain<T> domain, final T argument) {
        return switch (this) {
            case SIN -> domain.sin(argument);
            case COS -> domain.cos(argument);
            case EXP -> domain.exp(argument);
            case LN -> domain.ln(argument);
        };
    }

    public static Optional<Func> byName(final String name) {
        for (Func func : values()) {
            if (func.functionName.equals(name)) {
                return Optional.of(func);
            }
        }
        return Optional.empty();
    }
}
