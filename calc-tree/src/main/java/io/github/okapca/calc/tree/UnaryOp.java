package io.github.okapca.calc.tree;

import java.util.function.DoubleUnaryOperator;

/// Single-argument functions. All of them render as `name(arg)`.
public enum UnaryOp {
    /// Sine, argument in radians.
    SIN("sin", Math::sin),
    ABS("abs", Math::abs),
    /// -1, 0 or 1. Keeps the sign of zero; NaN stays NaN.
    SIGN("sign", Math::signum);

    private final String function;
    private final DoubleUnaryOperator operator;

    UnaryOp(String function, DoubleUnaryOperator operator) {
        this.function = function;
        this.operator = operator;
    }

    /// The function name used in rendered text.
    public String function() {
        return function;
    }

    public double apply(double value) {
        return operator.applyAsDouble(value);
    }
}
