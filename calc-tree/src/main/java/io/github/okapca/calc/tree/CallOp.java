package io.github.okapca.calc.tree;

import java.util.function.DoubleBinaryOperator;

/// Two-argument functions rendered as `name(a, b)`.
public enum CallOp {
    /// Real exponentiation. A negative base with a fractional exponent gives NaN.
    POWER("pow", Math::pow),
    /// NaN if either operand is NaN.
    MAX("max", Math::max),
    /// NaN if either operand is NaN.
    MIN("min", Math::min);

    private final String function;
    private final DoubleBinaryOperator operator;

    CallOp(String function, DoubleBinaryOperator operator) {
        this.function = function;
        this.operator = operator;
    }

    public String function() {
        return function;
    }

    public double apply(double a, double b) {
        return operator.applyAsDouble(a, b);
    }
}
