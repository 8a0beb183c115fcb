package io.github.okapca.calc.tree;

import java.util.function.DoubleBinaryOperator;

/// Infix operators. These are the only operators that render without a function
/// call around them, so they are the only ones that ever need parentheses or a
/// `calc()` group.
public enum ArithmeticOp {
    ADD("+", (a, b) -> a + b),
    SUBTRACT("-", (a, b) -> a - b),
    MULTIPLY("*", (a, b) -> a * b),
    /// IEEE division: a zero divisor gives an infinity or NaN, not an error.
    DIVIDE("/", (a, b) -> a / b);

    private final String symbol;
    private final DoubleBinaryOperator operator;

    ArithmeticOp(String symbol, DoubleBinaryOperator operator) {
        this.symbol = symbol;
        this.operator = operator;
    }

    public String symbol() {
        return symbol;
    }

    public double apply(double left, double right) {
        return operator.applyAsDouble(left, right);
    }

    /// True for `*` and `/`, whose additive operands must be parenthesized.
    boolean isMultiplicative() {
        return this == MULTIPLY || this == DIVIDE;
    }

    /// True for `+` and `-`.
    boolean isAdditive() {
        return this == ADD || this == SUBTRACT;
    }
}
