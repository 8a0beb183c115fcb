package io.github.okapca.calc.tree;

import io.github.okapca.calc.tree.CalcNode.Arithmetic;
import io.github.okapca.calc.tree.CalcNode.Call;
import io.github.okapca.calc.tree.CalcNode.Clamp;
import io.github.okapca.calc.tree.CalcNode.Composite;
import io.github.okapca.calc.tree.CalcNode.Constant;
import io.github.okapca.calc.tree.CalcNode.Reference;
import io.github.okapca.calc.tree.CalcNode.Unary;

import java.math.BigDecimal;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/// Factory functions for building expression trees.
///
/// Every operand may be a [CalcExpression] or a plain `double`. When all operands
/// are constants the result is folded immediately, so `add(2, 3)` is the constant
/// `5` rather than an addition node. Otherwise the operator node is built and the
/// free references of the operands are merged.
///
/// ```java
/// import static io.github.okapca.calc.tree.CalcTree.*;
///
/// CalcExpression hypot = power(add(power(reference("x"), 2), power(reference("y"), 2)), 0.5);
/// hypot.toNumber(Map.of("x", 3, "y", 4));   // 5.0
/// hypot.toCss().expression();              // pow(pow(var(--x), 2) + pow(var(--y), 2), 0.5)
/// ```
public final class CalcTree {

    private CalcTree() {}

    /// @throws IllegalArgumentException if `value` is NaN or infinite
    public static CalcExpression constant(double value) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("Constant value must be a finite number, got " + value);
        }
        return new CalcExpression(new Constant(value), Set.of());
    }

    /// Parses a plain decimal string such as `"0.5"` or `"1.5e2"`. Java literal
    /// suffixes and hex floats are rejected.
    /// @throws IllegalArgumentException if the text is not a finite number
    public static CalcExpression constant(String value) {
        Objects.requireNonNull(value, "value must not be null");
        final double parsed;
        try {
            parsed = new BigDecimal(value.trim()).doubleValue();
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Constant value must be a finite number, got '" + value + "'", e);
        }
        return constant(parsed);
    }

    /// A free variable that renders as `var(--name)` until bound.
    /// @throws IllegalArgumentException if `name` is empty
    public static CalcExpression reference(String name) {
        Objects.requireNonNull(name, "name must not be null");
        if (name.isEmpty()) {
            throw new IllegalArgumentException("Reference name must be a non-empty string");
        }
        return new CalcExpression(new Reference(name), Set.of(name));
    }

    /// Coerces an operand or binding value: expressions pass through, numbers become
    /// constants.
    /// @throws IllegalArgumentException for any other type, or a non-finite number
    public static CalcExpression toExpression(Object value) {
        Objects.requireNonNull(value, "value must not be null");
        if (value instanceof CalcExpression expression) {
            return expression;
        }
        if (value instanceof Number number) {
            return constant(number.doubleValue());
        }
        throw new IllegalArgumentException("Expected a CalcExpression or a Number, got " + value.getClass().getName());
    }

    // Arithmetic

    public static CalcExpression add(CalcExpression left, CalcExpression right) {
        return arithmetic(ArithmeticOp.ADD, left, right);
    }

    public static CalcExpression add(CalcExpression left, double right) {
        return add(left, constant(right));
    }

    public static CalcExpression add(double left, CalcExpression right) {
        return add(constant(left), right);
    }

    public static CalcExpression add(double left, double right) {
        return add(constant(left), constant(right));
    }

    public static CalcExpression subtract(CalcExpression left, CalcExpression right) {
        return arithmetic(ArithmeticOp.SUBTRACT, left, right);
    }

    public static CalcExpression subtract(CalcExpression left, double right) {
        return subtract(left, constant(right));
    }

    public static CalcExpression subtract(double left, CalcExpression right) {
        return subtract(constant(left), right);
    }

    public static CalcExpression subtract(double left, double right) {
        return subtract(constant(left), constant(right));
    }

    public static CalcExpression multiply(CalcExpression left, CalcExpression right) {
        return arithmetic(ArithmeticOp.MULTIPLY, left, right);
    }

    public static CalcExpression multiply(CalcExpression left, double right) {
        return multiply(left, constant(right));
    }

    public static CalcExpression multiply(double left, CalcExpression right) {
        return multiply(constant(left), right);
    }

    public static CalcExpression multiply(double left, double right) {
        return multiply(constant(left), constant(right));
    }

    /// Division by zero is not rejected; a constant zero divisor folds to an
    /// infinity or NaN.
    public static CalcExpression divide(CalcExpression left, CalcExpression right) {
        return arithmetic(ArithmeticOp.DIVIDE, left, right);
    }

    public static CalcExpression divide(CalcExpression left, double right) {
        return divide(left, constant(right));
    }

    public static CalcExpression divide(double left, CalcExpression right) {
        return divide(constant(left), right);
    }

    public static CalcExpression divide(double left, double right) {
        return divide(constant(left), constant(right));
    }

    // Function calls

    public static CalcExpression power(CalcExpression base, CalcExpression exponent) {
        return call(CallOp.POWER, base, exponent);
    }

    public static CalcExpression power(CalcExpression base, double exponent) {
        return power(base, constant(exponent));
    }

    public static CalcExpression power(double base, CalcExpression exponent) {
        return power(constant(base), exponent);
    }

    public static CalcExpression power(double base, double exponent) {
        return power(constant(base), constant(exponent));
    }

    public static CalcExpression max(CalcExpression a, CalcExpression b) {
        return call(CallOp.MAX, a, b);
    }

    public static CalcExpression max(CalcExpression a, double b) {
        return max(a, constant(b));
    }

    public static CalcExpression max(double a, CalcExpression b) {
        return max(constant(a), b);
    }

    public static CalcExpression max(double a, double b) {
        return max(constant(a), constant(b));
    }

    public static CalcExpression min(CalcExpression a, CalcExpression b) {
        return call(CallOp.MIN, a, b);
    }

    public static CalcExpression min(CalcExpression a, double b) {
        return min(a, constant(b));
    }

    public static CalcExpression min(double a, CalcExpression b) {
        return min(constant(a), b);
    }

    public static CalcExpression min(double a, double b) {
        return min(constant(a), constant(b));
    }

    /// Sine of an angle in radians.
    public static CalcExpression sin(CalcExpression arg) {
        return unary(UnaryOp.SIN, arg);
    }

    public static CalcExpression sin(double arg) {
        return sin(constant(arg));
    }

    public static CalcExpression abs(CalcExpression arg) {
        return unary(UnaryOp.ABS, arg);
    }

    public static CalcExpression abs(double arg) {
        return abs(constant(arg));
    }

    public static CalcExpression sign(CalcExpression arg) {
        return unary(UnaryOp.SIGN, arg);
    }

    public static CalcExpression sign(double arg) {
        return sign(constant(arg));
    }

    /// `max(minimum, min(value, maximum))`. When `minimum > maximum` the minimum wins.
    public static CalcExpression clamp(CalcExpression minimum, CalcExpression value, CalcExpression maximum) {
        Objects.requireNonNull(minimum, "minimum must not be null");
        Objects.requireNonNull(value, "value must not be null");
        Objects.requireNonNull(maximum, "maximum must not be null");
        final CalcNode node;
        if (minimum.node() instanceof Constant lo && value.node() instanceof Constant v
                && maximum.node() instanceof Constant hi) {
            node = new Constant(Clamp.apply(lo.value(), v.value(), hi.value()));
        } else {
            node = new Clamp(minimum.node(), value.node(), maximum.node());
        }
        return new CalcExpression(node, mergeRefs(minimum, value, maximum));
    }

    public static CalcExpression clamp(double minimum, CalcExpression value, double maximum) {
        return clamp(constant(minimum), value, constant(maximum));
    }

    public static CalcExpression clamp(double minimum, CalcExpression value, CalcExpression maximum) {
        return clamp(constant(minimum), value, maximum);
    }

    public static CalcExpression clamp(CalcExpression minimum, CalcExpression value, double maximum) {
        return clamp(minimum, value, constant(maximum));
    }

    public static CalcExpression clamp(CalcExpression minimum, double value, CalcExpression maximum) {
        return clamp(minimum, constant(value), maximum);
    }

    public static CalcExpression clamp(double minimum, double value, CalcExpression maximum) {
        return clamp(constant(minimum), constant(value), maximum);
    }

    public static CalcExpression clamp(CalcExpression minimum, double value, double maximum) {
        return clamp(minimum, constant(value), constant(maximum));
    }

    public static CalcExpression clamp(double minimum, double value, double maximum) {
        return clamp(constant(minimum), constant(value), constant(maximum));
    }

    // Composite literals

    /// An `oklch(lightness chroma hue)` color.
    public static CalcColor oklch(CalcExpression lightness, CalcExpression chroma, CalcExpression hue) {
        return composite("oklch", lightness, chroma, hue);
    }

    public static CalcColor oklch(CalcExpression lightness, CalcExpression chroma, double hue) {
        return oklch(lightness, chroma, constant(hue));
    }

    public static CalcColor oklch(double lightness, double chroma, double hue) {
        return oklch(constant(lightness), constant(chroma), constant(hue));
    }

    /// A three-channel literal rendered as `function(a b c)`. Never folded.
    /// @throws IllegalArgumentException if `function` is empty
    public static CalcColor composite(String function, CalcExpression a, CalcExpression b, CalcExpression c) {
        Objects.requireNonNull(function, "function must not be null");
        Objects.requireNonNull(a, "a must not be null");
        Objects.requireNonNull(b, "b must not be null");
        Objects.requireNonNull(c, "c must not be null");
        if (function.isEmpty()) {
            throw new IllegalArgumentException("Composite function name must be a non-empty string");
        }
        return new CalcColor(new Composite(function, a.node(), b.node(), c.node()), mergeRefs(a, b, c));
    }

    private static CalcExpression arithmetic(ArithmeticOp op, CalcExpression left, CalcExpression right) {
        Objects.requireNonNull(left, "left must not be null");
        Objects.requireNonNull(right, "right must not be null");
        final CalcNode node = left.node() instanceof Constant l && right.node() instanceof Constant r
                ? new Constant(op.apply(l.value(), r.value()))
                : new Arithmetic(op, left.node(), right.node());
        return new CalcExpression(node, mergeRefs(left, right));
    }

    private static CalcExpression call(CallOp op, CalcExpression a, CalcExpression b) {
        Objects.requireNonNull(a, "a must not be null");
        Objects.requireNonNull(b, "b must not be null");
        final CalcNode node = a.node() instanceof Constant x && b.node() instanceof Constant y
                ? new Constant(op.apply(x.value(), y.value()))
                : new Call(op, a.node(), b.node());
        return new CalcExpression(node, mergeRefs(a, b));
    }

    private static CalcExpression unary(UnaryOp op, CalcExpression arg) {
        Objects.requireNonNull(arg, "arg must not be null");
        final CalcNode node = arg.node() instanceof Constant c
                ? new Constant(op.apply(c.value()))
                : new Unary(op, arg.node());
        return new CalcExpression(node, arg.refs());
    }

    private static Set<String> mergeRefs(CalcExpression... expressions) {
        final Set<String> refs = new LinkedHashSet<>();
        for (final CalcExpression expression : expressions) {
            refs.addAll(expression.refs());
        }
        return refs;
    }
}
