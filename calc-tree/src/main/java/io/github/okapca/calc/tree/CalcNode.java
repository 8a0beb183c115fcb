package io.github.okapca.calc.tree;

import java.util.Map;
import java.util.Objects;
import java.util.Set;

/// The expression algebra. Every variant is an immutable record holding only its
/// direct children; transformations always build new nodes.
///
/// Each variant answers four questions:
/// - [#substitute(Map)] replaces bound references and folds any subtree that became
///   fully constant into a single [Constant]
/// - [#isConstant()] is true iff every reachable leaf is a [Constant]
/// - [#evaluateConstant()] computes the double value, failing on free references
/// - [#serialize(DeclarationTable)] renders CSS text, hoisting [Property] bodies
///   into the declaration table
public sealed interface CalcNode {

    /// Replaces every [Reference] whose name is bound and re-folds constant subtrees.
    /// Returns `this` where nothing changes.
    CalcNode substitute(Map<String, CalcNode> bindings);

    boolean isConstant();

    /// @throws UnboundReferenceException if a free reference is reached
    /// @throws CalcTreeException if a composite node is reached
    double evaluateConstant();

    /// Renders this node. [Property] nodes record their body in `declarations`.
    /// @throws DeclarationConflictException if a property name is reused for different text
    String serialize(DeclarationTable declarations);

    /// True if this node's text must be grouped with `calc(...)` before it can stand
    /// alone as a declaration value or as the final output.
    default boolean needsCalcWrap() {
        return false;
    }

    /// A literal number. Folding may produce non-finite values; they are kept as-is.
    record Constant(double value) implements CalcNode {
        @Override
        public CalcNode substitute(Map<String, CalcNode> bindings) {
            return this;
        }

        @Override
        public boolean isConstant() {
            return true;
        }

        @Override
        public double evaluateConstant() {
            return value;
        }

        @Override
        public String serialize(DeclarationTable declarations) {
            return CalcNumbers.format(value);
        }
    }

    /// A free variable, rendered as a custom property lookup `var(--name)`.
    record Reference(String name) implements CalcNode {
        public Reference {
            Objects.requireNonNull(name, "name must not be null");
        }

        @Override
        public CalcNode substitute(Map<String, CalcNode> bindings) {
            final CalcNode bound = bindings.get(name);
            return bound != null ? bound : this;
        }

        @Override
        public boolean isConstant() {
            return false;
        }

        @Override
        public double evaluateConstant() {
            throw new UnboundReferenceException(Set.of(name));
        }

        @Override
        public String serialize(DeclarationTable declarations) {
            return "var(--" + name + ")";
        }
    }

    record Unary(UnaryOp op, CalcNode arg) implements CalcNode {
        public Unary {
            Objects.requireNonNull(op, "op must not be null");
            Objects.requireNonNull(arg, "arg must not be null");
        }

        @Override
        public CalcNode substitute(Map<String, CalcNode> bindings) {
            final CalcNode newArg = arg.substitute(bindings);
            if (newArg instanceof Constant c) {
                return new Constant(op.apply(c.value()));
            }
            return newArg == arg ? this : new Unary(op, newArg);
        }

        @Override
        public boolean isConstant() {
            return arg.isConstant();
        }

        @Override
        public double evaluateConstant() {
            return op.apply(arg.evaluateConstant());
        }

        @Override
        public String serialize(DeclarationTable declarations) {
            return op.function() + "(" + arg.serialize(declarations) + ")";
        }
    }

    record Arithmetic(ArithmeticOp op, CalcNode left, CalcNode right) implements CalcNode {
        public Arithmetic {
            Objects.requireNonNull(op, "op must not be null");
            Objects.requireNonNull(left, "left must not be null");
            Objects.requireNonNull(right, "right must not be null");
        }

        @Override
        public CalcNode substitute(Map<String, CalcNode> bindings) {
            final CalcNode newLeft = left.substitute(bindings);
            final CalcNode newRight = right.substitute(bindings);
            if (newLeft instanceof Constant l && newRight instanceof Constant r) {
                return new Constant(op.apply(l.value(), r.value()));
            }
            if (newLeft == left && newRight == right) {
                return this;
            }
            return new Arithmetic(op, newLeft, newRight);
        }

        @Override
        public boolean isConstant() {
            return left.isConstant() && right.isConstant();
        }

        @Override
        public double evaluateConstant() {
            return op.apply(left.evaluateConstant(), right.evaluateConstant());
        }

        @Override
        public String serialize(DeclarationTable declarations) {
            final String leftText = operand(left, false, declarations);
            final String rightText = operand(right, true, declarations);
            return leftText + " " + op.symbol() + " " + rightText;
        }

        @Override
        public boolean needsCalcWrap() {
            return true;
        }

        /// Sums nested under `*` or `/` are parenthesized. The right operand of `-`
        /// or `/` is also parenthesized when it is at the same precedence level.
        private String operand(CalcNode child, boolean rightHand, DeclarationTable declarations) {
            final String text = child.serialize(declarations);
            if (!(child instanceof Arithmetic nested)) {
                return text;
            }
            final boolean wrap;
            if (op.isMultiplicative()) {
                wrap = nested.op().isAdditive() || (rightHand && op == ArithmeticOp.DIVIDE);
            } else {
                wrap = rightHand && op == ArithmeticOp.SUBTRACT && nested.op().isAdditive();
            }
            return wrap ? "(" + text + ")" : text;
        }
    }

    /// `pow`, `max` and `min`.
    record Call(CallOp op, CalcNode first, CalcNode second) implements CalcNode {
        public Call {
            Objects.requireNonNull(op, "op must not be null");
            Objects.requireNonNull(first, "first must not be null");
            Objects.requireNonNull(second, "second must not be null");
        }

        @Override
        public CalcNode substitute(Map<String, CalcNode> bindings) {
            final CalcNode newFirst = first.substitute(bindings);
            final CalcNode newSecond = second.substitute(bindings);
            if (newFirst instanceof Constant a && newSecond instanceof Constant b) {
                return new Constant(op.apply(a.value(), b.value()));
            }
            if (newFirst == first && newSecond == second) {
                return this;
            }
            return new Call(op, newFirst, newSecond);
        }

        @Override
        public boolean isConstant() {
            return first.isConstant() && second.isConstant();
        }

        @Override
        public double evaluateConstant() {
            return op.apply(first.evaluateConstant(), second.evaluateConstant());
        }

        @Override
        public String serialize(DeclarationTable declarations) {
            final String a = first.serialize(declarations);
            final String b = second.serialize(declarations);
            return op.function() + "(" + a + ", " + b + ")";
        }
    }

    /// `max(minimum, min(value, maximum))`. Bounds are not checked against each other.
    record Clamp(CalcNode minimum, CalcNode value, CalcNode maximum) implements CalcNode {
        public Clamp {
            Objects.requireNonNull(minimum, "minimum must not be null");
            Objects.requireNonNull(value, "value must not be null");
            Objects.requireNonNull(maximum, "maximum must not be null");
        }

        static double apply(double minimum, double value, double maximum) {
            return Math.max(minimum, Math.min(value, maximum));
        }

        @Override
        public CalcNode substitute(Map<String, CalcNode> bindings) {
            final CalcNode newMin = minimum.substitute(bindings);
            final CalcNode newValue = value.substitute(bindings);
            final CalcNode newMax = maximum.substitute(bindings);
            if (newMin instanceof Constant lo && newValue instanceof Constant v && newMax instanceof Constant hi) {
                return new Constant(apply(lo.value(), v.value(), hi.value()));
            }
            if (newMin == minimum && newValue == value && newMax == maximum) {
                return this;
            }
            return new Clamp(newMin, newValue, newMax);
        }

        @Override
        public boolean isConstant() {
            return minimum.isConstant() && value.isConstant() && maximum.isConstant();
        }

        @Override
        public double evaluateConstant() {
            return apply(minimum.evaluateConstant(), value.evaluateConstant(), maximum.evaluateConstant());
        }

        @Override
        public String serialize(DeclarationTable declarations) {
            final String lo = minimum.serialize(declarations);
            final String v = value.serialize(declarations);
            final String hi = maximum.serialize(declarations);
            return "clamp(" + lo + ", " + v + ", " + hi + ")";
        }
    }

    /// A three-channel literal such as `oklch(l c h)`. It has no numeric value and
    /// is never folded away, even when all channels are constant.
    record Composite(String function, CalcNode first, CalcNode second, CalcNode third) implements CalcNode {
        public Composite {
            Objects.requireNonNull(function, "function must not be null");
            Objects.requireNonNull(first, "first must not be null");
            Objects.requireNonNull(second, "second must not be null");
            Objects.requireNonNull(third, "third must not be null");
        }

        @Override
        public CalcNode substitute(Map<String, CalcNode> bindings) {
            final CalcNode a = first.substitute(bindings);
            final CalcNode b = second.substitute(bindings);
            final CalcNode c = third.substitute(bindings);
            if (a == first && b == second && c == third) {
                return this;
            }
            return new Composite(function, a, b, c);
        }

        @Override
        public boolean isConstant() {
            return first.isConstant() && second.isConstant() && third.isConstant();
        }

        @Override
        public double evaluateConstant() {
            throw new CalcTreeException("Cannot evaluate composite " + function + "() to a number");
        }

        /// Channels are not math-function arguments, so infix channels get `calc()`.
        @Override
        public String serialize(DeclarationTable declarations) {
            final String a = channel(first, declarations);
            final String b = channel(second, declarations);
            final String c = channel(third, declarations);
            return function + "(" + a + " " + b + " " + c + ")";
        }

        private static String channel(CalcNode node, DeclarationTable declarations) {
            final String text = node.serialize(declarations);
            return node.needsCalcWrap() ? "calc(" + text + ")" : text;
        }
    }

    /// A named output. Its body is hoisted into the declaration table and the node
    /// itself renders as `var(name)`. Substitution keeps the wrapper even when the
    /// body folds to a constant, so the declaration is still emitted.
    record Property(String name, CalcNode body) implements CalcNode {
        public Property {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(body, "body must not be null");
        }

        @Override
        public CalcNode substitute(Map<String, CalcNode> bindings) {
            final CalcNode newBody = body.substitute(bindings);
            return newBody == body ? this : new Property(name, newBody);
        }

        @Override
        public boolean isConstant() {
            return body.isConstant();
        }

        @Override
        public double evaluateConstant() {
            return body.evaluateConstant();
        }

        @Override
        public String serialize(DeclarationTable declarations) {
            final String text = body.serialize(declarations);
            declarations.declare(name, body.needsCalcWrap() ? "calc(" + text + ")" : text);
            return "var(" + name + ")";
        }
    }
}
