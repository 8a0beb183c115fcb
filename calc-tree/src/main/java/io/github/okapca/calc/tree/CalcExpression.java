package io.github.okapca.calc.tree;

import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/// The numeric view: a tree that folds to a double once every reference is bound.
///
/// Instances come from the [CalcTree] factory functions. Usage:
/// ```java
/// CalcExpression doubled = CalcTree.multiply(CalcTree.reference("x"), 2);
/// doubled.toNumber(Map.of("x", 5));            // 10.0
/// doubled.toCss().expression();                // calc(var(--x) * 2)
/// ```
public final class CalcExpression extends CalcValue<CalcExpression> {

    private static final Logger LOG = Logger.getLogger(CalcExpression.class.getName());

    CalcExpression(CalcNode node, Set<String> refs) {
        super(node, refs);
    }

    @Override
    CalcExpression create(CalcNode node, Set<String> refs) {
        return new CalcExpression(node, refs);
    }

    /// @throws UnboundReferenceException if free references remain
    public double toNumber() {
        if (!node().isConstant()) {
            throw new UnboundReferenceException(refs());
        }
        return node().evaluateConstant();
    }

    /// Binds `bindings`, then folds to a number.
    /// @throws UnboundReferenceException if free references remain after binding
    public double toNumber(Map<String, ?> bindings) {
        return bind(bindings).toNumber();
    }

    public EvaluationResult evaluate() {
        final CssResult css = toCss();
        if (node().isConstant()) {
            final double value = node().evaluateConstant();
            LOG.fine(() -> "Evaluated to number " + value);
            return new EvaluationResult.NumberResult(value, css);
        }
        LOG.fine(() -> "Evaluated to expression, free references " + refs());
        return new EvaluationResult.ExpressionResult(css);
    }

    /// Binds `bindings`, then evaluates. Never fails on free references: they yield
    /// an [EvaluationResult.ExpressionResult] instead.
    public EvaluationResult evaluate(Map<String, ?> bindings) {
        return bind(bindings).evaluate();
    }

    @Override
    public String toString() {
        return "CalcExpression[node=" + node() + ", refs=" + refs() + "]";
    }
}
