package io.github.okapca.calc.tree;

import java.util.Objects;

/// Outcome of [CalcExpression#evaluate(java.util.Map)]: a number when the bound tree
/// is fully constant, otherwise symbolic CSS. Both variants carry the rendered CSS.
public sealed interface EvaluationResult {

    CssResult css();

    /// The tree folded to a value.
    record NumberResult(double value, CssResult css) implements EvaluationResult {
        public NumberResult {
            Objects.requireNonNull(css, "css must not be null");
        }
    }

    /// Free references remain; only CSS text is available.
    record ExpressionResult(CssResult css) implements EvaluationResult {
        public ExpressionResult {
            Objects.requireNonNull(css, "css must not be null");
        }
    }
}
