package io.github.okapca.calc.tree;

import net.jqwik.api.*;
import net.jqwik.api.constraints.IntRange;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static io.github.okapca.calc.tree.CalcTree.*;
import static org.assertj.core.api.Assertions.assertThat;

/// Property-based checks over randomly generated trees:
/// - the tracked free-variable set always matches the references in the tree
/// - numeric evaluation and the evaluate result agree
/// - the order of independent constant binds does not change the value
class CalcTreePropertyTest extends CalcTreeTestBase {

    private static final List<String> NAMES = List.of("a", "b", "c", "d");

    enum Shape { ADD, SUBTRACT, MULTIPLY, DIVIDE, POWER, MAX, MIN, SIN, ABS, SIGN, CLAMP }

    @Provide
    Arbitrary<CalcExpression> expressions() {
        return expressionArbitrary(4, true);
    }

    @Provide
    Arbitrary<CalcExpression> propertyFreeExpressions() {
        return expressionArbitrary(4, false);
    }

    @Provide
    Arbitrary<String> names() {
        return Arbitraries.of(NAMES);
    }

    private static Arbitrary<CalcExpression> expressionArbitrary(int depth, boolean withProperties) {
        final Arbitrary<CalcExpression> constants = Arbitraries.integers().between(-5, 5).map(i -> constant(i));
        final Arbitrary<CalcExpression> references = Arbitraries.of(NAMES).map(CalcTree::reference);
        final Arbitrary<CalcExpression> leaves = Arbitraries.oneOf(constants, references);
        if (depth == 0) {
            return leaves;
        }

        final Arbitrary<CalcExpression> child = expressionArbitrary(depth - 1, withProperties);
        final Arbitrary<CalcExpression> composed = Combinators.combine(
            Arbitraries.of(Shape.class), child, child, child
        ).as(CalcTreePropertyTest::build);

        if (!withProperties) {
            return Arbitraries.oneOf(leaves, composed);
        }
        final Arbitrary<CalcExpression> wrapped = Combinators.combine(
            child, Arbitraries.of("--p", "--q", "--r")
        ).as(CalcExpression::asProperty);
        return Arbitraries.oneOf(leaves, composed, wrapped);
    }

    private static CalcExpression build(Shape shape, CalcExpression x, CalcExpression y, CalcExpression z) {
        switch (shape) {
            case ADD: return add(x, y);
            case SUBTRACT: return subtract(x, y);
            case MULTIPLY: return multiply(x, y);
            case DIVIDE: return divide(x, y);
            case POWER: return power(x, y);
            case MAX: return max(x, y);
            case MIN: return min(x, y);
            case SIN: return sin(x);
            case ABS: return abs(x);
            case SIGN: return sign(x);
            case CLAMP: return clamp(x, y, z);
            default: throw new IllegalStateException("Unhandled shape " + shape);
        }
    }

    /// Walks the tree and collects every reference name.
    static Set<String> referencesIn(CalcNode node) {
        final Set<String> found = new LinkedHashSet<>();
        collect(node, found);
        return found;
    }

    private static void collect(CalcNode node, Set<String> found) {
        if (node instanceof CalcNode.Reference r) {
            found.add(r.name());
        } else if (node instanceof CalcNode.Unary u) {
            collect(u.arg(), found);
        } else if (node instanceof CalcNode.Arithmetic a) {
            collect(a.left(), found);
            collect(a.right(), found);
        } else if (node instanceof CalcNode.Call c) {
            collect(c.first(), found);
            collect(c.second(), found);
        } else if (node instanceof CalcNode.Clamp c) {
            collect(c.minimum(), found);
            collect(c.value(), found);
            collect(c.maximum(), found);
        } else if (node instanceof CalcNode.Composite c) {
            collect(c.first(), found);
            collect(c.second(), found);
            collect(c.third(), found);
        } else if (node instanceof CalcNode.Property p) {
            collect(p.body(), found);
        }
    }

    @Property(tries = 300)
    void refsMatchReachableReferences(@ForAll("expressions") CalcExpression expression) {
        assertThat(expression.refs()).isEqualTo(referencesIn(expression.node()));
        assertThat(expression.node().isConstant()).isEqualTo(expression.refs().isEmpty());
    }

    @Property(tries = 300)
    void refsSurviveBinding(@ForAll("expressions") CalcExpression expression,
                            @ForAll("names") String name,
                            @ForAll("expressions") CalcExpression value) {
        final CalcExpression bound = expression.bind(name, value);
        assertThat(bound.refs()).isEqualTo(referencesIn(bound.node()));
    }

    @Property(tries = 200)
    void refsSurviveWrapping(@ForAll("expressions") CalcExpression expression) {
        final CalcExpression wrapped = expression.asProperty("--wrapped");
        assertThat(wrapped.refs()).isEqualTo(referencesIn(wrapped.node()));
        final CalcColor color = oklch(expression, wrapped, 250);
        assertThat(color.refs()).isEqualTo(referencesIn(color.node()));
    }

    @Property(tries = 300)
    void toNumberAgreesWithEvaluate(@ForAll("propertyFreeExpressions") CalcExpression expression,
                                    @ForAll @IntRange(min = -3, max = 3) int a,
                                    @ForAll @IntRange(min = -3, max = 3) int b,
                                    @ForAll @IntRange(min = -3, max = 3) int c,
                                    @ForAll @IntRange(min = -3, max = 3) int d) {
        final Map<String, Integer> bindings = Map.of("a", a, "b", b, "c", c, "d", d);
        final EvaluationResult result = expression.evaluate(bindings);

        assertThat(result).isInstanceOf(EvaluationResult.NumberResult.class);
        final double evaluated = ((EvaluationResult.NumberResult) result).value();
        final double number = expression.toNumber(bindings);
        assertThat(Double.doubleToLongBits(evaluated)).isEqualTo(Double.doubleToLongBits(number));
        assertThat(result.css().expression()).isEqualTo(CalcNumbers.format(number));
    }

    @Property(tries = 300)
    void bindOrderDoesNotMatter(@ForAll("propertyFreeExpressions") CalcExpression expression,
                                @ForAll @IntRange(min = -3, max = 3) int a,
                                @ForAll @IntRange(min = -3, max = 3) int b,
                                @ForAll @IntRange(min = -3, max = 3) int c,
                                @ForAll @IntRange(min = -3, max = 3) int d) {
        final Map<String, Integer> forward = new LinkedHashMap<>();
        forward.put("a", a);
        forward.put("b", b);
        forward.put("c", c);
        forward.put("d", d);
        final Map<String, Integer> backward = new LinkedHashMap<>();
        backward.put("d", d);
        backward.put("c", c);
        backward.put("b", b);
        backward.put("a", a);

        final double first = expression.toNumber(forward);
        final double second = expression.toNumber(backward);
        assertThat(Double.doubleToLongBits(first)).isEqualTo(Double.doubleToLongBits(second));
    }

    @Property(tries = 200)
    void bindingNeverMutatesTheSource(@ForAll("expressions") CalcExpression expression,
                                      @ForAll("names") String name) {
        final CalcNode before = expression.node();
        final Set<String> refsBefore = Set.copyOf(expression.refs());
        expression.bind(name, 1);
        assertThat(expression.node()).isSameAs(before);
        assertThat(expression.refs()).isEqualTo(refsBefore);
    }
}
