package io.github.okapca.calc.tree;

import java.util.Set;

/// The composite view: a three-channel color literal such as `oklch(l c h)`.
/// It can be bound, named and rendered, but never evaluated to a number.
public final class CalcColor extends CalcValue<CalcColor> {

    CalcColor(CalcNode node, Set<String> refs) {
        super(node, refs);
    }

    @Override
    CalcColor create(CalcNode node, Set<String> refs) {
        return new CalcColor(node, refs);
    }

    @Override
    public String toString() {
        return "CalcColor[node=" + node() + ", refs=" + refs() + "]";
    }
}
