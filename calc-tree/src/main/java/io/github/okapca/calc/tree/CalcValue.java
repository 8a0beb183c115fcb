package io.github.okapca.calc.tree;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/// An immutable tree paired with its free-variable set.
///
/// The set is maintained incrementally: constructors take the union of their
/// operands, [#bind] removes the bound name and adds the value's references, and
/// [#asProperty] leaves it unchanged. It always equals the set of reference names
/// reachable in [#node()].
///
/// @param <T> the concrete view, so that binding a color yields a color
public abstract sealed class CalcValue<T extends CalcValue<T>> permits CalcExpression, CalcColor {

    private static final Logger LOG = Logger.getLogger(CalcValue.class.getName());

    private final CalcNode node;
    private final Set<String> refs;

    CalcValue(CalcNode node, Set<String> refs) {
        this.node = Objects.requireNonNull(node, "node must not be null");
        this.refs = Collections.unmodifiableSet(new LinkedHashSet<>(refs));
    }

    /// Builds the same view around a transformed tree.
    abstract T create(CalcNode node, Set<String> refs);

    public CalcNode node() {
        return node;
    }

    /// The names of the references still awaiting a binding.
    public Set<String> refs() {
        return refs;
    }

    /// Substitutes `value` for every reference called `name` and re-folds.
    /// Binding a name that is not free returns an equivalent value.
    public T bind(String name, CalcExpression value) {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(value, "value must not be null");
        if (!refs.contains(name)) {
            LOG.finer(() -> "Ignoring binding for " + name + ", not a free reference");
            return create(node, refs);
        }
        final CalcNode substituted = node.substitute(Map.of(name, value.node()));
        final Set<String> newRefs = new LinkedHashSet<>(refs);
        newRefs.remove(name);
        newRefs.addAll(value.refs());
        LOG.finer(() -> "Bound " + name + ", free references now " + newRefs);
        return create(substituted, newRefs);
    }

    public T bind(String name, double value) {
        return bind(name, CalcTree.constant(value));
    }

    /// Applies every entry as a single [#bind(String, CalcExpression)], in the map's
    /// iteration order. Values may be [CalcExpression]s or [Number]s.
    /// When one value mentions another bound name, pass an insertion-ordered map
    /// such as [java.util.LinkedHashMap]; the result follows that order.
    @SuppressWarnings("unchecked")
    public T bind(Map<String, ?> bindings) {
        Objects.requireNonNull(bindings, "bindings must not be null");
        T current = (T) this;
        for (final Map.Entry<String, ?> entry : bindings.entrySet()) {
            current = current.bind(entry.getKey(), CalcTree.toExpression(entry.getValue()));
        }
        return current;
    }

    /// Wraps this tree as the named output `name`. Serializing it declares
    /// `name: <value>` and renders `var(name)` in its place.
    public T asProperty(String name) {
        Objects.requireNonNull(name, "name must not be null");
        if (name.isEmpty()) {
            throw new IllegalArgumentException("Property name must be a non-empty string");
        }
        return create(new CalcNode.Property(name, node), refs);
    }

    /// Renders CSS without binding anything; free references become `var(--name)`.
    public CssResult toCss() {
        return CssSerializer.serialize(node);
    }

    /// Binds `bindings` first, then renders.
    public CssResult toCss(Map<String, ?> bindings) {
        return bind(bindings).toCss();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final CalcValue<?> that = (CalcValue<?>) o;
        return node.equals(that.node) && refs.equals(that.refs);
    }

    @Override
    public int hashCode() {
        return Objects.hash(node, refs);
    }
}
