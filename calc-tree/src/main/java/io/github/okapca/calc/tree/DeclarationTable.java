package io.github.okapca.calc.tree;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/// Accumulates the declarations hoisted out of [CalcNode.Property] nodes during one
/// serialization pass. Entries keep the order in which they were first declared,
/// which is post-order: a nested property is declared before the one enclosing it.
///
/// A table belongs to exactly one top-level `toCss` call and is not thread-safe.
public final class DeclarationTable {

    private static final Logger LOG = Logger.getLogger(DeclarationTable.class.getName());

    private final Map<String, String> entries = new LinkedHashMap<>();

    /// Records `name: value`. Re-declaring a name with identical text is a no-op.
    /// @throws DeclarationConflictException if `name` already holds different text
    public void declare(String name, String value) {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(value, "value must not be null");
        final String existing = entries.putIfAbsent(name, value);
        if (existing == null) {
            LOG.finer(() -> "Declared " + name + ": " + value);
        } else if (!existing.equals(value)) {
            throw new DeclarationConflictException(name, existing, value);
        }
    }

    public int size() {
        return entries.size();
    }

    /// An immutable snapshot in declaration order.
    public Map<String, String> toMap() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }
}
