package io.github.okapca.calc.tree;

import java.util.Set;
import java.util.TreeSet;

/// Thrown when a numeric result is requested but free references remain.
public final class UnboundReferenceException extends CalcTreeException {

    @java.io.Serial
    private static final long serialVersionUID = 1L;

    private final Set<String> references;

    /// @param references the names still unbound
    public UnboundReferenceException(Set<String> references) {
        super("Cannot convert expression to number: unbound references remain " + new TreeSet<>(references));
        this.references = Set.copyOf(references);
    }

    public Set<String> references() {
        return references;
    }
}
