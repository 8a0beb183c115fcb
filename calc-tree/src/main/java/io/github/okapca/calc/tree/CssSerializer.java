package io.github.okapca.calc.tree;

import java.util.Objects;
import java.util.logging.Logger;

/// Runs one depth-first serialization of a tree into CSS.
///
/// Each call owns a fresh [DeclarationTable]; nothing is shared between calls, so
/// independent trees may be serialized concurrently.
final class CssSerializer {

    private static final Logger LOG = Logger.getLogger(CssSerializer.class.getName());

    private CssSerializer() {}

    /// @throws DeclarationConflictException if two properties share a name but not a value
    static CssResult serialize(CalcNode root) {
        Objects.requireNonNull(root, "root must not be null");
        final DeclarationTable declarations = new DeclarationTable();
        final String raw = root.serialize(declarations);
        final String expression = root.needsCalcWrap() ? "calc(" + raw + ")" : raw;
        LOG.fine(() -> "Serialized " + root.getClass().getSimpleName() + " to '" + expression
                + "' with " + declarations.size() + " declarations");
        return new CssResult(expression, declarations.toMap());
    }
}
