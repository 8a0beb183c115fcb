package io.github.okapca.calc.tree;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/// The output of one serialization: the top-level CSS value plus every custom
/// property declaration it depends on, in declaration order.
public record CssResult(String expression, Map<String, String> declarations) {

    public CssResult {
        Objects.requireNonNull(expression, "expression must not be null");
        Objects.requireNonNull(declarations, "declarations must not be null");
        declarations = Collections.unmodifiableMap(new LinkedHashMap<>(declarations));
    }

    /// Renders the declarations as `name: value;` lines.
    public String toDeclarationBlock() {
        return declarations.entrySet().stream()
                .map(e -> e.getKey() + ": " + e.getValue() + ";")
                .collect(Collectors.joining("\n"));
    }
}
