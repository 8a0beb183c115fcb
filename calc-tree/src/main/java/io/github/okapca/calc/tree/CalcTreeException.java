package io.github.okapca.calc.tree;

/// Base type for failures raised by the expression engine.
public class CalcTreeException extends RuntimeException {

    @java.io.Serial
    private static final long serialVersionUID = 1L;

    /// @param message the error message
    public CalcTreeException(String message) {
        super(message);
    }
}
