package io.github.okapca.calc.tree;

/// Thrown when two properties with the same name render to different text within
/// one serialization. The whole serialization is abandoned.
public final class DeclarationConflictException extends CalcTreeException {

    @java.io.Serial
    private static final long serialVersionUID = 1L;

    private final String name;
    private final String existingValue;
    private final String conflictingValue;

    public DeclarationConflictException(String name, String existingValue, String conflictingValue) {
        super("Property '" + name + "' defined multiple times with different values: '"
                + existingValue + "' and '" + conflictingValue + "'");
        this.name = name;
        this.existingValue = existingValue;
        this.conflictingValue = conflictingValue;
    }

    public String name() {
        return name;
    }

    public String existingValue() {
        return existingValue;
    }

    public String conflictingValue() {
        return conflictingValue;
    }
}
