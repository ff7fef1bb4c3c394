package com.syntaxforge.ast;

/**
 * A function or method parameter. Not a node: parameters are owned by their
 * declaration and are not visited.
 */
public record Parameter(
    String name,
    String type,          // Can be null
    String defaultValue,  // Can be null
    boolean optional
) {
    public Parameter(String name) {
        this(name, null, null, false);
    }

    public Parameter {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Parameter name is required");
        }
    }
}
