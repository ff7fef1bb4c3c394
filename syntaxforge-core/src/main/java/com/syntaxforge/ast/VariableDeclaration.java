package com.syntaxforge.ast;

import java.util.Objects;

public record VariableDeclaration(
    SourceLocation loc,
    Range range,
    String raw,
    String name,
    DeclarationKind kind,
    Node init,              // Can be null
    String typeAnnotation   // Can be null
) implements Node {

    public VariableDeclaration {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(kind, "kind");
    }

    public VariableDeclaration(String name, DeclarationKind kind, Node init) {
        this(null, null, null, name, kind, init, null);
    }

    @Override
    public String type() {
        return "VariableDeclaration";
    }
}
