package com.syntaxforge.ast;

import java.util.Objects;

public record IfStatement(
    SourceLocation loc,
    Range range,
    String raw,
    Node test,
    Node consequent,
    Node alternate  // Can be null
) implements Node {

    public IfStatement {
        Objects.requireNonNull(test, "test");
        Objects.requireNonNull(consequent, "consequent");
    }

    public IfStatement(Node test, Node consequent, Node alternate) {
        this(null, null, null, test, consequent, alternate);
    }

    public IfStatement(SourceLocation loc, Node test, Node consequent, Node alternate) {
        this(loc, null, null, test, consequent, alternate);
    }

    @Override
    public String type() {
        return "IfStatement";
    }
}
