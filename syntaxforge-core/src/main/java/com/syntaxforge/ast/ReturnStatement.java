package com.syntaxforge.ast;

public record ReturnStatement(
    SourceLocation loc,
    Range range,
    String raw,
    Node argument  // Can be null
) implements Node {

    public ReturnStatement(Node argument) {
        this(null, null, null, argument);
    }

    public ReturnStatement(SourceLocation loc, Node argument) {
        this(loc, null, null, argument);
    }

    @Override
    public String type() {
        return "ReturnStatement";
    }
}
