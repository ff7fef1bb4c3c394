package com.syntaxforge.ast;

public record ThrowStatement(
    SourceLocation loc,
    Range range,
    String raw,
    Node argument  // Can be null: Python's bare re-raise
) implements Node {

    public ThrowStatement(Node argument) {
        this(null, null, null, argument);
    }

    @Override
    public String type() {
        return "ThrowStatement";
    }
}
