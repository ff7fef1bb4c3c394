package com.syntaxforge.ast;

import java.util.Objects;

public record WhileLoop(
    SourceLocation loc,
    Range range,
    String raw,
    Node test,
    Node body
) implements Node {

    public WhileLoop {
        Objects.requireNonNull(test, "test");
        Objects.requireNonNull(body, "body");
    }

    public WhileLoop(Node test, Node body) {
        this(null, null, null, test, body);
    }

    @Override
    public String type() {
        return "WhileLoop";
    }
}
