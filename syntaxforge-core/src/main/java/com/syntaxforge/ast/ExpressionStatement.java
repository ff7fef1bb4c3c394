package com.syntaxforge.ast;

import java.util.Objects;

public record ExpressionStatement(
    SourceLocation loc,
    Range range,
    String raw,
    Node expression
) implements Node {

    public ExpressionStatement {
        Objects.requireNonNull(expression, "expression");
    }

    public ExpressionStatement(Node expression) {
        this(null, null, null, expression);
    }

    @Override
    public String type() {
        return "ExpressionStatement";
    }
}
