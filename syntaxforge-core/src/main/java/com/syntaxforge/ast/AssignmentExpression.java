package com.syntaxforge.ast;

import java.util.Objects;

public record AssignmentExpression(
    SourceLocation loc,
    Range range,
    String raw,
    String operator,
    Node left,
    Node right
) implements Node {

    public AssignmentExpression {
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
    }

    public AssignmentExpression(String operator, Node left, Node right) {
        this(null, null, null, operator, left, right);
    }

    @Override
    public String type() {
        return "AssignmentExpression";
    }
}
