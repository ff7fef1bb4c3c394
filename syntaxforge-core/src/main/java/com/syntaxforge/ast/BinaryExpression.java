package com.syntaxforge.ast;

import java.util.Objects;

/**
 * Binary operation. Logical operators are spelled {@code &&} and {@code ||} for every language.
 */
public record BinaryExpression(
    SourceLocation loc,
    Range range,
    String raw,
    String operator,
    Node left,
    Node right
) implements Node {

    public BinaryExpression {
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
    }

    public BinaryExpression(String operator, Node left, Node right) {
        this(null, null, null, operator, left, right);
    }

    public boolean isLogical() {
        return "&&".equals(operator) || "||".equals(operator);
    }

    @Override
    public String type() {
        return "BinaryExpression";
    }
}
