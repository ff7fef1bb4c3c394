package com.syntaxforge.ast;

import java.util.List;
import java.util.Objects;

public record CallExpression(
    SourceLocation loc,
    Range range,
    String raw,
    Node callee,
    List<Node> arguments
) implements Node {

    public CallExpression {
        Objects.requireNonNull(callee, "callee");
        arguments = NodeLists.copyOf(arguments);
    }

    public CallExpression(Node callee, List<Node> arguments) {
        this(null, null, null, callee, arguments);
    }

    @Override
    public String type() {
        return "CallExpression";
    }
}
