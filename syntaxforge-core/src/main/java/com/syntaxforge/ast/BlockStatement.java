package com.syntaxforge.ast;

import java.util.List;

public record BlockStatement(
    SourceLocation loc,
    Range range,
    String raw,
    List<Node> body
) implements Node {

    public BlockStatement {
        body = NodeLists.copyOf(body);
    }

    public BlockStatement(List<Node> body) {
        this(null, null, null, body);
    }

    public static BlockStatement empty() {
        return new BlockStatement(List.of());
    }

    @Override
    public String type() {
        return "BlockStatement";
    }
}
