package com.syntaxforge.ast;

import java.util.List;

public record Program(
    SourceLocation loc,
    Range range,
    String raw,
    List<Node> body,
    SourceType sourceType  // Can be null
) implements Node {

    public Program {
        body = NodeLists.copyOf(body);
    }

    public Program(List<Node> body, SourceType sourceType) {
        this(null, null, null, body, sourceType);
    }

    public Program(List<Node> body) {
        this(null, null, null, body, null);
    }

    /**
     * The placeholder AST returned alongside parse errors.
     */
    public static Program empty(SourceType sourceType) {
        return new Program(List.of(), sourceType);
    }

    @Override
    public String type() {
        return "Program";
    }
}
