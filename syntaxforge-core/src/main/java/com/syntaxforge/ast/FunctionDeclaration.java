package com.syntaxforge.ast;

import java.util.List;
import java.util.Objects;

public record FunctionDeclaration(
    SourceLocation loc,
    Range range,
    String raw,
    String name,
    List<Parameter> params,
    BlockStatement body,
    boolean async,
    boolean generator,
    String returnType  // Can be null
) implements Node {

    public FunctionDeclaration {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(body, "body");
        params = NodeLists.copyOf(params);
    }

    public FunctionDeclaration(String name, List<Parameter> params, BlockStatement body) {
        this(null, null, null, name, params, body, false, false, null);
    }

    public FunctionDeclaration(SourceLocation loc, String name, List<Parameter> params, BlockStatement body) {
        this(loc, null, null, name, params, body, false, false, null);
    }

    @Override
    public String type() {
        return "FunctionDeclaration";
    }
}
