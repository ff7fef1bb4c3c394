package com.syntaxforge.ast;

import java.util.List;
import java.util.Objects;

public record MethodDeclaration(
    SourceLocation loc,
    Range range,
    String raw,
    String name,
    List<Parameter> params,
    BlockStatement body,
    boolean isStatic,
    boolean async,
    Visibility visibility
) implements Node {

    public MethodDeclaration {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(body, "body");
        params = NodeLists.copyOf(params);
        if (visibility == null) {
            visibility = Visibility.PUBLIC;
        }
    }

    public MethodDeclaration(String name, List<Parameter> params, BlockStatement body) {
        this(null, null, null, name, params, body, false, false, Visibility.PUBLIC);
    }

    @Override
    public String type() {
        return "MethodDeclaration";
    }
}
