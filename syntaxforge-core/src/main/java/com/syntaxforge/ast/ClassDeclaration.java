package com.syntaxforge.ast;

import java.util.List;
import java.util.Objects;

public record ClassDeclaration(
    SourceLocation loc,
    Range range,
    String raw,
    String name,
    String superClass,  // Can be null
    List<String> interfaces,
    List<Node> body
) implements Node {

    public ClassDeclaration {
        Objects.requireNonNull(name, "name");
        interfaces = NodeLists.copyOf(interfaces);
        body = NodeLists.copyOf(body);
    }

    public ClassDeclaration(String name, List<Node> body) {
        this(null, null, null, name, null, List.of(), body);
    }

    public ClassDeclaration(SourceLocation loc, String name, List<Node> body) {
        this(loc, null, null, name, null, List.of(), body);
    }

    @Override
    public String type() {
        return "ClassDeclaration";
    }
}
