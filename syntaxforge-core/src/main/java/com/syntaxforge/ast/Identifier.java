package com.syntaxforge.ast;

import java.util.Objects;

public record Identifier(
    SourceLocation loc,
    Range range,
    String raw,
    String name
) implements Node {

    public Identifier {
        Objects.requireNonNull(name, "name");
    }

    public Identifier(String name) {
        this(null, null, null, name);
    }

    public Identifier(SourceLocation loc, String name) {
        this(loc, null, null, name);
    }

    @Override
    public String type() {
        return "Identifier";
    }
}
