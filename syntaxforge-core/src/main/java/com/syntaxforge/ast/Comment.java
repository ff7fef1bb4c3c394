package com.syntaxforge.ast;

import java.util.Objects;

public record Comment(
    SourceLocation loc,
    Range range,
    String raw,
    String value,
    CommentKind kind
) implements Node {

    public Comment {
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(kind, "kind");
    }

    public Comment(String value, CommentKind kind) {
        this(null, null, null, value, kind);
    }

    @Override
    public String type() {
        return "Comment";
    }
}
