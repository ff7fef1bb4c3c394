package com.syntaxforge.ast;

/**
 * A literal value: a {@link String}, {@link Long}, {@link Double}, {@link Boolean} or {@code null}.
 * The source spelling is kept in {@link #raw()}.
 */
public record Literal(
    SourceLocation loc,
    Range range,
    String raw,
    Object value
) implements Node {

    public Literal(Object value) {
        this(null, null, value == null ? "null" : String.valueOf(value), value);
    }

    public Literal(Object value, String raw) {
        this(null, null, raw, value);
    }

    @Override
    public String type() {
        return "Literal";
    }
}
