package com.syntaxforge.ast;

import java.util.Objects;

/**
 * Counting loops use {@code init}/{@code test}/{@code update}; for-each loops
 * declare the loop variable in {@code init} and the collection in {@code iterable}.
 */
public record ForLoop(
    SourceLocation loc,
    Range range,
    String raw,
    Node init,      // Can be null
    Node test,      // Can be null
    Node update,    // Can be null
    Node iterable,  // Can be null
    Node body
) implements Node {

    public ForLoop {
        Objects.requireNonNull(body, "body");
    }

    public ForLoop(Node init, Node test, Node update, Node body) {
        this(null, null, null, init, test, update, null, body);
    }

    public static ForLoop forEach(VariableDeclaration variable, Node iterable, Node body) {
        return new ForLoop(null, null, null, variable, null, null, iterable, body);
    }

    public boolean isForEach() {
        return iterable != null;
    }

    @Override
    public String type() {
        return "ForLoop";
    }
}
