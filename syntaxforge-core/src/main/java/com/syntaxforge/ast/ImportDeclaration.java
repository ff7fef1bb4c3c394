package com.syntaxforge.ast;

import java.util.List;
import java.util.Objects;

public record ImportDeclaration(
    SourceLocation loc,
    Range range,
    String raw,
    String source,
    List<String> specifiers
) implements Node {

    public ImportDeclaration {
        Objects.requireNonNull(source, "source");
        specifiers = NodeLists.copyOf(specifiers);
    }

    public ImportDeclaration(String source, List<String> specifiers) {
        this(null, null, null, source, specifiers);
    }

    @Override
    public String type() {
        return "ImportDeclaration";
    }
}
