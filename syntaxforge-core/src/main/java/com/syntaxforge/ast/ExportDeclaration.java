package com.syntaxforge.ast;

import java.util.List;

public record ExportDeclaration(
    SourceLocation loc,
    Range range,
    String raw,
    Node declaration,  // Can be null
    List<String> specifiers,
    boolean defaultExport
) implements Node {

    public ExportDeclaration {
        specifiers = NodeLists.copyOf(specifiers);
    }

    public ExportDeclaration(Node declaration, boolean defaultExport) {
        this(null, null, null, declaration, List.of(), defaultExport);
    }

    @Override
    public String type() {
        return "ExportDeclaration";
    }
}
