package com.syntaxforge.parser;

import com.syntaxforge.ast.SourceLocation;

/**
 * A non-fatal advisory, e.g. an expression the parser kept as unparsed text.
 */
public record ParseWarning(String message, SourceLocation location) {

    public ParseWarning(String message) {
        this(message, null);
    }

    public String severity() {
        return "warning";
    }
}
