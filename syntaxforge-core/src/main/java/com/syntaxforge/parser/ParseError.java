package com.syntaxforge.parser;

import com.syntaxforge.ast.SourceLocation;

/**
 * A syntax problem found while parsing. Always embedded in a {@link ParseResult}, never thrown.
 */
public record ParseError(String message, SourceLocation location) {

    public ParseError(String message) {
        this(message, null);
    }

    public String severity() {
        return "error";
    }
}
