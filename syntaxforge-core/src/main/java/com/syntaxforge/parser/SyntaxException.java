package com.syntaxforge.parser;

/**
 * Thrown by language parsers to abandon a parse. {@link AbstractParser} turns it
 * into a {@link ParseError}; it never escapes {@link Parser#parse}.
 */
public class SyntaxException extends RuntimeException {

    private final int offset;

    public SyntaxException(String message, int offset) {
        super(message);
        this.offset = offset;
    }

    public SyntaxException(String message) {
        this(message, -1);
    }

    /**
     * Character offset the problem was detected at, or -1 when unknown.
     */
    public int getOffset() {
        return offset;
    }
}
