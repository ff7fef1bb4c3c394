package com.syntaxforge.lang;

/**
 * Raised inside {@link ExpressionParser} when an expression cannot be read.
 * Never escapes the parser: the expression is kept as an {@code UnparsedExpression}.
 */
class ExpressionException extends RuntimeException {

    private final int offset;

    ExpressionException(String message, int offset) {
        super(message);
        this.offset = offset;
    }

    int getOffset() {
        return offset;
    }
}
