package com.syntaxforge.lang;

/**
 * A lexical token of an expression. Offsets are absolute positions in the parsed source.
 */
record Token(Kind kind, String lexeme, int start, int end) {

    enum Kind {
        IDENTIFIER,
        NUMBER,
        STRING,
        OPERATOR,
        EOF
    }

    boolean is(Kind expected, String text) {
        return kind == expected && lexeme.equals(text);
    }

    boolean isOperator(String text) {
        return is(Kind.OPERATOR, text);
    }

    boolean isIdentifier(String text) {
        return is(Kind.IDENTIFIER, text);
    }
}
