package com.syntaxforge.lang;

/**
 * One unit of a brace-delimited source as produced by {@link BraceScanner}.
 */
record Segment(Kind kind, Span span) {

    enum Kind {
        /** Statement or header text, trimmed, comments blanked out. */
        TEXT,
        /** A '{' opening a statement block. */
        OPEN,
        /** The '}' closing a statement block. */
        CLOSE,
        /** A comment including its delimiters. */
        COMMENT
    }

    int start() {
        return span.start();
    }

    int end() {
        return span.end();
    }

    boolean is(Kind expected) {
        return kind == expected;
    }

    String text() {
        return span.text();
    }
}
