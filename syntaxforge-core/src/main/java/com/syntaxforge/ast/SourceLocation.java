package com.syntaxforge.ast;

/**
 * Start and end position of a node. Lines are 1-based, columns 0-based.
 */
public record SourceLocation(Position start, Position end) {

    public SourceLocation {
        if (start == null || end == null) {
            throw new IllegalArgumentException("SourceLocation needs both a start and an end position");
        }
    }

    public static SourceLocation of(int startLine, int startColumn, int endLine, int endColumn) {
        return new SourceLocation(new Position(startLine, startColumn), new Position(endLine, endColumn));
    }

    public static SourceLocation ofLines(int startLine, int endLine) {
        return of(startLine, 0, endLine, 0);
    }

    public boolean containsLine(int line) {
        return start.line() <= line && end.line() >= line;
    }

    public record Position(int line, int column) {}
}
