package com.syntaxforge.lang;

import java.util.ArrayList;
import java.util.List;

/**
 * A slice of the source together with the absolute offset of its first character,
 * so nodes built from it keep exact positions.
 */
record Span(String text, int start) {

    static Span of(String source, int start, int end) {
        return new Span(source.substring(start, end), start);
    }

    int end() {
        return start + text.length();
    }

    int length() {
        return text.length();
    }

    boolean isEmpty() {
        return text.isBlank();
    }

    char charAt(int index) {
        return text.charAt(index);
    }

    Span sub(int from) {
        return new Span(text.substring(from), start + from);
    }

    Span sub(int from, int to) {
        return new Span(text.substring(from, to), start + from);
    }

    Span trim() {
        int from = 0;
        int to = text.length();
        while (from < to && Character.isWhitespace(text.charAt(from))) {
            from++;
        }
        while (to > from && Character.isWhitespace(text.charAt(to - 1))) {
            to--;
        }
        return sub(from, to);
    }

    boolean startsWith(String prefix) {
        return text.startsWith(prefix);
    }

    boolean endsWith(String suffix) {
        return text.endsWith(suffix);
    }

    /**
     * True when the span starts with {@code word} as a whole word.
     */
    boolean startsWithWord(String word) {
        return text.startsWith(word)
            && (text.length() == word.length() || !LexicalSyntax.isIdentifierPart(text.charAt(word.length())));
    }

    /**
     * The trimmed remainder after a leading {@code word}.
     */
    Span afterWord(String word) {
        return sub(word.length()).trim();
    }

    Span withoutSuffix(String suffix) {
        Span trimmed = trim();
        return trimmed.endsWith(suffix) ? trimmed.sub(0, trimmed.length() - suffix.length()).trim() : trimmed;
    }

    /**
     * Index of the bracket closing the one at {@code openIndex}, or -1.
     */
    int matchingClose(int openIndex, LexicalSyntax syntax) {
        char open = text.charAt(openIndex);
        char close = closerOf(open);
        int depth = 0;
        int i = openIndex;
        while (i < text.length()) {
            char ch = text.charAt(i);
            LexicalSyntax.Quoted quoted = ch == open || ch == close ? null : syntax.quoted(text, i);
            if (quoted != null) {
                i = quoted.end();
                continue;
            }
            if (ch == open) {
                depth++;
            } else if (ch == close) {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
            i++;
        }
        return -1;
    }

    /**
     * Index of the first occurrence of {@code token} outside brackets and literals, or -1.
     * With {@code angles}, {@code <...>} counts as a bracket pair.
     */
    int indexOfTopLevel(String token, LexicalSyntax syntax, boolean angles) {
        int depth = 0;
        int i = 0;
        while (i < text.length()) {
            char ch = text.charAt(i);
            if (depth == 0 && text.startsWith(token, i)) {
                return i;
            }
            LexicalSyntax.Quoted quoted = syntax.quoted(text, i);
            if (quoted != null) {
                i = quoted.end();
                continue;
            }
            if (ch == '(' || ch == '[' || ch == '{' || (angles && ch == '<')) {
                depth++;
            } else if (ch == ')' || ch == ']' || ch == '}' || (angles && ch == '>' && !isArrowHead(i))) {
                depth = Math.max(0, depth - 1);
            }
            i++;
        }
        return -1;
    }

    /**
     * Splits on {@code separator} outside brackets and literals. Pieces are trimmed
     * and empty pieces dropped.
     */
    List<Span> splitTopLevel(char separator, LexicalSyntax syntax, boolean angles) {
        List<Span> pieces = new ArrayList<>();
        int depth = 0;
        int pieceStart = 0;
        int i = 0;
        while (i < text.length()) {
            char ch = text.charAt(i);
            LexicalSyntax.Quoted quoted = syntax.quoted(text, i);
            if (quoted != null) {
                i = quoted.end();
                continue;
            }
            if (ch == '(' || ch == '[' || ch == '{' || (angles && ch == '<')) {
                depth++;
            } else if (ch == ')' || ch == ']' || ch == '}' || (angles && ch == '>' && !isArrowHead(i))) {
                depth = Math.max(0, depth - 1);
            } else if (ch == separator && depth == 0) {
                addPiece(pieces, pieceStart, i);
                pieceStart = i + 1;
            }
            i++;
        }
        addPiece(pieces, pieceStart, text.length());
        return pieces;
    }

    private void addPiece(List<Span> pieces, int from, int to) {
        Span piece = sub(from, to).trim();
        if (!piece.isEmpty()) {
            pieces.add(piece);
        }
    }

    // '>' of "->" or "=>" is not a closing angle bracket
    private boolean isArrowHead(int index) {
        return index > 0 && (text.charAt(index - 1) == '-' || text.charAt(index - 1) == '=');
    }

    private static char closerOf(char open) {
        return switch (open) {
            case '(' -> ')';
            case '[' -> ']';
            case '{' -> '}';
            case '<' -> '>';
            default -> throw new IllegalArgumentException("Not a bracket: " + open);
        };
    }

    @Override
    public String toString() {
        return text;
    }
}
