package com.syntaxforge.lang;

/**
 * Comment and string-literal conventions of a language, used to skip text that
 * must not be read as code.
 *
 * @param lineComment     line comment introducer
 * @param blockComments   whether {@code /* ... *}{@code /} comments exist
 * @param quotes          characters that open a string literal
 * @param multilineQuotes the subset of {@code quotes} whose literals may span lines
 * @param tripleQuotes    whether {@code """} (and for Python {@code '''}) open long literals
 * @param rustLiterals    Rust rules: {@code 'a} is a lifetime unless it closes as a char literal,
 *                        and {@code r#"..."#} raw strings
 */
record LexicalSyntax(
    String lineComment,
    boolean blockComments,
    String quotes,
    String multilineQuotes,
    boolean tripleQuotes,
    boolean rustLiterals
) {

    static final LexicalSyntax JAVASCRIPT = new LexicalSyntax("//", true, "'\"`", "`", false, false);
    static final LexicalSyntax JAVA = new LexicalSyntax("//", true, "'\"", "", true, false);
    static final LexicalSyntax RUST = new LexicalSyntax("//", true, "'\"", "\"", false, true);
    static final LexicalSyntax PYTHON = new LexicalSyntax("#", false, "'\"", "", true, false);

    /**
     * End of a literal starting at {@code start}.
     */
    record Quoted(int end, boolean terminated) {}

    /**
     * Scans the string or char literal opening at {@code start}.
     *
     * @return the literal's extent, or {@code null} when {@code start} does not open a literal
     */
    Quoted quoted(CharSequence text, int start) {
        int length = text.length();
        char open = text.charAt(start);

        if (rustLiterals && open == 'r' && isRawStringStart(text, start)) {
            int i = start + 1;
            int hashes = 0;
            while (i < length && text.charAt(i) == '#') {
                hashes++;
                i++;
            }
            i++; // opening quote
            while (i < length) {
                if (text.charAt(i) == '"' && closesRaw(text, i + 1, hashes)) {
                    return new Quoted(i + 1 + hashes, true);
                }
                i++;
            }
            return new Quoted(length, false);
        }

        if (quotes.indexOf(open) < 0) {
            return null;
        }

        if (rustLiterals && open == '\'') {
            // 'x' or '\n' is a char literal, anything else is a lifetime or label
            if (start + 2 < length && text.charAt(start + 1) != '\\' && text.charAt(start + 2) == '\'') {
                return new Quoted(start + 3, true);
            }
            if (start + 1 < length && text.charAt(start + 1) == '\\') {
                int close = indexOf(text, '\'', start + 2);
                if (close > 0 && close - start <= 12) {
                    return new Quoted(close + 1, true);
                }
            }
            return null;
        }

        if (tripleQuotes && startsWithTriple(text, start, open)) {
            int i = start + 3;
            while (i < length) {
                char ch = text.charAt(i);
                if (ch == '\\') {
                    i += 2;
                    continue;
                }
                if (startsWithTriple(text, i, open)) {
                    return new Quoted(i + 3, true);
                }
                i++;
            }
            return new Quoted(length, false);
        }

        boolean multiline = multilineQuotes.indexOf(open) >= 0;
        int i = start + 1;
        while (i < length) {
            char ch = text.charAt(i);
            if (ch == '\\') {
                i += 2;
                continue;
            }
            if (ch == open) {
                return new Quoted(i + 1, true);
            }
            if (ch == '\n' && !multiline) {
                return new Quoted(i, false);
            }
            i++;
        }
        return new Quoted(length, false);
    }

    private static boolean startsWithTriple(CharSequence text, int at, char quote) {
        return (quote == '"' || quote == '\'')
            && at + 2 < text.length()
            && text.charAt(at) == quote
            && text.charAt(at + 1) == quote
            && text.charAt(at + 2) == quote;
    }

    private static boolean isRawStringStart(CharSequence text, int start) {
        if (start > 0 && isIdentifierPart(text.charAt(start - 1))) {
            return false;
        }
        int i = start + 1;
        while (i < text.length() && text.charAt(i) == '#') {
            i++;
        }
        return i < text.length() && text.charAt(i) == '"' && (i > start + 1 || text.charAt(start + 1) == '"');
    }

    private static boolean closesRaw(CharSequence text, int from, int hashes) {
        for (int k = 0; k < hashes; k++) {
            if (from + k >= text.length() || text.charAt(from + k) != '#') {
                return false;
            }
        }
        return true;
    }

    private static int indexOf(CharSequence text, char ch, int from) {
        for (int i = from; i < text.length(); i++) {
            if (text.charAt(i) == ch) {
                return i;
            }
            if (text.charAt(i) == '\n') {
                return -1;
            }
        }
        return -1;
    }

    static boolean isIdentifierStart(char ch) {
        return Character.isLetter(ch) || ch == '_' || ch == '$';
    }

    static boolean isIdentifierPart(char ch) {
        return Character.isLetterOrDigit(ch) || ch == '_' || ch == '$';
    }
}
