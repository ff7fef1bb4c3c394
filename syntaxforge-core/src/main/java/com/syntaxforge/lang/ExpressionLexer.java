package com.syntaxforge.lang;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits an expression span into {@link Token}s. Comments are already blanked out
 * of the text by the statement scanners.
 */
final class ExpressionLexer {

    // Longest first so that maximal munch falls out of a linear scan
    private static final String[] OPERATORS = {
        ">>>=",
        "...", "===", "!==", "**=", "<<=", ">>=", "//=", "&&=", "||=", "??=", "..=", ">>>",
        "=>", "->", "==", "!=", "<=", ">=", "&&", "||", "??", "?.", "++", "--", "+=", "-=", "*=", "/=",
        "%=", "&=", "|=", "^=", "@=", "**", "//", "<<", ">>", "::", ":=", "..",
        "+", "-", "*", "/", "%", "=", "<", ">", "!", "~", "&", "|", "^", "?", ":", "@", ".", ",",
        "(", ")", "[", "]", "{", "}", ";"
    };

    private static final String STRING_PREFIX_LETTERS = "rbfuRBFU";

    private final ExpressionSyntax syntax;

    ExpressionLexer(ExpressionSyntax syntax) {
        this.syntax = syntax;
    }

    List<Token> tokenize(Span span) {
        String text = span.text();
        int base = span.start();
        List<Token> tokens = new ArrayList<>();
        int i = 0;
        while (i < text.length()) {
            char ch = text.charAt(i);
            if (Character.isWhitespace(ch) || (ch == '\\' && isLineContinuation(text, i))) {
                i++;
                continue;
            }

            int literalEnd = literalEnd(text, i);
            if (literalEnd > 0) {
                tokens.add(new Token(Token.Kind.STRING, text.substring(i, literalEnd), base + i, base + literalEnd));
                i = literalEnd;
                continue;
            }

            if (Character.isDigit(ch) || (ch == '.' && nextIsDigit(text, i) && !followsOperand(tokens))) {
                int end = numberEnd(text, i);
                tokens.add(new Token(Token.Kind.NUMBER, text.substring(i, end), base + i, base + end));
                i = end;
                continue;
            }

            if (LexicalSyntax.isIdentifierStart(ch)
                || (ch == '#' && i + 1 < text.length() && LexicalSyntax.isIdentifierStart(text.charAt(i + 1)))
                || (ch == '\'' && syntax.lexical.rustLiterals())) {
                int end = identifierEnd(text, i);
                String word = text.substring(i, end);
                String operator = syntax.wordOperators.get(word);
                Token.Kind kind = operator != null ? Token.Kind.OPERATOR : Token.Kind.IDENTIFIER;
                tokens.add(new Token(kind, operator != null ? operator : word, base + i, base + end));
                i = end;
                continue;
            }

            String operator = matchOperator(text, i);
            if (operator == null) {
                throw new ExpressionException("Unexpected character '" + ch + "'", base + i);
            }
            tokens.add(new Token(Token.Kind.OPERATOR, operator, base + i, base + i + operator.length()));
            i += operator.length();
        }
        tokens.add(new Token(Token.Kind.EOF, "", base + text.length(), base + text.length()));
        return tokens;
    }

    // A string or char literal, with an optional prefix such as r"", f'' or b"".
    // Returns the end index, or -1 when no literal starts here.
    private int literalEnd(String text, int i) {
        int quoteAt = i;
        if (STRING_PREFIX_LETTERS.indexOf(text.charAt(i)) >= 0 && (i == 0 || !LexicalSyntax.isIdentifierPart(text.charAt(i - 1)))) {
            int j = i;
            while (j < text.length() && j - i < 2 && STRING_PREFIX_LETTERS.indexOf(text.charAt(j)) >= 0) {
                j++;
            }
            if (j < text.length() && (text.charAt(j) == '"' || text.charAt(j) == '\'')) {
                quoteAt = j;
            }
        }
        LexicalSyntax.Quoted quoted = syntax.lexical.quoted(text, i);
        if (quoted == null && quoteAt != i) {
            quoted = syntax.lexical.quoted(text, quoteAt);
        }
        if (quoted == null) {
            return -1;
        }
        if (!quoted.terminated()) {
            throw new ExpressionException("Unterminated string literal", i);
        }
        return quoted.end();
    }

    private static boolean isLineContinuation(String text, int i) {
        int j = i + 1;
        while (j < text.length() && (text.charAt(j) == ' ' || text.charAt(j) == '\t' || text.charAt(j) == '\r')) {
            j++;
        }
        return j >= text.length() || text.charAt(j) == '\n';
    }

    private static boolean nextIsDigit(String text, int i) {
        return i + 1 < text.length() && Character.isDigit(text.charAt(i + 1));
    }

    private static boolean followsOperand(List<Token> tokens) {
        if (tokens.isEmpty()) {
            return false;
        }
        Token last = tokens.get(tokens.size() - 1);
        return last.kind() == Token.Kind.IDENTIFIER
            || last.kind() == Token.Kind.NUMBER
            || last.kind() == Token.Kind.STRING
            || last.isOperator(")")
            || last.isOperator("]");
    }

    private static int numberEnd(String text, int start) {
        int i = start;
        int length = text.length();
        if (text.charAt(i) == '0' && i + 1 < length && "xXbBoO".indexOf(text.charAt(i + 1)) >= 0) {
            i += 2;
            while (i < length && (Character.isLetterOrDigit(text.charAt(i)) || text.charAt(i) == '_')) {
                i++;
            }
            return i;
        }
        while (i < length && (Character.isDigit(text.charAt(i)) || text.charAt(i) == '_')) {
            i++;
        }
        if (i < length && text.charAt(i) == '.' && nextIsDigit(text, i)) {
            i++;
            while (i < length && (Character.isDigit(text.charAt(i)) || text.charAt(i) == '_')) {
                i++;
            }
        }
        if (i < length && (text.charAt(i) == 'e' || text.charAt(i) == 'E')) {
            int j = i + 1;
            if (j < length && (text.charAt(j) == '+' || text.charAt(j) == '-')) {
                j++;
            }
            if (j < length && Character.isDigit(text.charAt(j))) {
                i = j;
                while (i < length && Character.isDigit(text.charAt(i))) {
                    i++;
                }
            }
        }
        // Type suffixes: 10L, 1.5f, 42u32, 10n
        while (i < length && (Character.isLetterOrDigit(text.charAt(i)) || text.charAt(i) == '_')) {
            i++;
        }
        return i;
    }

    private int identifierEnd(String text, int start) {
        int i = start + 1;
        int length = text.length();
        while (i < length && LexicalSyntax.isIdentifierPart(text.charAt(i))) {
            i++;
        }
        if (text.charAt(start) == '\'') {
            return i;
        }
        if (syntax.genericArguments) {
            i = genericArgumentsEnd(text, i);
        }
        while (syntax.paths && text.startsWith("::", i) && i + 2 < length) {
            char next = text.charAt(i + 2);
            if (LexicalSyntax.isIdentifierStart(next)) {
                i += 3;
                while (i < length && LexicalSyntax.isIdentifierPart(text.charAt(i))) {
                    i++;
                }
                if (syntax.genericArguments) {
                    i = genericArgumentsEnd(text, i);
                }
            } else if (next == '<' && syntax.genericArguments) {
                int end = genericArgumentsEnd(text, i + 2);
                if (end == i + 2) {
                    break;
                }
                i = end;
            } else {
                break;
            }
        }
        if (syntax.macros && i + 1 < length && text.charAt(i) == '!' && text.charAt(i + 1) != '=') {
            i++;
        }
        return i;
    }

    // Consumes "<...>" after a type name when it is followed by a call or path, e.g.
    // ArrayList<>() or Vec::<u8>::new(). Returns {@code from} when there is none.
    private static int genericArgumentsEnd(String text, int from) {
        if (from >= text.length() || text.charAt(from) != '<') {
            return from;
        }
        int depth = 0;
        int i = from;
        while (i < text.length()) {
            char ch = text.charAt(i);
            if (ch == '<') {
                depth++;
            } else if (ch == '>') {
                depth--;
                if (depth == 0) {
                    break;
                }
            } else if (!(LexicalSyntax.isIdentifierPart(ch) || " ,.?&'[]:".indexOf(ch) >= 0)) {
                return from;
            }
            i++;
        }
        if (depth != 0 || i >= text.length()) {
            return from;
        }
        String group = text.substring(from, i + 1);
        if (group.contains("&&") || group.contains("||")) {
            return from;
        }
        int after = i + 1;
        if (after < text.length() && (text.charAt(after) == '(' || text.startsWith("::", after))) {
            return after;
        }
        return from;
    }

    private String matchOperator(String text, int i) {
        for (String operator : OPERATORS) {
            if (text.startsWith(operator, i)) {
                if (syntax.postfixTry && (operator.equals("?.") || operator.equals("??"))) {
                    continue;
                }
                return operator;
            }
        }
        return null;
    }
}
