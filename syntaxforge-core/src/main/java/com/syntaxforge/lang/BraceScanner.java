package com.syntaxforge.lang;

import com.syntaxforge.parser.ParseContext;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Splits a curly-brace language into statement text, block braces and comments.
 *
 * <p>Statements end at ';', at a block brace, or at a newline outside brackets
 * unless the line obviously continues. A '{' that starts a value (an object
 * literal, a lambda body, an initializer) is decided by the language's
 * {@code expressionBrace} predicate over the pending statement text; such
 * braces stay inside the statement text.</p>
 */
final class BraceScanner {

    private static final String CONTINUATION_CHARS = "=+-*/%&|^?:,.<>";

    private final LexicalSyntax lexical;
    private final Predicate<String> expressionBrace;

    BraceScanner(LexicalSyntax lexical, Predicate<String> expressionBrace) {
        this.lexical = lexical;
        this.expressionBrace = expressionBrace;
    }

    List<Segment> scan(ParseContext context) {
        String source = context.source();
        List<Segment> segments = new ArrayList<>();
        String code = blankComments(source, context, segments);
        splitStatements(code, context, segments);
        segments.sort(Comparator.comparingInt(Segment::start));
        return segments;
    }

    // Pass 1: collect comments and replace them with spaces, keeping offsets and newlines
    private String blankComments(String source, ParseContext context, List<Segment> segments) {
        StringBuilder code = new StringBuilder(source);
        int length = source.length();
        int i = 0;
        while (i < length) {
            LexicalSyntax.Quoted quoted = lexical.quoted(source, i);
            if (quoted != null) {
                if (!quoted.terminated()) {
                    context.error("Unterminated string literal", i);
                }
                i = Math.max(quoted.end(), i + 1);
                continue;
            }
            int end;
            if (source.startsWith(lexical.lineComment(), i)) {
                end = source.indexOf('\n', i);
                if (end < 0) {
                    end = length;
                }
                if (end > i && source.charAt(end - 1) == '\r') {
                    end--;
                }
            } else if (lexical.blockComments() && source.startsWith("/*", i)) {
                int close = source.indexOf("*/", i + 2);
                if (close < 0) {
                    context.error("Unterminated comment", i);
                    end = length;
                } else {
                    end = close + 2;
                }
            } else {
                i++;
                continue;
            }
            segments.add(new Segment(Segment.Kind.COMMENT, Span.of(source, i, end)));
            for (int k = i; k < end; k++) {
                if (code.charAt(k) != '\n') {
                    code.setCharAt(k, ' ');
                }
            }
            i = end;
        }
        return code.toString();
    }

    // Pass 2: statement text and block braces
    private void splitStatements(String code, ParseContext context, List<Segment> segments) {
        Deque<Integer> brackets = new ArrayDeque<>();
        int opaqueDepth = 0;
        int opaqueStart = -1;
        int statementStart = -1;
        int length = code.length();
        int i = 0;
        while (i < length) {
            char ch = code.charAt(i);
            LexicalSyntax.Quoted quoted = lexical.quoted(code, i);
            if (quoted != null) {
                if (statementStart < 0) {
                    statementStart = i;
                }
                i = Math.max(quoted.end(), i + 1);
                continue;
            }

            boolean topLevel = brackets.isEmpty() && opaqueDepth == 0;
            switch (ch) {
                case '\n' -> {
                    if (topLevel && statementStart >= 0 && !continuesOnNextLine(code, statementStart, i)) {
                        flush(code, statementStart, i, segments);
                        statementStart = -1;
                    }
                }
                case '(', '[' -> {
                    if (statementStart < 0) {
                        statementStart = i;
                    }
                    brackets.push(i);
                }
                case ')', ']' -> {
                    if (brackets.isEmpty()) {
                        context.error("Unexpected '" + ch + "'", i);
                    } else {
                        brackets.pop();
                    }
                    if (statementStart < 0) {
                        statementStart = i;
                    }
                }
                case '{' -> {
                    if (!brackets.isEmpty()) {
                        break;
                    }
                    if (opaqueDepth > 0) {
                        opaqueDepth++;
                    } else if (statementStart >= 0 && expressionBrace.test(code.substring(statementStart, i).trim())) {
                        opaqueDepth = 1;
                        opaqueStart = i;
                    } else {
                        flush(code, statementStart, i, segments);
                        statementStart = -1;
                        segments.add(new Segment(Segment.Kind.OPEN, Span.of(code, i, i + 1)));
                    }
                }
                case '}' -> {
                    if (!brackets.isEmpty()) {
                        break;
                    }
                    if (opaqueDepth > 0) {
                        opaqueDepth--;
                    } else {
                        flush(code, statementStart, i, segments);
                        statementStart = -1;
                        segments.add(new Segment(Segment.Kind.CLOSE, Span.of(code, i, i + 1)));
                    }
                }
                case ';' -> {
                    if (topLevel) {
                        flush(code, statementStart, i, segments);
                        statementStart = -1;
                    }
                }
                case ',' -> {
                    // A leading comma separates a closed block from what follows, e.g. "},"
                    if (statementStart < 0 && topLevel) {
                        break;
                    }
                    if (statementStart < 0) {
                        statementStart = i;
                    }
                }
                default -> {
                    if (statementStart < 0 && !Character.isWhitespace(ch)) {
                        statementStart = i;
                    }
                }
            }
            i++;
        }

        if (!brackets.isEmpty()) {
            int open = brackets.getLast();
            context.error("Unclosed '" + code.charAt(open) + "'", open);
        } else if (opaqueDepth > 0) {
            context.error("Unclosed '{'", opaqueStart);
        }
        flush(code, statementStart, length, segments);
    }

    private static void flush(String code, int start, int end, List<Segment> segments) {
        if (start < 0) {
            return;
        }
        Span text = Span.of(code, start, end).trim();
        if (!text.isEmpty()) {
            segments.add(new Segment(Segment.Kind.TEXT, text));
        }
    }

    private static boolean continuesOnNextLine(String code, int start, int newline) {
        String pending = code.substring(start, newline).stripTrailing();
        if (pending.isEmpty()) {
            return false;
        }
        char last = pending.charAt(pending.length() - 1);
        if (CONTINUATION_CHARS.indexOf(last) >= 0 && !pending.endsWith("++") && !pending.endsWith("--")) {
            return true;
        }
        int next = newline + 1;
        while (next < code.length() && Character.isWhitespace(code.charAt(next))) {
            next++;
        }
        if (next >= code.length()) {
            return false;
        }
        return (code.startsWith(".", next) && !code.startsWith("..", next))
            || code.startsWith("?", next)
            || code.startsWith("&&", next)
            || code.startsWith("||", next)
            || (code.startsWith(":", next) && !code.startsWith("::", next));
    }

    // ========================================================================
    // Helpers for expressionBrace predicates
    // ========================================================================

    /**
     * True when {@code text} contains an assignment '=' outside brackets, ignoring
     * comparison and arrow operators.
     */
    static boolean hasTopLevelAssignment(String text, LexicalSyntax lexical) {
        return assignmentIndex(text, lexical) >= 0;
    }

    /**
     * Index of the first assignment '=' outside brackets, or -1.
     */
    static int assignmentIndex(String text, LexicalSyntax lexical) {
        int depth = 0;
        int i = 0;
        while (i < text.length()) {
            LexicalSyntax.Quoted quoted = lexical.quoted(text, i);
            if (quoted != null) {
                i = Math.max(quoted.end(), i + 1);
                continue;
            }
            char ch = text.charAt(i);
            if (ch == '(' || ch == '[' || ch == '{') {
                depth++;
            } else if (ch == ')' || ch == ']' || ch == '}') {
                depth = Math.max(0, depth - 1);
            } else if (ch == '=' && depth == 0) {
                char before = i > 0 ? text.charAt(i - 1) : ' ';
                char after = i + 1 < text.length() ? text.charAt(i + 1) : ' ';
                if ("=!<>+-*/%&|^:?".indexOf(before) < 0 && after != '=' && after != '>') {
                    return i;
                }
            }
            i++;
        }
        return -1;
    }

    static boolean startsWithAnyWord(String text, Set<String> words) {
        int end = 0;
        while (end < text.length() && LexicalSyntax.isIdentifierPart(text.charAt(end))) {
            end++;
        }
        return words.contains(text.substring(0, end));
    }

    static boolean endsWithWord(String text, String word) {
        return text.endsWith(word)
            && (text.length() == word.length()
                || !LexicalSyntax.isIdentifierPart(text.charAt(text.length() - word.length() - 1)));
    }

    /**
     * True when the text ends in a binary or prefix operator, so a following
     * '{' must be an operand.
     */
    static boolean endsWithOperator(String text, String operatorChars) {
        if (text.isEmpty() || text.endsWith("++") || text.endsWith("--")) {
            return false;
        }
        return operatorChars.indexOf(text.charAt(text.length() - 1)) >= 0;
    }
}
