package com.syntaxforge.lang;

import com.syntaxforge.ast.BlockStatement;
import com.syntaxforge.ast.CatchClause;
import com.syntaxforge.ast.Comment;
import com.syntaxforge.ast.CommentKind;
import com.syntaxforge.ast.ExpressionStatement;
import com.syntaxforge.ast.GenericNode;
import com.syntaxforge.ast.Identifier;
import com.syntaxforge.ast.IfStatement;
import com.syntaxforge.ast.Node;
import com.syntaxforge.ast.Parameter;
import com.syntaxforge.ast.Program;
import com.syntaxforge.ast.Range;
import com.syntaxforge.ast.ReturnStatement;
import com.syntaxforge.ast.SourceLocation;
import com.syntaxforge.ast.SourceType;
import com.syntaxforge.ast.SwitchStatement;
import com.syntaxforge.ast.ThrowStatement;
import com.syntaxforge.ast.TryStatement;
import com.syntaxforge.ast.WhileLoop;
import com.syntaxforge.parser.ParseContext;
import com.syntaxforge.parser.SyntaxException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Recursive descent over the segments of a curly-brace language. One instance
 * parses one source; subclasses supply the statement forms of their language.
 */
abstract class BraceParser {

    protected final ParseContext context;
    protected final LexicalSyntax lexical;
    protected final ExpressionParser expressions;

    private final List<Segment> segments;
    private int position;
    private int lastEnd;
    private int functionDepth;
    private int blockDepth;

    protected BraceParser(ParseContext context, ExpressionSyntax syntax, Predicate<String> expressionBrace) {
        this.context = context;
        this.lexical = syntax.lexical;
        this.expressions = new ExpressionParser(context, syntax);
        this.segments = new BraceScanner(syntax.lexical, expressionBrace).scan(context);
    }

    /**
     * Reads one statement from {@code text}, a TEXT segment or the tail of one,
     * consuming any block that belongs to it.
     */
    protected abstract void readTextStatement(Span text, List<Node> out);

    protected SourceType sourceType() {
        return null;
    }

    Program parseProgram() {
        List<Node> body = new ArrayList<>();
        while (!atEnd()) {
            if (peek().is(Segment.Kind.CLOSE)) {
                context.error("Unexpected '}'", next().start());
                continue;
            }
            readStatement(body);
        }
        int end = context.source().length();
        return new Program(loc(0, end), range(0, end), null, body, sourceType());
    }

    // ========================================================================
    // Segment cursor
    // ========================================================================

    protected boolean atEnd() {
        return position >= segments.size();
    }

    protected Segment peek() {
        return atEnd() ? null : segments.get(position);
    }

    protected Segment next() {
        Segment segment = segments.get(position++);
        lastEnd = segment.end();
        return segment;
    }

    protected int lastEnd() {
        return lastEnd;
    }

    protected boolean peekIs(Segment.Kind kind) {
        return !atEnd() && peek().is(kind);
    }

    /**
     * True when the next segment is text starting with {@code word}.
     */
    protected boolean peekWord(String word) {
        return peekIs(Segment.Kind.TEXT) && peek().span().startsWithWord(word);
    }

    protected boolean insideFunction() {
        return functionDepth > 0;
    }

    protected boolean atTopLevel() {
        return blockDepth == 0;
    }

    // ========================================================================
    // Statements and blocks
    // ========================================================================

    protected void readStatement(List<Node> out) {
        Segment segment = next();
        switch (segment.kind()) {
            case COMMENT -> out.add(comment(segment.span()));
            case OPEN -> out.add(readBlockFrom(segment));
            case CLOSE -> context.error("Unexpected '}'", segment.start());
            case TEXT -> {
                Span text = segment.span();
                if (text.startsWithWord("else")) {
                    context.error("'else' without a matching 'if'", text.start());
                } else if (text.startsWithWord("catch") || text.startsWithWord("finally")) {
                    context.error("'" + text.text().split("\\W", 2)[0] + "' without a matching 'try'", text.start());
                } else {
                    readTextStatement(text, out);
                }
            }
        }
    }

    protected BlockStatement readBlock() {
        if (!peekIs(Segment.Kind.OPEN)) {
            throw new SyntaxException("Expected '{'", atEnd() ? lastEnd : peek().start());
        }
        return readBlockFrom(next());
    }

    protected BlockStatement readBlockFrom(Segment open) {
        List<Node> body = new ArrayList<>();
        blockDepth++;
        while (!peekIs(Segment.Kind.CLOSE)) {
            if (atEnd()) {
                throw new SyntaxException("Unterminated block: missing '}' for the '{' on line "
                    + context.lineAt(open.start()), open.start());
            }
            readStatement(body);
        }
        blockDepth--;
        Segment close = next();
        return new BlockStatement(loc(open.start(), close.end()), range(open.start(), close.end()), null, body);
    }

    /**
     * Members of a braced body (class, impl, trait, module) read with {@code reader}.
     */
    protected List<Node> readBracedMembers(MemberReader reader) {
        if (!peekIs(Segment.Kind.OPEN)) {
            throw new SyntaxException("Expected '{'", atEnd() ? lastEnd : peek().start());
        }
        Segment open = next();
        List<Node> members = new ArrayList<>();
        blockDepth++;
        while (!peekIs(Segment.Kind.CLOSE)) {
            if (atEnd()) {
                throw new SyntaxException("Unterminated block: missing '}' for the '{' on line "
                    + context.lineAt(open.start()), open.start());
            }
            Segment segment = next();
            switch (segment.kind()) {
                case COMMENT -> members.add(comment(segment.span()));
                case OPEN -> members.add(readBlockFrom(segment)); // initializer block
                case TEXT -> reader.read(segment.span(), members);
                case CLOSE -> throw new IllegalStateException("unreachable");
            }
        }
        blockDepth--;
        next();
        return members;
    }

    @FunctionalInterface
    protected interface MemberReader {
        void read(Span text, List<Node> out);
    }

    protected BlockStatement readFunctionBody() {
        functionDepth++;
        try {
            return readBlock();
        } finally {
            functionDepth--;
        }
    }

    /**
     * A function body when one follows, otherwise an empty block (abstract and
     * interface methods, trait declarations).
     */
    protected BlockStatement readOptionalFunctionBody() {
        if (peekIs(Segment.Kind.OPEN)) {
            return readFunctionBody();
        }
        return BlockStatement.empty();
    }

    /**
     * The body of a control statement: a block, or the single statement that follows.
     */
    protected Node readBody(int headerStart) {
        while (peekIs(Segment.Kind.COMMENT)) {
            next();
        }
        if (atEnd() || peekIs(Segment.Kind.CLOSE)) {
            throw new SyntaxException("Expected a statement body", headerStart);
        }
        List<Node> statements = new ArrayList<>();
        readStatement(statements);
        return single(statements);
    }

    protected Node statementFrom(Span text) {
        List<Node> statements = new ArrayList<>();
        readTextStatement(text, statements);
        return single(statements);
    }

    private Node single(List<Node> statements) {
        if (statements.size() == 1) {
            return statements.get(0);
        }
        return new BlockStatement(statements);
    }

    // ========================================================================
    // Shared statement forms
    // ========================================================================

    /**
     * The condition of a control header and whatever follows it on the same line.
     */
    protected record Header(Span condition, Span tail) {}

    /**
     * Splits a header such as {@code (x > 0) return x}. Languages without
     * parenthesized conditions override this.
     */
    protected Header header(Span afterKeyword) {
        Span text = afterKeyword.trim();
        if (text.startsWith("(")) {
            int close = text.matchingClose(0, lexical);
            if (close > 0) {
                return new Header(text.sub(1, close), text.sub(close + 1).trim());
            }
        }
        return new Header(text, text.sub(text.length()));
    }

    protected Node readIf(int start, Span afterIf) {
        Header header = header(afterIf);
        Node test = condition(header.condition(), start);
        Node consequent = header.tail().isEmpty() ? readBody(start) : statementFrom(header.tail());
        Node alternate = null;
        if (peekWord("else")) {
            Segment elseSegment = next();
            Span rest = elseSegment.span().afterWord("else");
            if (rest.startsWithWord("if")) {
                alternate = readIf(rest.start(), rest.afterWord("if"));
            } else if (!rest.isEmpty()) {
                alternate = statementFrom(rest);
            } else {
                alternate = readBody(elseSegment.start());
            }
        }
        return new IfStatement(loc(start, lastEnd), range(start, lastEnd), null, test, consequent, alternate);
    }

    protected Node readWhile(int start, Span afterWhile) {
        Header header = header(afterWhile);
        Node test = condition(header.condition(), start);
        Node body = header.tail().isEmpty() ? readBody(start) : statementFrom(header.tail());
        return new WhileLoop(loc(start, lastEnd), range(start, lastEnd), null, test, body);
    }

    protected Node readDoWhile(int start, Span afterDo) {
        Node body = afterDo.isEmpty() ? readBody(start) : statementFrom(afterDo);
        if (!peekWord("while")) {
            throw new SyntaxException("Expected 'while' after do block", lastEnd);
        }
        Segment whileSegment = next();
        Node test = condition(header(whileSegment.span().afterWord("while")).condition(), whileSegment.start());
        return new WhileLoop(loc(start, lastEnd), range(start, lastEnd), null, test, body);
    }

    /**
     * try/catch/finally. {@code catchClause} reads the text after {@code catch}.
     */
    protected Node readTry(int start) {
        BlockStatement block = readBlock();
        List<CatchClause> handlers = new ArrayList<>();
        while (peekWord("catch")) {
            Segment catchSegment = next();
            Span params = catchSegment.span().afterWord("catch");
            if (params.startsWith("(")) {
                int close = params.matchingClose(0, lexical);
                params = close > 0 ? params.sub(1, close).trim() : params.sub(1).trim();
            }
            BlockStatement body = readBlock();
            handlers.add(catchClause(params, catchSegment.start(), body));
        }
        BlockStatement finalizer = null;
        if (peekWord("finally")) {
            next();
            finalizer = readBlock();
        }
        if (handlers.isEmpty() && finalizer == null && requiresHandler()) {
            context.error("Missing catch or finally after try", start);
        }
        return new TryStatement(loc(start, lastEnd), range(start, lastEnd), null, block, handlers, finalizer);
    }

    protected boolean requiresHandler() {
        return true;
    }

    /**
     * Default catch parameter: {@code e} or {@code Type e} or {@code A | B e}.
     */
    protected CatchClause catchClause(Span params, int start, BlockStatement body) {
        Identifier param = null;
        List<String> types = new ArrayList<>();
        if (!params.isEmpty()) {
            String[] words = params.text().trim().split("\\s+");
            String name = words[words.length - 1];
            int nameAt = params.text().lastIndexOf(name);
            param = expressions.identifier(name, params.start() + nameAt, params.start() + nameAt + name.length());
            if (words.length > 1) {
                String typeText = params.text().substring(0, nameAt).trim();
                for (String type : typeText.split("\\|")) {
                    String trimmed = type.replace("final ", "").trim();
                    if (!trimmed.isEmpty()) {
                        types.add(trimmed);
                    }
                }
            }
        }
        return new CatchClause(loc(start, lastEnd), range(start, lastEnd), null, param, types, body);
    }

    protected Node readReturn(Span text) {
        Span argument = text.afterWord("return");
        Node value = expressions.parse(argument);
        return new ReturnStatement(loc(text.start(), text.end()), range(text.start(), text.end()), null, value);
    }

    protected Node readThrow(Span text, String keyword) {
        Node value = expressions.parse(text.afterWord(keyword));
        return new ThrowStatement(loc(text.start(), text.end()), range(text.start(), text.end()), null, value);
    }

    /**
     * {@code switch (x) { case 1: ...; default -> ... }} in the colon or arrow form.
     */
    protected Node readSwitch(int start, Span discriminantText) {
        Node discriminant = condition(header(discriminantText).condition(), start);
        if (!peekIs(Segment.Kind.OPEN)) {
            throw new SyntaxException("Expected '{' after switch", lastEnd);
        }
        Segment open = next();
        List<SwitchStatement.Case> cases = new ArrayList<>();
        Node test = null;
        List<Node> consequent = null;
        while (!peekIs(Segment.Kind.CLOSE)) {
            if (atEnd()) {
                throw new SyntaxException("Unterminated block: missing '}' for the '{' on line "
                    + context.lineAt(open.start()), open.start());
            }
            Segment segment = peek();
            Span text = segment.span();
            boolean label = segment.is(Segment.Kind.TEXT) && (text.startsWithWord("case") || text.startsWithWord("default"));
            if (label) {
                next();
                if (consequent != null) {
                    cases.add(new SwitchStatement.Case(test, consequent));
                }
                consequent = new ArrayList<>();
                int labelEnd = caseLabelEnd(text);
                if (labelEnd < 0) {
                    throw new SyntaxException("Expected ':' or '->' after case label", text.start());
                }
                Span labelText = text.sub(0, labelEnd).trim();
                test = labelText.startsWithWord("default") ? null : expressions.parseRequired(labelText.afterWord("case"), "a case label");
                int separatorLength = text.text().startsWith("->", labelEnd) ? 2 : 1;
                Span tail = text.sub(labelEnd + separatorLength).trim();
                if (!tail.isEmpty()) {
                    readTextStatement(tail, consequent);
                }
            } else if (consequent == null) {
                if (segment.is(Segment.Kind.COMMENT)) {
                    next();
                    continue;
                }
                throw new SyntaxException("Expected 'case' or 'default' in switch", segment.start());
            } else {
                readStatement(consequent);
            }
        }
        next();
        if (consequent != null) {
            cases.add(new SwitchStatement.Case(test, consequent));
        }
        return new SwitchStatement(loc(start, lastEnd), range(start, lastEnd), null, discriminant, cases);
    }

    // Index of the ':' or '->' ending a case label, skipping '::' and '?:'
    private int caseLabelEnd(Span text) {
        String s = text.text();
        int depth = 0;
        int ternaries = 0;
        int i = 0;
        while (i < s.length()) {
            LexicalSyntax.Quoted quoted = lexical.quoted(s, i);
            if (quoted != null) {
                i = Math.max(quoted.end(), i + 1);
                continue;
            }
            char ch = s.charAt(i);
            if (ch == '(' || ch == '[' || ch == '{') {
                depth++;
            } else if (ch == ')' || ch == ']' || ch == '}') {
                depth = Math.max(0, depth - 1);
            } else if (depth == 0) {
                if (s.startsWith("::", i)) {
                    i += 2;
                    continue;
                }
                if (s.startsWith("->", i)) {
                    return i;
                }
                if (ch == '?') {
                    ternaries++;
                } else if (ch == ':') {
                    if (ternaries == 0) {
                        return i;
                    }
                    ternaries--;
                }
            }
            i++;
        }
        return -1;
    }

    protected Node expressionStatement(Span text) {
        Node expression = expressions.parseRequired(text, "an expression");
        return new ExpressionStatement(loc(text.start(), text.end()), range(text.start(), text.end()), null, expression);
    }

    protected Node condition(Span text, int headerStart) {
        Node test = expressions.parse(text);
        if (test == null) {
            throw new SyntaxException("Expected a condition", headerStart);
        }
        return test;
    }

    protected Node generic(String type, int start, int end, Map<String, Object> attributes, List<Node> children) {
        return new GenericNode(loc(start, end), range(start, end), null, type, attributes, children);
    }

    // ========================================================================
    // Declarations helpers
    // ========================================================================

    /**
     * Parameters of a declaration, {@code inner} being the text between the parentheses.
     */
    protected List<Parameter> parameters(Span inner, Function<Span, Parameter> reader) {
        List<Parameter> params = new ArrayList<>();
        for (Span piece : inner.splitTopLevel(',', lexical, true)) {
            Parameter parameter = reader.apply(piece);
            if (parameter != null) {
                params.add(parameter);
            }
        }
        return params;
    }

    /**
     * The parenthesized part of a header starting at {@code openIndex}.
     */
    protected Span parenthesized(Span header, int openIndex) {
        int close = header.matchingClose(openIndex, lexical);
        if (close < 0) {
            throw new SyntaxException("Expected ')'", header.start() + openIndex);
        }
        return header.sub(openIndex + 1, close);
    }

    protected Comment comment(Span text) {
        String raw = text.text();
        CommentKind kind;
        String value;
        if (raw.startsWith("/*")) {
            kind = CommentKind.BLOCK;
            value = raw.substring(2, raw.endsWith("*/") && raw.length() >= 4 ? raw.length() - 2 : raw.length());
        } else {
            kind = CommentKind.LINE;
            value = raw.substring(lexical.lineComment().length());
        }
        return new Comment(loc(text.start(), text.end()), range(text.start(), text.end()), null, value.strip(), kind);
    }

    protected SourceLocation loc(int start, int end) {
        return context.location(start, end);
    }

    protected Range range(int start, int end) {
        return context.range(start, end);
    }
}
