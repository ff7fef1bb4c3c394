package com.syntaxforge.lang;

import com.syntaxforge.ast.AssignmentExpression;
import com.syntaxforge.ast.BlockStatement;
import com.syntaxforge.ast.CatchClause;
import com.syntaxforge.ast.ClassDeclaration;
import com.syntaxforge.ast.Comment;
import com.syntaxforge.ast.CommentKind;
import com.syntaxforge.ast.DeclarationKind;
import com.syntaxforge.ast.ExpressionStatement;
import com.syntaxforge.ast.ForLoop;
import com.syntaxforge.ast.FunctionDeclaration;
import com.syntaxforge.ast.GenericNode;
import com.syntaxforge.ast.Identifier;
import com.syntaxforge.ast.IfStatement;
import com.syntaxforge.ast.ImportDeclaration;
import com.syntaxforge.ast.MethodDeclaration;
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
import com.syntaxforge.ast.VariableDeclaration;
import com.syntaxforge.ast.Visibility;
import com.syntaxforge.ast.WhileLoop;
import com.syntaxforge.parser.ParseContext;
import com.syntaxforge.parser.SyntaxException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Python statements. Source is first cut into logical lines (comments removed,
 * bracketed and backslash-continued lines joined, {@code ;} split), then suites
 * are read by indentation.
 */
final class PythonStatementParser {

    private static final int TAB_SIZE = 8;

    private static final Pattern NAME = Pattern.compile("^[A-Za-z_]\\w*$");
    private static final Pattern DEF = Pattern.compile("^(async\\s+)?def\\s+([A-Za-z_]\\w*)\\s*\\(");
    private static final Pattern CLASS = Pattern.compile("^class\\s+([A-Za-z_]\\w*)\\s*");
    private static final Pattern DECORATOR = Pattern.compile("^@\\s*([\\w.]+)");

    private record Line(int indent, Span text, boolean comment) {
        int start() {
            return text.start();
        }
    }

    private enum Scope { MODULE, CLASS, FUNCTION }

    private final ParseContext context;
    private final LexicalSyntax lexical = LexicalSyntax.PYTHON;
    private final ExpressionParser expressions;
    private final List<Line> lines = new ArrayList<>();
    private final Deque<Scope> scopes = new ArrayDeque<>();
    private final Deque<boolean[]> generators = new ArrayDeque<>();
    private int position;
    private int lastEnd;

    PythonStatementParser(ParseContext context) {
        this.context = context;
        this.expressions = new ExpressionParser(context, ExpressionSyntax.PYTHON);
    }

    Program parseProgram() {
        splitLines();
        scopes.push(Scope.MODULE);
        List<Node> body = readStatements(0);
        int end = context.source().length();
        return new Program(loc(0, end), range(0, end), null, body, SourceType.MODULE);
    }

    // ========================================================================
    // Logical lines
    // ========================================================================

    private void splitLines() {
        String source = context.source();
        StringBuilder code = new StringBuilder(source);
        Deque<Integer> brackets = new ArrayDeque<>();
        List<Line> pendingComments = new ArrayList<>();
        int length = source.length();
        int lineStart = -1;
        int indent = 0;
        int column = 0;
        boolean measuring = true;
        int i = 0;
        while (i < length) {
            char ch = source.charAt(i);
            if (measuring) {
                if (ch == ' ' || ch == '\t' || ch == '\f') {
                    column = ch == ' ' ? column + 1 : ch == '\t' ? (column / TAB_SIZE + 1) * TAB_SIZE : 0;
                    i++;
                    continue;
                }
                measuring = false;
                if (lineStart < 0 && brackets.isEmpty()) {
                    indent = column;
                }
            }

            if (ch == '#') {
                int end = source.indexOf('\n', i);
                end = end < 0 ? length : end;
                int commentIndent = lineStart < 0 && brackets.isEmpty() ? column : indent;
                pendingComments.add(new Line(commentIndent, Span.of(source, i, end).trim(), true));
                for (int k = i; k < end; k++) {
                    code.setCharAt(k, ' ');
                }
                if (lineStart < 0) {
                    lines.addAll(pendingComments);
                    pendingComments.clear();
                }
                i = end;
                continue;
            }

            LexicalSyntax.Quoted quoted = lexical.quoted(source, i);
            if (quoted != null) {
                if (!quoted.terminated()) {
                    boolean triple = source.startsWith("\"\"\"", i) || source.startsWith("'''", i);
                    context.error(triple ? "Unterminated triple-quoted string literal" : "Unterminated string literal", i);
                }
                if (lineStart < 0) {
                    lineStart = i;
                }
                i = Math.max(quoted.end(), i + 1);
                continue;
            }

            switch (ch) {
                case '\\' -> {
                    int next = i + 1;
                    if (next < length && source.charAt(next) == '\r') {
                        next++;
                    }
                    if (next < length && source.charAt(next) == '\n') {
                        i = next + 1;
                        continue;
                    }
                    if (lineStart < 0) {
                        lineStart = i;
                    }
                }
                case '(', '[', '{' -> {
                    if (lineStart < 0) {
                        lineStart = i;
                    }
                    brackets.push(i);
                }
                case ')', ']', '}' -> {
                    if (lineStart < 0) {
                        lineStart = i;
                    }
                    if (brackets.isEmpty()) {
                        context.error("Unmatched '" + ch + "'", i);
                    } else {
                        char open = source.charAt(brackets.pop());
                        if (closerOf(open) != ch) {
                            context.error("Closing '" + ch + "' does not match opening '" + open + "'", i);
                        }
                    }
                }
                case '\n' -> {
                    if (brackets.isEmpty()) {
                        flush(code, lineStart, i, indent, pendingComments);
                        lineStart = -1;
                    }
                    measuring = true;
                    column = 0;
                }
                case ';' -> {
                    if (brackets.isEmpty() && lineStart >= 0) {
                        flush(code, lineStart, i, indent, pendingComments);
                        lineStart = -1;
                    }
                }
                default -> {
                    if (lineStart < 0 && !Character.isWhitespace(ch)) {
                        lineStart = i;
                    }
                }
            }
            i++;
        }
        if (!brackets.isEmpty()) {
            int open = brackets.getLast();
            context.error("'" + source.charAt(open) + "' was never closed", open);
        }
        flush(code, lineStart, length, indent, pendingComments);
    }

    private void flush(StringBuilder code, int start, int end, int indent, List<Line> pendingComments) {
        if (start >= 0) {
            Span text = new Span(code.substring(start, end), start).trim();
            if (!text.isEmpty()) {
                lines.add(new Line(indent, text, false));
            }
        }
        lines.addAll(pendingComments);
        pendingComments.clear();
    }

    private static char closerOf(char open) {
        return switch (open) {
            case '(' -> ')';
            case '[' -> ']';
            default -> '}';
        };
    }

    // ========================================================================
    // Suites
    // ========================================================================

    private List<Node> readStatements(int indent) {
        List<Node> out = new ArrayList<>();
        while (position < lines.size()) {
            Line line = lines.get(position);
            if (line.comment()) {
                if (line.indent() < indent && isDedentAhead(indent)) {
                    break;
                }
                out.add(comment(line));
                position++;
                continue;
            }
            if (line.indent() < indent) {
                break;
            }
            if (line.indent() > indent) {
                context.error(previousIndent() > line.indent()
                    ? "Unindent does not match any outer indentation level"
                    : "Unexpected indent", line.start());
            }
            position++;
            lastEnd = line.text().end();
            readStatement(line, out);
        }
        return out;
    }

    // True when the next code line closes the block at indent
    private boolean isDedentAhead(int indent) {
        int next = nextCodeLine(position);
        return next < 0 || lines.get(next).indent() < indent;
    }

    private int previousIndent() {
        for (int i = position - 1; i >= 0; i--) {
            if (!lines.get(i).comment()) {
                return lines.get(i).indent();
            }
        }
        return 0;
    }

    private int nextCodeLine(int from) {
        for (int i = from; i < lines.size(); i++) {
            if (!lines.get(i).comment()) {
                return i;
            }
        }
        return -1;
    }

    /**
     * The suite after a compound statement header: the rest of the header line,
     * or the indented block that follows.
     */
    private BlockStatement readSuite(Line header, Span tail, String what) {
        if (!tail.isEmpty()) {
            List<Node> body = new ArrayList<>();
            readStatement(new Line(header.indent(), tail, false), body);
            return new BlockStatement(loc(tail.start(), tail.end()), range(tail.start(), tail.end()), null, body);
        }
        int next = nextCodeLine(position);
        if (next < 0 || lines.get(next).indent() <= header.indent()) {
            context.error("Expected an indented block after " + what + " on line "
                + context.lineAt(header.start()), header.text().end());
            int end = header.text().end();
            return new BlockStatement(loc(end, end), range(end, end), null, List.of());
        }
        int start = lines.get(next).start();
        List<Node> body = readStatements(lines.get(next).indent());
        return new BlockStatement(loc(start, lastEnd), range(start, lastEnd), null, body);
    }

    /**
     * The index of the next code line when it continues the statement at
     * {@code indent} with {@code keyword} (elif, else, except, finally, case).
     */
    private int clause(int indent, String keyword) {
        int next = nextCodeLine(position);
        if (next < 0) {
            return -1;
        }
        Line line = lines.get(next);
        return line.indent() == indent && line.text().startsWithWord(keyword) ? next : -1;
    }

    private Line takeClause(int index) {
        Line line = lines.get(index);
        position = index + 1;
        lastEnd = line.text().end();
        return line;
    }

    // Index of the ':' ending a compound statement header
    private int headerColon(Span text) {
        int i = 0;
        while (true) {
            int colon = text.sub(i).indexOfTopLevel(":", lexical, false);
            if (colon < 0) {
                return -1;
            }
            int at = i + colon;
            if (at + 1 >= text.length() || text.charAt(at + 1) != '=') {
                return at;
            }
            i = at + 2;
        }
    }

    private Span afterColon(Span header, int colon) {
        return header.sub(colon + 1).trim();
    }

    private int requireColon(Span header, String what) {
        int colon = headerColon(header);
        if (colon < 0) {
            throw new SyntaxException("Expected ':' after " + what, header.end());
        }
        return colon;
    }

    // ========================================================================
    // Statements
    // ========================================================================

    private void readStatement(Line line, List<Node> out) {
        Span text = line.text();
        int start = text.start();
        if (!generators.isEmpty() && containsWord(text.text(), "yield")) {
            generators.peek()[0] = true;
        }

        if (text.startsWith("@")) {
            readDecorated(line, out);
        } else if (DEF.matcher(text.text()).find()) {
            out.add(readFunction(line, List.of()));
        } else if (CLASS.matcher(text.text()).find()) {
            out.add(readClass(line));
        } else if (text.startsWithWord("if")) {
            out.add(readIf(line, text.afterWord("if"), "if"));
        } else if (text.startsWithWord("elif") || text.startsWithWord("else")) {
            context.error("'" + firstWord(text) + "' without a matching 'if'", start);
        } else if (text.startsWithWord("except") || text.startsWithWord("finally")) {
            context.error("'" + firstWord(text) + "' without a matching 'try'", start);
        } else if (text.startsWithWord("while")) {
            readWhile(line, out);
        } else if (text.startsWithWord("for") || isAsync(text, "for")) {
            readFor(line, out);
        } else if (text.startsWithWord("try")) {
            readTry(line, out);
        } else if (text.startsWithWord("with") || isAsync(text, "with")) {
            out.add(readWith(line));
        } else if (isMatchStatement(line)) {
            out.add(readMatch(line));
        } else if (text.startsWithWord("return")) {
            if (scopes.peek() != Scope.FUNCTION) {
                context.error("'return' outside function", start);
            }
            Node value = expressions.parse(text.afterWord("return"));
            out.add(new ReturnStatement(loc(start, text.end()), range(start, text.end()), null, value));
        } else if (text.startsWithWord("raise")) {
            Span argument = text.afterWord("raise");
            int cause = argument.indexOfTopLevel(" from ", lexical, false);
            Node value = expressions.parse(cause >= 0 ? argument.sub(0, cause) : argument);
            out.add(new ThrowStatement(loc(start, text.end()), range(start, text.end()), null, value));
        } else if (text.startsWithWord("import")) {
            readImport(text, out);
        } else if (text.startsWithWord("from") && text.text().matches("(?s)^from\\s+\\S+\\s+import\\b.*")) {
            out.add(readFromImport(text));
        } else if (text.text().equals("pass") || text.text().equals("break") || text.text().equals("continue")) {
            String type = switch (text.text()) {
                case "pass" -> "PassStatement";
                case "break" -> "BreakStatement";
                default -> "ContinueStatement";
            };
            out.add(generic(type, start, text.end(), Map.of(), List.of()));
        } else if (text.startsWithWord("global") || text.startsWithWord("nonlocal")) {
            String keyword = firstWord(text);
            List<String> names = new ArrayList<>();
            for (Span name : text.afterWord(keyword).splitTopLevel(',', lexical, false)) {
                names.add(name.text());
            }
            String type = keyword.equals("global") ? "GlobalStatement" : "NonlocalStatement";
            out.add(generic(type, start, text.end(), Map.of("names", names), List.of()));
        } else if (text.startsWithWord("del")) {
            out.add(generic("DeleteStatement", start, text.end(), Map.of(), parseList(text.afterWord("del"))));
        } else if (text.startsWithWord("assert")) {
            out.add(generic("AssertStatement", start, text.end(), Map.of(), parseList(text.afterWord("assert"))));
        } else {
            readAssignmentOrExpression(text, out);
        }
    }

    private void readDecorated(Line first, List<Node> out) {
        List<String> decorators = new ArrayList<>();
        Line line = first;
        while (line.text().startsWith("@")) {
            Matcher decorator = DECORATOR.matcher(line.text().text());
            if (decorator.find()) {
                decorators.add(decorator.group(1));
            }
            int next = nextCodeLine(position);
            if (next < 0 || lines.get(next).indent() != first.indent()) {
                context.error("Expected a function or class definition after decorator", line.start());
                return;
            }
            line = takeClause(next);
        }
        if (DEF.matcher(line.text().text()).find()) {
            out.add(readFunction(line, decorators));
        } else if (CLASS.matcher(line.text().text()).find()) {
            out.add(readClass(line));
        } else {
            context.error("Expected a function or class definition after decorator", line.start());
            readStatement(line, out);
        }
    }

    private Node readFunction(Line line, List<String> decorators) {
        Span text = line.text();
        int start = text.start();
        Matcher def = DEF.matcher(text.text());
        def.find();
        boolean async = def.group(1) != null;
        String name = def.group(2);
        int open = def.end() - 1;
        int close = text.matchingClose(open, lexical);
        if (close < 0) {
            throw new SyntaxException("Expected ')'", text.start() + open);
        }
        Span rest = text.sub(close + 1).trim();
        int colon = requireColon(rest, "function signature");
        String returnType = rest.startsWith("->") ? rest.sub(2, colon).trim().text() : null;

        List<Parameter> params = new ArrayList<>();
        for (Span piece : text.sub(open + 1, close).splitTopLevel(',', lexical, false)) {
            Parameter parameter = parameter(piece);
            if (parameter != null) {
                params.add(parameter);
            }
        }
        boolean method = scopes.peek() == Scope.CLASS;
        boolean staticMethod = decorators.contains("staticmethod");
        boolean classMethod = decorators.contains("classmethod");
        if (method && !staticMethod && !params.isEmpty()) {
            params.remove(0); // self or cls
        }

        scopes.push(Scope.FUNCTION);
        generators.push(new boolean[1]);
        BlockStatement body;
        boolean generator;
        try {
            body = readSuite(line, afterColon(rest, colon), "function definition");
        } finally {
            scopes.pop();
            generator = generators.pop()[0];
        }
        if (method) {
            return new MethodDeclaration(loc(start, lastEnd), range(start, lastEnd), null,
                name, params, body, staticMethod || classMethod, async, visibility(name));
        }
        return new FunctionDeclaration(loc(start, lastEnd), range(start, lastEnd), null,
            name, params, body, async, generator, returnType);
    }

    // name, name: type, name=default, *args, **kwargs
    private Parameter parameter(Span piece) {
        String text = piece.text();
        if (text.equals("*") || text.equals("/")) {
            return null;
        }
        int assign = BraceScanner.assignmentIndex(text, lexical);
        String defaultValue = assign >= 0 ? text.substring(assign + 1).trim() : null;
        Span declared = assign >= 0 ? piece.sub(0, assign).trim() : piece;
        int colon = declared.indexOfTopLevel(":", lexical, false);
        String name = (colon >= 0 ? declared.text().substring(0, colon) : declared.text()).trim();
        String type = colon >= 0 ? declared.text().substring(colon + 1).trim() : null;
        return new Parameter(name, type, defaultValue, defaultValue != null);
    }

    // __x is private, _x protected, dunder methods public
    private static Visibility visibility(String name) {
        if (name.startsWith("__") && !name.endsWith("__")) {
            return Visibility.PRIVATE;
        }
        return name.startsWith("_") && !name.startsWith("__") ? Visibility.PROTECTED : Visibility.PUBLIC;
    }

    private Node readClass(Line line) {
        Span text = line.text();
        int start = text.start();
        Matcher cls = CLASS.matcher(text.text());
        cls.find();
        String name = cls.group(1);
        Span rest = text.sub(cls.end()).trim();

        String superClass = null;
        List<String> interfaces = new ArrayList<>();
        if (rest.startsWith("(")) {
            int close = rest.matchingClose(0, lexical);
            if (close < 0) {
                throw new SyntaxException("Expected ')'", rest.start());
            }
            for (Span base : rest.sub(1, close).splitTopLevel(',', lexical, false)) {
                if (BraceScanner.hasTopLevelAssignment(base.text(), lexical)) {
                    continue; // metaclass=...
                }
                if (superClass == null) {
                    superClass = base.text();
                } else {
                    interfaces.add(base.text());
                }
            }
            rest = rest.sub(close + 1).trim();
        }
        int colon = requireColon(rest, "class name");

        scopes.push(Scope.CLASS);
        BlockStatement body;
        try {
            body = readSuite(line, afterColon(rest, colon), "class definition");
        } finally {
            scopes.pop();
        }
        return new ClassDeclaration(loc(start, lastEnd), range(start, lastEnd), null,
            name, superClass, interfaces, body.body());
    }

    private Node readIf(Line line, Span afterKeyword, String keyword) {
        int start = line.start();
        int colon = requireColon(afterKeyword, "'" + keyword + "' condition");
        Node test = condition(afterKeyword.sub(0, colon), start);
        BlockStatement consequent = readSuite(line, afterColon(afterKeyword, colon), "'" + keyword + "' statement");
        Node alternate = null;
        int elif = clause(line.indent(), "elif");
        int orElse = clause(line.indent(), "else");
        if (elif >= 0) {
            Line next = takeClause(elif);
            alternate = readIf(next, next.text().afterWord("elif"), "elif");
        } else if (orElse >= 0) {
            alternate = readElse(takeClause(orElse));
        }
        return new IfStatement(loc(start, lastEnd), range(start, lastEnd), null, test, consequent, alternate);
    }

    private BlockStatement readElse(Line line) {
        Span rest = line.text().afterWord("else");
        int colon = requireColon(rest, "'else'");
        return readSuite(line, afterColon(rest, colon), "'else' statement");
    }

    // for/while/try else suites follow the statement as an ElseClause
    private void readLoopElse(Line line, List<Node> out) {
        int orElse = clause(line.indent(), "else");
        if (orElse >= 0) {
            Line elseLine = takeClause(orElse);
            BlockStatement body = readElse(elseLine);
            out.add(generic("ElseClause", elseLine.start(), lastEnd, Map.of(), List.of(body)));
        }
    }

    private void readWhile(Line line, List<Node> out) {
        int start = line.start();
        Span header = line.text().afterWord("while");
        int colon = requireColon(header, "'while' condition");
        Node test = condition(header.sub(0, colon), start);
        BlockStatement body = readSuite(line, afterColon(header, colon), "'while' statement");
        out.add(new WhileLoop(loc(start, lastEnd), range(start, lastEnd), null, test, body));
        readLoopElse(line, out);
    }

    private void readFor(Line line, List<Node> out) {
        int start = line.start();
        Span text = line.text();
        Span header = (text.startsWithWord("async") ? text.afterWord("async") : text).afterWord("for");
        int colon = requireColon(header, "'for' target list");
        Span clause = header.sub(0, colon).trim();
        int in = clause.indexOfTopLevel(" in ", lexical, false);
        if (in < 0) {
            throw new SyntaxException("Expected 'in' in for statement", clause.start());
        }
        Span target = clause.sub(0, in).trim();
        VariableDeclaration variable = new VariableDeclaration(loc(target.start(), target.end()),
            range(target.start(), target.end()), null, target.text(), DeclarationKind.VAR, null, null);
        Node iterable = condition(clause.sub(in + 4), start);
        BlockStatement body = readSuite(line, afterColon(header, colon), "'for' statement");
        out.add(new ForLoop(loc(start, lastEnd), range(start, lastEnd), null, variable, null, null, iterable, body));
        readLoopElse(line, out);
    }

    private void readTry(Line line, List<Node> out) {
        int start = line.start();
        Span rest = line.text().afterWord("try");
        int colon = requireColon(rest, "'try'");
        BlockStatement block = readSuite(line, afterColon(rest, colon), "'try' statement");

        List<CatchClause> handlers = new ArrayList<>();
        int index;
        while ((index = clause(line.indent(), "except")) >= 0) {
            Line handler = takeClause(index);
            handlers.add(readExcept(handler));
        }
        BlockStatement orElse = null;
        int elseStart = start;
        int elseIndex = clause(line.indent(), "else");
        if (elseIndex >= 0) {
            Line elseLine = takeClause(elseIndex);
            elseStart = elseLine.start();
            orElse = readElse(elseLine);
        }
        BlockStatement finalizer = null;
        int finallyIndex = clause(line.indent(), "finally");
        if (finallyIndex >= 0) {
            Line finallyLine = takeClause(finallyIndex);
            Span finallyRest = finallyLine.text().afterWord("finally");
            int finallyColon = requireColon(finallyRest, "'finally'");
            finalizer = readSuite(finallyLine, afterColon(finallyRest, finallyColon), "'finally' statement");
        }
        if (handlers.isEmpty() && finalizer == null) {
            context.error("Expected 'except' or 'finally' block", line.start());
        }
        out.add(new TryStatement(loc(start, lastEnd), range(start, lastEnd), null, block, handlers, finalizer));
        if (orElse != null) {
            out.add(generic("ElseClause", elseStart, lastEnd, Map.of(), List.of(orElse)));
        }
    }

    // except, except E, except (A, B) as e, except* E
    private CatchClause readExcept(Line line) {
        int start = line.start();
        Span rest = line.text().afterWord("except");
        if (rest.startsWith("*")) {
            rest = rest.sub(1).trim();
        }
        int colon = requireColon(rest, "'except'");
        Span handled = rest.sub(0, colon).trim();
        Identifier param = null;
        List<String> types = new ArrayList<>();
        if (!handled.isEmpty()) {
            int as = handled.indexOfTopLevel(" as ", lexical, false);
            if (as >= 0) {
                Span name = handled.sub(as + 4).trim();
                param = expressions.identifier(name.text(), name.start(), name.end());
                handled = handled.sub(0, as).trim();
            }
            if (handled.startsWith("(") && handled.endsWith(")")) {
                handled = handled.sub(1, handled.length() - 1);
            }
            for (Span type : handled.splitTopLevel(',', lexical, false)) {
                types.add(type.text());
            }
        }
        BlockStatement body = readSuite(line, afterColon(rest, colon), "'except' statement");
        return new CatchClause(loc(start, lastEnd), range(start, lastEnd), null, param, types, body);
    }

    // with open(p) as f, lock: ...  Items bound with 'as' become declarations
    private Node readWith(Line line) {
        int start = line.start();
        Span text = line.text();
        Span header = (text.startsWithWord("async") ? text.afterWord("async") : text).afterWord("with");
        int colon = requireColon(header, "'with' items");
        Span items = header.sub(0, colon).trim();
        if (items.startsWith("(") && items.matchingClose(0, lexical) == items.length() - 1) {
            items = items.sub(1, items.length() - 1);
        }
        List<Node> children = new ArrayList<>();
        for (Span item : items.splitTopLevel(',', lexical, false)) {
            int as = item.indexOfTopLevel(" as ", lexical, false);
            if (as < 0) {
                children.add(expressions.parseRequired(item, "a context manager"));
                continue;
            }
            Node value = expressions.parseRequired(item.sub(0, as), "a context manager");
            String name = item.sub(as + 4).trim().text();
            children.add(new VariableDeclaration(loc(item.start(), item.end()), range(item.start(), item.end()), null,
                name, DeclarationKind.VAR, value, null));
        }
        children.add(readSuite(line, afterColon(header, colon), "'with' statement"));
        return generic("WithStatement", start, lastEnd, Map.of(), children);
    }

    // 'match' is a soft keyword: only a header followed by indented case clauses
    private boolean isMatchStatement(Line line) {
        Span text = line.text();
        if (!text.startsWithWord("match") || !text.endsWith(":")) {
            return false;
        }
        int next = nextCodeLine(position);
        return next >= 0 && lines.get(next).indent() > line.indent() && lines.get(next).text().startsWithWord("case");
    }

    private Node readMatch(Line line) {
        int start = line.start();
        Span header = line.text().afterWord("match");
        Node subject = condition(header.sub(0, header.length() - 1), start);
        int caseIndent = lines.get(nextCodeLine(position)).indent();
        List<SwitchStatement.Case> cases = new ArrayList<>();
        int index;
        while ((index = clause(caseIndent, "case")) >= 0) {
            Line caseLine = takeClause(index);
            Span rest = caseLine.text().afterWord("case");
            int colon = requireColon(rest, "case pattern");
            Span pattern = rest.sub(0, colon).trim();
            int guard = pattern.indexOfTopLevel(" if ", lexical, false);
            if (guard >= 0) {
                pattern = pattern.sub(0, guard).trim();
            }
            Node test = pattern.text().equals("_") ? null : expressions.parseRequired(pattern, "a case pattern");
            BlockStatement body = readSuite(caseLine, afterColon(rest, colon), "'case' statement");
            cases.add(new SwitchStatement.Case(test, body.body()));
        }
        return new SwitchStatement(loc(start, lastEnd), range(start, lastEnd), null, subject, cases);
    }

    // import a.b as c, d
    private void readImport(Span text, List<Node> out) {
        for (Span module : text.afterWord("import").splitTopLevel(',', lexical, false)) {
            int as = module.indexOfTopLevel(" as ", lexical, false);
            String source = (as >= 0 ? module.text().substring(0, as) : module.text()).trim();
            String name = as >= 0 ? module.text().substring(as + 4).trim() : source;
            out.add(new ImportDeclaration(loc(module.start(), module.end()), range(module.start(), module.end()), null,
                source, List.of(name)));
        }
    }

    // from x import a, b as c / from . import (a, b) / from x import *
    private Node readFromImport(Span text) {
        Span rest = text.afterWord("from");
        int importAt = rest.indexOfTopLevel(" import", lexical, false);
        String source = rest.text().substring(0, importAt).trim();
        Span names = rest.sub(importAt).trim().afterWord("import");
        if (names.startsWith("(") && names.endsWith(")")) {
            names = names.sub(1, names.length() - 1);
        }
        List<String> specifiers = new ArrayList<>();
        for (Span name : names.splitTopLevel(',', lexical, false)) {
            int as = name.indexOfTopLevel(" as ", lexical, false);
            specifiers.add(as >= 0 ? name.text().substring(as + 4).trim() : name.text());
        }
        return new ImportDeclaration(loc(text.start(), text.end()), range(text.start(), text.end()), null,
            source, specifiers);
    }

    /**
     * {@code x = 1}, {@code x: int = 1} and {@code a = b = 1} declare names; other
     * targets (attributes, subscripts, tuples) are assignment expressions.
     */
    private void readAssignmentOrExpression(Span text, List<Node> out) {
        List<Span> parts = new ArrayList<>();
        Span rest = text;
        int assign;
        while ((assign = BraceScanner.assignmentIndex(rest.text(), lexical)) >= 0) {
            parts.add(rest.sub(0, assign).trim());
            rest = rest.sub(assign + 1).trim();
        }
        parts.add(rest);

        if (parts.size() == 1) {
            int colon = headerColon(text);
            if (colon > 0 && NAME.matcher(text.text().substring(0, colon).trim()).matches()) {
                String type = text.text().substring(colon + 1).trim();
                out.add(declaration(text, text.text().substring(0, colon).trim(), type, null));
                return;
            }
            out.add(new ExpressionStatement(loc(text.start(), text.end()), range(text.start(), text.end()), null,
                expressions.parse(text)));
            return;
        }

        Span value = parts.get(parts.size() - 1);
        for (Span target : parts.subList(0, parts.size() - 1)) {
            int colon = target.indexOfTopLevel(":", lexical, false);
            String name = colon >= 0 ? target.text().substring(0, colon).trim() : target.text();
            if (NAME.matcher(name).matches()) {
                String type = colon >= 0 ? target.text().substring(colon + 1).trim() : null;
                out.add(declaration(text, name, type, expressions.parseRequired(value, "a value after '='")));
            } else {
                Node assignment = new AssignmentExpression(loc(text.start(), text.end()), range(text.start(), text.end()),
                    null, "=", expressions.parseRequired(target, "an assignment target"),
                    expressions.parseRequired(value, "a value after '='"));
                out.add(new ExpressionStatement(loc(text.start(), text.end()), range(text.start(), text.end()), null,
                    assignment));
            }
        }
    }

    private Node declaration(Span text, String name, String type, Node init) {
        return new VariableDeclaration(loc(text.start(), text.end()), range(text.start(), text.end()), null,
            name, DeclarationKind.VAR, init, type);
    }

    // ========================================================================
    // Helpers
    // ========================================================================

    private Node condition(Span text, int headerStart) {
        Node test = expressions.parse(text);
        if (test == null) {
            throw new SyntaxException("Expected a condition", headerStart);
        }
        return test;
    }

    private List<Node> parseList(Span text) {
        List<Node> nodes = new ArrayList<>();
        for (Span piece : text.splitTopLevel(',', lexical, false)) {
            // a trailing comma leaves an empty last piece
            if (!piece.trim().isEmpty()) {
                nodes.add(expressions.parse(piece));
            }
        }
        return nodes;
    }

    private boolean isAsync(Span text, String keyword) {
        return text.startsWithWord("async") && text.afterWord("async").startsWithWord(keyword);
    }

    private static String firstWord(Span text) {
        return text.text().split("\\W", 2)[0];
    }

    // Whole-word search outside string literals
    private boolean containsWord(String text, String word) {
        int i = 0;
        while (i < text.length()) {
            LexicalSyntax.Quoted quoted = lexical.quoted(text, i);
            if (quoted != null) {
                i = Math.max(quoted.end(), i + 1);
                continue;
            }
            if (text.startsWith(word, i)
                && (i == 0 || !LexicalSyntax.isIdentifierPart(text.charAt(i - 1)))
                && (i + word.length() == text.length() || !LexicalSyntax.isIdentifierPart(text.charAt(i + word.length())))) {
                return true;
            }
            i++;
        }
        return false;
    }

    private Comment comment(Line line) {
        Span text = line.text();
        return new Comment(loc(text.start(), text.end()), range(text.start(), text.end()), null,
            text.text().substring(1).strip(), CommentKind.LINE);
    }

    private Node generic(String type, int start, int end, Map<String, Object> attributes, List<Node> children) {
        return new GenericNode(loc(start, end), range(start, end), null, type, attributes, children);
    }

    private SourceLocation loc(int start, int end) {
        return context.location(start, end);
    }

    private Range range(int start, int end) {
        return context.range(start, end);
    }
}
