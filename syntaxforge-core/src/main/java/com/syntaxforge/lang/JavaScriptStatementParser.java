package com.syntaxforge.lang;

import com.syntaxforge.ast.BlockStatement;
import com.syntaxforge.ast.ClassDeclaration;
import com.syntaxforge.ast.DeclarationKind;
import com.syntaxforge.ast.ExportDeclaration;
import com.syntaxforge.ast.ForLoop;
import com.syntaxforge.ast.FunctionDeclaration;
import com.syntaxforge.ast.ImportDeclaration;
import com.syntaxforge.ast.MethodDeclaration;
import com.syntaxforge.ast.Node;
import com.syntaxforge.ast.Parameter;
import com.syntaxforge.ast.SourceType;
import com.syntaxforge.ast.VariableDeclaration;
import com.syntaxforge.ast.Visibility;
import com.syntaxforge.parser.ParseContext;
import com.syntaxforge.parser.ParserConfig;
import com.syntaxforge.parser.SyntaxException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Statement forms of JavaScript, including the checks driven by {@link ParserConfig}.
 */
final class JavaScriptStatementParser extends BraceParser {

    private static final Set<String> CONTROL_WORDS = Set.of(
        "if", "else", "for", "while", "do", "switch", "try", "catch", "finally", "with", "function", "class");

    private static final Pattern FUNCTION = Pattern.compile(
        "^(async\\s+)?function\\s*(\\*)?\\s*([A-Za-z_$][\\w$]*)?\\s*\\(");
    private static final Pattern CLASS = Pattern.compile(
        "^class(?:\\s+([A-Za-z_$][\\w$]*))?(?:\\s+extends\\s+(.+))?$", Pattern.DOTALL);
    private static final Pattern METHOD = Pattern.compile(
        "^((?:(?:static|async|get|set)\\s+)*)(\\*\\s*)?(#?[A-Za-z_$][\\w$]*|\\[[^\\]]+]|'[^']*'|\"[^\"]*\")\\s*\\(");
    private static final Pattern FIELD = Pattern.compile(
        "^(static\\s+)?(#?[A-Za-z_$][\\w$]*)\\s*(?:=\\s*(.*))?$", Pattern.DOTALL);
    private static final Pattern FOR_EACH = Pattern.compile(
        "^(?:(let|const|var)\\s+)?(.+?)\\s+(of|in)\\s+(.+)$", Pattern.DOTALL);
    private static final Pattern IMPORT_FROM = Pattern.compile(
        "^import\\s+(.+?)\\s+from\\s+(['\"])(.*)\\2$", Pattern.DOTALL);
    private static final Pattern IMPORT_BARE = Pattern.compile("^import\\s+(['\"])(.*)\\1$");
    private static final Pattern EXPORT_FROM = Pattern.compile(
        "^(.*?)\\s+from\\s+(['\"])(.*)\\2$", Pattern.DOTALL);
    private static final Pattern LABEL = Pattern.compile("^([A-Za-z_$][\\w$]*)\\s*:(?!:)\\s*(.*)$", Pattern.DOTALL);

    private final ParserConfig config;

    JavaScriptStatementParser(ParseContext context) {
        super(context, ExpressionSyntax.JAVASCRIPT, JavaScriptStatementParser::opensExpression);
        this.config = context.config();
    }

    static boolean opensExpression(String pending) {
        if (pending.endsWith("=>") || BraceScanner.endsWithOperator(pending, "=(,[?+-*/%&|^!~<")) {
            return true;
        }
        for (String word : List.of("return", "yield", "await", "typeof", "void", "import", "export")) {
            if (BraceScanner.endsWithWord(pending, word)) {
                return true;
            }
        }
        if (pending.startsWith("export") && BraceScanner.endsWithWord(pending, "default")) {
            return true;
        }
        return BraceScanner.hasTopLevelAssignment(pending, LexicalSyntax.JAVASCRIPT)
            && !BraceScanner.startsWithAnyWord(pending, CONTROL_WORDS);
    }

    @Override
    protected SourceType sourceType() {
        return config.sourceType();
    }

    @Override
    protected void readTextStatement(Span text, List<Node> out) {
        if (text.isEmpty()) {
            return;
        }
        int start = text.start();
        if (config.ecmaYear() < 2015 && containsArrow(text.text())) {
            context.error("Arrow functions require ecmaVersion 2015 or later", start);
        }

        if (text.startsWithWord("import") && !text.startsWith("import(") && !text.startsWith("import.")) {
            checkModuleItem("import", start);
            out.add(readImport(text));
        } else if (text.startsWithWord("export")) {
            checkModuleItem("export", start);
            out.add(readExport(text));
        } else if (FUNCTION.matcher(text.text()).find()) {
            out.add(readFunction(text));
        } else if (text.startsWithWord("class")) {
            requireEs2015("class", start);
            out.add(readClass(text));
        } else if (text.startsWithWord("var")) {
            readVariables(text.afterWord("var"), DeclarationKind.VAR, text, out);
        } else if (isDeclaration(text, "let")) {
            requireEs2015("let", start);
            readVariables(text.afterWord("let"), DeclarationKind.LET, text, out);
        } else if (text.startsWithWord("const")) {
            requireEs2015("const", start);
            readVariables(text.afterWord("const"), DeclarationKind.CONST, text, out);
        } else if (text.startsWithWord("if")) {
            out.add(readIf(start, text.afterWord("if")));
        } else if (text.startsWithWord("while")) {
            out.add(readWhile(start, text.afterWord("while")));
        } else if (text.startsWithWord("do")) {
            out.add(readDoWhile(start, text.afterWord("do")));
        } else if (text.startsWithWord("for")) {
            out.add(readFor(text));
        } else if (text.startsWithWord("switch")) {
            out.add(readSwitch(start, text.afterWord("switch")));
        } else if (text.startsWithWord("try")) {
            out.add(readTry(start));
        } else if (text.startsWithWord("return")) {
            if (!insideFunction() && !config.returnOutsideFunctionAllowed()) {
                context.error("'return' outside of function", start);
            }
            out.add(readReturn(text));
        } else if (text.startsWithWord("throw")) {
            out.add(readThrow(text, "throw"));
        } else if (text.startsWithWord("break") || text.startsWithWord("continue")) {
            out.add(readJump(text));
        } else if (text.startsWithWord("debugger")) {
            out.add(generic("DebuggerStatement", start, text.end(), Map.of(), List.of()));
        } else {
            Matcher label = LABEL.matcher(text.text());
            if (label.matches()) {
                // Labels are not modelled; the labelled statement stands alone
                Span rest = text.sub(label.start(2)).trim();
                if (!rest.isEmpty()) {
                    readTextStatement(rest, out);
                }
                return;
            }
            out.add(expressionStatement(text));
        }
    }

    private void checkModuleItem(String keyword, int start) {
        if (config.sourceType() == SourceType.SCRIPT) {
            context.error("'" + keyword + "' may only appear with sourceType: module", start);
        } else if ((!atTopLevel() || insideFunction()) && !config.importExportEverywhereAllowed()) {
            context.error("'" + keyword + "' may only appear at the top level", start);
        }
    }

    private void requireEs2015(String keyword, int start) {
        if (config.ecmaYear() < 2015) {
            context.error("'" + keyword + "' requires ecmaVersion 2015 or later", start);
        }
    }

    // "let" is also a legal identifier in sloppy scripts: let(x), let = 1
    private static boolean isDeclaration(Span text, String keyword) {
        if (!text.startsWithWord(keyword)) {
            return false;
        }
        Span rest = text.afterWord(keyword);
        return !rest.isEmpty() && (LexicalSyntax.isIdentifierStart(rest.charAt(0)) || rest.startsWith("[") || rest.startsWith("{"));
    }

    private static boolean containsArrow(String text) {
        int i = 0;
        while (i < text.length()) {
            LexicalSyntax.Quoted quoted = LexicalSyntax.JAVASCRIPT.quoted(text, i);
            if (quoted != null) {
                i = Math.max(quoted.end(), i + 1);
                continue;
            }
            if (text.startsWith("=>", i)) {
                return true;
            }
            i++;
        }
        return false;
    }

    // ========================================================================
    // Modules
    // ========================================================================

    private Node readImport(Span text) {
        String source;
        List<String> specifiers = new ArrayList<>();
        Matcher from = IMPORT_FROM.matcher(text.text());
        Matcher bare = IMPORT_BARE.matcher(text.text());
        if (from.matches()) {
            source = from.group(3);
            for (String specifier : from.group(1).replace("{", ",").replace("}", ",").split(",")) {
                String local = localName(specifier);
                if (!local.isEmpty()) {
                    specifiers.add(local);
                }
            }
        } else if (bare.matches()) {
            source = bare.group(2);
        } else {
            throw new SyntaxException("Malformed import declaration", text.start());
        }
        return new ImportDeclaration(loc(text.start(), text.end()), range(text.start(), text.end()), null, source, specifiers);
    }

    // "a as b" binds b, "* as ns" binds ns
    private static String localName(String specifier) {
        String trimmed = specifier.trim();
        int as = trimmed.lastIndexOf(" as ");
        return as >= 0 ? trimmed.substring(as + 4).trim() : trimmed;
    }

    private Node readExport(Span text) {
        int start = text.start();
        Span rest = text.afterWord("export");
        if (rest.startsWithWord("default")) {
            Span value = rest.afterWord("default");
            Node declaration = FUNCTION.matcher(value.text()).find() || value.startsWithWord("class")
                ? statementFrom(value)
                : expressions.parseRequired(value, "an expression after 'export default'");
            return new ExportDeclaration(loc(start, lastEnd()), range(start, lastEnd()), null, declaration, List.of(), true);
        }
        if (rest.startsWith("{") || rest.startsWith("*")) {
            List<String> specifiers = new ArrayList<>();
            Matcher from = EXPORT_FROM.matcher(rest.text());
            String list = from.matches() ? from.group(1) : rest.text();
            if (list.trim().startsWith("*")) {
                specifiers.add(list.trim());
            } else {
                for (String specifier : list.replace("{", "").replace("}", "").split(",")) {
                    String exported = localName(specifier);
                    if (!exported.isEmpty()) {
                        specifiers.add(exported);
                    }
                }
            }
            return new ExportDeclaration(loc(start, text.end()), range(start, text.end()), null, null, specifiers, false);
        }
        Node declaration = statementFrom(rest);
        return new ExportDeclaration(loc(start, lastEnd()), range(start, lastEnd()), null, declaration, List.of(), false);
    }

    // ========================================================================
    // Declarations
    // ========================================================================

    private Node readFunction(Span text) {
        Matcher m = FUNCTION.matcher(text.text());
        if (!m.find()) {
            throw new SyntaxException("Malformed function declaration", text.start());
        }
        boolean async = m.group(1) != null;
        boolean generator = m.group(2) != null;
        String name = m.group(3) != null ? m.group(3) : "default";
        if (async && config.ecmaYear() < 2017) {
            context.error("Async functions require ecmaVersion 2017 or later", text.start());
        }
        List<Parameter> params = parameters(parenthesized(text, m.end() - 1), this::parameter);
        BlockStatement body = readFunctionBody();
        int start = text.start();
        return new FunctionDeclaration(loc(start, lastEnd()), range(start, lastEnd()), null,
            name, params, body, async, generator, null);
    }

    private Parameter parameter(Span piece) {
        int assign = BraceScanner.assignmentIndex(piece.text(), lexical);
        if (assign >= 0) {
            String name = piece.text().substring(0, assign).trim();
            String defaultValue = piece.text().substring(assign + 1).trim();
            return new Parameter(name, null, defaultValue, true);
        }
        return new Parameter(piece.text().trim());
    }

    private Node readClass(Span text) {
        Matcher m = CLASS.matcher(text.text());
        if (!m.matches()) {
            throw new SyntaxException("Malformed class declaration", text.start());
        }
        String name = m.group(1) != null ? m.group(1) : "default";
        String superClass = m.group(2) != null ? m.group(2).trim() : null;
        List<Node> members = readBracedMembers(this::readClassMember);
        int start = text.start();
        return new ClassDeclaration(loc(start, lastEnd()), range(start, lastEnd()), null, name, superClass, List.of(), members);
    }

    private void readClassMember(Span text, List<Node> out) {
        int start = text.start();
        if (text.text().equals("static") && peekIs(Segment.Kind.OPEN)) {
            BlockStatement block = readFunctionBody();
            out.add(generic("StaticBlock", start, lastEnd(), Map.of(), List.of(block)));
            return;
        }
        Matcher method = METHOD.matcher(text.text());
        if (method.find()) {
            String modifiers = method.group(1);
            boolean isStatic = modifiers.contains("static");
            boolean async = modifiers.contains("async");
            String name = method.group(3);
            List<Parameter> params = parameters(parenthesized(text, method.end() - 1), this::parameter);
            BlockStatement body = readFunctionBody();
            Visibility visibility = name.startsWith("#") ? Visibility.PRIVATE : Visibility.PUBLIC;
            out.add(new MethodDeclaration(loc(start, lastEnd()), range(start, lastEnd()), null,
                name, params, body, isStatic, async, visibility));
            return;
        }
        Matcher field = FIELD.matcher(text.text());
        if (field.matches()) {
            Node init = field.group(3) != null ? expressions.parse(text.sub(field.start(3))) : null;
            out.add(new VariableDeclaration(loc(start, text.end()), range(start, text.end()), null,
                field.group(2), DeclarationKind.VAR, init, null));
            return;
        }
        context.warn("Unrecognized class member", start, text.end());
        out.add(expressions.unparsed(text));
    }

    /**
     * One {@link VariableDeclaration} per declarator of {@code let a = 1, b}.
     */
    private void readVariables(Span declarators, DeclarationKind kind, Span statement, List<Node> out) {
        List<Span> pieces = declarators.splitTopLevel(',', lexical, false);
        if (pieces.isEmpty()) {
            throw new SyntaxException("Expected a variable name after '" + kind.label() + "'", statement.start());
        }
        for (Span piece : pieces) {
            int assign = BraceScanner.assignmentIndex(piece.text(), lexical);
            String name = (assign >= 0 ? piece.text().substring(0, assign) : piece.text()).trim();
            Node init = assign >= 0 ? expressions.parseRequired(piece.sub(assign + 1), "an initializer") : null;
            if (kind == DeclarationKind.CONST && init == null && !name.startsWith("{") && !name.startsWith("[")) {
                context.error("Missing initializer in const declaration", piece.start());
            }
            Span extent = pieces.size() == 1 ? statement : piece;
            out.add(new VariableDeclaration(loc(extent.start(), extent.end()), range(extent.start(), extent.end()), null,
                name, kind, init, null));
        }
    }

    // ========================================================================
    // Statements
    // ========================================================================

    private Node readFor(Span text) {
        int start = text.start();
        Span afterFor = text.afterWord("for");
        if (afterFor.startsWithWord("await")) {
            afterFor = afterFor.afterWord("await");
        }
        Header header = header(afterFor);
        Span inner = header.condition().trim();

        int firstSemicolon = inner.indexOfTopLevel(";", lexical, false);
        if (firstSemicolon >= 0) {
            Span initText = inner.sub(0, firstSemicolon);
            Span rest = inner.sub(firstSemicolon + 1);
            int secondSemicolon = rest.indexOfTopLevel(";", lexical, false);
            if (secondSemicolon < 0) {
                throw new SyntaxException("Expected ';' in for statement header", rest.start());
            }
            Node init = forInit(initText.trim());
            Node test = expressions.parse(rest.sub(0, secondSemicolon));
            Node update = expressions.parse(rest.sub(secondSemicolon + 1));
            Node body = header.tail().isEmpty() ? readBody(start) : statementFrom(header.tail());
            return new ForLoop(loc(start, lastEnd()), range(start, lastEnd()), null, init, test, update, null, body);
        }

        Matcher m = FOR_EACH.matcher(inner.text());
        if (!m.matches()) {
            throw new SyntaxException("Malformed for statement header", inner.start());
        }
        Node target;
        if (m.group(1) != null) {
            DeclarationKind kind = switch (m.group(1)) {
                case "let" -> DeclarationKind.LET;
                case "const" -> DeclarationKind.CONST;
                default -> DeclarationKind.VAR;
            };
            Span name = inner.sub(m.start(2), m.end(2));
            target = new VariableDeclaration(loc(name.start(), name.end()), range(name.start(), name.end()), null,
                name.text(), kind, null, null);
        } else {
            target = expressions.parseRequired(inner.sub(m.start(2), m.end(2)), "a loop variable");
        }
        Node iterable = expressions.parseRequired(inner.sub(m.start(4)), "an iterable");
        Node body = header.tail().isEmpty() ? readBody(start) : statementFrom(header.tail());
        return new ForLoop(loc(start, lastEnd()), range(start, lastEnd()), null, target, null, null, iterable, body);
    }

    private Node forInit(Span initText) {
        if (initText.isEmpty()) {
            return null;
        }
        for (DeclarationKind kind : DeclarationKind.values()) {
            if (initText.startsWithWord(kind.label())) {
                List<Node> declarations = new ArrayList<>();
                readVariables(initText.afterWord(kind.label()), kind, initText, declarations);
                return declarations.size() == 1 ? declarations.get(0) : new BlockStatement(declarations);
            }
        }
        return expressions.parse(initText);
    }

    private Node readJump(Span text) {
        String keyword = text.startsWithWord("break") ? "break" : "continue";
        Span label = text.afterWord(keyword);
        Map<String, Object> attributes = label.isEmpty() ? Map.of() : Map.of("label", label.text());
        String type = keyword.equals("break") ? "BreakStatement" : "ContinueStatement";
        return generic(type, text.start(), text.end(), attributes, List.of());
    }
}
