package com.syntaxforge.lang;

import com.syntaxforge.ast.BlockStatement;
import com.syntaxforge.ast.ClassDeclaration;
import com.syntaxforge.ast.DeclarationKind;
import com.syntaxforge.ast.ForLoop;
import com.syntaxforge.ast.ImportDeclaration;
import com.syntaxforge.ast.MethodDeclaration;
import com.syntaxforge.ast.Node;
import com.syntaxforge.ast.Parameter;
import com.syntaxforge.ast.SourceType;
import com.syntaxforge.ast.VariableDeclaration;
import com.syntaxforge.ast.Visibility;
import com.syntaxforge.parser.ParseContext;
import com.syntaxforge.parser.SyntaxException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Statement and member forms of Java.
 */
final class JavaStatementParser extends BraceParser {

    private static final Set<String> MODIFIERS = Set.of(
        "public", "protected", "private", "static", "final", "abstract", "native", "synchronized",
        "transient", "volatile", "strictfp", "default", "sealed", "non-sealed");
    private static final Set<String> TYPE_KEYWORDS = Set.of("class", "interface", "enum", "record", "@interface");
    private static final Set<String> CONTROL_WORDS = Set.of(
        "if", "else", "for", "while", "do", "switch", "try", "catch", "finally", "synchronized");
    private static final Set<String> NOT_TYPES = Set.of(
        "return", "throw", "new", "else", "case", "yield", "assert", "break", "continue", "this", "super",
        "import", "package", "instanceof", "goto");

    private static final Pattern TYPE = Pattern.compile("^[A-Za-z_$][\\w$.]*(<.*>)?(\\[\\])*(\\.\\.\\.)?$", Pattern.DOTALL);
    private static final Pattern NAME = Pattern.compile("^[A-Za-z_$][\\w$]*(\\[\\])*$");
    private static final Pattern ENUM_CONSTANTS = Pattern.compile(
        "^[A-Za-z_$][\\w$]*\\s*(\\(.*?\\))?(\\s*,\\s*[A-Za-z_$][\\w$]*\\s*(\\(.*?\\))?)*\\s*,?$", Pattern.DOTALL);
    private static final Pattern NEW_OPERAND = Pattern.compile("(^|[^\\w$])new[\\s(<\\[]");
    private static final Pattern SWITCH_OPERAND = Pattern.compile("(^|[^\\w$])switch\\s*\\(");
    private static final Pattern LABEL = Pattern.compile("^([A-Za-z_$][\\w$]*)\\s*:(?!:)\\s*(.*)$", Pattern.DOTALL);

    private final Deque<String> enclosingTypes = new ArrayDeque<>();

    JavaStatementParser(ParseContext context) {
        super(context, ExpressionSyntax.JAVA, JavaStatementParser::opensExpression);
    }

    static boolean opensExpression(String pending) {
        if (BraceScanner.endsWithOperator(pending, "=(,[?+-*/%&|^!~")) {
            return true;
        }
        if (BraceScanner.startsWithAnyWord(pending, CONTROL_WORDS)) {
            return false;
        }
        // new Foo() { ... } and new int[] { ... }
        if ((pending.endsWith(")") || pending.endsWith("]")) && NEW_OPERAND.matcher(pending).find()) {
            return true;
        }
        // return switch (x) { ... }
        if (SWITCH_OPERAND.matcher(pending).find()) {
            return true;
        }
        return BraceScanner.hasTopLevelAssignment(pending, LexicalSyntax.JAVA);
    }

    @Override
    protected SourceType sourceType() {
        return SourceType.MODULE;
    }

    @Override
    protected boolean requiresHandler() {
        return false; // try-with-resources
    }

    // ========================================================================
    // Statements
    // ========================================================================

    @Override
    protected void readTextStatement(Span raw, List<Node> out) {
        Span text = stripAnnotations(raw);
        if (text.isEmpty()) {
            return;
        }
        int start = text.start();

        if (text.startsWithWord("package")) {
            String name = text.afterWord("package").text();
            out.add(generic("PackageDeclaration", start, text.end(), Map.of("name", name), List.of()));
        } else if (text.startsWithWord("import")) {
            out.add(readImport(text));
        } else if (isTypeDeclaration(text)) {
            out.add(readTypeDeclaration(text));
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
            out.add(readReturn(text));
        } else if (text.startsWithWord("throw")) {
            out.add(readThrow(text, "throw"));
        } else if (text.startsWithWord("break") || text.startsWithWord("continue")) {
            String keyword = text.startsWithWord("break") ? "break" : "continue";
            Span label = text.afterWord(keyword);
            Map<String, Object> attributes = label.isEmpty() ? Map.of() : Map.of("label", label.text());
            out.add(generic(keyword.equals("break") ? "BreakStatement" : "ContinueStatement",
                start, text.end(), attributes, List.of()));
        } else if (text.startsWithWord("yield")) {
            out.add(generic("YieldStatement", start, text.end(), Map.of(),
                List.of(expressions.parseRequired(text.afterWord("yield"), "a value after 'yield'"))));
        } else if (text.startsWithWord("assert")) {
            Span assertion = text.afterWord("assert");
            int colon = assertion.indexOfTopLevel(":", lexical, false);
            Span condition = colon >= 0 ? assertion.sub(0, colon) : assertion;
            out.add(generic("AssertStatement", start, text.end(), Map.of(),
                List.of(expressions.parseRequired(condition, "a condition after 'assert'"))));
        } else if (text.startsWithWord("synchronized")) {
            Node lock = condition(header(text.afterWord("synchronized")).condition(), start);
            BlockStatement body = readBlock();
            out.add(generic("SynchronizedStatement", start, lastEnd(), Map.of(), List.of(lock, body)));
        } else if (!readLocalVariables(text, out)) {
            Matcher label = LABEL.matcher(text.text());
            if (label.matches() && !text.text().contains("?")) {
                Span rest = text.sub(label.start(2)).trim();
                if (!rest.isEmpty()) {
                    readTextStatement(rest, out);
                }
                return;
            }
            out.add(expressionStatement(text));
        }
    }

    private Node readImport(Span text) {
        Span rest = text.afterWord("import");
        if (rest.startsWithWord("static")) {
            rest = rest.afterWord("static");
        }
        String source = rest.text().replaceAll("\\s+", "");
        String specifier = source.substring(source.lastIndexOf('.') + 1);
        return new ImportDeclaration(loc(text.start(), text.end()), range(text.start(), text.end()), null,
            source, List.of(specifier));
    }

    private Node readFor(Span text) {
        int start = text.start();
        Header header = header(text.afterWord("for"));
        Span inner = header.condition().trim();

        int firstSemicolon = inner.indexOfTopLevel(";", lexical, false);
        if (firstSemicolon >= 0) {
            Span initText = inner.sub(0, firstSemicolon).trim();
            Span rest = inner.sub(firstSemicolon + 1);
            int secondSemicolon = rest.indexOfTopLevel(";", lexical, false);
            if (secondSemicolon < 0) {
                throw new SyntaxException("Expected ';' in for statement header", rest.start());
            }
            Node init = null;
            if (!initText.isEmpty()) {
                List<Node> declarations = new ArrayList<>();
                if (readLocalVariables(initText, declarations)) {
                    init = declarations.size() == 1 ? declarations.get(0) : new BlockStatement(declarations);
                } else {
                    init = expressions.parse(initText);
                }
            }
            Node test = expressions.parse(rest.sub(0, secondSemicolon));
            Node update = expressions.parse(rest.sub(secondSemicolon + 1));
            Node body = header.tail().isEmpty() ? readBody(start) : statementFrom(header.tail());
            return new ForLoop(loc(start, lastEnd()), range(start, lastEnd()), null, init, test, update, null, body);
        }

        int colon = inner.indexOfTopLevel(":", lexical, true);
        if (colon < 0) {
            throw new SyntaxException("Malformed for statement header", inner.start());
        }
        Span variable = stripAnnotations(inner.sub(0, colon).trim());
        List<Span> words = words(variable);
        words.removeIf(word -> word.text().equals("final"));
        if (words.size() != 2) {
            throw new SyntaxException("Malformed enhanced for variable", variable.start());
        }
        String type = words.get(0).text();
        VariableDeclaration target = new VariableDeclaration(loc(variable.start(), variable.end()),
            range(variable.start(), variable.end()), null, words.get(1).text(), DeclarationKind.VAR, null,
            type.equals("var") ? null : type);
        Node iterable = expressions.parseRequired(inner.sub(colon + 1), "an iterable");
        Node body = header.tail().isEmpty() ? readBody(start) : statementFrom(header.tail());
        return new ForLoop(loc(start, lastEnd()), range(start, lastEnd()), null, target, null, null, iterable, body);
    }

    /**
     * Reads {@code Type a = 1, b;} as one declaration per variable.
     *
     * @return false when the text is not a local variable declaration
     */
    private boolean readLocalVariables(Span text, List<Node> out) {
        Declarators declarators = declarators(text, false);
        if (declarators == null) {
            return false;
        }
        addDeclarations(declarators, text, out);
        return true;
    }

    // ========================================================================
    // Types and members
    // ========================================================================

    private boolean isTypeDeclaration(Span text) {
        for (Span word : words(text)) {
            String value = word.text();
            if (TYPE_KEYWORDS.contains(value)) {
                return true;
            }
            if (!MODIFIERS.contains(value)) {
                return false;
            }
        }
        return false;
    }

    private Node readTypeDeclaration(Span text) {
        int start = text.start();
        List<Span> words = words(text);
        int keywordIndex = 0;
        while (!TYPE_KEYWORDS.contains(words.get(keywordIndex).text())) {
            keywordIndex++;
        }
        String keyword = words.get(keywordIndex).text();
        if (keywordIndex + 1 >= words.size()) {
            throw new SyntaxException("Expected a name after '" + keyword + "'", words.get(keywordIndex).start());
        }
        Span nameWord = words.get(keywordIndex + 1);
        String nameText = nameWord.text();
        int cut = firstIndexOf(nameText, '<', '(');
        String name = cut >= 0 ? nameText.substring(0, cut) : nameText;

        List<Node> recordComponents = new ArrayList<>();
        int paren = nameText.indexOf('(');
        if (keyword.equals("record") && paren >= 0) {
            for (Parameter component : parameters(parenthesized(nameWord, paren), this::parameter)) {
                recordComponents.add(new VariableDeclaration(component.name(), DeclarationKind.CONST, null));
            }
        }

        String superClass = null;
        List<String> interfaces = new ArrayList<>();
        String clause = null;
        for (int i = keywordIndex + 2; i < words.size(); i++) {
            String word = words.get(i).text();
            if (word.equals("extends") || word.equals("implements") || word.equals("permits")) {
                clause = word;
                continue;
            }
            for (Span type : words.get(i).splitTopLevel(',', lexical, true)) {
                String trimmed = type.text();
                if (clause == null || clause.equals("permits")) {
                    continue;
                }
                if (clause.equals("extends") && keyword.equals("class")) {
                    superClass = trimmed;
                } else {
                    interfaces.add(trimmed);
                }
            }
        }

        enclosingTypes.push(name);
        boolean isEnum = keyword.equals("enum");
        boolean[] constantsPending = {isEnum};
        List<Node> members = new ArrayList<>(recordComponents);
        try {
            members.addAll(readBracedMembers((member, out) -> readMember(member, out, constantsPending)));
        } finally {
            enclosingTypes.pop();
        }
        return new ClassDeclaration(loc(start, lastEnd()), range(start, lastEnd()), null,
            name, superClass, interfaces, members);
    }

    private void readMember(Span raw, List<Node> out, boolean[] constantsPending) {
        Span text = stripAnnotations(raw);
        if (text.isEmpty()) {
            return;
        }
        int start = text.start();
        String owner = enclosingTypes.peek();

        if (constantsPending[0]) {
            boolean constructor = text.startsWith(owner + "(") || text.startsWith(owner + " (");
            if (!constructor && ENUM_CONSTANTS.matcher(text.text()).matches()) {
                for (Span constant : text.splitTopLevel(',', lexical, false)) {
                    int paren = constant.text().indexOf('(');
                    String name = (paren >= 0 ? constant.text().substring(0, paren) : constant.text()).trim();
                    out.add(generic("EnumConstant", constant.start(), constant.end(), Map.of("name", name), List.of()));
                }
                if (peekIs(Segment.Kind.OPEN)) {
                    // constant-specific class body
                    readBracedMembers((member, ignored) -> readMember(member, ignored, new boolean[1]));
                }
                return;
            }
            constantsPending[0] = false;
        }

        if (text.text().equals("static") && peekIs(Segment.Kind.OPEN)) {
            BlockStatement block = readFunctionBody();
            out.add(generic("StaticInitializer", start, lastEnd(), Map.of(), List.of(block)));
            return;
        }
        if (isTypeDeclaration(text)) {
            out.add(readTypeDeclaration(text));
            return;
        }

        Declarators fields = declarators(text, true);
        if (fields != null) {
            addDeclarations(fields, text, out);
            return;
        }

        Node method = readMethod(text, owner);
        if (method != null) {
            out.add(method);
            return;
        }
        context.warn("Unrecognized class member", start, text.end());
        out.add(expressions.unparsed(text));
    }

    /**
     * Methods and constructors: modifiers, optional type parameters, return type
     * (absent for constructors), name and parameters, optional throws clause.
     */
    private Node readMethod(Span text, String owner) {
        List<Span> words = words(text);
        int i = 0;
        List<String> modifiers = new ArrayList<>();
        while (i < words.size() && MODIFIERS.contains(words.get(i).text())) {
            modifiers.add(words.get(i).text());
            i++;
        }
        if (i < words.size() && words.get(i).text().startsWith("<")) {
            i++; // type parameters
        }
        int signature = i;
        while (signature < words.size() && words.get(signature).text().indexOf('(') < 0) {
            signature++;
        }
        if (signature >= words.size() || signature - i > 1) {
            return null;
        }
        Span signatureWord = words.get(signature);
        int paren = signatureWord.text().indexOf('(');
        String name = signatureWord.text().substring(0, paren).trim();
        boolean constructor = signature == i;
        if (!NAME.matcher(name).matches() || (constructor && !name.equals(owner))) {
            return null;
        }

        List<Parameter> params = parameters(parenthesized(signatureWord, paren), this::parameter);
        BlockStatement body = readOptionalFunctionBody();
        Visibility visibility = modifiers.contains("private") ? Visibility.PRIVATE
            : modifiers.contains("protected") ? Visibility.PROTECTED
            : Visibility.PUBLIC;
        int start = text.start();
        int end = Math.max(lastEnd(), text.end());
        return new MethodDeclaration(loc(start, end), range(start, end), null,
            name, params, body, modifiers.contains("static"), false, visibility);
    }

    private Parameter parameter(Span piece) {
        List<Span> words = words(stripAnnotations(piece));
        words.removeIf(word -> word.text().equals("final"));
        if (words.isEmpty()) {
            return null;
        }
        String name = words.get(words.size() - 1).text();
        String type = words.size() > 1
            ? String.join(" ", words.subList(0, words.size() - 1).stream().map(Span::text).toList())
            : null;
        return new Parameter(name, type, null, false);
    }

    // ========================================================================
    // Variable declarators
    // ========================================================================

    private record Declarators(String type, boolean isFinal, List<Span> pieces) {}

    /**
     * Splits {@code [modifiers] Type a = 1, b} into its type and declarators, or
     * returns null when the text does not declare variables.
     */
    private Declarators declarators(Span text, boolean member) {
        int assign = BraceScanner.assignmentIndex(text.text(), lexical);
        Span declaration = assign >= 0 ? text.sub(0, assign).trim() : text;
        List<Span> words = words(declaration);
        boolean isFinal = false;
        int i = 0;
        while (i < words.size() && (MODIFIERS.contains(words.get(i).text()))) {
            if (!member && !words.get(i).text().equals("final")) {
                return null;
            }
            isFinal |= words.get(i).text().equals("final");
            i++;
        }
        if (words.size() - i < 2) {
            return null;
        }
        Span typeWord = words.get(i);
        String type = typeWord.text();
        if (NOT_TYPES.contains(type) || !TYPE.matcher(type).matches()) {
            return null;
        }
        String firstName = words.get(i + 1).text();
        if (firstName.endsWith(",")) {
            firstName = firstName.substring(0, firstName.length() - 1);
        }
        if (!NAME.matcher(firstName).matches()) {
            return null;
        }
        Span rest = text.sub(typeWord.end() - text.start()).trim();
        List<Span> pieces = rest.splitTopLevel(',', lexical, true);
        return new Declarators(type.equals("var") ? null : type, isFinal, pieces);
    }

    private void addDeclarations(Declarators declarators, Span statement, List<Node> out) {
        DeclarationKind kind = declarators.isFinal() ? DeclarationKind.CONST : DeclarationKind.VAR;
        for (Span piece : declarators.pieces()) {
            int assign = BraceScanner.assignmentIndex(piece.text(), lexical);
            String name = (assign >= 0 ? piece.text().substring(0, assign) : piece.text()).trim();
            Node init = assign >= 0 ? expressions.parseRequired(piece.sub(assign + 1), "an initializer") : null;
            Span extent = declarators.pieces().size() == 1 ? statement : piece;
            out.add(new VariableDeclaration(loc(extent.start(), extent.end()), range(extent.start(), extent.end()), null,
                name, kind, init, declarators.type()));
        }
    }

    // ========================================================================
    // Text helpers
    // ========================================================================

    /**
     * Whitespace-separated words at bracket depth zero; a word starting with a
     * bracket is glued to the previous one, so {@code foo (int a)} is one word.
     */
    private List<Span> words(Span text) {
        List<Span> words = new ArrayList<>();
        String s = text.text();
        int depth = 0;
        int wordStart = -1;
        int i = 0;
        while (i <= s.length()) {
            if (i < s.length()) {
                LexicalSyntax.Quoted quoted = lexical.quoted(s, i);
                if (quoted != null) {
                    if (wordStart < 0) {
                        wordStart = i;
                    }
                    i = Math.max(quoted.end(), i + 1);
                    continue;
                }
            }
            char ch = i < s.length() ? s.charAt(i) : ' ';
            if (ch == '(' || ch == '[' || ch == '{' || ch == '<') {
                depth++;
            } else if (ch == ')' || ch == ']' || ch == '}' || (ch == '>' && depth > 0)) {
                depth = Math.max(0, depth - 1);
            }
            if (Character.isWhitespace(ch) && depth == 0) {
                if (wordStart >= 0) {
                    words.add(text.sub(wordStart, i));
                    wordStart = -1;
                }
            } else if (wordStart < 0) {
                if ((ch == '(' || ch == '[') && !words.isEmpty()) {
                    wordStart = words.remove(words.size() - 1).start() - text.start();
                } else {
                    wordStart = i;
                }
            }
            i++;
        }
        return words;
    }

    // Leading annotations such as @Override or @SuppressWarnings("x")
    private Span stripAnnotations(Span text) {
        Span rest = text.trim();
        while (rest.startsWith("@") && !rest.startsWithWord("@interface")) {
            int i = 1;
            while (i < rest.length() && (LexicalSyntax.isIdentifierPart(rest.charAt(i)) || rest.charAt(i) == '.')) {
                i++;
            }
            int next = i;
            while (next < rest.length() && Character.isWhitespace(rest.charAt(next))) {
                next++;
            }
            if (next < rest.length() && rest.charAt(next) == '(') {
                int close = rest.matchingClose(next, lexical);
                i = close < 0 ? rest.length() : close + 1;
            }
            rest = rest.sub(i).trim();
        }
        return rest;
    }

    private static int firstIndexOf(String text, char first, char second) {
        int a = text.indexOf(first);
        int b = text.indexOf(second);
        if (a < 0) {
            return b;
        }
        return b < 0 ? a : Math.min(a, b);
    }
}
