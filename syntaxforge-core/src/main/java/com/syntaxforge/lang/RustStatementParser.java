package com.syntaxforge.lang;

import com.syntaxforge.ast.BlockStatement;
import com.syntaxforge.ast.ClassDeclaration;
import com.syntaxforge.ast.DeclarationKind;
import com.syntaxforge.ast.ForLoop;
import com.syntaxforge.ast.FunctionDeclaration;
import com.syntaxforge.ast.GenericNode;
import com.syntaxforge.ast.ImportDeclaration;
import com.syntaxforge.ast.Literal;
import com.syntaxforge.ast.MethodDeclaration;
import com.syntaxforge.ast.Node;
import com.syntaxforge.ast.Parameter;
import com.syntaxforge.ast.SourceType;
import com.syntaxforge.ast.SwitchStatement;
import com.syntaxforge.ast.VariableDeclaration;
import com.syntaxforge.ast.Visibility;
import com.syntaxforge.ast.WhileLoop;
import com.syntaxforge.parser.ParseContext;
import com.syntaxforge.parser.SyntaxException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Items and statements of Rust. Functions inside {@code impl} and {@code trait}
 * bodies become methods; {@code match} becomes a switch.
 */
final class RustStatementParser extends BraceParser {

    private static final Set<String> BLOCK_WORDS = Set.of(
        "if", "while", "for", "match", "loop", "else", "unsafe", "fn", "impl", "trait", "struct", "enum",
        "mod", "union", "async", "where", "extern");

    private static final Pattern VISIBILITY = Pattern.compile("^pub(\\s*\\([^)]*\\))?\\s+");
    private static final Pattern FUNCTION = Pattern.compile(
        "^((?:(?:const|async|unsafe|extern\\s+\"[^\"]*\"|extern)\\s+)*)fn\\s+([A-Za-z_]\\w*)");
    private static final Pattern STRUCT = Pattern.compile(
        "^(?:struct|union)\\s+([A-Za-z_]\\w*)\\s*(<.*?>)?\\s*(.*)$", Pattern.DOTALL);
    private static final Pattern NAMED_ITEM = Pattern.compile("^(enum|trait|mod)\\s+([A-Za-z_]\\w*)\\s*(.*)$", Pattern.DOTALL);
    private static final Pattern TYPE_ALIAS = Pattern.compile("^type\\s+([A-Za-z_]\\w*)\\s*(<.*?>)?\\s*(?:=\\s*(.*))?$", Pattern.DOTALL);
    private static final Pattern BINDING = Pattern.compile("^(let|const|static)\\s+(mut\\s+)?(.*)$", Pattern.DOTALL);
    private static final Pattern LOOP_LABEL = Pattern.compile("^'[A-Za-z_]\\w*\\s*:\\s*(.*)$", Pattern.DOTALL);
    private static final Pattern STRUCT_LITERAL = Pattern.compile("(^|[^\\w:])(?:[A-Za-z_]\\w*::)*[A-Z]\\w*$");
    private static final Pattern LEADING_NAME = Pattern.compile("^([A-Za-z_]\\w*)");
    private static final Pattern FOR_CLAUSE = Pattern.compile("\\s+for\\s+");

    // What a fn directly inside the current body declares
    private enum Owner { NONE, IMPL, TRAIT }

    RustStatementParser(ParseContext context) {
        super(context, ExpressionSyntax.RUST, RustStatementParser::opensExpression);
    }

    static boolean opensExpression(String pending) {
        if (BraceScanner.endsWithOperator(pending, "=(,[+-*/%&|^!<")) {
            return true;
        }
        String item = VISIBILITY.matcher(pending).replaceFirst("");
        if (item.startsWith("use ") || item.startsWith("macro_rules!")) {
            return true;
        }
        if (BraceScanner.startsWithAnyWord(item, BLOCK_WORDS) || FUNCTION.matcher(item).find() || pending.endsWith("=>")) {
            return false;
        }
        if (BraceScanner.hasTopLevelAssignment(pending, LexicalSyntax.RUST)) {
            return true;
        }
        return STRUCT_LITERAL.matcher(pending).find();
    }

    @Override
    protected SourceType sourceType() {
        return SourceType.MODULE;
    }

    /**
     * Rust conditions are not parenthesized: everything up to the block is the condition.
     */
    @Override
    protected Header header(Span afterKeyword) {
        Span text = afterKeyword.trim();
        return new Header(text, text.sub(text.length()));
    }

    @Override
    protected Node condition(Span text, int headerStart) {
        Span trimmed = text.trim();
        if (!trimmed.startsWithWord("let")) {
            return super.condition(trimmed, headerStart);
        }
        // if let Some(x) = value
        Span binding = trimmed.afterWord("let");
        int assign = BraceScanner.assignmentIndex(binding.text(), lexical);
        if (assign < 0) {
            throw new SyntaxException("Expected '=' in let condition", binding.start());
        }
        String pattern = binding.text().substring(0, assign).trim();
        Node value = super.condition(binding.sub(assign + 1), headerStart);
        return generic("LetCondition", trimmed.start(), trimmed.end(), Map.of("pattern", pattern), List.of(value));
    }

    // ========================================================================
    // Items and statements
    // ========================================================================

    @Override
    protected void readTextStatement(Span raw, List<Node> out) {
        readItem(raw, out, Owner.NONE);
    }

    private void readItem(Span raw, List<Node> out, Owner enclosing) {
        Span text = stripAttributes(raw);
        if (text.isEmpty()) {
            return;
        }
        int start = text.start();
        boolean isPublic = false;
        Matcher visibility = VISIBILITY.matcher(text.text());
        if (visibility.find()) {
            isPublic = true;
            text = text.sub(visibility.end()).trim();
        }

        Matcher function = FUNCTION.matcher(text.text());
        if (function.find()) {
            out.add(readFunction(text, start, function, isPublic, enclosing));
            return;
        }
        Matcher label = LOOP_LABEL.matcher(text.text());
        if (label.matches()) {
            readItem(text.sub(label.start(1)), out, enclosing);
            return;
        }

        if (text.startsWithWord("use")) {
            out.add(readUse(text, start));
        } else if (text.startsWithWord("extern") && text.afterWord("extern").startsWithWord("crate")) {
            String crate = text.afterWord("extern").afterWord("crate").text().split("\\s+")[0];
            out.add(new ImportDeclaration(loc(start, text.end()), range(start, text.end()), null, crate, List.of(crate)));
        } else if (text.startsWith("macro_rules!")) {
            String name = text.sub("macro_rules!".length()).trim().text().split("[\\s{(\\[]", 2)[0];
            out.add(generic("MacroDefinition", start, text.end(), Map.of("name", name), List.of()));
        } else if (STRUCT.matcher(text.text()).matches()) {
            out.add(readStruct(text, start));
        } else if (NAMED_ITEM.matcher(text.text()).matches()) {
            out.add(readNamedItem(text, start));
        } else if (text.startsWithWord("impl") || (text.startsWithWord("unsafe") && text.afterWord("unsafe").startsWithWord("impl"))) {
            out.add(readImpl(text, start));
        } else if (TYPE_ALIAS.matcher(text.text()).matches()) {
            Matcher alias = TYPE_ALIAS.matcher(text.text());
            alias.matches();
            Map<String, Object> attributes = new LinkedHashMap<>();
            attributes.put("name", alias.group(1));
            if (alias.group(3) != null) {
                attributes.put("target", alias.group(3).trim());
            }
            out.add(generic("TypeAlias", start, text.end(), attributes, List.of()));
        } else if (BINDING.matcher(text.text()).matches()) {
            out.add(readBinding(text, start));
        } else if (text.startsWithWord("if")) {
            out.add(readIf(start, text.afterWord("if")));
        } else if (text.startsWithWord("while")) {
            out.add(readWhile(start, text.afterWord("while")));
        } else if (text.startsWithWord("loop")) {
            Literal always = new Literal(true);
            BlockStatement body = readBlock();
            out.add(new WhileLoop(loc(start, lastEnd()), range(start, lastEnd()), null, always, body));
        } else if (text.startsWithWord("for")) {
            out.add(readFor(text, start));
        } else if (text.startsWithWord("match")) {
            out.add(readMatch(start, text.afterWord("match")));
        } else if (text.startsWithWord("unsafe") && text.afterWord("unsafe").isEmpty()) {
            BlockStatement block = readBlock();
            out.add(generic("UnsafeBlock", start, lastEnd(), Map.of(), List.of(block)));
        } else if (text.startsWithWord("return")) {
            out.add(readReturn(text));
        } else if (text.startsWithWord("break") || text.startsWithWord("continue")) {
            String keyword = text.startsWithWord("break") ? "break" : "continue";
            Span rest = text.afterWord(keyword);
            Map<String, Object> attributes = new LinkedHashMap<>();
            List<Node> children = new ArrayList<>();
            if (rest.startsWith("'")) {
                String loopLabel = rest.text().split("\\s+", 2)[0];
                attributes.put("label", loopLabel);
                rest = rest.sub(loopLabel.length()).trim();
            }
            if (!rest.isEmpty()) {
                children.add(expressions.parse(rest));
            }
            out.add(generic(keyword.equals("break") ? "BreakStatement" : "ContinueStatement",
                start, text.end(), attributes, children));
        } else {
            out.add(expressionStatement(text));
        }
    }

    // ========================================================================
    // Functions
    // ========================================================================

    private Node readFunction(Span text, int start, Matcher function, boolean isPublic, Owner enclosing) {
        String name = function.group(2);
        boolean async = function.group(1).contains("async");
        int open = text.text().indexOf('(', function.end());
        if (open < 0) {
            throw new SyntaxException("Expected '(' after fn " + name, text.start());
        }
        int close = text.matchingClose(open, lexical);
        if (close < 0) {
            throw new SyntaxException("Expected ')'", text.start() + open);
        }
        boolean[] hasSelf = {false};
        List<Parameter> params = parameters(text.sub(open + 1, close), piece -> {
            Parameter parameter = parameter(piece);
            if (parameter.name().equals("self")) {
                hasSelf[0] = true;
                return null;
            }
            return parameter;
        });

        String returnType = null;
        Span signatureTail = text.sub(close + 1).trim();
        if (signatureTail.startsWith("->")) {
            String type = signatureTail.sub(2).trim().text();
            int where = type.indexOf(" where ");
            returnType = (where >= 0 ? type.substring(0, where) : type).trim();
        }
        if (peekWord("where")) {
            next();
        }

        BlockStatement body = readOptionalFunctionBody();
        int end = Math.max(lastEnd(), text.end());
        if (enclosing == Owner.NONE) {
            return new FunctionDeclaration(loc(start, end), range(start, end), null,
                name, params, body, async, false, returnType);
        }
        Visibility visibility = isPublic || enclosing == Owner.TRAIT ? Visibility.PUBLIC : Visibility.PRIVATE;
        return new MethodDeclaration(loc(start, end), range(start, end), null,
            name, params, body, !hasSelf[0], async, visibility);
    }

    // self, &self, &mut self, mut name: Type, (a, b): (i32, i32)
    private Parameter parameter(Span piece) {
        Span text = stripAttributes(piece);
        String value = text.text();
        if (value.matches("^&?('\\w+\\s+)?(mut\\s+)?self(\\s*:.*)?$")) {
            return new Parameter("self");
        }
        int colon = text.indexOfTopLevel(":", lexical, true);
        String name = (colon >= 0 ? value.substring(0, colon) : value).trim();
        if (name.startsWith("mut ")) {
            name = name.substring(4).trim();
        }
        String type = colon >= 0 ? value.substring(colon + 1).trim() : null;
        return new Parameter(name, type, null, false);
    }

    // ========================================================================
    // Types and modules
    // ========================================================================

    private Node readUse(Span text, int start) {
        String path = text.afterWord("use").text().replaceAll("\\s+", " ");
        String source = path;
        List<String> specifiers = new ArrayList<>();
        int brace = path.indexOf('{');
        if (brace >= 0) {
            source = path.substring(0, brace).replaceAll("::\\s*$", "").trim();
            String inner = path.substring(brace + 1, path.lastIndexOf('}') > brace ? path.lastIndexOf('}') : path.length());
            for (Span piece : new Span(inner, 0).splitTopLevel(',', lexical, false)) {
                specifiers.add(importedName(piece.text()));
            }
        } else {
            specifiers.add(importedName(path));
        }
        return new ImportDeclaration(loc(start, text.end()), range(start, text.end()), null, source, specifiers);
    }

    // a::b::C as D -> D, a::b::C -> C, self -> self
    private static String importedName(String path) {
        String[] alias = path.split("\\s+as\\s+");
        if (alias.length == 2) {
            return alias[1].trim();
        }
        String trimmed = path.trim();
        int separator = trimmed.lastIndexOf("::");
        return separator >= 0 ? trimmed.substring(separator + 2) : trimmed;
    }

    private Node readStruct(Span text, int start) {
        Matcher struct = STRUCT.matcher(text.text());
        struct.matches();
        String name = struct.group(1);
        Span rest = text.sub(struct.start(3)).trim();
        List<Node> fields = new ArrayList<>();
        if (rest.startsWith("(")) {
            // Tuple struct: fields are named by position
            int close = rest.matchingClose(0, lexical);
            Span inner = close > 0 ? rest.sub(1, close) : rest.sub(1);
            int index = 0;
            for (Span field : inner.splitTopLevel(',', lexical, true)) {
                String type = VISIBILITY.matcher(stripAttributes(field).text()).replaceFirst("");
                fields.add(new VariableDeclaration(loc(field.start(), field.end()), range(field.start(), field.end()), null,
                    String.valueOf(index++), DeclarationKind.LET, null, type));
            }
        } else if (peekIs(Segment.Kind.OPEN)) {
            fields.addAll(readBracedMembers(this::readFields));
        }
        int end = Math.max(lastEnd(), text.end());
        return new ClassDeclaration(loc(start, end), range(start, end), null, name, null, List.of(), fields);
    }

    private void readFields(Span text, List<Node> out) {
        for (Span piece : text.splitTopLevel(',', lexical, true)) {
            Span field = stripAttributes(piece);
            field = field.sub(field.length() - VISIBILITY.matcher(field.text()).replaceFirst("").length());
            int colon = field.indexOfTopLevel(":", lexical, true);
            if (colon < 0) {
                context.warn("Expected 'name: Type' in struct body", field.start(), field.end());
                continue;
            }
            String name = field.text().substring(0, colon).trim();
            String type = field.text().substring(colon + 1).trim();
            out.add(new VariableDeclaration(loc(field.start(), field.end()), range(field.start(), field.end()), null,
                name, DeclarationKind.LET, null, type));
        }
    }

    private Node readNamedItem(Span text, int start) {
        Matcher item = NAMED_ITEM.matcher(text.text());
        item.matches();
        String keyword = item.group(1);
        String name = item.group(2);
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("name", name);
        List<Node> children = new ArrayList<>();

        switch (keyword) {
            case "enum" -> {
                List<String> variants = new ArrayList<>();
                for (Node member : readBracedMembers(this::readVariants)) {
                    if (member instanceof GenericNode variant) {
                        variants.add((String) variant.attribute("name"));
                    }
                }
                attributes.put("variants", variants);
            }
            case "trait" -> {
                String bounds = item.group(3).trim();
                if (bounds.startsWith(":")) {
                    attributes.put("supertraits", bounds.substring(1).trim());
                }
                children.addAll(readMembers(Owner.TRAIT));
            }
            default -> {
                if (peekIs(Segment.Kind.OPEN)) {
                    children.addAll(readBlock().body());
                }
            }
        }
        String type = switch (keyword) {
            case "enum" -> "EnumDeclaration";
            case "trait" -> "TraitDeclaration";
            default -> "ModuleDeclaration";
        };
        int end = Math.max(lastEnd(), text.end());
        return generic(type, start, end, attributes, children);
    }

    private void readVariants(Span text, List<Node> out) {
        for (Span piece : text.splitTopLevel(',', lexical, true)) {
            Span variant = stripAttributes(piece);
            Matcher name = LEADING_NAME.matcher(variant.text());
            if (name.find()) {
                out.add(generic("EnumVariant", variant.start(), variant.end(), Map.of("name", name.group(1)), List.of()));
            }
        }
        if (peekIs(Segment.Kind.OPEN)) {
            // Struct-like variant body
            readBracedMembers(this::readFields);
        }
    }

    private Node readImpl(Span text, int start) {
        Span rest = text.startsWithWord("unsafe") ? text.afterWord("unsafe").afterWord("impl") : text.afterWord("impl");
        if (rest.startsWith("<")) {
            int close = rest.matchingClose(0, lexical);
            rest = close > 0 ? rest.sub(close + 1).trim() : rest;
        }
        String header = rest.text();
        int where = header.indexOf(" where ");
        if (where >= 0) {
            header = header.substring(0, where);
        }
        Map<String, Object> attributes = new LinkedHashMap<>();
        Matcher forClause = FOR_CLAUSE.matcher(header);
        if (forClause.find()) {
            attributes.put("target", header.substring(forClause.end()).trim());
            attributes.put("trait", header.substring(0, forClause.start()).trim());
        } else {
            attributes.put("target", header.trim());
        }
        if (peekWord("where")) {
            next();
        }
        List<Node> children = readMembers(Owner.IMPL);
        return generic("ImplBlock", start, lastEnd(), attributes, children);
    }

    private List<Node> readMembers(Owner kind) {
        if (!peekIs(Segment.Kind.OPEN)) {
            return List.of();
        }
        return readBracedMembers((member, out) -> readItem(member, out, kind));
    }

    // ========================================================================
    // Statements
    // ========================================================================

    private Node readBinding(Span text, int start) {
        Matcher binding = BINDING.matcher(text.text());
        binding.matches();
        String keyword = binding.group(1);
        Span rest = text.sub(binding.start(3)).trim();
        int assign = BraceScanner.assignmentIndex(rest.text(), lexical);
        Span target = assign >= 0 ? rest.sub(0, assign).trim() : rest;
        Node init = null;
        if (assign >= 0) {
            Span value = rest.sub(assign + 1).trim();
            int letElse = value.indexOfTopLevel(" else ", lexical, false);
            init = expressions.parseRequired(letElse >= 0 ? value.sub(0, letElse) : value, "an initializer");
        }
        int colon = target.indexOfTopLevel(":", lexical, true);
        String name = (colon >= 0 ? target.text().substring(0, colon) : target.text()).trim();
        String type = colon >= 0 ? target.text().substring(colon + 1).trim() : null;
        DeclarationKind kind = switch (keyword) {
            case "const" -> DeclarationKind.CONST;
            case "static" -> DeclarationKind.VAR;
            default -> DeclarationKind.LET;
        };
        return new VariableDeclaration(loc(start, text.end()), range(start, text.end()), null, name, kind, init, type);
    }

    private Node readFor(Span text, int start) {
        Span header = text.afterWord("for");
        int in = header.indexOfTopLevel(" in ", lexical, false);
        if (in < 0) {
            throw new SyntaxException("Expected 'in' in for loop", header.start());
        }
        Span pattern = header.sub(0, in).trim();
        VariableDeclaration variable = new VariableDeclaration(loc(pattern.start(), pattern.end()),
            range(pattern.start(), pattern.end()), null, pattern.text(), DeclarationKind.LET, null, null);
        Node iterable = condition(header.sub(in + 4), start);
        BlockStatement body = readBlock();
        return new ForLoop(loc(start, lastEnd()), range(start, lastEnd()), null, variable, null, null, iterable, body);
    }

    /**
     * {@code match x { A => 1, B | C => { ... } _ => 0 }}: each arm becomes a case,
     * {@code _} the default.
     */
    private Node readMatch(int start, Span scrutinee) {
        Node discriminant = condition(scrutinee, start);
        if (!peekIs(Segment.Kind.OPEN)) {
            throw new SyntaxException("Expected '{' after match", lastEnd());
        }
        Segment open = next();
        List<SwitchStatement.Case> cases = new ArrayList<>();
        while (!peekIs(Segment.Kind.CLOSE)) {
            if (atEnd()) {
                throw new SyntaxException("Unterminated block: missing '}' for the '{' on line "
                    + context.lineAt(open.start()), open.start());
            }
            Segment segment = next();
            if (segment.is(Segment.Kind.COMMENT)) {
                continue;
            }
            if (segment.is(Segment.Kind.OPEN)) {
                throw new SyntaxException("Expected a match arm", segment.start());
            }
            List<Span> arms = segment.span().splitTopLevel(',', lexical, false);
            for (int i = 0; i < arms.size(); i++) {
                cases.add(readArm(arms.get(i), i == arms.size() - 1));
            }
        }
        next();
        return new SwitchStatement(loc(start, lastEnd()), range(start, lastEnd()), null, discriminant, cases);
    }

    private SwitchStatement.Case readArm(Span arm, boolean last) {
        int arrow = arm.indexOfTopLevel("=>", lexical, false);
        if (arrow < 0) {
            throw new SyntaxException("Expected '=>' in match arm", arm.start());
        }
        Span pattern = arm.sub(0, arrow).trim();
        int guard = pattern.indexOfTopLevel(" if ", lexical, false);
        if (guard >= 0) {
            pattern = pattern.sub(0, guard).trim();
        }
        Node test = pattern.text().equals("_") ? null : expressions.parseRequired(pattern, "a match pattern");

        Span bodyText = arm.sub(arrow + 2).trim();
        List<Node> consequent = new ArrayList<>();
        if (!bodyText.isEmpty()) {
            readItem(bodyText, consequent, Owner.NONE);
        } else if (last) {
            consequent.add(readBody(arm.start()));
        } else {
            throw new SyntaxException("Expected an expression after '=>'", arm.start() + arrow);
        }
        return new SwitchStatement.Case(test, consequent);
    }

    // ========================================================================
    // Helpers
    // ========================================================================

    // #[derive(Debug)], #![allow(dead_code)]
    private Span stripAttributes(Span text) {
        Span rest = text.trim();
        while (rest.startsWith("#[") || rest.startsWith("#![")) {
            int open = rest.text().indexOf('[');
            int close = rest.matchingClose(open, lexical);
            if (close < 0) {
                return rest.sub(rest.length());
            }
            rest = rest.sub(close + 1).trim();
        }
        return rest;
    }
}
