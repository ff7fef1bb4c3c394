package com.syntaxforge.lang;

import com.syntaxforge.ast.AssignmentExpression;
import com.syntaxforge.ast.BinaryExpression;
import com.syntaxforge.ast.CallExpression;
import com.syntaxforge.ast.GenericNode;
import com.syntaxforge.ast.Identifier;
import com.syntaxforge.ast.Literal;
import com.syntaxforge.ast.Node;
import com.syntaxforge.ast.Range;
import com.syntaxforge.ast.SourceLocation;
import com.syntaxforge.parser.ParseContext;
import com.syntaxforge.parser.SyntaxException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pratt parser for the expression part of statements, shared by all bundled languages.
 * Language differences come from {@link ExpressionSyntax}.
 *
 * <p>Expressions that cannot be read are not errors: {@link #parse(Span)} records a
 * warning and returns an {@code UnparsedExpression} holding the text.</p>
 */
final class ExpressionParser {
    // ========================================================================
    // Binding Power Constants
    // ========================================================================
    // Higher binding power = tighter binding (higher precedence)
    private static final int BP_NONE = 0;           // Lowest - used as minimum for top-level
    private static final int BP_ASSIGNMENT = 2;     // Assignment (=, +=, :=) - right-associative
    private static final int BP_TERNARY = 3;        // Conditional (? :, a if b else c)
    private static final int BP_NULLISH = 4;        // Nullish coalescing (??) and ranges (..)
    private static final int BP_OR = 5;             // Logical OR (||, or)
    private static final int BP_AND = 6;            // Logical AND (&&, and)
    private static final int BP_BIT_OR = 7;         // Bitwise OR (|)
    private static final int BP_BIT_XOR = 8;        // Bitwise XOR (^)
    private static final int BP_BIT_AND = 9;        // Bitwise AND (&)
    private static final int BP_EQUALITY = 10;      // Equality (==, !=, ===, !==, is)
    private static final int BP_RELATIONAL = 11;    // Relational (<, <=, instanceof, in, as)
    private static final int BP_SHIFT = 12;         // Shift (<<, >>, >>>)
    private static final int BP_ADDITIVE = 13;      // Additive (+, -)
    private static final int BP_MULTIPLICATIVE = 14;// Multiplicative (*, /, %, //, @)
    private static final int BP_EXPONENT = 15;      // Exponentiation (**) - right-associative
    private static final int BP_UNARY = 16;         // Prefix unary (!, -, +, ~, typeof, await, ++, --)
    private static final int BP_POSTFIX = 17;       // Postfix (x++, call, member access, x?)

    private final ParseContext context;
    private final ExpressionSyntax syntax;
    private final ExpressionLexer lexer;

    private Span span;
    private List<Token> tokens;
    private int current;

    ExpressionParser(ParseContext context, ExpressionSyntax syntax) {
        this.context = context;
        this.syntax = syntax;
        this.lexer = new ExpressionLexer(syntax);
    }

    /**
     * Parses the whole span as one expression.
     *
     * @return the expression, {@code null} for a blank span, or an {@code UnparsedExpression}
     */
    Node parse(Span text) {
        Span trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        span = trimmed;
        current = 0;
        try {
            tokens = lexer.tokenize(trimmed);
            Node expression = parseSequence();
            if (peek().kind() != Token.Kind.EOF) {
                throw unexpected(peek());
            }
            return expression;
        } catch (ExpressionException e) {
            context.warn("Could not parse expression '" + abbreviate(trimmed.text()) + "': " + e.getMessage(),
                trimmed.start(), trimmed.end());
            return unparsed(trimmed);
        }
    }

    /**
     * Like {@link #parse(Span)}, but a blank span is a syntax error naming what was expected.
     */
    Node parseRequired(Span text, String expected) {
        Node expression = parse(text);
        if (expression == null) {
            throw new SyntaxException("Expected " + expected, text.trim().start());
        }
        return expression;
    }

    Identifier identifier(String name, int start, int end) {
        return new Identifier(loc(start, end), range(start, end), null, name);
    }

    GenericNode unparsed(Span text) {
        Span trimmed = text.trim();
        return new GenericNode(loc(trimmed.start(), trimmed.end()), range(trimmed.start(), trimmed.end()),
            trimmed.text(), "UnparsedExpression", Map.of(), List.of());
    }

    // ========================================================================
    // Pratt loop
    // ========================================================================

    private Node parseSequence() {
        int start = peek().start();
        Node first = parseExpr(BP_ASSIGNMENT);
        if (!check(",")) {
            return first;
        }
        List<Node> expressions = new ArrayList<>();
        expressions.add(first);
        while (match(",")) {
            if (atExpressionEnd()) {
                break;
            }
            expressions.add(parseExpr(BP_ASSIGNMENT));
        }
        return generic("SequenceExpression", start, Map.of(), expressions);
    }

    private Node parseExpr(int minBp) {
        int start = peek().start();
        Node left = parsePrefix();
        while (true) {
            Token token = peek();
            int lbp = infixBindingPower(token, left);
            if (lbp == BP_NONE || lbp < minBp) {
                break;
            }
            left = parseInfix(left, start, token, lbp);
        }
        return left;
    }

    private int infixBindingPower(Token token, Node left) {
        if (token.kind() == Token.Kind.IDENTIFIER) {
            return syntax.conditionalKeywords && token.lexeme().equals("if") ? BP_TERNARY : BP_NONE;
        }
        if (token.kind() != Token.Kind.OPERATOR) {
            return BP_NONE;
        }
        return switch (token.lexeme()) {
            case "=", "+=", "-=", "*=", "/=", "%=", "**=", "//=", "<<=", ">>=", ">>>=",
                 "&=", "|=", "^=", "@=", "&&=", "||=", "??=", ":=" -> BP_ASSIGNMENT;
            case "?" -> syntax.ternary ? BP_TERNARY : syntax.postfixTry ? BP_POSTFIX : BP_NONE;
            case "??", "..", "..=" -> BP_NULLISH;
            case "||" -> BP_OR;
            case "&&" -> BP_AND;
            case "|" -> BP_BIT_OR;
            case "^" -> BP_BIT_XOR;
            case "&" -> BP_BIT_AND;
            case "==", "!=", "===", "!==", "is" -> BP_EQUALITY;
            case "<", ">", "<=", ">=", "instanceof", "in", "as" -> BP_RELATIONAL;
            case "not" -> peekAhead(1).isOperator("in") ? BP_RELATIONAL : BP_NONE;
            case "<<", ">>", ">>>" -> BP_SHIFT;
            case "+", "-" -> BP_ADDITIVE;
            case "*", "/", "%", "//", "@" -> BP_MULTIPLICATIVE;
            case "**" -> BP_EXPONENT;
            case "(", "[", ".", "?.", "++", "--" -> BP_POSTFIX;
            case "{" -> syntax.structLiterals && isTypeName(left) ? BP_POSTFIX : BP_NONE;
            default -> BP_NONE;
        };
    }

    private Node parseInfix(Node left, int start, Token token, int bp) {
        advance();
        if (token.kind() == Token.Kind.IDENTIFIER) {
            // a if test else b
            Node test = parseExpr(BP_OR);
            consumeIdentifier("else");
            Node alternate = parseExpr(BP_TERNARY);
            return generic("ConditionalExpression", start, Map.of(), List.of(test, left, alternate));
        }
        String operator = token.lexeme();
        return switch (operator) {
            case "(" -> call(left, start, parseArguments(")"));
            case "[" -> parseIndex(left, start);
            case ".", "?." -> parseMember(left, start, operator.equals("?."));
            case "++", "--" -> generic("UpdateExpression", start,
                attributes("operator", operator, "prefix", false), List.of(left));
            case "{" -> {
                skipGroup("{", "}");
                yield new GenericNode(loc(start, end()), range(start, end()), text(start, end()),
                    "StructExpression", attributes("name", ((Identifier) left).name()), List.of());
            }
            case "?" -> syntax.ternary
                ? parseConditional(left, start)
                : generic("TryExpression", start, Map.of(), List.of(left));
            case "=", "+=", "-=", "*=", "/=", "%=", "**=", "//=", "<<=", ">>=", ">>>=",
                 "&=", "|=", "^=", "@=", "&&=", "||=", "??=", ":=" -> {
                Node right = parseExpr(BP_ASSIGNMENT); // Right-associative
                yield new AssignmentExpression(loc(start, end()), range(start, end()), null, operator, left, right);
            }
            case "**" -> binary(operator, left, parseExpr(bp), start);
            case "not" -> {
                advance(); // in
                yield binary("not in", left, parseExpr(bp + 1), start);
            }
            case "is" -> {
                String spelled = match("not") ? "is not" : "is";
                yield binary(spelled, left, parseExpr(bp + 1), start);
            }
            default -> binary(operator, left, parseExpr(bp + 1), start);
        };
    }

    // Arguments must be parsed before the end offset is read
    private Node call(Node callee, int start, List<Node> arguments) {
        return new CallExpression(loc(start, end()), range(start, end()), null, callee, arguments);
    }

    private Node binary(String operator, Node left, Node right, int start) {
        return new BinaryExpression(loc(start, end()), range(start, end()), null, operator, left, right);
    }

    private Node parseConditional(Node test, int start) {
        Node consequent = parseExpr(BP_ASSIGNMENT);
        consume(":", "Expected ':' in conditional expression");
        Node alternate = parseExpr(BP_ASSIGNMENT);
        return generic("ConditionalExpression", start, Map.of(), List.of(test, consequent, alternate));
    }

    private Node parseMember(Node object, int start, boolean optional) {
        Token name = advance();
        if (name.kind() != Token.Kind.IDENTIFIER && name.kind() != Token.Kind.NUMBER) {
            throw new ExpressionException("Expected a property name after '.'", name.start());
        }
        Node property = identifier(name.lexeme(), name.start(), name.end());
        Map<String, Object> attributes = optional
            ? attributes("computed", false, "optional", true)
            : attributes("computed", false);
        return generic("MemberExpression", start, attributes, List.of(object, property));
    }

    private Node parseIndex(Node object, int start) {
        if (syntax.macros && object instanceof Identifier id && id.name().endsWith("!")) {
            return call(object, start, parseArguments("]"));
        }
        int saved = current;
        int propertyStart = peek().start();
        Node property;
        try {
            property = parseSequence();
            if (!check("]")) {
                throw new ExpressionException("Expected ']'", peek().start());
            }
            advance();
        } catch (ExpressionException e) {
            // Slices and other subscripts the grammar does not model are kept as text
            current = saved;
            int end = skipGroup("[", "]");
            int propertyEnd = previous().start();
            property = new GenericNode(loc(propertyStart, propertyEnd), range(propertyStart, propertyEnd),
                text(propertyStart, propertyEnd), "SliceExpression", Map.of(), List.of());
            return generic("MemberExpression", start, end, attributes("computed", true), List.of(object, property));
        }
        return generic("MemberExpression", start, attributes("computed", true), List.of(object, property));
    }

    private List<Node> parseArguments(String close) {
        List<Node> arguments = new ArrayList<>();
        while (!check(close)) {
            if (peek().kind() == Token.Kind.EOF) {
                throw new ExpressionException("Expected '" + close + "'", peek().start());
            }
            int argumentStart = peek().start();
            Node argument = parseExpr(BP_ASSIGNMENT);
            if (syntax.comprehensions && peek().isIdentifier("for")) {
                skipUntil(close);
                argument = generic("ComprehensionExpression", argumentStart,
                    attributes("kind", "generator"), List.of(argument));
            }
            arguments.add(argument);
            if (!check(close)) {
                consume(",", "Expected ',' or '" + close + "'");
            }
        }
        advance();
        return arguments;
    }

    // ========================================================================
    // Prefix (NUD)
    // ========================================================================

    private Node parsePrefix() {
        Token token = advance();
        return switch (token.kind()) {
            case NUMBER -> new Literal(loc(token.start(), token.end()), range(token.start(), token.end()),
                token.lexeme(), numberValue(token));
            case STRING -> parseString(token);
            case IDENTIFIER -> parseIdentifierPrefix(token);
            case OPERATOR -> parseOperatorPrefix(token);
            case EOF -> throw new ExpressionException("Unexpected end of expression", token.start());
        };
    }

    private Number numberValue(Token token) {
        try {
            return LiteralValues.number(token.lexeme());
        } catch (NumberFormatException e) {
            throw new ExpressionException("Malformed number '" + token.lexeme() + "'", token.start());
        }
    }

    // Adjacent literals concatenate: "a" "b"
    private Node parseString(Token first) {
        StringBuilder value = new StringBuilder(LiteralValues.string(first.lexeme()));
        int end = first.end();
        while (peek().kind() == Token.Kind.STRING) {
            Token next = advance();
            value.append(LiteralValues.string(next.lexeme()));
            end = next.end();
        }
        return new Literal(loc(first.start(), end), range(first.start(), end), text(first.start(), end), value.toString());
    }

    private Node parseIdentifierPrefix(Token token) {
        String name = token.lexeme();
        int start = token.start();

        Boolean bool = syntax.booleanKeywords.get(name);
        if (bool != null) {
            return new Literal(loc(start, token.end()), range(start, token.end()), name, bool);
        }
        if (syntax.nullKeywords.contains(name)) {
            return new Literal(loc(start, token.end()), range(start, token.end()), name, null);
        }
        if (syntax.arrow != null && check(syntax.arrow)) {
            return parseLambda(start, name, false);
        }
        if (syntax.lambdaKeyword && name.equals("lambda")) {
            int paramsStart = peek().start();
            while (!check(":")) {
                if (peek().kind() == Token.Kind.EOF) {
                    throw new ExpressionException("Expected ':' in lambda", peek().start());
                }
                advance();
            }
            String params = text(paramsStart, peek().start()).trim();
            advance();
            Node body = parseExpr(BP_TERNARY);
            return generic("LambdaExpression", start, attributes("params", params), List.of(body));
        }
        if (syntax.closures && name.equals("move") && (check("|") || check("||"))) {
            return parseClosure(start, advance());
        }
        if (syntax.closures && isBlockKeyword(name)) {
            return parseBlockLike(token);
        }
        if (name.equals("yield")) {
            if (peek().isIdentifier("from")) {
                advance();
            }
            List<Node> argument = atExpressionEnd() ? List.of() : List.of(parseExpr(BP_ASSIGNMENT));
            return generic("YieldExpression", start, Map.of(), argument);
        }
        if (syntax.arrow != null && syntax.arrow.equals("=>")) {
            if (name.equals("function") || name.equals("class")) {
                return parseOpaqueDeclaration(token);
            }
            if (name.equals("async")) {
                if (peek().isIdentifier("function")) {
                    return parseOpaqueDeclaration(token);
                }
                if (peek().kind() == Token.Kind.IDENTIFIER && peekAhead(1).isOperator("=>")) {
                    Token param = advance();
                    return parseLambda(start, param.lexeme(), true);
                }
                if (check("(") && arrowFollowsGroup()) {
                    Token open = advance();
                    return parseParenthesizedLambda(start, open, true);
                }
            }
        }
        return identifier(name, start, token.end());
    }

    private Node parseOperatorPrefix(Token token) {
        String operator = token.lexeme();
        int start = token.start();
        return switch (operator) {
            case "(" -> parseParenthesized(token);
            case "[" -> parseArray(token);
            case "{" -> {
                skipGroup("{", "}");
                yield new GenericNode(loc(start, end()), range(start, end()), text(start, end()),
                    syntax.braceExpressionType, Map.of(), List.of());
            }
            case "|", "||" -> {
                if (!syntax.closures) {
                    throw unexpected(token);
                }
                yield parseClosure(start, token);
            }
            case "++", "--" -> {
                Node argument = parseExpr(BP_UNARY);
                yield generic("UpdateExpression", start, attributes("operator", operator, "prefix", true), List.of(argument));
            }
            case "not" -> {
                Node argument = parseExpr(BP_BIT_OR);
                yield generic("UnaryExpression", start, attributes("operator", "!", "prefix", true), List.of(argument));
            }
            case "new" -> {
                Node target = parseExpr(BP_POSTFIX);
                if (match("{")) {
                    skipGroup("{", "}"); // anonymous class body
                }
                yield generic("NewExpression", start, Map.of(), List.of(target));
            }
            case "..", "..=" -> atExpressionEnd()
                ? generic("RangeExpression", start, Map.of(), List.of())
                : generic("RangeExpression", start, Map.of(), List.of(parseExpr(BP_NULLISH + 1)));
            case "!", "-", "+", "~", "*", "**", "&", "...", "typeof", "void", "delete", "await" -> {
                if (operator.equals("&") && peek().isIdentifier("mut")) {
                    advance();
                }
                Node argument = parseExpr(BP_UNARY);
                yield generic("UnaryExpression", start, attributes("operator", operator, "prefix", true), List.of(argument));
            }
            default -> throw unexpected(token);
        };
    }

    private static ExpressionException unexpected(Token token) {
        return new ExpressionException("Unexpected '" + token.lexeme() + "'", token.start());
    }

    private Node parseParenthesized(Token open) {
        int start = open.start();
        if (syntax.arrow != null) {
            current--;
            if (arrowFollowsGroup()) {
                advance();
                return parseParenthesizedLambda(start, open, false);
            }
            advance();
        }
        if (match(")")) {
            return generic("TupleExpression", start, Map.of(), List.of());
        }

        Node inner = parseExpr(BP_ASSIGNMENT);
        if (syntax.comprehensions && peek().isIdentifier("for")) {
            skipUntil(")");
            advance();
            return generic("ComprehensionExpression", start, attributes("kind", "generator"), List.of(inner));
        }
        if (check(",")) {
            List<Node> elements = new ArrayList<>();
            elements.add(inner);
            while (match(",")) {
                if (check(")")) {
                    break;
                }
                elements.add(parseExpr(BP_ASSIGNMENT));
            }
            consume(")", "Expected ')'");
            return generic(syntax.ternary ? "SequenceExpression" : "TupleExpression", start, Map.of(), elements);
        }
        consume(")", "Expected ')'");

        if (syntax.parenthesizedCasts && isTypeName(inner) && startsOperand(peek())) {
            String type = text(open.end(), previous().start()).trim();
            Node operand = parseExpr(BP_UNARY);
            return generic("CastExpression", start, attributes("type", type), List.of(operand));
        }
        if (context.config().preserveParensEnabled()) {
            return generic("ParenthesizedExpression", start, Map.of(), List.of(inner));
        }
        return inner;
    }

    private Node parseArray(Token open) {
        int start = open.start();
        List<Node> elements = new ArrayList<>();
        while (!check("]")) {
            if (peek().kind() == Token.Kind.EOF) {
                throw new ExpressionException("Expected ']'", peek().start());
            }
            if (match(",")) {
                continue; // hole
            }
            Node element = parseExpr(BP_ASSIGNMENT);
            if (syntax.comprehensions && peek().isIdentifier("for")) {
                skipUntil("]");
                advance();
                return generic("ComprehensionExpression", start, attributes("kind", "list"), List.of(element));
            }
            elements.add(element);
            if (!check("]")) {
                consume(",", "Expected ',' or ']'");
            }
        }
        advance();
        return generic("ArrayExpression", start, Map.of(), elements);
    }

    private Node parseParenthesizedLambda(int start, Token open, boolean async) {
        int close = skipGroup("(", ")");
        String params = text(open.end(), close - 1).trim();
        return parseLambda(start, params, async);
    }

    private Node parseLambda(int start, String params, boolean async) {
        advance(); // arrow
        Node body = parseLambdaBody();
        String type = "=>".equals(syntax.arrow) ? "ArrowFunctionExpression" : "LambdaExpression";
        Map<String, Object> attributes = async
            ? attributes("params", params, "async", true)
            : attributes("params", params);
        return generic(type, start, attributes, List.of(body));
    }

    private Node parseClosure(int start, Token bar) {
        String params = "";
        if (bar.lexeme().equals("|")) {
            int paramsStart = peek().start();
            while (!check("|")) {
                if (peek().kind() == Token.Kind.EOF) {
                    throw new ExpressionException("Expected '|' to close closure parameters", peek().start());
                }
                advance();
            }
            params = text(paramsStart, peek().start()).trim();
            advance();
        }
        if (match("->")) {
            // Explicit return type: the body must be a block
            while (!check("{") && peek().kind() != Token.Kind.EOF) {
                advance();
            }
        }
        Node body = parseLambdaBody();
        return generic("LambdaExpression", start, attributes("params", params), List.of(body));
    }

    private Node parseLambdaBody() {
        if (check("{")) {
            Token open = advance();
            skipGroup("{", "}");
            return new GenericNode(loc(open.start(), end()), range(open.start(), end()), text(open.start(), end()),
                "BlockExpression", Map.of(), List.of());
        }
        return parseExpr(BP_ASSIGNMENT);
    }

    // function () {...}, class X extends Y {...} used as values
    private Node parseOpaqueDeclaration(Token keyword) {
        int start = keyword.start();
        String type = keyword.lexeme().equals("class") ? "ClassExpression" : "FunctionExpression";
        skipBlock(keyword);
        return new GenericNode(loc(start, end()), range(start, end()), text(start, end()), type, Map.of(), List.of());
    }

    private boolean isBlockKeyword(String name) {
        return switch (name) {
            case "if", "match", "loop", "unsafe", "while", "for" -> true;
            case "async" -> check("{") || peek().isIdentifier("move");
            default -> false;
        };
    }

    // if/match/loop blocks used as values, kept opaque
    private Node parseBlockLike(Token keyword) {
        int start = keyword.start();
        skipBlock(keyword);
        while (keyword.lexeme().equals("if") && peek().isIdentifier("else")) {
            skipBlock(advance());
        }
        String type = switch (keyword.lexeme()) {
            case "if" -> "IfExpression";
            case "match" -> "MatchExpression";
            case "loop", "while", "for" -> "LoopExpression";
            default -> "BlockExpression";
        };
        return new GenericNode(loc(start, end()), range(start, end()), text(start, end()), type, Map.of(), List.of());
    }

    // Skips the header after keyword and the braced block ending it
    private void skipBlock(Token keyword) {
        while (!check("{")) {
            if (peek().kind() == Token.Kind.EOF) {
                throw new ExpressionException("Expected '{' after " + keyword.lexeme(), peek().start());
            }
            if (check("(")) {
                advance();
                skipGroup("(", ")");
            } else {
                advance();
            }
        }
        advance();
        skipGroup("{", "}");
    }

    // ========================================================================
    // Token helpers
    // ========================================================================

    private Token peek() {
        return tokens.get(current);
    }

    private Token peekAhead(int distance) {
        return tokens.get(Math.min(current + distance, tokens.size() - 1));
    }

    private Token previous() {
        return tokens.get(Math.max(0, current - 1));
    }

    private Token advance() {
        Token token = tokens.get(current);
        if (token.kind() != Token.Kind.EOF) {
            current++;
        }
        return token;
    }

    private boolean check(String operator) {
        return peek().isOperator(operator);
    }

    private boolean match(String operator) {
        if (check(operator)) {
            advance();
            return true;
        }
        return false;
    }

    private void consume(String operator, String message) {
        if (!match(operator)) {
            throw new ExpressionException(message, peek().start());
        }
    }

    private void consumeIdentifier(String word) {
        if (!peek().isIdentifier(word)) {
            throw new ExpressionException("Expected '" + word + "'", peek().start());
        }
        advance();
    }

    private int end() {
        return previous().end();
    }

    private boolean atExpressionEnd() {
        Token token = peek();
        return token.kind() == Token.Kind.EOF
            || token.isOperator(")") || token.isOperator("]") || token.isOperator("}")
            || token.isOperator(",") || token.isOperator(":") || token.isOperator(";");
    }

    private static boolean startsOperand(Token token) {
        return token.kind() == Token.Kind.IDENTIFIER
            || token.kind() == Token.Kind.NUMBER
            || token.kind() == Token.Kind.STRING
            || token.isOperator("(");
    }

    private static boolean isTypeName(Node node) {
        if (!(node instanceof Identifier id)) {
            return false;
        }
        String name = id.name();
        String last = name.substring(name.lastIndexOf(':') + 1);
        return (!last.isEmpty() && Character.isUpperCase(last.charAt(0))) || isPrimitiveType(name);
    }

    private static boolean isPrimitiveType(String name) {
        return switch (name) {
            case "int", "long", "short", "byte", "char", "float", "double", "boolean" -> true;
            default -> false;
        };
    }

    // With the current token on an opening '(', true when its group is followed by the arrow
    private boolean arrowFollowsGroup() {
        int depth = 0;
        for (int i = current; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (token.isOperator("(")) {
                depth++;
            } else if (token.isOperator(")")) {
                depth--;
                if (depth == 0) {
                    return i + 1 < tokens.size() && tokens.get(i + 1).isOperator(syntax.arrow);
                }
            } else if (token.kind() == Token.Kind.EOF) {
                return false;
            }
        }
        return false;
    }

    /**
     * Skips to just past the token closing an already consumed {@code open}.
     *
     * @return the end offset of the closing token
     */
    private int skipGroup(String open, String close) {
        int depth = 1;
        while (true) {
            Token token = advance();
            if (token.kind() == Token.Kind.EOF) {
                throw new ExpressionException("Unclosed '" + open + "'", token.start());
            }
            if (token.isOperator(open)) {
                depth++;
            } else if (token.isOperator(close)) {
                depth--;
                if (depth == 0) {
                    return token.end();
                }
            }
        }
    }

    // Advances to (not past) the token closing the enclosing group
    private void skipUntil(String close) {
        int depth = 0;
        while (true) {
            Token token = peek();
            if (token.kind() == Token.Kind.EOF) {
                throw new ExpressionException("Expected '" + close + "'", token.start());
            }
            if (token.isOperator("(") || token.isOperator("[") || token.isOperator("{")) {
                depth++;
            } else if (token.isOperator(")") || token.isOperator("]") || token.isOperator("}")) {
                if (depth == 0) {
                    if (!token.isOperator(close)) {
                        throw new ExpressionException("Expected '" + close + "'", token.start());
                    }
                    return;
                }
                depth--;
            }
            advance();
        }
    }

    // ========================================================================
    // Node helpers
    // ========================================================================

    private SourceLocation loc(int start, int end) {
        return context.location(start, end);
    }

    private Range range(int start, int end) {
        return context.range(start, end);
    }

    private String text(int start, int end) {
        int from = Math.max(0, start - span.start());
        int to = Math.min(span.length(), Math.max(from, end - span.start()));
        return span.text().substring(from, to);
    }

    private GenericNode generic(String type, int start, Map<String, Object> attributes, List<Node> children) {
        return generic(type, start, end(), attributes, children);
    }

    private GenericNode generic(String type, int start, int end, Map<String, Object> attributes, List<Node> children) {
        return new GenericNode(loc(start, end), range(start, end), null, type, attributes, children);
    }

    private static Map<String, Object> attributes(Object... keyValues) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            attributes.put((String) keyValues[i], keyValues[i + 1]);
        }
        return attributes;
    }

    private static String abbreviate(String text) {
        String singleLine = text.replaceAll("\\s+", " ");
        return singleLine.length() <= 40 ? singleLine : singleLine.substring(0, 37) + "...";
    }
}
