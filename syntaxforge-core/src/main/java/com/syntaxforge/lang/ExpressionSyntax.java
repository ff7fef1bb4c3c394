package com.syntaxforge.lang;

import java.util.Map;
import java.util.Set;

/**
 * Per-language switches for {@link ExpressionLexer} and {@link ExpressionParser}.
 */
final class ExpressionSyntax {

    final LexicalSyntax lexical;
    final Map<String, String> wordOperators;  // keyword -> operator lexeme
    final Map<String, Boolean> booleanKeywords;
    final Set<String> nullKeywords;
    final String arrow;                       // Can be null
    final boolean ternary;
    final boolean conditionalKeywords;        // a if b else c
    final boolean lambdaKeyword;              // lambda x: x
    final boolean closures;                   // |x| x + 1
    final boolean postfixTry;                 // expr?
    final boolean parenthesizedCasts;         // (int) x
    final boolean paths;                      // a::b joined into one identifier
    final boolean genericArguments;           // List<String>::new, Vec::<u8>::new()
    final boolean macros;                     // println!(...)
    final boolean structLiterals;             // Point { x: 1 }
    final boolean comprehensions;             // [x for x in xs]
    final String braceExpressionType;

    private ExpressionSyntax(Builder builder) {
        this.lexical = builder.lexical;
        this.wordOperators = builder.wordOperators;
        this.booleanKeywords = builder.booleanKeywords;
        this.nullKeywords = builder.nullKeywords;
        this.arrow = builder.arrow;
        this.ternary = builder.ternary;
        this.conditionalKeywords = builder.conditionalKeywords;
        this.lambdaKeyword = builder.lambdaKeyword;
        this.closures = builder.closures;
        this.postfixTry = builder.postfixTry;
        this.parenthesizedCasts = builder.parenthesizedCasts;
        this.paths = builder.paths;
        this.genericArguments = builder.genericArguments;
        this.macros = builder.macros;
        this.structLiterals = builder.structLiterals;
        this.comprehensions = builder.comprehensions;
        this.braceExpressionType = builder.braceExpressionType;
    }

    static final ExpressionSyntax JAVASCRIPT = new Builder(LexicalSyntax.JAVASCRIPT)
        .wordOperators(Map.of(
            "typeof", "typeof", "instanceof", "instanceof", "in", "in", "void", "void",
            "delete", "delete", "await", "await", "new", "new"))
        .booleanKeywords(Map.of("true", true, "false", false))
        .nullKeywords(Set.of("null"))
        .arrow("=>")
        .ternary()
        .braceExpressionType("ObjectExpression")
        .build();

    static final ExpressionSyntax JAVA = new Builder(LexicalSyntax.JAVA)
        .wordOperators(Map.of("instanceof", "instanceof", "new", "new"))
        .booleanKeywords(Map.of("true", true, "false", false))
        .nullKeywords(Set.of("null"))
        .arrow("->")
        .ternary()
        .parenthesizedCasts()
        .paths()
        .genericArguments()
        .braceExpressionType("ArrayInitializer")
        .build();

    static final ExpressionSyntax RUST = new Builder(LexicalSyntax.RUST)
        .wordOperators(Map.of("as", "as"))
        .booleanKeywords(Map.of("true", true, "false", false))
        .closures()
        .postfixTry()
        .paths()
        .genericArguments()
        .macros()
        .structLiterals()
        .braceExpressionType("BlockExpression")
        .build();

    static final ExpressionSyntax PYTHON = new Builder(LexicalSyntax.PYTHON)
        .wordOperators(Map.of(
            "and", "&&", "or", "||", "not", "not", "in", "in", "is", "is", "await", "await"))
        .booleanKeywords(Map.of("True", true, "False", false))
        .nullKeywords(Set.of("None"))
        .conditionalKeywords()
        .lambdaKeyword()
        .comprehensions()
        .braceExpressionType("DictExpression")
        .build();

    static final class Builder {
        private final LexicalSyntax lexical;
        private Map<String, String> wordOperators = Map.of();
        private Map<String, Boolean> booleanKeywords = Map.of();
        private Set<String> nullKeywords = Set.of();
        private String arrow;
        private boolean ternary;
        private boolean conditionalKeywords;
        private boolean lambdaKeyword;
        private boolean closures;
        private boolean postfixTry;
        private boolean parenthesizedCasts;
        private boolean paths;
        private boolean genericArguments;
        private boolean macros;
        private boolean structLiterals;
        private boolean comprehensions;
        private String braceExpressionType = "BlockExpression";

        Builder(LexicalSyntax lexical) {
            this.lexical = lexical;
        }

        Builder wordOperators(Map<String, String> wordOperators) {
            this.wordOperators = wordOperators;
            return this;
        }

        Builder booleanKeywords(Map<String, Boolean> booleanKeywords) {
            this.booleanKeywords = booleanKeywords;
            return this;
        }

        Builder nullKeywords(Set<String> nullKeywords) {
            this.nullKeywords = nullKeywords;
            return this;
        }

        Builder arrow(String arrow) {
            this.arrow = arrow;
            return this;
        }

        Builder ternary() {
            this.ternary = true;
            return this;
        }

        Builder conditionalKeywords() {
            this.conditionalKeywords = true;
            return this;
        }

        Builder lambdaKeyword() {
            this.lambdaKeyword = true;
            return this;
        }

        Builder closures() {
            this.closures = true;
            return this;
        }

        Builder postfixTry() {
            this.postfixTry = true;
            return this;
        }

        Builder parenthesizedCasts() {
            this.parenthesizedCasts = true;
            return this;
        }

        Builder paths() {
            this.paths = true;
            return this;
        }

        Builder genericArguments() {
            this.genericArguments = true;
            return this;
        }

        Builder macros() {
            this.macros = true;
            return this;
        }

        Builder structLiterals() {
            this.structLiterals = true;
            return this;
        }

        Builder comprehensions() {
            this.comprehensions = true;
            return this;
        }

        Builder braceExpressionType(String braceExpressionType) {
            this.braceExpressionType = braceExpressionType;
            return this;
        }

        ExpressionSyntax build() {
            return new ExpressionSyntax(this);
        }
    }
}
