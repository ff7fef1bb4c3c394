package com.syntaxforge.lang;

import com.syntaxforge.ast.BinaryExpression;
import com.syntaxforge.ast.CallExpression;
import com.syntaxforge.ast.ClassDeclaration;
import com.syntaxforge.ast.Comment;
import com.syntaxforge.ast.CommentKind;
import com.syntaxforge.ast.DeclarationKind;
import com.syntaxforge.ast.ExportDeclaration;
import com.syntaxforge.ast.ExpressionStatement;
import com.syntaxforge.ast.ForLoop;
import com.syntaxforge.ast.FunctionDeclaration;
import com.syntaxforge.ast.GenericNode;
import com.syntaxforge.ast.Identifier;
import com.syntaxforge.ast.ImportDeclaration;
import com.syntaxforge.ast.Literal;
import com.syntaxforge.ast.MethodDeclaration;
import com.syntaxforge.ast.Node;
import com.syntaxforge.ast.NodeType;
import com.syntaxforge.ast.Program;
import com.syntaxforge.ast.ReturnStatement;
import com.syntaxforge.ast.SourceType;
import com.syntaxforge.ast.SwitchStatement;
import com.syntaxforge.ast.TryStatement;
import com.syntaxforge.ast.VariableDeclaration;
import com.syntaxforge.ast.Visibility;
import com.syntaxforge.metrics.AstMetrics;
import com.syntaxforge.parser.ParseResult;
import com.syntaxforge.parser.ParserConfig;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class JavaScriptParserTest {

    private static Program parseOk(String source) {
        ParseResult result = new JavaScriptParser().parse(source);
        assertTrue(result.isSuccess(), () -> "Unexpected errors: " + result.errors());
        return result.ast();
    }

    @Test
    void testVariablesAndFunctions() {
        ParseResult result = new JavaScriptParser().parse(
            "const x = 1 + 2;\nfunction add(a, b = 2) {\n  return a + b;\n}\n", "math.js");

        assertTrue(result.isSuccess());
        Program program = result.ast();
        assertEquals(SourceType.MODULE, program.sourceType());
        assertEquals(2, program.body().size());

        VariableDeclaration x = (VariableDeclaration) program.body().get(0);
        assertEquals("x", x.name());
        assertEquals(DeclarationKind.CONST, x.kind());
        BinaryExpression sum = (BinaryExpression) x.init();
        assertEquals("+", sum.operator());
        assertEquals(1L, ((Literal) sum.left()).value());

        FunctionDeclaration add = (FunctionDeclaration) program.body().get(1);
        assertEquals("add", add.name());
        assertEquals(2, add.params().size());
        assertEquals("a", add.params().get(0).name());
        assertEquals("2", add.params().get(1).defaultValue());
        assertTrue(add.params().get(1).optional());
        assertTrue(add.body().body().get(0) instanceof ReturnStatement);

        // Program, const, +, 1, 2, function, return, +, a, b
        assertEquals(10, result.metadata().nodeCount());
        assertEquals(5, result.metadata().lineCount());
        assertEquals("javascript", result.metadata().language());
        assertEquals("math.js", result.metadata().filename());
    }

    @Test
    void testLocationsAndRanges() {
        Program program = parseOk("let x = 1;");
        Node declaration = program.body().get(0);

        assertEquals(1, declaration.loc().start().line());
        assertEquals(0, declaration.loc().start().column());
        assertEquals(9, declaration.loc().end().column());
        assertEquals(0, declaration.range().start());
        assertEquals(9, declaration.range().end());
    }

    @Test
    void testLocationsCanBeDisabled() {
        JavaScriptParser parser = new JavaScriptParser(ParserConfig.builder().locations(false).ranges(false).build());
        Program program = parser.parse("let x = 1;").ast();
        assertNull(program.body().get(0).loc());
        assertNull(program.body().get(0).range());
    }

    @Test
    void testPreserveParens() {
        String source = "let x = (a + b) * c;";
        BinaryExpression plain = (BinaryExpression) ((VariableDeclaration) parseOk(source).body().get(0)).init();
        assertInstanceOf(BinaryExpression.class, plain.left());

        JavaScriptParser parser = new JavaScriptParser(ParserConfig.builder().preserveParens(true).build());
        VariableDeclaration x = (VariableDeclaration) parser.parse(source).ast().body().get(0);
        GenericNode group = (GenericNode) ((BinaryExpression) x.init()).left();
        assertEquals("ParenthesizedExpression", group.type());
        assertEquals("+", ((BinaryExpression) group.children().get(0)).operator());
    }

    @Test
    void testClassMembers() {
        Program program = parseOk(String.join("\n",
            "class Dog extends Animal {",
            "  static create() { return new Dog(); }",
            "  #secret = 1;",
            "  bark() {}",
            "}"));

        ClassDeclaration dog = (ClassDeclaration) program.body().get(0);
        assertEquals("Dog", dog.name());
        assertEquals("Animal", dog.superClass());
        assertEquals(3, dog.body().size());

        MethodDeclaration create = (MethodDeclaration) dog.body().get(0);
        assertEquals("create", create.name());
        assertTrue(create.isStatic());
        VariableDeclaration secret = (VariableDeclaration) dog.body().get(1);
        assertEquals("#secret", secret.name());
        MethodDeclaration bark = (MethodDeclaration) dog.body().get(2);
        assertFalse(bark.isStatic());
        assertEquals(Visibility.PUBLIC, bark.visibility());
    }

    @Test
    void testImportsAndExports() {
        Program program = parseOk(String.join("\n",
            "import React, { useState as useS } from 'react';",
            "import './styles.css';",
            "export default function main() {}",
            "export { a, b as c };"));

        ImportDeclaration react = (ImportDeclaration) program.body().get(0);
        assertEquals("react", react.source());
        assertEquals(List.of("React", "useS"), react.specifiers());

        ImportDeclaration styles = (ImportDeclaration) program.body().get(1);
        assertEquals("./styles.css", styles.source());
        assertTrue(styles.specifiers().isEmpty());

        ExportDeclaration main = (ExportDeclaration) program.body().get(2);
        assertTrue(main.defaultExport());
        assertEquals("main", ((FunctionDeclaration) main.declaration()).name());

        ExportDeclaration list = (ExportDeclaration) program.body().get(3);
        assertNull(list.declaration());
        assertEquals(List.of("a", "c"), list.specifiers());
    }

    @Test
    void testLoops() {
        Program program = parseOk(String.join("\n",
            "for (let i = 0; i < 10; i++) { sum += i; }",
            "for (const item of items) console.log(item);"));

        ForLoop counting = (ForLoop) program.body().get(0);
        assertFalse(counting.isForEach());
        assertEquals("i", ((VariableDeclaration) counting.init()).name());
        assertEquals("<", ((BinaryExpression) counting.test()).operator());
        assertEquals("UpdateExpression", counting.update().type());

        ForLoop each = (ForLoop) program.body().get(1);
        assertTrue(each.isForEach());
        VariableDeclaration item = (VariableDeclaration) each.init();
        assertEquals("item", item.name());
        assertEquals(DeclarationKind.CONST, item.kind());
        assertEquals("items", ((Identifier) each.iterable()).name());
        CallExpression log = (CallExpression) ((ExpressionStatement) each.body()).expression();
        assertEquals("MemberExpression", log.callee().type());
    }

    @Test
    void testSwitchAndTry() {
        Program program = parseOk(String.join("\n",
            "switch (x) {",
            "  case 1: a(); break;",
            "  default: b();",
            "}",
            "try { risky(); } catch (e) { handle(e); } finally { done(); }"));

        SwitchStatement switchStatement = (SwitchStatement) program.body().get(0);
        assertEquals(2, switchStatement.cases().size());
        assertEquals(1L, ((Literal) switchStatement.cases().get(0).test()).value());
        assertEquals(2, switchStatement.cases().get(0).consequent().size());
        assertEquals("BreakStatement", switchStatement.cases().get(0).consequent().get(1).type());
        assertTrue(switchStatement.cases().get(1).isDefault());

        TryStatement tryStatement = (TryStatement) program.body().get(1);
        assertEquals(1, tryStatement.handlers().size());
        assertEquals("e", tryStatement.handlers().get(0).param().name());
        assertNotNull(tryStatement.finalizer());
    }

    @Test
    void testArrowFunctionsAndComments() {
        Program program = parseOk("// adds two numbers\nconst add = (a, b) => a + b;");

        Comment comment = (Comment) program.body().get(0);
        assertEquals("adds two numbers", comment.value());
        assertEquals(CommentKind.LINE, comment.kind());

        GenericNode arrow = (GenericNode) ((VariableDeclaration) program.body().get(1)).init();
        assertEquals("ArrowFunctionExpression", arrow.type());
        assertEquals("a, b", arrow.attribute("params"));
        assertTrue(arrow.children().get(0).is(NodeType.BINARY_EXPRESSION));
    }

    @Test
    void testComplexityOfParsedFunction() {
        Program program = parseOk(String.join("\n",
            "function f(a, b) {",
            "  if (a && b) { return 1; }",
            "  while (a) { a--; }",
            "  return 0;",
            "}"));

        assertEquals(4, AstMetrics.calculateComplexity(program));
    }

    @Test
    void testUnterminatedBlockIsAnError() {
        ParseResult result = new JavaScriptParser().parse("function f() {\n  return 1;\n");

        assertFalse(result.isSuccess());
        assertTrue(result.ast().body().isEmpty());
        assertTrue(result.errors().get(0).message().startsWith("Unterminated block"), result.errors().toString());
    }

    @Test
    void testModuleItemsRejectedInScripts() {
        JavaScriptParser parser = new JavaScriptParser(ParserConfig.builder().sourceType(SourceType.SCRIPT).build());
        ParseResult result = parser.parse("import x from 'x';");

        assertFalse(result.isSuccess());
        assertEquals("'import' may only appear with sourceType: module", result.errors().get(0).message());
        assertEquals(SourceType.SCRIPT, result.ast().sourceType());
    }

    @Test
    void testReturnOutsideFunction() {
        assertFalse(new JavaScriptParser().parse("return 1;").isSuccess());

        JavaScriptParser lenient = new JavaScriptParser(
            ParserConfig.builder().allowReturnOutsideFunction(true).build());
        assertTrue(lenient.parse("return 1;").isSuccess());
    }

    @Test
    void testEcmaVersionGatesLet() {
        JavaScriptParser es5 = new JavaScriptParser(ParserConfig.builder().ecmaVersion(5).build());
        ParseResult result = es5.parse("let x = 1;");

        assertFalse(result.isSuccess());
        assertEquals("'let' requires ecmaVersion 2015 or later", result.errors().get(0).message());
        assertTrue(es5.parse("var x = 1;").isSuccess());
    }

    @Test
    void testUpdateConfigAffectsLaterParses() {
        JavaScriptParser parser = new JavaScriptParser();
        ParseResult before = parser.parse("x = 1;");
        parser.updateConfig(ParserConfig.builder().sourceType(SourceType.SCRIPT).build());
        ParseResult after = parser.parse("x = 1;");

        assertEquals(SourceType.MODULE, before.ast().sourceType());
        assertEquals(SourceType.SCRIPT, after.ast().sourceType());
    }
}
