package com.syntaxforge.lang;

import com.syntaxforge.ast.BinaryExpression;
import com.syntaxforge.ast.ClassDeclaration;
import com.syntaxforge.ast.Comment;
import com.syntaxforge.ast.CommentKind;
import com.syntaxforge.ast.DeclarationKind;
import com.syntaxforge.ast.ExpressionStatement;
import com.syntaxforge.ast.ForLoop;
import com.syntaxforge.ast.FunctionDeclaration;
import com.syntaxforge.ast.GenericNode;
import com.syntaxforge.ast.IfStatement;
import com.syntaxforge.ast.ImportDeclaration;
import com.syntaxforge.ast.Literal;
import com.syntaxforge.ast.MethodDeclaration;
import com.syntaxforge.ast.Program;
import com.syntaxforge.ast.ReturnStatement;
import com.syntaxforge.ast.SourceType;
import com.syntaxforge.ast.SwitchStatement;
import com.syntaxforge.ast.VariableDeclaration;
import com.syntaxforge.ast.Visibility;
import com.syntaxforge.ast.WhileLoop;
import com.syntaxforge.parser.ParseResult;
import com.syntaxforge.traverse.AstQueries;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class RustParserTest {

    private static Program parseOk(String source) {
        ParseResult result = new RustParser().parse(source, "lib.rs");
        assertTrue(result.isSuccess(), () -> "Unexpected errors: " + result.errors());
        return result.ast();
    }

    @Test
    void testFunctionAndUnitStruct() {
        ParseResult result = new RustParser().parse("fn main() {}\nstruct Point\n", "main.rs");

        assertTrue(result.isSuccess());
        assertEquals(3, result.metadata().nodeCount());
        // the function body block is walked but not counted as a construct
        assertEquals(4, AstQueries.countNodes(result.ast()));
        assertEquals(3, result.metadata().lineCount());
        assertEquals("rust", result.metadata().language());

        Program program = result.ast();
        assertEquals(SourceType.MODULE, program.sourceType());
        FunctionDeclaration main = (FunctionDeclaration) program.body().get(0);
        assertEquals("main", main.name());
        assertTrue(main.params().isEmpty());
        assertTrue(main.body().body().isEmpty());
        ClassDeclaration point = (ClassDeclaration) program.body().get(1);
        assertEquals("Point", point.name());
        assertTrue(point.body().isEmpty());
    }

    @Test
    void testUseDeclarations() {
        Program program = parseOk(String.join("\n",
            "use std::collections::{HashMap, HashSet as Set};",
            "use std::io;"));

        ImportDeclaration grouped = (ImportDeclaration) program.body().get(0);
        assertEquals("std::collections", grouped.source());
        assertEquals(List.of("HashMap", "Set"), grouped.specifiers());

        ImportDeclaration single = (ImportDeclaration) program.body().get(1);
        assertEquals("std::io", single.source());
        assertEquals(List.of("io"), single.specifiers());
    }

    @Test
    void testStructAndImpl() {
        Program program = parseOk(String.join("\n",
            "#[derive(Debug)]",
            "pub struct Point {",
            "    pub x: i32,",
            "    y: i32,",
            "}",
            "",
            "impl Point {",
            "    pub fn new(x: i32, y: i32) -> Self {",
            "        Point { x, y }",
            "    }",
            "",
            "    fn len(&self) -> i32 {",
            "        let sum = self.x + self.y;",
            "        sum",
            "    }",
            "}"));

        assertEquals(2, program.body().size());

        ClassDeclaration point = (ClassDeclaration) program.body().get(0);
        assertEquals("Point", point.name());
        assertEquals(2, point.body().size());
        VariableDeclaration x = (VariableDeclaration) point.body().get(0);
        assertEquals("x", x.name());
        assertEquals("i32", x.typeAnnotation());
        assertEquals(DeclarationKind.LET, x.kind());
        assertEquals("y", ((VariableDeclaration) point.body().get(1)).name());

        GenericNode impl = (GenericNode) program.body().get(1);
        assertEquals("ImplBlock", impl.type());
        assertEquals("Point", impl.attribute("target"));
        assertEquals(2, impl.children().size());

        MethodDeclaration constructor = (MethodDeclaration) impl.children().get(0);
        assertEquals("new", constructor.name());
        assertEquals(2, constructor.params().size());
        assertEquals("i32", constructor.params().get(0).type());
        assertTrue(constructor.isStatic());
        assertEquals(Visibility.PUBLIC, constructor.visibility());
        ExpressionStatement literal = (ExpressionStatement) constructor.body().body().get(0);
        assertEquals("StructExpression", literal.expression().type());

        MethodDeclaration len = (MethodDeclaration) impl.children().get(1);
        assertEquals("len", len.name());
        assertTrue(len.params().isEmpty());
        assertFalse(len.isStatic());
        assertEquals(Visibility.PRIVATE, len.visibility());
        VariableDeclaration sum = (VariableDeclaration) len.body().body().get(0);
        assertEquals("sum", sum.name());
        assertInstanceOf(BinaryExpression.class, sum.init());
    }

    @Test
    void testTraitAndEnum() {
        Program program = parseOk(String.join("\n",
            "pub trait Shape: Debug {",
            "    fn area(&self) -> f64;",
            "    fn name() -> String {",
            "        String::from(\"shape\")",
            "    }",
            "}",
            "",
            "enum Color { Red, Green(u8), Blue }"));

        GenericNode shape = (GenericNode) program.body().get(0);
        assertEquals("TraitDeclaration", shape.type());
        assertEquals("Shape", shape.attribute("name"));
        assertEquals("Debug", shape.attribute("supertraits"));

        MethodDeclaration area = (MethodDeclaration) shape.children().get(0);
        assertEquals("area", area.name());
        assertFalse(area.isStatic());
        assertEquals(Visibility.PUBLIC, area.visibility());
        assertTrue(area.body().body().isEmpty());

        MethodDeclaration name = (MethodDeclaration) shape.children().get(1);
        assertTrue(name.isStatic());
        assertEquals(1, name.body().body().size());

        GenericNode color = (GenericNode) program.body().get(1);
        assertEquals("EnumDeclaration", color.type());
        assertEquals(List.of("Red", "Green", "Blue"), color.attribute("variants"));
    }

    @Test
    void testBindings() {
        Program program = parseOk(String.join("\n",
            "const MAX: u32 = 100;",
            "static mut COUNTER: u32 = 0;",
            "fn f() {",
            "    let mut total = MAX;",
            "}"));

        VariableDeclaration max = (VariableDeclaration) program.body().get(0);
        assertEquals("MAX", max.name());
        assertEquals(DeclarationKind.CONST, max.kind());
        assertEquals("u32", max.typeAnnotation());
        assertEquals(100L, ((Literal) max.init()).value());

        VariableDeclaration counter = (VariableDeclaration) program.body().get(1);
        assertEquals("COUNTER", counter.name());
        assertEquals(DeclarationKind.VAR, counter.kind());

        FunctionDeclaration f = (FunctionDeclaration) program.body().get(2);
        VariableDeclaration total = (VariableDeclaration) f.body().body().get(0);
        assertEquals("total", total.name());
        assertEquals(DeclarationKind.LET, total.kind());
        assertNull(total.typeAnnotation());
    }

    @Test
    void testLoopsAndConditionals() {
        Program program = parseOk(String.join("\n",
            "fn run(items: Vec<i32>) {",
            "    let mut total = 0;",
            "    for item in items.iter() {",
            "        if item > 10 {",
            "            total += item;",
            "        } else if item < 0 {",
            "            break;",
            "        } else {",
            "            continue;",
            "        }",
            "    }",
            "    while total > 100 {",
            "        total -= 1;",
            "    }",
            "    loop {",
            "        return;",
            "    }",
            "}"));

        FunctionDeclaration run = (FunctionDeclaration) program.body().get(0);
        assertEquals("Vec<i32>", run.params().get(0).type());
        List<?> body = run.body().body();
        assertEquals(4, body.size());

        ForLoop forLoop = (ForLoop) body.get(1);
        assertTrue(forLoop.isForEach());
        assertEquals("item", ((VariableDeclaration) forLoop.init()).name());

        IfStatement branch = AstQueries.findNodesByType(forLoop, IfStatement.class).get(0);
        IfStatement elseIf = (IfStatement) branch.alternate();
        assertNotNull(elseIf.alternate());
        assertEquals(1, AstQueries.findNodesByType(program, "BreakStatement").size());
        assertEquals(1, AstQueries.findNodesByType(program, "ContinueStatement").size());

        WhileLoop whileLoop = (WhileLoop) body.get(2);
        assertInstanceOf(BinaryExpression.class, whileLoop.test());

        WhileLoop loop = (WhileLoop) body.get(3);
        assertEquals(true, ((Literal) loop.test()).value());
        ReturnStatement ret = AstQueries.findNodesByType(loop, ReturnStatement.class).get(0);
        assertNull(ret.argument());
    }

    @Test
    void testMatchBecomesSwitch() {
        Program program = parseOk(String.join("\n",
            "fn describe(n: i32) -> i32 {",
            "    match n {",
            "        0 => 10,",
            "        1 | 2 => 20,",
            "        _ => 30,",
            "    }",
            "}"));

        FunctionDeclaration describe = (FunctionDeclaration) program.body().get(0);
        assertEquals("i32", describe.returnType());
        SwitchStatement match = (SwitchStatement) describe.body().body().get(0);
        assertEquals(3, match.cases().size());
        assertEquals(0L, ((Literal) match.cases().get(0).test()).value());
        assertInstanceOf(BinaryExpression.class, match.cases().get(1).test());
        assertTrue(match.cases().get(2).isDefault());
        assertEquals(1, match.cases().get(2).consequent().size());
    }

    @Test
    void testIfLetCondition() {
        Program program = parseOk(String.join("\n",
            "fn f(opt: Option<i32>) {",
            "    if let Some(v) = opt {",
            "        g(v);",
            "    }",
            "}"));

        IfStatement branch = AstQueries.findNodesByType(program, IfStatement.class).get(0);
        GenericNode test = (GenericNode) branch.test();
        assertEquals("LetCondition", test.type());
        assertEquals("Some(v)", test.attribute("pattern"));
    }

    @Test
    void testComments() {
        Program program = parseOk("// line\n/* block */\nfn f() {}");

        Comment line = (Comment) program.body().get(0);
        assertEquals("line", line.value());
        assertEquals(CommentKind.LINE, line.kind());
        Comment block = (Comment) program.body().get(1);
        assertEquals("block", block.value());
        assertEquals(CommentKind.BLOCK, block.kind());
    }

    @Test
    void testUnterminatedBlock() {
        ParseResult result = new RustParser().parse("fn main() {\n    let x = 1;\n", "main.rs");

        assertFalse(result.isSuccess());
        assertEquals("Unterminated block: missing '}' for the '{' on line 1", result.errors().get(0).message());
        assertTrue(result.ast().body().isEmpty());
        assertEquals(SourceType.MODULE, result.ast().sourceType());
    }

    @Test
    void testUnclosedParenthesis() {
        ParseResult result = new RustParser().parse("fn main() {\n    let x = (1;\n}\n", "main.rs");

        assertFalse(result.isSuccess());
        assertTrue(result.errors().stream().anyMatch(e -> e.message().equals("Unclosed '('")), result.errors().toString());
    }
}
