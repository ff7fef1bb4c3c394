package com.syntaxforge.lang;

import com.syntaxforge.ast.AssignmentExpression;
import com.syntaxforge.ast.BinaryExpression;
import com.syntaxforge.ast.ClassDeclaration;
import com.syntaxforge.ast.DeclarationKind;
import com.syntaxforge.ast.ExpressionStatement;
import com.syntaxforge.ast.ForLoop;
import com.syntaxforge.ast.GenericNode;
import com.syntaxforge.ast.IfStatement;
import com.syntaxforge.ast.ImportDeclaration;
import com.syntaxforge.ast.MethodDeclaration;
import com.syntaxforge.ast.Node;
import com.syntaxforge.ast.Program;
import com.syntaxforge.ast.ReturnStatement;
import com.syntaxforge.ast.SourceType;
import com.syntaxforge.ast.SwitchStatement;
import com.syntaxforge.ast.ThrowStatement;
import com.syntaxforge.ast.TryStatement;
import com.syntaxforge.ast.VariableDeclaration;
import com.syntaxforge.ast.Visibility;
import com.syntaxforge.parser.ParseResult;
import com.syntaxforge.traverse.AstQueries;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class JavaParserTest {

    private static final String GREETER = String.join("\n",
        "package com.example;",
        "",
        "import java.util.List;",
        "import static java.util.Objects.requireNonNull;",
        "",
        "public class Greeter extends Base implements Runnable, Comparable<Greeter> {",
        "    private final String name;",
        "    private static int count = 0;",
        "",
        "    public Greeter(String name) {",
        "        this.name = name;",
        "    }",
        "",
        "    @Override",
        "    public void run() {",
        "        for (int i = 0; i < count; i++) {",
        "            System.out.println(name);",
        "        }",
        "    }",
        "",
        "    protected static String greet(final String who, int times) {",
        "        if (who == null) {",
        "            throw new IllegalArgumentException(\"who\");",
        "        }",
        "        return \"Hello \" + who;",
        "    }",
        "}");

    private static Program parseOk(String source) {
        ParseResult result = new JavaParser().parse(source, "Test.java");
        assertTrue(result.isSuccess(), () -> "Unexpected errors: " + result.errors());
        return result.ast();
    }

    @Test
    void testCompilationUnit() {
        Program program = parseOk(GREETER);

        assertEquals(SourceType.MODULE, program.sourceType());
        assertEquals(4, program.body().size());

        GenericNode packageDeclaration = (GenericNode) program.body().get(0);
        assertEquals("PackageDeclaration", packageDeclaration.type());
        assertEquals("com.example", packageDeclaration.attribute("name"));

        ImportDeclaration list = (ImportDeclaration) program.body().get(1);
        assertEquals("java.util.List", list.source());
        assertEquals(List.of("List"), list.specifiers());
        ImportDeclaration requireNonNull = (ImportDeclaration) program.body().get(2);
        assertEquals("java.util.Objects.requireNonNull", requireNonNull.source());
        assertEquals(List.of("requireNonNull"), requireNonNull.specifiers());
    }

    @Test
    void testClassHeaderAndFields() {
        ClassDeclaration greeter = (ClassDeclaration) parseOk(GREETER).body().get(3);

        assertEquals("Greeter", greeter.name());
        assertEquals("Base", greeter.superClass());
        assertEquals(List.of("Runnable", "Comparable<Greeter>"), greeter.interfaces());
        assertEquals(5, greeter.body().size());

        VariableDeclaration name = (VariableDeclaration) greeter.body().get(0);
        assertEquals("name", name.name());
        assertEquals(DeclarationKind.CONST, name.kind());
        assertEquals("String", name.typeAnnotation());
        assertNull(name.init());

        VariableDeclaration count = (VariableDeclaration) greeter.body().get(1);
        assertEquals(DeclarationKind.VAR, count.kind());
        assertEquals("int", count.typeAnnotation());
        assertEquals("Literal", count.init().type());
    }

    @Test
    void testMethodsAndConstructors() {
        ClassDeclaration greeter = (ClassDeclaration) parseOk(GREETER).body().get(3);

        MethodDeclaration constructor = (MethodDeclaration) greeter.body().get(2);
        assertEquals("Greeter", constructor.name());
        assertEquals("String", constructor.params().get(0).type());
        ExpressionStatement assignment = (ExpressionStatement) constructor.body().body().get(0);
        assertTrue(assignment.expression() instanceof AssignmentExpression);

        MethodDeclaration run = (MethodDeclaration) greeter.body().get(3);
        assertEquals("run", run.name());
        assertEquals(Visibility.PUBLIC, run.visibility());
        ForLoop loop = (ForLoop) run.body().body().get(0);
        assertEquals("int", ((VariableDeclaration) loop.init()).typeAnnotation());
        assertEquals("<", ((BinaryExpression) loop.test()).operator());

        MethodDeclaration greet = (MethodDeclaration) greeter.body().get(4);
        assertTrue(greet.isStatic());
        assertEquals(Visibility.PROTECTED, greet.visibility());
        assertEquals(List.of("who", "times"), greet.params().stream().map(p -> p.name()).toList());
        IfStatement check = (IfStatement) greet.body().body().get(0);
        assertNull(check.alternate());
        assertEquals(1, AstQueries.findNodesByType(check, ThrowStatement.class).size());
        assertTrue(greet.body().body().get(1) instanceof ReturnStatement);
    }

    @Test
    void testEnumRecordAndInterface() {
        Program program = parseOk(String.join("\n",
            "enum Color { RED, GREEN, BLUE; int rank() { return ordinal(); } }",
            "public record Point(int x, int y) implements Shape {}",
            "interface Shape { double area(); }"));

        ClassDeclaration color = (ClassDeclaration) program.body().get(0);
        assertEquals(4, color.body().size());
        assertEquals("EnumConstant", color.body().get(0).type());
        assertEquals("BLUE", ((GenericNode) color.body().get(2)).attribute("name"));
        assertEquals("rank", ((MethodDeclaration) color.body().get(3)).name());

        ClassDeclaration point = (ClassDeclaration) program.body().get(1);
        assertEquals("Point", point.name());
        assertEquals(List.of("Shape"), point.interfaces());
        assertEquals(List.of("x", "y"), point.body().stream()
            .map(member -> ((VariableDeclaration) member).name()).toList());

        ClassDeclaration shape = (ClassDeclaration) program.body().get(2);
        MethodDeclaration area = (MethodDeclaration) shape.body().get(0);
        assertTrue(area.body().body().isEmpty());
    }

    @Test
    void testStatements() {
        Program program = parseOk(String.join("\n",
            "for (String s : names) { print(s); }",
            "switch (day) {",
            "    case MONDAY -> work();",
            "    default -> rest();",
            "}",
            "try (var in = open()) { read(in); }",
            "Runnable r = () -> run();"));

        ForLoop each = (ForLoop) program.body().get(0);
        assertTrue(each.isForEach());
        VariableDeclaration s = (VariableDeclaration) each.init();
        assertEquals("s", s.name());
        assertEquals("String", s.typeAnnotation());

        SwitchStatement switchStatement = (SwitchStatement) program.body().get(1);
        assertEquals(2, switchStatement.cases().size());
        assertEquals("MONDAY", ((com.syntaxforge.ast.Identifier) switchStatement.cases().get(0).test()).name());
        assertTrue(switchStatement.cases().get(1).isDefault());

        TryStatement tryStatement = (TryStatement) program.body().get(2);
        assertTrue(tryStatement.handlers().isEmpty());
        assertNull(tryStatement.finalizer());

        VariableDeclaration r = (VariableDeclaration) program.body().get(3);
        assertEquals("Runnable", r.typeAnnotation());
        assertEquals("LambdaExpression", r.init().type());
    }

    @Test
    void testUnterminatedClassIsAnError() {
        ParseResult result = new JavaParser().parse("class A {\n  void f() {\n");

        assertFalse(result.isSuccess());
        assertTrue(result.ast().body().isEmpty());
        assertTrue(result.errors().stream().anyMatch(e -> e.message().startsWith("Unterminated block")));
    }

    @Test
    void testStrayClosingParenthesis() {
        ParseResult result = new JavaParser().parse("int x = foo());");

        assertFalse(result.isSuccess());
        assertEquals("Unexpected ')'", result.errors().get(0).message());
        assertEquals(1, result.errors().get(0).location().start().line());
    }

    @Test
    void testYieldWithoutValue() {
        ParseResult result = new JavaParser().parse("class A { void f() { yield; } }");

        assertFalse(result.isSuccess());
        assertEquals(1, result.errors().size());
        assertEquals("Expected a value after 'yield'", result.errors().get(0).message());
        assertEquals(1, result.errors().get(0).location().start().line());
        assertEquals(26, result.errors().get(0).location().start().column());
    }

    @Test
    void testMissingInitializer() {
        ParseResult result = new JavaParser().parse("class A {\n  void f() {\n    int x = ;\n  }\n}");

        assertFalse(result.isSuccess());
        assertEquals("Expected an initializer", result.errors().get(0).message());
        assertEquals(3, result.errors().get(0).location().start().line());
    }

    @Test
    void testCommentsAreKept() {
        Program program = parseOk("/** Entry point. */\nclass Main {}");
        Node comment = program.body().get(0);
        assertEquals("Comment", comment.type());
        assertEquals("* Entry point.", ((com.syntaxforge.ast.Comment) comment).value());
    }
}
