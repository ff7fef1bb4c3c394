package com.syntaxforge.metrics;

import com.syntaxforge.ast.BinaryExpression;
import com.syntaxforge.ast.BlockStatement;
import com.syntaxforge.ast.CatchClause;
import com.syntaxforge.ast.ClassDeclaration;
import com.syntaxforge.ast.DeclarationKind;
import com.syntaxforge.ast.ExpressionStatement;
import com.syntaxforge.ast.ForLoop;
import com.syntaxforge.ast.FunctionDeclaration;
import com.syntaxforge.ast.Identifier;
import com.syntaxforge.ast.IfStatement;
import com.syntaxforge.ast.Literal;
import com.syntaxforge.ast.MethodDeclaration;
import com.syntaxforge.ast.Program;
import com.syntaxforge.ast.ReturnStatement;
import com.syntaxforge.ast.SourceLocation;
import com.syntaxforge.ast.TryStatement;
import com.syntaxforge.ast.VariableDeclaration;
import com.syntaxforge.ast.WhileLoop;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class AstMetricsTest {

    @Test
    void testStraightLineCodeHasComplexityOne() {
        Program program = new Program(List.of(new ExpressionStatement(new Identifier("x"))));
        assertEquals(1, AstMetrics.calculateComplexity(program));
        assertEquals(1, AstMetrics.calculateComplexity(new Literal(1L)));
    }

    @Test
    void testNestedIfsWithLogicalAnd() {
        IfStatement inner = new IfStatement(
            new BinaryExpression("&&", new Identifier("a"), new Identifier("b")), BlockStatement.empty(), null);
        IfStatement outer = new IfStatement(new Identifier("x"), new BlockStatement(List.of(inner)), null);

        assertEquals(4, AstMetrics.calculateComplexity(outer));
    }

    @Test
    void testDecisionPointsAndLogicalOperators() {
        BinaryExpression condition = new BinaryExpression("&&",
            new BinaryExpression("||", new Identifier("a"), new Identifier("b")),
            new BinaryExpression("==", new Identifier("c"), new Literal(1L)));
        Program program = new Program(List.of(
            new IfStatement(condition, BlockStatement.empty(), null),
            new WhileLoop(new Identifier("running"), BlockStatement.empty()),
            new ForLoop(null, null, null, BlockStatement.empty()),
            new TryStatement(BlockStatement.empty(),
                List.of(new CatchClause(new Identifier("e"), BlockStatement.empty())), null)));

        // 1 + if + && + || + while + for + catch
        assertEquals(7, AstMetrics.calculateComplexity(program));
    }

    @Test
    void testExtractMetrics() {
        FunctionDeclaration function = new FunctionDeclaration("f", List.of(), new BlockStatement(List.of(
            new IfStatement(new Identifier("x"), new BlockStatement(List.of(new ReturnStatement(null))), null))));
        ClassDeclaration type = new ClassDeclaration("Task", List.of(
            new MethodDeclaration("run", List.of(), new BlockStatement(List.of(
                new WhileLoop(new Identifier("busy"), BlockStatement.empty()))))));
        Program program = new Program(List.of(function, type,
            new VariableDeclaration("n", DeclarationKind.LET, new Literal(0L))));

        CodeMetrics metrics = AstMetrics.extractMetrics(program);

        assertEquals(1, metrics.functions());
        assertEquals(1, metrics.methods());
        assertEquals(1, metrics.classes());
        assertEquals(1, metrics.variables());
        assertEquals(1, metrics.conditionals());
        assertEquals(1, metrics.loops());
        assertEquals(3, metrics.complexity());
        // Program > function > block > if > block > return
        assertEquals(5, metrics.depth());
        // Program, function, block, if, identifier, block, return,
        // class, method, block, while, identifier, block, variable, literal
        assertEquals(15, metrics.nodeCount());
    }

    @Test
    void testFunctionComplexities() {
        FunctionDeclaration inner = new FunctionDeclaration(SourceLocation.of(3, 4, 3, 30), "inner", List.of(),
            new BlockStatement(List.of(new IfStatement(new Identifier("y"), BlockStatement.empty(), null))));
        FunctionDeclaration outer = new FunctionDeclaration(SourceLocation.of(1, 0, 6, 1), "outer", List.of(),
            new BlockStatement(List.of(inner, new WhileLoop(new Identifier("x"), BlockStatement.empty()))));
        MethodDeclaration method = new MethodDeclaration("run", List.of(), BlockStatement.empty());
        Program program = new Program(List.of(outer, new ClassDeclaration("C", List.of(method))));

        List<FunctionComplexity> complexities = AstMetrics.functionComplexities(program);

        assertEquals(List.of(
            new FunctionComplexity("outer", 1, 3),
            new FunctionComplexity("inner", 3, 2),
            new FunctionComplexity("run", 0, 1)), complexities);
    }
}
