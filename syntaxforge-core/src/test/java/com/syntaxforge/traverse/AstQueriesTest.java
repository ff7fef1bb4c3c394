package com.syntaxforge.traverse;

import com.syntaxforge.ast.BlockStatement;
import com.syntaxforge.ast.ClassDeclaration;
import com.syntaxforge.ast.DeclarationKind;
import com.syntaxforge.ast.ExpressionStatement;
import com.syntaxforge.ast.FunctionDeclaration;
import com.syntaxforge.ast.GenericNode;
import com.syntaxforge.ast.Identifier;
import com.syntaxforge.ast.IfStatement;
import com.syntaxforge.ast.Literal;
import com.syntaxforge.ast.MethodDeclaration;
import com.syntaxforge.ast.Node;
import com.syntaxforge.ast.NodeType;
import com.syntaxforge.ast.Program;
import com.syntaxforge.ast.ReturnStatement;
import com.syntaxforge.ast.SourceLocation;
import com.syntaxforge.ast.VariableDeclaration;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class AstQueriesTest {

    private static Program sample() {
        ReturnStatement inner = new ReturnStatement(SourceLocation.of(3, 8, 3, 17), new Identifier("x"));
        IfStatement check = new IfStatement(SourceLocation.of(2, 4, 4, 5), new Identifier("x"),
            new BlockStatement(List.of(inner)), null);
        FunctionDeclaration function = new FunctionDeclaration(SourceLocation.of(1, 0, 5, 1), "f", List.of(),
            new BlockStatement(List.of(check)));
        MethodDeclaration method = new MethodDeclaration("run", List.of(), BlockStatement.empty());
        ClassDeclaration type = new ClassDeclaration("Task", List.of(method));
        VariableDeclaration variable = new VariableDeclaration("limit", DeclarationKind.CONST, new Literal(10L));
        return new Program(List.of(function, type, variable));
    }

    @Test
    void testFindNodesByType() {
        Program program = sample();

        assertEquals(1, AstQueries.findNodesByType(program, NodeType.IF_STATEMENT).size());
        assertEquals(2, AstQueries.findNodesByType(program, "Identifier").size());
        assertEquals("run", AstQueries.findNodesByType(program, MethodDeclaration.class).get(0).name());
        assertTrue(AstQueries.findNodesByType(program, NodeType.WHILE_LOOP).isEmpty());
    }

    @Test
    void testFindGenericKindsByLabel() {
        Program program = new Program(List.of(new ExpressionStatement(
            new GenericNode("AwaitExpression", null, List.of(new Identifier("job"))))));
        List<Node> found = AstQueries.findNodesByType(program, "AwaitExpression");
        assertEquals(1, found.size());
    }

    @Test
    void testFindNodeAtLineReturnsInnermost() {
        Program program = sample();

        assertEquals("ReturnStatement", AstQueries.findNodeAtLine(program, 3).orElseThrow().type());
        assertEquals("IfStatement", AstQueries.findNodeAtLine(program, 4).orElseThrow().type());
        assertEquals("FunctionDeclaration", AstQueries.findNodeAtLine(program, 5).orElseThrow().type());
        assertTrue(AstQueries.findNodeAtLine(program, 9).isEmpty());
    }

    @Test
    void testCountsAndDepths() {
        Program program = sample();

        // Program, function, block, if, identifier, block, return, identifier,
        // class, method, block, variable, literal
        assertEquals(13, AstQueries.countNodes(program));
        // Program > function > block > if > block > return > identifier
        assertEquals(6, AstQueries.getDepth(program));
        assertEquals(0, AstQueries.getDepth(new Identifier("leaf")));
        assertEquals(1, AstQueries.getBlockDepth(program));
        assertEquals(0, AstQueries.getBlockDepth(new Identifier("leaf")));
    }

    @Test
    void testBlockDepthFollowsNestedBlocks() {
        BlockStatement inner = new BlockStatement(List.of(new ExpressionStatement(new Identifier("x"))));
        Program program = new Program(List.of(new BlockStatement(List.of(inner))));
        assertEquals(3, AstQueries.getBlockDepth(program));
    }

    @Test
    void testTypedShortcuts() {
        Program program = sample();
        assertEquals("f", AstQueries.getFunctions(program).get(0).name());
        assertEquals("Task", AstQueries.getClasses(program).get(0).name());
        assertEquals("limit", AstQueries.getVariables(program).get(0).name());
    }
}
