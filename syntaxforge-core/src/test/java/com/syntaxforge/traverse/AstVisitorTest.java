package com.syntaxforge.traverse;

import com.syntaxforge.ast.BlockStatement;
import com.syntaxforge.ast.ExpressionStatement;
import com.syntaxforge.ast.FunctionDeclaration;
import com.syntaxforge.ast.GenericNode;
import com.syntaxforge.ast.Identifier;
import com.syntaxforge.ast.NodeType;
import com.syntaxforge.ast.Program;
import com.syntaxforge.ast.ReturnStatement;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class AstVisitorTest {

    private static Program sample() {
        FunctionDeclaration outer = new FunctionDeclaration("outer", List.of(), new BlockStatement(List.of(
            new FunctionDeclaration("inner", List.of(), BlockStatement.empty()),
            new ReturnStatement(new Identifier("value")))));
        return new Program(List.of(outer, new ExpressionStatement(new Identifier("main"))));
    }

    @Test
    void testHandlersRunBeforeChildren() {
        List<String> names = new ArrayList<>();
        AstVisitor.<List<String>>builder()
            .on(NodeType.FUNCTION_DECLARATION, NodeHandler.of((node, out) -> out.add(((FunctionDeclaration) node).name())))
            .on(NodeType.IDENTIFIER, NodeHandler.of((node, out) -> out.add(((Identifier) node).name())))
            .build()
            .visit(sample(), names);

        assertEquals(List.of("outer", "inner", "value", "main"), names);
    }

    @Test
    void testSpecificHandlerCanPruneSubtree() {
        List<String> seen = new ArrayList<>();
        AstVisitor<List<String>> visitor = new AstVisitor<>();
        visitor.addVisitor(NodeType.FUNCTION_DECLARATION, (node, out) -> false);
        visitor.setGenericVisitor(NodeHandler.of((node, out) -> out.add(node.type())));

        visitor.visit(sample(), seen);

        // the generic handler does not run for a pruned node either
        assertEquals(List.of("Program", "ExpressionStatement", "Identifier"), seen);
    }

    @Test
    void testGenericHandlerCanPrune() {
        List<String> seen = new ArrayList<>();
        AstVisitor.<List<String>>builder()
            .onAny((node, out) -> {
                out.add(node.type());
                return !node.is(NodeType.BLOCK_STATEMENT);
            })
            .build()
            .visit(sample(), seen);

        assertEquals(List.of("Program", "FunctionDeclaration", "BlockStatement", "ExpressionStatement", "Identifier"),
            seen);
    }

    @Test
    void testHandlersForGenericKinds() {
        int[] count = {0};
        AstVisitor<Void> visitor = AstVisitor.<Void>builder()
            .on("AwaitExpression", NodeHandler.of((node, state) -> count[0]++))
            .build();

        visitor.visit(new ExpressionStatement(new GenericNode("AwaitExpression", null,
            List.of(new GenericNode("AwaitExpression", null, List.of(new Identifier("x")))))));

        assertEquals(2, count[0]);
    }
}
