package com.syntaxforge.traverse;

import com.syntaxforge.ast.BinaryExpression;
import com.syntaxforge.ast.BlockStatement;
import com.syntaxforge.ast.CallExpression;
import com.syntaxforge.ast.ExpressionStatement;
import com.syntaxforge.ast.GenericNode;
import com.syntaxforge.ast.Identifier;
import com.syntaxforge.ast.IfStatement;
import com.syntaxforge.ast.Literal;
import com.syntaxforge.ast.Node;
import com.syntaxforge.ast.Program;
import com.syntaxforge.ast.SwitchStatement;
import com.syntaxforge.metrics.AstMetrics;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class AstWalkerTest {

    @Test
    void testPreOrderWithParents() {
        Identifier callee = new Identifier("print");
        Literal argument = new Literal("hi");
        CallExpression call = new CallExpression(callee, List.of(argument));
        ExpressionStatement statement = new ExpressionStatement(call);
        Program program = new Program(List.of(statement));

        List<Node> visited = new ArrayList<>();
        List<Node> parents = new ArrayList<>();
        AstWalker.walk(program, (node, parent) -> {
            visited.add(node);
            parents.add(parent);
        });

        assertEquals(List.of(program, statement, call, callee, argument), visited);
        assertNull(parents.get(0));
        assertSame(program, parents.get(1));
        assertSame(call, parents.get(3));
        assertSame(call, parents.get(4));
    }

    @Test
    void testNullOptionalChildrenAreSkipped() {
        IfStatement statement = new IfStatement(new Identifier("x"), BlockStatement.empty(), null);
        assertEquals(List.of("Identifier", "BlockStatement"), types(NodeChildren.childrenOf(statement)));
    }

    @Test
    void testSwitchCasesAreFlattened() {
        SwitchStatement statement = new SwitchStatement(new Identifier("x"), List.of(
            new SwitchStatement.Case(new Literal(1L), List.of(new ExpressionStatement(new Identifier("a")))),
            new SwitchStatement.Case(null, List.of(new ExpressionStatement(new Identifier("b"))))));

        assertEquals(List.of("Identifier", "Literal", "ExpressionStatement", "ExpressionStatement"),
            types(NodeChildren.childrenOf(statement)));
    }

    @Test
    void testGenericNodesAreTraversed() {
        GenericNode member = new GenericNode("MemberExpression", Map.of("property", "length"),
            List.of(new Identifier("items")));
        BinaryExpression compare = new BinaryExpression(">", member, new Literal(0L));

        List<String> seen = new ArrayList<>();
        AstWalker.walk(compare, (node, parent) -> seen.add(node.type()));

        assertEquals(List.of("BinaryExpression", "MemberExpression", "Identifier", "Literal"), seen);
        assertTrue(NodeChildren.childrenOf(new GenericNode("Leaf")).isEmpty());
    }

    @Test
    void testDeepChainDoesNotExhaustStack() {
        int depth = 200_000;
        Node chain = new Identifier("a");
        for (int i = 0; i < depth; i++) {
            chain = new BinaryExpression(i % 2 == 0 ? "+" : "&&", chain, new Identifier("a"));
        }
        Node root = chain;

        int[] visits = {0};
        Node[] firstParent = {root};
        AstWalker.walk(root, (node, parent) -> {
            if (visits[0]++ == 0) {
                firstParent[0] = parent;
            }
        });
        assertEquals(2 * depth + 1, visits[0]);
        assertNull(firstParent[0]);
        assertEquals(2 * depth + 1, AstQueries.countNodes(root));
        assertEquals(depth, AstQueries.getDepth(root));
        assertEquals(1 + depth / 2, AstMetrics.calculateComplexity(root));

        int[] handled = {0};
        new AstVisitor<Void>(Map.of(), (node, state) -> {
            handled[0]++;
            return true;
        }).visit(root);
        assertEquals(2 * depth + 1, handled[0]);
    }

    @Test
    void testEveryNodeClassHasChildAccessors() {
        for (Class<?> nodeClass : Node.class.getPermittedSubclasses()) {
            assertTrue(NodeChildren.definedTypes().contains(nodeClass), nodeClass.getSimpleName());
        }
    }

    private static List<String> types(List<Node> nodes) {
        List<String> types = new ArrayList<>();
        for (Node node : nodes) {
            types.add(node.type());
        }
        return types;
    }
}
