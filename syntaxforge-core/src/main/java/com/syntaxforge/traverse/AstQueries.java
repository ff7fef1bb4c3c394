package com.syntaxforge.traverse;

import com.syntaxforge.ast.BlockStatement;
import com.syntaxforge.ast.ClassDeclaration;
import com.syntaxforge.ast.FunctionDeclaration;
import com.syntaxforge.ast.Node;
import com.syntaxforge.ast.NodeType;
import com.syntaxforge.ast.Program;
import com.syntaxforge.ast.VariableDeclaration;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Node lookups built on {@link AstWalker#walk}.
 */
public final class AstQueries {

    private AstQueries() {
    }

    /**
     * All nodes of the given kind, in pre-order.
     */
    public static List<Node> findNodesByType(Node ast, NodeType nodeType) {
        return findNodesByType(ast, nodeType.label());
    }

    /**
     * All nodes whose {@link Node#type()} equals {@code type}; works for generic kinds too.
     */
    public static List<Node> findNodesByType(Node ast, String type) {
        List<Node> results = new ArrayList<>();
        AstWalker.walk(ast, (node, parent) -> {
            if (node.type().equals(type)) {
                results.add(node);
            }
        });
        return results;
    }

    public static <T extends Node> List<T> findNodesByType(Node ast, Class<T> nodeClass) {
        List<T> results = new ArrayList<>();
        AstWalker.walk(ast, (node, parent) -> {
            if (nodeClass.isInstance(node)) {
                results.add(nodeClass.cast(node));
            }
        });
        return results;
    }

    /**
     * The innermost node whose location spans {@code line}: the last match in
     * pre-order. Nodes without a location never match.
     */
    public static Optional<Node> findNodeAtLine(Node ast, int line) {
        Node[] result = new Node[1];
        AstWalker.walk(ast, (node, parent) -> {
            if (node.loc() != null && node.loc().containsLine(line)) {
                result[0] = node;
            }
        });
        return Optional.ofNullable(result[0]);
    }

    public static int countNodes(Node ast) {
        int[] count = {0};
        AstWalker.walk(ast, (node, parent) -> count[0]++);
        return count[0];
    }

    /**
     * Height of the tree: the start node is at depth 0 and every child is one
     * level deeper than its parent, whatever its kind.
     */
    public static int getDepth(Node ast) {
        Deque<Node> nodes = new ArrayDeque<>();
        Deque<Integer> depths = new ArrayDeque<>();
        nodes.push(ast);
        depths.push(0);
        int max = 0;
        while (!nodes.isEmpty()) {
            Node node = nodes.pop();
            int depth = depths.pop();
            max = Math.max(max, depth);
            for (Node child : NodeChildren.childrenOf(node)) {
                nodes.push(child);
                depths.push(depth + 1);
            }
        }
        return max;
    }

    /**
     * Block nesting depth: only {@link Program} and {@link BlockStatement}
     * bodies add a level, and only their direct statements are followed.
     */
    public static int getBlockDepth(Node ast) {
        List<Node> body;
        if (ast instanceof Program program) {
            body = program.body();
        } else if (ast instanceof BlockStatement block) {
            body = block.body();
        } else {
            return 0;
        }
        int max = 0;
        for (Node statement : body) {
            max = Math.max(max, getBlockDepth(statement) + 1);
        }
        return max;
    }

    public static List<FunctionDeclaration> getFunctions(Node ast) {
        return findNodesByType(ast, FunctionDeclaration.class);
    }

    public static List<ClassDeclaration> getClasses(Node ast) {
        return findNodesByType(ast, ClassDeclaration.class);
    }

    public static List<VariableDeclaration> getVariables(Node ast) {
        return findNodesByType(ast, VariableDeclaration.class);
    }
}
