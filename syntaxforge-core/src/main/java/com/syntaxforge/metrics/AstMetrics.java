package com.syntaxforge.metrics;

import com.syntaxforge.ast.BinaryExpression;
import com.syntaxforge.ast.FunctionDeclaration;
import com.syntaxforge.ast.MethodDeclaration;
import com.syntaxforge.ast.Node;
import com.syntaxforge.ast.NodeType;
import com.syntaxforge.traverse.AstQueries;
import com.syntaxforge.traverse.AstWalker;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Complexity and aggregate metrics. Everything here is a pure function of tree
 * structure: unreachable branches count like any other.
 */
public final class AstMetrics {

    private static final Set<NodeType> DECISION_POINTS = EnumSet.of(
        NodeType.IF_STATEMENT,
        NodeType.WHILE_LOOP,
        NodeType.FOR_LOOP,
        NodeType.CATCH_CLAUSE);

    private AstMetrics() {
    }

    /**
     * McCabe cyclomatic complexity: 1, plus one per if, while, for and catch,
     * plus one per short-circuit {@code &&} or {@code ||}.
     */
    public static int calculateComplexity(Node node) {
        int[] complexity = {1};
        AstWalker.walk(node, (current, parent) -> {
            if (isDecisionPoint(current)) {
                complexity[0]++;
            }
        });
        return complexity[0];
    }

    private static boolean isDecisionPoint(Node node) {
        if (node instanceof BinaryExpression binary) {
            return binary.isLogical();
        }
        return NodeType.fromLabel(node.type()).map(DECISION_POINTS::contains).orElse(false);
    }

    public static CodeMetrics extractMetrics(Node ast) {
        int functions = AstQueries.findNodesByType(ast, NodeType.FUNCTION_DECLARATION).size();
        int methods = AstQueries.findNodesByType(ast, NodeType.METHOD_DECLARATION).size();
        int classes = AstQueries.findNodesByType(ast, NodeType.CLASS_DECLARATION).size();
        int variables = AstQueries.findNodesByType(ast, NodeType.VARIABLE_DECLARATION).size();
        int conditionals = AstQueries.findNodesByType(ast, NodeType.IF_STATEMENT).size();
        int loops = AstQueries.findNodesByType(ast, NodeType.WHILE_LOOP).size()
            + AstQueries.findNodesByType(ast, NodeType.FOR_LOOP).size();

        return new CodeMetrics(
            functions,
            methods,
            classes,
            variables,
            conditionals,
            loops,
            calculateComplexity(ast),
            AstQueries.getDepth(ast),
            AstQueries.countNodes(ast));
    }

    /**
     * Complexity of every function and method, in pre-order. Nested functions
     * are also counted inside their enclosing function's figure.
     */
    public static List<FunctionComplexity> functionComplexities(Node ast) {
        List<FunctionComplexity> results = new ArrayList<>();
        AstWalker.walk(ast, (node, parent) -> {
            if (node instanceof FunctionDeclaration function) {
                results.add(new FunctionComplexity(function.name(), startLine(node), calculateComplexity(node)));
            } else if (node instanceof MethodDeclaration method) {
                results.add(new FunctionComplexity(method.name(), startLine(node), calculateComplexity(node)));
            }
        });
        return results;
    }

    private static int startLine(Node node) {
        return node.loc() != null ? node.loc().start().line() : 0;
    }
}
