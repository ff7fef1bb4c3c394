package com.syntaxforge.traverse;

import com.syntaxforge.ast.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Child enumeration for every node class, shared by {@link AstWalker} and {@link AstVisitor}.
 *
 * <p>Each node class maps to an ordered list of field accessors. An accessor
 * returns a {@link Node}, a {@link List} of nodes, or {@code null}. Classes
 * without an entry are leaves.</p>
 */
public final class NodeChildren {

    private static final Map<Class<?>, List<Function<Node, ?>>> ACCESSORS = new HashMap<>();

    static {
        define(Program.class, Program::body);
        define(FunctionDeclaration.class, FunctionDeclaration::body);
        define(ClassDeclaration.class, ClassDeclaration::body);
        define(MethodDeclaration.class, MethodDeclaration::body);
        define(VariableDeclaration.class, VariableDeclaration::init);
        define(IfStatement.class, IfStatement::test, IfStatement::consequent, IfStatement::alternate);
        define(WhileLoop.class, WhileLoop::test, WhileLoop::body);
        define(ForLoop.class, ForLoop::init, ForLoop::test, ForLoop::update, ForLoop::iterable, ForLoop::body);
        define(BlockStatement.class, BlockStatement::body);
        define(ReturnStatement.class, ReturnStatement::argument);
        define(ExpressionStatement.class, ExpressionStatement::expression);
        define(CallExpression.class, CallExpression::callee, CallExpression::arguments);
        define(Identifier.class);
        define(Literal.class);
        define(BinaryExpression.class, BinaryExpression::left, BinaryExpression::right);
        define(AssignmentExpression.class, AssignmentExpression::left, AssignmentExpression::right);
        define(ImportDeclaration.class);
        define(ExportDeclaration.class, ExportDeclaration::declaration);
        define(TryStatement.class, TryStatement::block, TryStatement::handlers, TryStatement::finalizer);
        define(CatchClause.class, CatchClause::param, CatchClause::body);
        define(ThrowStatement.class, ThrowStatement::argument);
        define(SwitchStatement.class, SwitchStatement::discriminant, NodeChildren::caseNodes);
        define(Comment.class);
        define(GenericNode.class, GenericNode::children);
    }

    private NodeChildren() {
    }

    @SafeVarargs
    @SuppressWarnings("unchecked")
    private static <T extends Node> void define(Class<T> type, Function<T, ?>... accessors) {
        List<Function<Node, ?>> list = new ArrayList<>();
        for (Function<T, ?> accessor : accessors) {
            list.add(node -> accessor.apply((T) node));
        }
        ACCESSORS.put(type, List.copyOf(list));
    }

    private static List<Node> caseNodes(SwitchStatement statement) {
        List<Node> nodes = new ArrayList<>();
        for (SwitchStatement.Case switchCase : statement.cases()) {
            if (switchCase.test() != null) {
                nodes.add(switchCase.test());
            }
            nodes.addAll(switchCase.consequent());
        }
        return nodes;
    }

    /**
     * Direct children of {@code node} in traversal order.
     */
    public static List<Node> childrenOf(Node node) {
        List<Function<Node, ?>> accessors = ACCESSORS.get(node.getClass());
        if (accessors == null || accessors.isEmpty()) {
            return List.of();
        }
        List<Node> children = new ArrayList<>();
        for (Function<Node, ?> accessor : accessors) {
            Object value = accessor.apply(node);
            if (value instanceof Node child) {
                children.add(child);
            } else if (value instanceof List<?> list) {
                for (Object element : list) {
                    if (element instanceof Node child) {
                        children.add(child);
                    }
                }
            }
        }
        return children;
    }

    /**
     * Node classes that have an entry in the accessor table, leaves included.
     */
    public static Set<Class<?>> definedTypes() {
        return Collections.unmodifiableSet(ACCESSORS.keySet());
    }
}
