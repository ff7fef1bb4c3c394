package com.syntaxforge.traverse;

import com.syntaxforge.ast.Node;
import com.syntaxforge.ast.NodeType;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Kind-keyed dispatch over a tree.
 *
 * <p>For each node: the handler registered for its kind runs first, then the
 * generic handler, then the children are visited. Any handler returning
 * {@code false} ends the visit of that subtree at once.</p>
 *
 * <p>Handlers may be added between visits with {@link #addVisitor}; a visitor
 * is not meant for concurrent use.</p>
 *
 * <pre>{@code
 * List<String> names = new ArrayList<>();
 * AstVisitor.<List<String>>builder()
 *     .on(NodeType.FUNCTION_DECLARATION, NodeHandler.of((node, out) -> out.add(((FunctionDeclaration) node).name())))
 *     .build()
 *     .visit(program, names);
 * }</pre>
 *
 * @param <S> type of the state passed to every handler
 */
public class AstVisitor<S> {

    private final Map<String, NodeHandler<S>> handlers;
    private NodeHandler<S> genericHandler;

    public AstVisitor(Map<String, NodeHandler<S>> handlers, NodeHandler<S> genericHandler) {
        this.handlers = new HashMap<>(handlers);
        this.genericHandler = genericHandler;
    }

    public AstVisitor() {
        this(Map.of(), null);
    }

    public static <S> Builder<S> builder() {
        return new Builder<>();
    }

    public void visit(Node node) {
        visit(node, null);
    }

    public void visit(Node node, S state) {
        Deque<Node> pending = new ArrayDeque<>();
        pending.push(node);
        while (!pending.isEmpty()) {
            Node current = pending.pop();
            if (!dispatch(current, state)) {
                continue;
            }
            List<Node> children = NodeChildren.childrenOf(current);
            for (int i = children.size() - 1; i >= 0; i--) {
                pending.push(children.get(i));
            }
        }
    }

    private boolean dispatch(Node node, S state) {
        NodeHandler<S> specific = handlers.get(node.type());
        if (specific != null && !specific.handle(node, state)) {
            return false;
        }
        return genericHandler == null || genericHandler.handle(node, state);
    }

    public void addVisitor(NodeType nodeType, NodeHandler<S> handler) {
        addVisitor(nodeType.label(), handler);
    }

    /**
     * Registers or replaces the handler for a node kind, generic kinds included.
     */
    public void addVisitor(String type, NodeHandler<S> handler) {
        handlers.put(type, handler);
    }

    public void setGenericVisitor(NodeHandler<S> handler) {
        this.genericHandler = handler;
    }

    public static final class Builder<S> {
        private final Map<String, NodeHandler<S>> handlers = new HashMap<>();
        private NodeHandler<S> genericHandler;

        private Builder() {
        }

        public Builder<S> on(NodeType nodeType, NodeHandler<S> handler) {
            handlers.put(nodeType.label(), handler);
            return this;
        }

        public Builder<S> on(String type, NodeHandler<S> handler) {
            handlers.put(type, handler);
            return this;
        }

        public Builder<S> onAny(NodeHandler<S> handler) {
            this.genericHandler = handler;
            return this;
        }

        public AstVisitor<S> build() {
            return new AstVisitor<>(handlers, genericHandler);
        }
    }
}
