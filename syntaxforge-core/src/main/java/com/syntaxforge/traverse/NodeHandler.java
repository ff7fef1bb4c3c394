package com.syntaxforge.traverse;

import com.syntaxforge.ast.Node;

import java.util.function.BiConsumer;

/**
 * Visitor hook. Returning {@code false} stops the visit of the node's subtree.
 *
 * @param <S> type of the state threaded through a visit
 */
@FunctionalInterface
public interface NodeHandler<S> {

    boolean handle(Node node, S state);

    /**
     * Wraps a handler that never stops traversal.
     */
    static <S> NodeHandler<S> of(BiConsumer<Node, S> action) {
        return (node, state) -> {
            action.accept(node, state);
            return true;
        };
    }
}
