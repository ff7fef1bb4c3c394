package com.syntaxforge.traverse;

import com.syntaxforge.ast.Node;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Pre-order, depth-first traversal. A walk always runs to completion; callers
 * that want to stop early keep their own flag and ignore later callbacks.
 *
 * <p>The walk keeps its own stack, so arbitrarily deep trees (long operator
 * chains, say) do not exhaust the thread stack.</p>
 */
public final class AstWalker {

    private AstWalker() {
    }

    public static void walk(Node node, NodeCallback callback) {
        walk(node, callback, null);
    }

    public static void walk(Node node, NodeCallback callback, Node parent) {
        Deque<Frame> pending = new ArrayDeque<>();
        pending.push(new Frame(node, parent));
        while (!pending.isEmpty()) {
            Frame frame = pending.pop();
            callback.accept(frame.node(), frame.parent());
            pushChildren(pending, frame.node());
        }
    }

    // Reversed so the first child is popped first
    private static void pushChildren(Deque<Frame> pending, Node node) {
        List<Node> children = NodeChildren.childrenOf(node);
        for (int i = children.size() - 1; i >= 0; i--) {
            pending.push(new Frame(children.get(i), node));
        }
    }

    private record Frame(Node node, Node parent) {
    }
}
