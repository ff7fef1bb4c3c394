package com.syntaxforge.traverse;

import com.syntaxforge.ast.Node;

@FunctionalInterface
public interface NodeCallback {

    /**
     * @param node   the node being visited
     * @param parent its parent, or {@code null} for the walk's start node
     */
    void accept(Node node, Node parent);
}
