package com.syntaxforge.ast;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Carrier for language constructs outside the fixed {@link NodeType} set,
 * e.g. {@code MemberExpression} or Rust's {@code ImplBlock}.
 *
 * <p>{@code attributes} hold scalar fields in insertion order; {@code children}
 * are the nodes the walker descends into. A generic node without children is a leaf.</p>
 */
public record GenericNode(
    SourceLocation loc,
    Range range,
    String raw,
    String type,
    Map<String, Object> attributes,
    List<Node> children
) implements Node {

    public GenericNode {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("GenericNode type is required");
        }
        if (NodeType.isFixedLabel(type)) {
            throw new IllegalArgumentException(
                "'" + type + "' is a fixed node kind; use its record instead of GenericNode");
        }
        attributes = attributes == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        children = NodeLists.copyOf(children);
    }

    public GenericNode(String type, Map<String, Object> attributes, List<Node> children) {
        this(null, null, null, type, attributes, children);
    }

    public GenericNode(String type) {
        this(null, null, null, type, Map.of(), List.of());
    }

    public Object attribute(String name) {
        return attributes.get(name);
    }
}
