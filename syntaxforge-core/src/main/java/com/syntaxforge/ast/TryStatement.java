package com.syntaxforge.ast;

import java.util.List;
import java.util.Objects;

public record TryStatement(
    SourceLocation loc,
    Range range,
    String raw,
    BlockStatement block,
    List<CatchClause> handlers,
    BlockStatement finalizer  // Can be null
) implements Node {

    public TryStatement {
        Objects.requireNonNull(block, "block");
        handlers = NodeLists.copyOf(handlers);
    }

    public TryStatement(BlockStatement block, List<CatchClause> handlers, BlockStatement finalizer) {
        this(null, null, null, block, handlers, finalizer);
    }

    @Override
    public String type() {
        return "TryStatement";
    }
}
