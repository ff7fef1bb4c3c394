package com.syntaxforge.ast;

import java.util.List;
import java.util.Objects;

public record CatchClause(
    SourceLocation loc,
    Range range,
    String raw,
    Identifier param,  // Can be null
    List<String> exceptionTypes,
    BlockStatement body
) implements Node {

    public CatchClause {
        Objects.requireNonNull(body, "body");
        exceptionTypes = NodeLists.copyOf(exceptionTypes);
    }

    public CatchClause(Identifier param, BlockStatement body) {
        this(null, null, null, param, List.of(), body);
    }

    @Override
    public String type() {
        return "CatchClause";
    }
}
