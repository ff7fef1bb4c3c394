package com.syntaxforge.ast;

import java.util.List;
import java.util.Objects;

public record SwitchStatement(
    SourceLocation loc,
    Range range,
    String raw,
    Node discriminant,
    List<Case> cases
) implements Node {

    public SwitchStatement {
        Objects.requireNonNull(discriminant, "discriminant");
        cases = NodeLists.copyOf(cases);
    }

    public SwitchStatement(Node discriminant, List<Case> cases) {
        this(null, null, null, discriminant, cases);
    }

    @Override
    public String type() {
        return "SwitchStatement";
    }

    /**
     * One {@code case} (or match arm). A {@code null} test is the default case.
     */
    public record Case(Node test, List<Node> consequent) {
        public Case {
            consequent = NodeLists.copyOf(consequent);
        }

        public boolean isDefault() {
            return test == null;
        }
    }
}
