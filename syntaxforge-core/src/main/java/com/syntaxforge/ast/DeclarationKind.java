package com.syntaxforge.ast;

public enum DeclarationKind implements Labeled {
    VAR("var"),
    LET("let"),
    CONST("const");

    private final String label;

    DeclarationKind(String label) {
        this.label = label;
    }

    @Override
    public String label() {
        return label;
    }
}
