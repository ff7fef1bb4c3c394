package com.syntaxforge.ast;

public enum Visibility implements Labeled {
    PUBLIC("public"),
    PRIVATE("private"),
    PROTECTED("protected");

    private final String label;

    Visibility(String label) {
        this.label = label;
    }

    @Override
    public String label() {
        return label;
    }
}
