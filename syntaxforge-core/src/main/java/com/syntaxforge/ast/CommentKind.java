package com.syntaxforge.ast;

public enum CommentKind implements Labeled {
    LINE("line"),
    BLOCK("block");

    private final String label;

    CommentKind(String label) {
        this.label = label;
    }

    @Override
    public String label() {
        return label;
    }
}
