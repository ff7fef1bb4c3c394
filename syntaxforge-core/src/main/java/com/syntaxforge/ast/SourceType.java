package com.syntaxforge.ast;

public enum SourceType implements Labeled {
    SCRIPT("script"),
    MODULE("module");

    private final String label;

    SourceType(String label) {
        this.label = label;
    }

    @Override
    public String label() {
        return label;
    }
}
