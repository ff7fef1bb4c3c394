package com.syntaxforge.ast;

/**
 * An enum constant with a lower-case text form, e.g. {@code "module"} or {@code "const"}.
 */
public interface Labeled {
    String label();
}
